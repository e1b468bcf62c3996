package com.oracle.deepsearch.config;

import com.oracle.deepsearch.thread.MdcAwareExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ExecutorConfig {

    @Bean(name = "researchJobExecutor", destroyMethod = "shutdown")
    public MdcAwareExecutor researchJobExecutor(ResearchConfig researchConfig) {
        return MdcAwareExecutor.fixed("research-job", researchConfig.getJobPoolSize());
    }

    @Bean(name = "researchSessionExecutor", destroyMethod = "shutdown")
    public MdcAwareExecutor researchSessionExecutor(ResearchConfig researchConfig) {
        return MdcAwareExecutor.fixed("research-session", researchConfig.getSessionPoolSize());
    }
}
