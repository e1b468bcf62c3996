package com.oracle.deepsearch.config;

import com.oracle.deepsearch.model.ResearchSettings;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "research")
@Data
public class ResearchConfig {

    /**
     * Number of research rounds per session
     */
    private int maxDepth = 3;

    /**
     * Sub-queries derived per round
     */
    private int batchSize = 3;

    /**
     * Search results fetched per sub-query
     */
    private int maxResults = 3;

    /**
     * Continue past a round in which every job failed instead of ending the session
     */
    private boolean skipEmptyRounds = false;

    /**
     * Worker threads shared by the jobs of a step
     */
    private int jobPoolSize = 8;

    /**
     * Sessions that may run in the background at once
     */
    private int sessionPoolSize = 2;

    /**
     * How long a finished session stays available for status and result lookups
     */
    private Duration sessionRetention = Duration.ofHours(1);

    /**
     * Temperature for query derivation
     */
    private double derivationTemperature = 0.8;

    /**
     * Temperature for report synthesis
     */
    private double synthesisTemperature = 0.6;

    public ResearchSettings toSettings() {
        return ResearchSettings.builder()
                .maxDepth(maxDepth)
                .batchSize(batchSize)
                .maxResults(maxResults)
                .skipEmptyRounds(skipEmptyRounds)
                .build();
    }
}
