package com.oracle.deepsearch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "research.tools")
@Data
public class ToolsConfig {

    private Brave brave = new Brave();

    private Firecrawl firecrawl = new Firecrawl();

    @Data
    public static class Brave {
        private String apiKey;
        private String baseUrl = "https://api.search.brave.com/res/v1/web/search";
        /**
         * Minimum spacing between two search calls, in milliseconds
         */
        private long minRequestIntervalMs = 1100;
        /**
         * Wait before the single retry after a 429
         */
        private long rateLimitBackoffMs = 2000;
        private int timeoutSeconds = 30;
    }

    @Data
    public static class Firecrawl {
        private String apiKey;
        private String baseUrl = "https://api.firecrawl.dev/v1";
        private long pollIntervalMs = 2000;
        private int timeoutSeconds = 120;
    }
}
