package com.oracle.deepsearch.model;

import com.oracle.deepsearch.core.SessionState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResearchResponse {

    private String sessionId;

    private String topic;

    private SessionState state;

    private String error;

    private ResearchResults results;

    @Builder.Default
    private List<RoundSummary> rounds = new ArrayList<>();

    private Long processingTimeMs;

    @Builder.Default
    private LocalDateTime timestamp = LocalDateTime.now();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RoundSummary {

        private Integer round;

        @Builder.Default
        private List<String> queries = new ArrayList<>();

        private Boolean fallbackUsed;

        private Long completedJobs;

        private Long failedJobs;

        private String findings;

        private String error;

        /**
         * Per-job detail, only filled for verbose requests.
         */
        private StepData step;
    }
}
