package com.oracle.deepsearch.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class ResearchSettings {

    public static final int MAX_DEPTH_LIMIT = 10;
    public static final int MAX_BATCH_SIZE = 10;
    public static final int MAX_RESULTS_LIMIT = 20;

    /**
     * Number of rounds a session runs.
     */
    @Builder.Default
    int maxDepth = 3;

    /**
     * Sub-queries requested from the query deriver per round.
     */
    @Builder.Default
    int batchSize = 3;

    /**
     * Search results fetched per job.
     */
    @Builder.Default
    int maxResults = 3;

    /**
     * When true a round in which every job failed is recorded and skipped instead of ending the session.
     */
    @Builder.Default
    boolean skipEmptyRounds = false;

    public static ResearchSettings defaults() {
        return ResearchSettings.builder().build();
    }
}
