package com.oracle.deepsearch.model;

import com.oracle.deepsearch.core.JobState;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time view of a job. Failed jobs carry their error message here.
 */
@Value
@Builder
public class JobData {

    String jobId;

    QueryConfig queryConfig;

    JobState state;

    String errorMessage;

    List<SearchResult> searchResults;

    ExtractionResult extraction;

    String findings;

    Instant startedAt;

    Instant finishedAt;

    public boolean isCompleted() {
        return state == JobState.COMPLETED;
    }

    public boolean isFailed() {
        return state == JobState.FAILED;
    }
}
