package com.oracle.deepsearch.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * What one round of a session produced.
 */
@Value
@Builder
public class RoundResult {

    int round;

    List<QueryConfig> queries;

    boolean fallbackUsed;

    StepData stepData;

    /**
     * Set when the round failed and the session was configured to skip empty rounds.
     */
    String errorMessage;

    public boolean isSuccessful() {
        return errorMessage == null;
    }

    public String getFindings() {
        return stepData != null ? stepData.getFindings() : null;
    }
}
