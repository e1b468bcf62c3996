package com.oracle.deepsearch.model;

import com.oracle.deepsearch.core.SessionState;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class SessionStatus {

    String sessionId;

    String topic;

    SessionState state;

    String error;

    boolean hasResults;

    int currentRound;

    int maxDepth;

    int completedRounds;

    Instant startTime;

    Instant endTime;

    /**
     * Job counts of the round in progress, or of the last round once the session has moved on.
     */
    @Builder.Default
    Map<String, Object> stepProgress = Map.of();
}
