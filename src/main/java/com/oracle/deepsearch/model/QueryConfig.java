package com.oracle.deepsearch.model;

import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One search query plus the goals its results must answer.
 * <p>
 * Goal lists longer than {@link #MAX_GOALS} are truncated, never rejected.
 * Emptiness is checked later, when a job is initialized.
 */
@Value
public class QueryConfig {

    public static final int MAX_GOALS = 4;

    String query;

    List<String> goals;

    String context;

    Integer maxDepth;

    /**
     * Search results to request for this query; falls back to the session settings when null.
     */
    Integer maxResults;

    @Builder(toBuilder = true)
    private QueryConfig(String query, List<String> goals, String context, Integer maxDepth, Integer maxResults) {
        this.query = query;
        this.goals = truncate(goals);
        this.context = context;
        this.maxDepth = maxDepth;
        this.maxResults = maxResults;
    }

    public static QueryConfig of(String query, List<String> goals) {
        return QueryConfig.builder().query(query).goals(goals).build();
    }

    /**
     * Topic-only query used when query derivation produced nothing usable.
     */
    public static QueryConfig fallback(String topic) {
        return QueryConfig.builder()
                .query(topic)
                .goals(List.of(
                        "What are the most important facts about " + topic + "?",
                        "What are the latest developments regarding " + topic + "?"))
                .build();
    }

    private static List<String> truncate(List<String> goals) {
        if (goals == null || goals.isEmpty()) {
            return List.of();
        }
        List<String> kept = new ArrayList<>(goals.subList(0, Math.min(MAX_GOALS, goals.size())));
        return Collections.unmodifiableList(kept);
    }
}
