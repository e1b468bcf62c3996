package com.oracle.deepsearch.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Answers extracted from a set of pages, keyed by goal id ({@code goal1}, {@code goal2}, ...).
 */
@Value
@Builder
public class ExtractionResult {

    /**
     * Answer value meaning the sources held no factual information for a goal.
     */
    public static final String NOT_FOUND = "NA";

    Map<String, String> answers;

    List<String> sources;

    @Builder.Default
    Instant timestamp = Instant.now();

    public static String goalId(int index) {
        return "goal" + (index + 1);
    }

    public String answerFor(int goalIndex) {
        if (answers == null) {
            return NOT_FOUND;
        }
        String answer = answers.get(goalId(goalIndex));
        return answer == null || answer.isBlank() ? NOT_FOUND : answer.trim();
    }

    public static boolean isNotFound(String answer) {
        return answer == null || answer.isBlank() || NOT_FOUND.equals(answer.trim());
    }
}
