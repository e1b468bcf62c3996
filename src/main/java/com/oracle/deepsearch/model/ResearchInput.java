package com.oracle.deepsearch.model;

import com.oracle.deepsearch.core.ErrorKind;
import com.oracle.deepsearch.core.Outcome;
import lombok.Value;

@Value
public class ResearchInput {

    String topic;

    ResearchSettings settings;

    public static ResearchInput of(String topic, ResearchSettings settings) {
        return new ResearchInput(topic, settings);
    }

    public Outcome<Void> validate() {
        if (topic == null || topic.isBlank()) {
            return Outcome.failure(ErrorKind.CONFIGURATION, "Invalid research input: topic must not be blank");
        }
        if (settings == null) {
            return Outcome.failure(ErrorKind.CONFIGURATION, "Invalid research input: settings are missing");
        }
        if (settings.getMaxDepth() < 1 || settings.getMaxDepth() > ResearchSettings.MAX_DEPTH_LIMIT) {
            return Outcome.failure(ErrorKind.CONFIGURATION,
                    "Invalid research settings: maxDepth must be between 1 and " + ResearchSettings.MAX_DEPTH_LIMIT);
        }
        if (settings.getBatchSize() < 1 || settings.getBatchSize() > ResearchSettings.MAX_BATCH_SIZE) {
            return Outcome.failure(ErrorKind.CONFIGURATION,
                    "Invalid research settings: batchSize must be between 1 and " + ResearchSettings.MAX_BATCH_SIZE);
        }
        if (settings.getMaxResults() < 1 || settings.getMaxResults() > ResearchSettings.MAX_RESULTS_LIMIT) {
            return Outcome.failure(ErrorKind.CONFIGURATION,
                    "Invalid research settings: maxResults must be between 1 and " + ResearchSettings.MAX_RESULTS_LIMIT);
        }
        return Outcome.success();
    }
}
