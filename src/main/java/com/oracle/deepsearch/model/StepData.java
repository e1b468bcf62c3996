package com.oracle.deepsearch.model;

import com.oracle.deepsearch.core.StepState;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class StepData {

    int stepNumber;

    StepState state;

    String errorMessage;

    /**
     * Every job of the step by id, in launch order, including failed ones.
     */
    Map<String, JobData> jobs;

    String findings;

    @Builder.Default
    Instant timestamp = Instant.now();

    public long completedJobs() {
        return jobs.values().stream().filter(JobData::isCompleted).count();
    }

    public long failedJobs() {
        return jobs.values().stream().filter(JobData::isFailed).count();
    }
}
