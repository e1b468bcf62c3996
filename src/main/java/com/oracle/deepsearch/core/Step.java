package com.oracle.deepsearch.core;

import com.oracle.deepsearch.model.JobData;
import com.oracle.deepsearch.model.QueryConfig;
import com.oracle.deepsearch.model.ResearchSettings;
import com.oracle.deepsearch.model.StepData;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;

/**
 * One round of research: a batch of jobs launched together and joined before the step completes.
 * <p>
 * A job failure never cancels its siblings. The step completes when at least one job completed
 * and fails only when none did.
 */
@Slf4j
public class Step {

    private final int stepNumber;
    private final List<QueryConfig> queryConfigs;
    private final ResearchSettings settings;
    private final Discoverer discoverer;
    private final Extractor extractor;
    private final Executor executor;

    // keyed by job id, iteration order is launch order
    private final Map<String, Job> jobs = Collections.synchronizedMap(new LinkedHashMap<>());

    private volatile StepState state = StepState.NONE;
    private volatile String errorMessage;
    private volatile String findings;

    public Step(int stepNumber, List<QueryConfig> queryConfigs, ResearchSettings settings,
                Discoverer discoverer, Extractor extractor, Executor executor) {
        this.stepNumber = stepNumber;
        this.queryConfigs = queryConfigs != null ? List.copyOf(queryConfigs) : List.of();
        this.settings = settings;
        this.discoverer = discoverer;
        this.extractor = extractor;
        this.executor = executor;
    }

    /**
     * Builds and initializes one job per query. Any job that fails to initialize fails the whole step.
     */
    public Outcome<Void> initialize() {
        if (state != StepState.NONE) {
            return Outcome.failure(ErrorKind.ILLEGAL_STATE, "Cannot initialize step in state: " + state);
        }
        log.info("Initializing research step {} with {} queries", stepNumber, queryConfigs.size());
        if (queryConfigs.isEmpty()) {
            return fail(ErrorKind.CONFIGURATION, "No jobs configured for the step");
        }
        if (executor == null) {
            return fail(ErrorKind.CONFIGURATION, "No executor configured for the step");
        }
        for (QueryConfig config : queryConfigs) {
            Job job = new Job(config, settings, discoverer, extractor);
            jobs.put(job.getJobId(), job);
            Outcome<Void> init = job.initialize();
            if (init.isFailure()) {
                return fail(ErrorKind.CONFIGURATION, "Failed to initialize job " + job.getJobId()
                        + ": " + init.getErrorMessage());
            }
        }
        state = StepState.INITIALIZED;
        log.debug("Research step {} initialized, {} jobs", stepNumber, jobs.size());
        return Outcome.success();
    }

    public Outcome<StepData> run() {
        if (state != StepState.INITIALIZED) {
            return Outcome.failure(ErrorKind.ILLEGAL_STATE, "Cannot run step in state: " + state);
        }
        state = StepState.RUNNING;
        List<Job> launched = jobsInLaunchOrder();
        log.info("Running research step {} with {} jobs", stepNumber, launched.size());

        List<CompletableFuture<Void>> tasks = new ArrayList<>(launched.size());
        RejectedExecutionException rejected = null;
        for (Job job : launched) {
            try {
                tasks.add(CompletableFuture.runAsync(job::run, executor));
            } catch (RejectedExecutionException e) {
                rejected = e;
                break;
            }
        }

        try {
            CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            // Job.run() reports its own failures; reaching here means a task died outside of it.
            // allOf only completes after every task has finished, so the barrier still held.
            log.error("Research step {} had a job terminate abnormally: {}", stepNumber, e.getMessage());
        }

        if (rejected != null) {
            return fail(ErrorKind.STEP_FAILURE, "Job executor rejected the step after " + tasks.size()
                    + " of " + launched.size() + " jobs were launched: " + rejected.getMessage());
        }

        List<Job> failed = launched.stream().filter(job -> job.getState() != JobState.COMPLETED).toList();
        if (failed.size() == launched.size()) {
            String jobErrors = failed.stream()
                    .map(job -> job.getJobId() + ": " + describeFailure(job))
                    .collect(Collectors.joining("; "));
            return fail(ErrorKind.STEP_FAILURE, "All jobs failed: " + jobErrors);
        }
        if (!failed.isEmpty()) {
            log.warn("Research step {} completed with {}/{} failed jobs", stepNumber, failed.size(), launched.size());
        }

        findings = aggregateFindings();
        state = StepState.COMPLETED;
        log.info("Research step {} completed successfully", stepNumber);
        return Outcome.success(snapshot());
    }

    /**
     * Newline-joined findings of every completed job, in launch order.
     */
    public String aggregateFindings() {
        return jobsInLaunchOrder().stream()
                .filter(job -> job.getState() == JobState.COMPLETED)
                .map(Job::getFindings)
                .filter(f -> f != null && !f.isBlank())
                .collect(Collectors.joining("\n"));
    }

    public Optional<StepData> getResults() {
        if (state != StepState.COMPLETED) {
            log.warn("Attempting to get results for incomplete step {}", stepNumber);
            return Optional.empty();
        }
        return Optional.of(snapshot());
    }

    public StepData snapshot() {
        Map<String, JobData> jobsData = new LinkedHashMap<>();
        for (Job job : jobsInLaunchOrder()) {
            jobsData.put(job.getJobId(), job.snapshot());
        }
        return StepData.builder()
                .stepNumber(stepNumber)
                .state(state)
                .errorMessage(errorMessage)
                .jobs(Collections.unmodifiableMap(jobsData))
                .findings(findings)
                .build();
    }

    public Map<String, Object> getProgress() {
        List<Job> all = jobsInLaunchOrder();
        long completed = all.stream().filter(j -> j.getState() == JobState.COMPLETED).count();
        long failed = all.stream().filter(j -> j.getState() == JobState.FAILED).count();
        long running = all.stream().filter(j -> j.getState() == JobState.RUNNING).count();
        double percentage = all.isEmpty() ? 0.0 : (completed + failed) * 100.0 / all.size();

        Map<String, Object> progress = new LinkedHashMap<>();
        progress.put("total", all.size());
        progress.put("completed", completed);
        progress.put("failed", failed);
        progress.put("running", running);
        progress.put("progressPercentage", percentage);
        return progress;
    }

    private List<Job> jobsInLaunchOrder() {
        synchronized (jobs) {
            return new ArrayList<>(jobs.values());
        }
    }

    private static String describeFailure(Job job) {
        if (job.getErrorMessage() != null) {
            return job.getErrorMessage();
        }
        return "terminated in state " + job.getState();
    }

    private <T> Outcome<T> fail(ErrorKind kind, String message) {
        errorMessage = message;
        state = StepState.FAILED;
        log.error("Research step {} failed: {}", stepNumber, message);
        return Outcome.failure(kind, message);
    }

    public int getStepNumber() {
        return stepNumber;
    }

    public StepState getState() {
        return state;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public String getFindings() {
        return findings;
    }
}
