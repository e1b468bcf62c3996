package com.oracle.deepsearch.core;

import com.oracle.deepsearch.model.ExtractionResult;
import com.oracle.deepsearch.model.JobData;
import com.oracle.deepsearch.model.QueryConfig;
import com.oracle.deepsearch.model.ResearchSettings;
import com.oracle.deepsearch.model.SearchResult;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Atomic unit of research: one search over a query, one extraction over the results,
 * reduced to a short findings string.
 * <p>
 * A job runs once. Collaborator failures end it in {@link JobState#FAILED}; nothing is retried here.
 */
@Slf4j
public class Job {

    static final String NO_RESULTS = "no results found";
    static final String NO_ANSWERS = "no answers extracted";
    static final String NO_FACTS = "no factual information found";

    private final String jobId = UUID.randomUUID().toString();
    private final QueryConfig queryConfig;
    private final ResearchSettings settings;
    private final Discoverer discoverer;
    private final Extractor extractor;

    private volatile JobState state = JobState.NONE;
    private volatile String errorMessage;
    private volatile List<SearchResult> searchResults;
    private volatile ExtractionResult extraction;
    private volatile String findings;
    private volatile Instant startedAt;
    private volatile Instant finishedAt;

    public Job(QueryConfig queryConfig, ResearchSettings settings, Discoverer discoverer, Extractor extractor) {
        this.queryConfig = queryConfig;
        this.settings = settings != null ? settings : ResearchSettings.defaults();
        this.discoverer = discoverer;
        this.extractor = extractor;
    }

    public Outcome<Void> initialize() {
        if (state != JobState.NONE) {
            return Outcome.failure(ErrorKind.ILLEGAL_STATE, "Cannot initialize job in state: " + state);
        }
        if (queryConfig == null || queryConfig.getQuery() == null || queryConfig.getQuery().isBlank()) {
            return fail(ErrorKind.CONFIGURATION, "Invalid query configuration: missing query");
        }
        if (queryConfig.getGoals() == null || queryConfig.getGoals().isEmpty()) {
            return fail(ErrorKind.CONFIGURATION, "Invalid query configuration: no research goals provided");
        }
        if (discoverer == null || extractor == null) {
            return fail(ErrorKind.CONFIGURATION, "Job collaborators are not configured");
        }
        state = JobState.INITIALIZED;
        log.debug("Job {} initialized for query: {}", jobId, queryConfig.getQuery());
        return Outcome.success();
    }

    public Outcome<JobData> run() {
        if (state != JobState.INITIALIZED) {
            return Outcome.failure(ErrorKind.ILLEGAL_STATE, "Cannot run job in state: " + state);
        }

        state = JobState.RUNNING;
        startedAt = Instant.now();
        MDC.put("jobId", jobId);
        try {
            log.info("Job {} searching: {}", jobId, queryConfig.getQuery());
            List<SearchResult> results = discoverer.discover(queryConfig.getQuery(), resultBound());
            if (results == null || results.isEmpty()) {
                return fail(ErrorKind.JOB_FAILURE, NO_RESULTS);
            }
            searchResults = List.copyOf(results);

            List<String> urls = searchResults.stream().map(SearchResult::getUrl).toList();
            ExtractionResult extracted = extractor.extract(urls, queryConfig.getGoals());
            if (extracted == null || extracted.getAnswers() == null || extracted.getAnswers().isEmpty()) {
                return fail(ErrorKind.JOB_FAILURE, NO_ANSWERS);
            }
            extraction = extracted;

            String reduced = reduceFindings(queryConfig, extracted);
            if (reduced == null) {
                return fail(ErrorKind.JOB_FAILURE, NO_FACTS);
            }
            findings = reduced;
            finishedAt = Instant.now();
            state = JobState.COMPLETED;
            log.info("Job {} completed with {} sources", jobId, searchResults.size());
            return Outcome.success(snapshot());
        } catch (Exception e) {
            return fail(ErrorKind.COLLABORATOR, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        } finally {
            MDC.remove("jobId");
        }
    }

    /**
     * Query text followed by one {@code - goal: answer} line per answered goal.
     *
     * @return null when no goal was answered
     */
    static String reduceFindings(QueryConfig queryConfig, ExtractionResult extraction) {
        List<String> lines = new ArrayList<>();
        List<String> goals = queryConfig.getGoals();
        for (int i = 0; i < goals.size(); i++) {
            String answer = extraction.answerFor(i);
            if (!ExtractionResult.isNotFound(answer)) {
                lines.add("- " + goals.get(i) + ": " + answer);
            }
        }
        if (lines.isEmpty()) {
            return null;
        }
        return queryConfig.getQuery() + "\n" + String.join("\n", lines);
    }

    public Optional<JobData> getResults() {
        if (state != JobState.COMPLETED) {
            return Optional.empty();
        }
        return Optional.of(snapshot());
    }

    public JobData snapshot() {
        return JobData.builder()
                .jobId(jobId)
                .queryConfig(queryConfig)
                .state(state)
                .errorMessage(errorMessage)
                .searchResults(searchResults)
                .extraction(extraction)
                .findings(findings)
                .startedAt(startedAt)
                .finishedAt(finishedAt)
                .build();
    }

    private int resultBound() {
        Integer perQuery = queryConfig.getMaxResults();
        return perQuery != null && perQuery > 0 ? perQuery : settings.getMaxResults();
    }

    private <T> Outcome<T> fail(ErrorKind kind, String message) {
        errorMessage = message;
        finishedAt = Instant.now();
        state = JobState.FAILED;
        if (kind == ErrorKind.CONFIGURATION) {
            log.warn("Job {} initialization failed: {}", jobId, message);
        } else {
            log.warn("Job {} failed: {}", jobId, message);
        }
        return Outcome.failure(kind, message);
    }

    public String getJobId() {
        return jobId;
    }

    public QueryConfig getQueryConfig() {
        return queryConfig;
    }

    public JobState getState() {
        return state;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public String getFindings() {
        return findings;
    }
}
