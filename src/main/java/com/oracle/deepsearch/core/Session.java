package com.oracle.deepsearch.core;

import com.oracle.deepsearch.model.JobData;
import com.oracle.deepsearch.model.QueryConfig;
import com.oracle.deepsearch.model.ResearchInput;
import com.oracle.deepsearch.model.ResearchResults;
import com.oracle.deepsearch.model.ResearchSettings;
import com.oracle.deepsearch.model.RoundResult;
import com.oracle.deepsearch.model.SearchResult;
import com.oracle.deepsearch.model.SessionStatus;
import com.oracle.deepsearch.model.StepData;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;

/**
 * Top-level research controller.
 * <p>
 * Runs exactly {@code maxDepth} rounds one after another. Each round asks the {@link QueryDeriver}
 * for a batch of queries built on the findings so far, runs them as a {@link Step}, and keeps the
 * step's findings for the next round. A round in which every job fails ends the session in
 * {@link SessionState#ERROR} unless the settings ask for empty rounds to be skipped.
 * After the last round the {@link ReportSynthesizer} produces the report; if it fails the session
 * still completes with a placeholder report carrying the raw findings.
 */
@Slf4j
public class Session {

    private static final DateTimeFormatter ID_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private final ResearchInput input;
    private final Discoverer discoverer;
    private final Extractor extractor;
    private final QueryDeriver queryDeriver;
    private final ReportSynthesizer reportSynthesizer;
    private final Executor jobExecutor;

    private final List<RoundResult> rounds = new CopyOnWriteArrayList<>();
    private final List<String> findings = new CopyOnWriteArrayList<>();

    private volatile String sessionId;
    private volatile SessionState state = SessionState.NONE;
    private volatile String errorMessage;
    private volatile int currentRound;
    private volatile Instant startTime;
    private volatile Instant endTime;
    private volatile ResearchResults results;
    private volatile Step currentStep;

    public Session(ResearchInput input, Discoverer discoverer, Extractor extractor,
                   QueryDeriver queryDeriver, ReportSynthesizer reportSynthesizer, Executor jobExecutor) {
        this.input = input;
        this.discoverer = discoverer;
        this.extractor = extractor;
        this.queryDeriver = queryDeriver;
        this.reportSynthesizer = reportSynthesizer;
        this.jobExecutor = jobExecutor;
    }

    public Outcome<Void> initialize() {
        if (state != SessionState.NONE) {
            return Outcome.failure(ErrorKind.ILLEGAL_STATE, "Cannot initialize session in state: " + state);
        }
        sessionId = newSessionId();
        if (input == null) {
            return fail(ErrorKind.CONFIGURATION, "Invalid research input: missing");
        }
        Outcome<Void> validation = input.validate();
        if (validation.isFailure()) {
            return fail(validation.getError().getKind(), validation.getErrorMessage());
        }
        if (discoverer == null || extractor == null || queryDeriver == null
                || reportSynthesizer == null || jobExecutor == null) {
            return fail(ErrorKind.CONFIGURATION, "Session collaborators are not configured");
        }
        rounds.clear();
        findings.clear();
        startTime = Instant.now();
        state = SessionState.INITIALIZED;
        log.info("Session {} initialized for topic: {}", sessionId, input.getTopic());
        return Outcome.success();
    }

    /**
     * Runs every round and the final synthesis. Blocks until the session is terminal.
     */
    public Outcome<ResearchResults> run() {
        if (state != SessionState.INITIALIZED) {
            return Outcome.failure(ErrorKind.ILLEGAL_STATE, "Cannot start research in state: " + state);
        }
        state = SessionState.RESEARCHING;
        ResearchSettings settings = input.getSettings();
        MDC.put("sessionId", sessionId);
        try {
            log.info("Session {} researching '{}' over {} rounds", sessionId, input.getTopic(), settings.getMaxDepth());

            for (int round = 1; round <= settings.getMaxDepth(); round++) {
                currentRound = round;
                MDC.put("round", String.valueOf(round));
                Outcome<RoundResult> outcome = runRound(round, settings);
                if (outcome.isFailure()) {
                    if (!settings.isSkipEmptyRounds()) {
                        return fail(outcome.getError().getKind(),
                                "Round " + round + " failed: " + outcome.getErrorMessage());
                    }
                    log.warn("Session {} skipping round {}: {}", sessionId, round, outcome.getErrorMessage());
                }
            }
            MDC.remove("round");

            results = synthesize();
            endTime = Instant.now();
            state = SessionState.COMPLETED;
            log.info("Session {} completed: {} rounds, {} findings blocks", sessionId, rounds.size(), findings.size());
            if (log.isDebugEnabled()) {
                log.debug("Session snapshot: {}", toSnapshot());
            }
            return Outcome.success(results);
        } catch (RuntimeException e) {
            log.error("Session {} aborted unexpectedly", sessionId, e);
            return fail(ErrorKind.ILLEGAL_STATE, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        } finally {
            MDC.remove("round");
            MDC.remove("sessionId");
        }
    }

    private Outcome<RoundResult> runRound(int round, ResearchSettings settings) {
        List<QueryConfig> batch = deriveQueries(round, settings);
        boolean fallbackUsed = batch == null;
        if (fallbackUsed) {
            batch = List.of(QueryConfig.fallback(input.getTopic()));
        }

        Step step = new Step(round, batch, settings, discoverer, extractor, jobExecutor);
        currentStep = step;
        Outcome<StepData> stepOutcome = step.initialize().isSuccess()
                ? step.run()
                : Outcome.failure(ErrorKind.CONFIGURATION, step.getErrorMessage());

        if (stepOutcome.isFailure()) {
            rounds.add(RoundResult.builder()
                    .round(round)
                    .queries(batch)
                    .fallbackUsed(fallbackUsed)
                    .stepData(step.snapshot())
                    .errorMessage(stepOutcome.getErrorMessage())
                    .build());
            return Outcome.failure(stepOutcome.getError());
        }

        StepData stepData = stepOutcome.getValue();
        findings.add(stepData.getFindings());
        RoundResult result = RoundResult.builder()
                .round(round)
                .queries(batch)
                .fallbackUsed(fallbackUsed)
                .stepData(stepData)
                .build();
        rounds.add(result);
        log.info("Round {} complete: {}/{} jobs succeeded", round, stepData.completedJobs(), stepData.getJobs().size());
        return Outcome.success(result);
    }

    /**
     * @return the derived batch, or null when the fallback query has to be used
     */
    private List<QueryConfig> deriveQueries(int round, ResearchSettings settings) {
        try {
            List<QueryConfig> derived = queryDeriver.derive(input.getTopic(), List.copyOf(findings), settings.getBatchSize());
            List<QueryConfig> usable = derived == null ? List.of() : derived.stream()
                    .filter(Objects::nonNull)
                    .limit(settings.getBatchSize())
                    .toList();
            if (usable.isEmpty()) {
                log.warn("Query derivation returned no queries for round {}, using topic fallback", round);
                return null;
            }
            return usable;
        } catch (Exception e) {
            log.warn("Query derivation failed for round {}, using topic fallback: {}", round, e.getMessage());
            return null;
        }
    }

    private ResearchResults synthesize() {
        List<String> allFindings = List.copyOf(findings);
        List<String> sources = visitedSources();
        if (allFindings.isEmpty()) {
            return ResearchResults.synthesisFailed("no findings were collected", allFindings)
                    .toBuilder().visitedSources(sources).build();
        }
        try {
            ResearchResults synthesized = reportSynthesizer.synthesize(input.getTopic(), allFindings);
            if (synthesized == null || synthesized.getMainReport() == null || synthesized.getMainReport().isBlank()) {
                throw new CollaboratorException("report synthesizer returned an empty report");
            }
            if (synthesized.getVisitedSources().isEmpty()) {
                return synthesized.toBuilder().visitedSources(sources).build();
            }
            return synthesized;
        } catch (Exception e) {
            String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("Session {} report synthesis failed: {}", sessionId, reason);
            return ResearchResults.synthesisFailed(reason, allFindings)
                    .toBuilder().visitedSources(sources).build();
        }
    }

    // URLs of every completed job, first-seen order
    private List<String> visitedSources() {
        Set<String> urls = new LinkedHashSet<>();
        for (RoundResult round : rounds) {
            if (round.getStepData() == null) {
                continue;
            }
            for (JobData job : round.getStepData().getJobs().values()) {
                if (job.isCompleted() && job.getSearchResults() != null) {
                    job.getSearchResults().stream().map(SearchResult::getUrl).forEach(urls::add);
                }
            }
        }
        return new ArrayList<>(urls);
    }

    public SessionStatus getStatus() {
        Step step = currentStep;
        return SessionStatus.builder()
                .sessionId(sessionId)
                .topic(input != null ? input.getTopic() : null)
                .state(state)
                .error(errorMessage)
                .hasResults(results != null)
                .currentRound(currentRound)
                .maxDepth(input != null && input.getSettings() != null ? input.getSettings().getMaxDepth() : 0)
                .completedRounds((int) rounds.stream().filter(RoundResult::isSuccessful).count())
                .startTime(startTime)
                .endTime(endTime)
                .stepProgress(step != null ? step.getProgress() : Map.of())
                .build();
    }

    public Optional<ResearchResults> getResults() {
        return Optional.ofNullable(results);
    }

    public List<RoundResult> getRounds() {
        return Collections.unmodifiableList(rounds);
    }

    public List<String> getFindings() {
        return Collections.unmodifiableList(findings);
    }

    /**
     * Plain map of the session's current fields for logging. Never read back.
     */
    public Map<String, Object> toSnapshot() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("sessionId", sessionId);
        snapshot.put("topic", input != null ? input.getTopic() : null);
        snapshot.put("state", state);
        snapshot.put("error", errorMessage);
        snapshot.put("startTime", startTime);
        snapshot.put("endTime", endTime);
        snapshot.put("settings", input != null ? input.getSettings() : null);
        snapshot.put("rounds", List.copyOf(rounds));
        snapshot.put("results", results);
        return snapshot;
    }

    private <T> Outcome<T> fail(ErrorKind kind, String message) {
        errorMessage = message;
        endTime = Instant.now();
        state = SessionState.ERROR;
        log.error("Session {} failed: {}", sessionId, message);
        return Outcome.failure(kind, message);
    }

    private static String newSessionId() {
        return LocalDateTime.now().format(ID_FORMAT) + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    public String getSessionId() {
        return sessionId;
    }

    public SessionState getState() {
        return state;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public String getTopic() {
        return input != null ? input.getTopic() : null;
    }

    public ResearchSettings getSettings() {
        return input != null ? input.getSettings() : null;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Instant getEndTime() {
        return endTime;
    }
}
