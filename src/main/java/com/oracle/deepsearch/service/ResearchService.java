package com.oracle.deepsearch.service;

import com.oracle.deepsearch.config.ResearchConfig;
import com.oracle.deepsearch.core.Discoverer;
import com.oracle.deepsearch.core.Extractor;
import com.oracle.deepsearch.core.Outcome;
import com.oracle.deepsearch.core.QueryDeriver;
import com.oracle.deepsearch.core.ReportSynthesizer;
import com.oracle.deepsearch.core.Session;
import com.oracle.deepsearch.core.SessionRegistry;
import com.oracle.deepsearch.model.QueryConfig;
import com.oracle.deepsearch.model.ResearchInput;
import com.oracle.deepsearch.model.ResearchRequest;
import com.oracle.deepsearch.model.ResearchResponse;
import com.oracle.deepsearch.model.ResearchResults;
import com.oracle.deepsearch.model.ResearchSettings;
import com.oracle.deepsearch.model.RoundResult;
import com.oracle.deepsearch.model.SessionStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * Turns research requests into sessions and runs them, in the caller's thread or in the background.
 */
@Service
@Slf4j
public class ResearchService {

    private final Discoverer discoverer;
    private final Extractor extractor;
    private final QueryDeriver queryDeriver;
    private final ReportSynthesizer reportSynthesizer;
    private final SessionRegistry sessionRegistry;
    private final ResearchConfig researchConfig;
    private final Executor jobExecutor;
    private final Executor sessionExecutor;

    public ResearchService(Discoverer discoverer,
                           Extractor extractor,
                           QueryDeriver queryDeriver,
                           ReportSynthesizer reportSynthesizer,
                           SessionRegistry sessionRegistry,
                           ResearchConfig researchConfig,
                           @Qualifier("researchJobExecutor") Executor jobExecutor,
                           @Qualifier("researchSessionExecutor") Executor sessionExecutor) {
        this.discoverer = discoverer;
        this.extractor = extractor;
        this.queryDeriver = queryDeriver;
        this.reportSynthesizer = reportSynthesizer;
        this.sessionRegistry = sessionRegistry;
        this.researchConfig = researchConfig;
        this.jobExecutor = jobExecutor;
        this.sessionExecutor = sessionExecutor;
    }

    /**
     * Runs a whole session and returns once it is terminal. A failed session is reported in the
     * response, not thrown.
     */
    public ResearchResponse research(ResearchRequest request) {
        Instant start = Instant.now();
        log.info("Processing research request: {}", request.getTopic());

        Session session = createSession(request);
        Outcome<Void> init = session.initialize();
        if (init.isSuccess()) {
            sessionRegistry.register(session);
            Outcome<ResearchResults> outcome = session.run();
            if (outcome.isFailure()) {
                log.warn("Research on '{}' ended in {}: {}", request.getTopic(), session.getState(), outcome.getErrorMessage());
            }
        }
        return toResponse(session, Boolean.TRUE.equals(request.getVerbose()), Duration.between(start, Instant.now()));
    }

    /**
     * Initializes a session and runs it on the session executor.
     *
     * @return the status right after initialization; ERROR when the request was rejected
     */
    public SessionStatus startResearch(ResearchRequest request) {
        Session session = createSession(request);
        Outcome<Void> init = session.initialize();
        if (init.isFailure()) {
            return session.getStatus();
        }
        sessionRegistry.register(session);
        sessionExecutor.execute(() -> {
            Outcome<ResearchResults> outcome = session.run();
            if (outcome.isFailure()) {
                log.warn("Background session {} ended in {}: {}",
                        session.getSessionId(), session.getState(), outcome.getErrorMessage());
            }
        });
        log.info("Started background session {} for '{}'", session.getSessionId(), request.getTopic());
        return session.getStatus();
    }

    public Optional<SessionStatus> getStatus(String sessionId) {
        return sessionRegistry.getSession(sessionId).map(Session::getStatus);
    }

    public Optional<Session> getSession(String sessionId) {
        return sessionRegistry.getSession(sessionId);
    }

    Session createSession(ResearchRequest request) {
        ResearchInput input = ResearchInput.of(request.getTopic(), settingsFor(request));
        return new Session(input, discoverer, extractor, queryDeriver, reportSynthesizer, jobExecutor);
    }

    ResearchSettings settingsFor(ResearchRequest request) {
        ResearchSettings.ResearchSettingsBuilder settings = researchConfig.toSettings().toBuilder();
        if (request.getMaxDepth() != null) {
            settings.maxDepth(request.getMaxDepth());
        }
        if (request.getBatchSize() != null) {
            settings.batchSize(request.getBatchSize());
        }
        if (request.getMaxResults() != null) {
            settings.maxResults(request.getMaxResults());
        }
        if (request.getSkipEmptyRounds() != null) {
            settings.skipEmptyRounds(request.getSkipEmptyRounds());
        }
        return settings.build();
    }

    public ResearchResponse toResponse(Session session, boolean verbose, Duration processingTime) {
        ResearchResponse response = ResearchResponse.builder()
                .sessionId(session.getSessionId())
                .topic(session.getTopic())
                .state(session.getState())
                .error(session.getErrorMessage())
                .results(session.getResults().orElse(null))
                .processingTimeMs(processingTime != null ? processingTime.toMillis() : null)
                .build();
        for (RoundResult round : session.getRounds()) {
            response.getRounds().add(summarize(round, verbose));
        }
        return response;
    }

    private static ResearchResponse.RoundSummary summarize(RoundResult round, boolean verbose) {
        ResearchResponse.RoundSummary summary = ResearchResponse.RoundSummary.builder()
                .round(round.getRound())
                .fallbackUsed(round.isFallbackUsed())
                .findings(round.getFindings())
                .error(round.getErrorMessage())
                .build();
        round.getQueries().stream().map(QueryConfig::getQuery).forEach(summary.getQueries()::add);
        if (round.getStepData() != null) {
            summary.setCompletedJobs(round.getStepData().completedJobs());
            summary.setFailedJobs(round.getStepData().failedJobs());
            if (verbose) {
                summary.setStep(round.getStepData());
            }
        }
        return summary;
    }
}
