package com.oracle.deepsearch.core.impl;

import com.oracle.deepsearch.config.ResearchConfig;
import com.oracle.deepsearch.core.Session;
import com.oracle.deepsearch.core.SessionRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Session lookup backed by a concurrent map. Finished sessions are swept on every registration once
 * they are older than the configured retention.
 */
@Component
@Slf4j
public class InMemorySessionRegistry implements SessionRegistry {

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final Duration retention;
    private final Clock clock;

    @Autowired
    public InMemorySessionRegistry(ResearchConfig researchConfig) {
        this(researchConfig.getSessionRetention(), Clock.systemUTC());
    }

    public InMemorySessionRegistry(Duration retention, Clock clock) {
        this.retention = retention;
        this.clock = clock;
    }

    @Override
    public void register(Session session) {
        if (session.getSessionId() == null) {
            throw new IllegalArgumentException("Session must be initialized before it is registered");
        }
        evictExpired();
        sessions.put(session.getSessionId(), session);
    }

    @Override
    public Optional<Session> getSession(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public Collection<Session> getSessions() {
        return List.copyOf(sessions.values());
    }

    @Override
    public void removeSession(String sessionId) {
        sessions.remove(sessionId);
    }

    @Override
    public int evictExpired() {
        Instant cutoff = clock.instant().minus(retention);
        int evicted = 0;
        for (Session session : sessions.values()) {
            Instant endTime = session.getEndTime();
            if (session.getState().isTerminal() && endTime != null && endTime.isBefore(cutoff)) {
                removeSession(session.getSessionId());
                evicted++;
            }
        }
        if (evicted > 0) {
            log.info("Evicted {} finished sessions older than {}", evicted, retention);
        }
        return evicted;
    }
}
