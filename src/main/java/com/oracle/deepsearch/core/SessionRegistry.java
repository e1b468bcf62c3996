package com.oracle.deepsearch.core;

import java.util.Collection;
import java.util.Optional;

/**
 * Keeps sessions addressable by id so their status can be read while they run and for a while after.
 * In-memory only; nothing survives a restart.
 */
public interface SessionRegistry {

    void register(Session session);

    Optional<Session> getSession(String sessionId);

    Collection<Session> getSessions();

    void removeSession(String sessionId);

    /**
     * Drops terminal sessions that ended longer ago than the retention allows. Running sessions are kept.
     *
     * @return number of sessions removed
     */
    int evictExpired();
}
