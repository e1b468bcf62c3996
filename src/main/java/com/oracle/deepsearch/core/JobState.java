package com.oracle.deepsearch.core;

/**
 * NONE → INITIALIZED → RUNNING → {COMPLETED | FAILED}.
 */
public enum JobState {
    NONE,
    INITIALIZED,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
