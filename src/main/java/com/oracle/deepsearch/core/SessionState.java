package com.oracle.deepsearch.core;

/**
 * NONE → INITIALIZED → RESEARCHING → {COMPLETED | ERROR}.
 */
public enum SessionState {
    NONE,
    INITIALIZED,
    RESEARCHING,
    COMPLETED,
    ERROR;

    public boolean isTerminal() {
        return this == COMPLETED || this == ERROR;
    }
}
