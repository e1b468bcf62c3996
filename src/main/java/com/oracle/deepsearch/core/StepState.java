package com.oracle.deepsearch.core;

public enum StepState {
    NONE,
    INITIALIZED,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
