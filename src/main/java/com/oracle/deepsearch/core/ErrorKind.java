package com.oracle.deepsearch.core;

public enum ErrorKind {
    /** Malformed query config or research input, caught at initialize(). */
    CONFIGURATION,
    /** A discovery/extraction call failed after the collaborator's own retry. */
    COLLABORATOR,
    /** An operation was invoked from a state that does not allow it. */
    ILLEGAL_STATE,
    JOB_FAILURE,
    /** Every job of a step failed. */
    STEP_FAILURE
}
