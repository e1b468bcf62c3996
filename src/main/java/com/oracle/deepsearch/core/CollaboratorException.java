package com.oracle.deepsearch.core;

/**
 * Raised by a discovery, extraction or LLM collaborator when a call cannot be completed.
 */
public class CollaboratorException extends RuntimeException {

    public CollaboratorException(String message) {
        super(message);
    }

    public CollaboratorException(String message, Throwable cause) {
        super(message, cause);
    }
}
