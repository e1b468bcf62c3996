package com.oracle.deepsearch.core;

public class RateLimitException extends CollaboratorException {

    public RateLimitException(String message) {
        super(message);
    }
}
