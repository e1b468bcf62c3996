package com.oracle.deepsearch.core;

import lombok.Value;

@Value
public class ResearchError {

    ErrorKind kind;

    String message;

    public static ResearchError of(ErrorKind kind, String message) {
        return new ResearchError(kind, message);
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
