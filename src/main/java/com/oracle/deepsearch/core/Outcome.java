package com.oracle.deepsearch.core;

import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.function.Function;

/**
 * Success value or typed failure, returned by every engine operation instead of throwing.
 *
 * @param <T> success payload, {@link Void} for operations that only signal success
 */
public final class Outcome<T> {

    private static final Outcome<Void> SUCCESS = new Outcome<>(null, null);

    private final T value;
    private final ResearchError error;

    private Outcome(T value, ResearchError error) {
        this.value = value;
        this.error = error;
    }

    public static Outcome<Void> success() {
        return SUCCESS;
    }

    public static <T> Outcome<T> success(T value) {
        return new Outcome<>(value, null);
    }

    public static <T> Outcome<T> failure(ResearchError error) {
        if (error == null) {
            throw new IllegalArgumentException("error must not be null");
        }
        return new Outcome<>(null, error);
    }

    public static <T> Outcome<T> failure(ErrorKind kind, String message) {
        return failure(ResearchError.of(kind, message));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    public T getValue() {
        if (error != null) {
            throw new NoSuchElementException("Outcome is a failure: " + error);
        }
        return value;
    }

    public Optional<T> value() {
        return Optional.ofNullable(value);
    }

    public ResearchError getError() {
        return error;
    }

    public String getErrorMessage() {
        return error != null ? error.getMessage() : null;
    }

    public <R> Outcome<R> map(Function<? super T, ? extends R> mapper) {
        if (error != null) {
            return failure(error);
        }
        return success(mapper.apply(value));
    }

    @Override
    public String toString() {
        return error == null ? "Success[" + value + "]" : "Failure[" + error + "]";
    }
}
