package com.oracle.deepsearch.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OutcomeTest {

    @Test
    @DisplayName("success carries its value and maps it")
    void success() {
        Outcome<Integer> outcome = Outcome.success(2).map(value -> value * 21);

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.getValue()).isEqualTo(42);
        assertThat(outcome.value()).contains(42);
        assertThat(outcome.getError()).isNull();
    }

    @Test
    @DisplayName("failure carries its error through map and has no value")
    void failure() {
        Outcome<Integer> failed = Outcome.failure(ErrorKind.JOB_FAILURE, "no results found");
        Outcome<String> mapped = failed.map(String::valueOf);

        assertThat(mapped.isFailure()).isTrue();
        assertThat(mapped.getError().getKind()).isEqualTo(ErrorKind.JOB_FAILURE);
        assertThat(mapped.getErrorMessage()).isEqualTo("no results found");
        assertThat(mapped.value()).isEmpty();
        assertThatThrownBy(mapped::getValue).isInstanceOf(NoSuchElementException.class);
    }
}
