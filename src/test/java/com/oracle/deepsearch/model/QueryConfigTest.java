package com.oracle.deepsearch.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class QueryConfigTest {

    @Test
    @DisplayName("goal lists are cut to the first four")
    void truncatesGoals() {
        QueryConfig config = QueryConfig.of("q", List.of("1", "2", "3", "4", "5", "6"));

        assertThat(config.getGoals()).containsExactly("1", "2", "3", "4");
    }

    @Test
    @DisplayName("null goals become an empty list")
    void nullGoals() {
        assertThat(QueryConfig.of("q", null).getGoals()).isEmpty();
    }

    @Test
    @DisplayName("fallback asks two generic questions about the topic")
    void fallback() {
        QueryConfig config = QueryConfig.fallback("lithium mining");

        assertThat(config.getQuery()).isEqualTo("lithium mining");
        assertThat(config.getGoals()).hasSize(2).allMatch(goal -> goal.contains("lithium mining"));
    }

    @Test
    @DisplayName("toBuilder keeps the truncation")
    void toBuilder() {
        QueryConfig config = QueryConfig.of("q", List.of("1")).toBuilder()
                .goals(List.of("a", "b", "c", "d", "e"))
                .maxResults(5)
                .build();

        assertThat(config.getGoals()).hasSize(QueryConfig.MAX_GOALS);
        assertThat(config.getMaxResults()).isEqualTo(5);
    }
}
