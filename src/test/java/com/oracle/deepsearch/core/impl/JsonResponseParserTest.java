package com.oracle.deepsearch.core.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class JsonResponseParserTest {

    private final JsonResponseParser parser = new JsonResponseParser(new ObjectMapper());

    @Test
    @DisplayName("plain JSON object")
    void plainJson() {
        assertThat(parser.parse("  {\"a\": 1}  ")).hasValueSatisfying(node ->
                assertThat(node.path("a").asInt()).isEqualTo(1));
    }

    @Test
    @DisplayName("JSON inside a fenced block with surrounding prose")
    void fenced() {
        String response = "Here you go:\n```json\n{\"queries\": []}\n```\nAnything else?";

        assertThat(parser.parse(response)).hasValueSatisfying(node ->
                assertThat(node.has("queries")).isTrue());
    }

    @Test
    @DisplayName("JSON embedded in prose without a fence")
    void embedded() {
        String response = "Sure. {\"mainReport\": \"text with } brace\"} Hope this helps.";

        assertThat(parser.parse(response)).hasValueSatisfying(node ->
                assertThat(node.path("mainReport").asText()).isEqualTo("text with } brace"));
    }

    @Test
    @DisplayName("non-object JSON and garbage yield nothing")
    void rejects() {
        assertThat(parser.parse("[1, 2, 3]")).isEmpty();
        assertThat(parser.parse("no json here")).isEmpty();
        assertThat(parser.parse("{broken")).isEmpty();
        assertThat(parser.parse(null)).isEmpty();
        assertThat(parser.parse("   ")).isEmpty();
    }
}
