package com.oracle.deepsearch.core.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

/**
 * Pulls a JSON object out of free-form model output.
 */
@Component
public class JsonResponseParser {

    private final ObjectMapper objectMapper;

    public JsonResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Accepts pure JSON, JSON inside a ```json fence, or the largest {...} slice that parses.
     */
    public Optional<JsonNode> parse(String response) {
        String trimmed = response == null ? "" : response.trim();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }
        if (trimmed.charAt(0) == '{') {
            Optional<JsonNode> direct = tryRead(trimmed);
            if (direct.isPresent()) {
                return direct;
            }
        }

        int fenceStart = trimmed.indexOf("```");
        while (fenceStart != -1) {
            int fenceEnd = trimmed.indexOf("```", fenceStart + 3);
            if (fenceEnd == -1) break;

            int headerEnd = trimmed.indexOf('\n', fenceStart + 3);
            String header = "";
            int contentStart;
            if (headerEnd != -1 && headerEnd < fenceEnd) {
                header = trimmed.substring(fenceStart + 3, headerEnd).trim().toLowerCase(Locale.ROOT);
                contentStart = headerEnd + 1;
            } else {
                contentStart = fenceStart + 3;
            }
            if (header.isEmpty() || header.contains("json")) {
                Optional<JsonNode> fenced = tryRead(trimmed.substring(contentStart, fenceEnd).trim());
                if (fenced.isPresent()) {
                    return fenced;
                }
            }
            fenceStart = trimmed.indexOf("```", fenceEnd + 3);
        }

        int firstBrace = trimmed.indexOf('{');
        int lastBrace = trimmed.lastIndexOf('}');
        while (firstBrace != -1 && lastBrace != -1 && lastBrace > firstBrace) {
            Optional<JsonNode> slice = tryRead(trimmed.substring(firstBrace, lastBrace + 1));
            if (slice.isPresent()) {
                return slice;
            }
            lastBrace = trimmed.lastIndexOf('}', lastBrace - 1);
        }
        return Optional.empty();
    }

    private Optional<JsonNode> tryRead(String candidate) {
        try {
            JsonNode node = objectMapper.readTree(candidate);
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (Exception ignore) {
            return Optional.empty();
        }
    }
}
