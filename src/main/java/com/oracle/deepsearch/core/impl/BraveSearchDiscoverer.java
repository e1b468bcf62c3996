package com.oracle.deepsearch.core.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.oracle.deepsearch.config.ToolsConfig;
import com.oracle.deepsearch.core.CollaboratorException;
import com.oracle.deepsearch.core.Discoverer;
import com.oracle.deepsearch.core.RateLimitException;
import com.oracle.deepsearch.model.SearchResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Web search through the Brave Search API.
 * <p>
 * Calls are spaced at least {@code minRequestIntervalMs} apart across all threads. A 429 answer is
 * retried once after a back-off; a second failure is reported to the caller.
 */
@Component
@Slf4j
public class BraveSearchDiscoverer implements Discoverer {

    static final int MAX_COUNT = 20;

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ToolsConfig.Brave config;

    private final Object pacingLock = new Object();
    private long lastRequestTime;

    @Autowired
    public BraveSearchDiscoverer(ToolsConfig toolsConfig, ObjectMapper objectMapper) {
        this(HttpClient.newBuilder()
                        .connectTimeout(Duration.ofSeconds(toolsConfig.getBrave().getTimeoutSeconds()))
                        .build(),
                toolsConfig.getBrave(), objectMapper);
    }

    BraveSearchDiscoverer(HttpClient httpClient, ToolsConfig.Brave config, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.config = config;
        this.objectMapper = objectMapper;
    }

    @Override
    @Cacheable(value = "search-results", key = "#query + ':' + #count")
    public List<SearchResult> discover(String query, int count) {
        if (config.getApiKey() == null || config.getApiKey().isBlank()) {
            throw new CollaboratorException("Brave API key is not configured (research.tools.brave.api-key)");
        }
        try {
            return search(query, count);
        } catch (RateLimitException e) {
            log.warn("Rate limit exceeded, retrying after {} ms", config.getRateLimitBackoffMs());
            sleep(config.getRateLimitBackoffMs());
            return search(query, count);
        }
    }

    private List<SearchResult> search(String query, int count) {
        waitForRateLimit();

        int bounded = Math.max(1, Math.min(count, MAX_COUNT));
        URI uri = URI.create(config.getBaseUrl()
                + "?q=" + URLEncoder.encode(query, StandardCharsets.UTF_8)
                + "&count=" + bounded);

        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(Duration.ofSeconds(config.getTimeoutSeconds()))
                .header("Accept", "application/json")
                .header("X-Subscription-Token", config.getApiKey())
                .GET()
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new CollaboratorException("Brave search request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CollaboratorException("Brave search interrupted", e);
        }

        if (response.statusCode() == 429) {
            throw new RateLimitException("Brave search rate limit exceeded");
        }
        if (response.statusCode() != 200) {
            log.error("Brave search API error: {} - {}", response.statusCode(), response.body());
            throw new CollaboratorException("Brave search API error: " + response.statusCode());
        }
        return parseResults(response.body());
    }

    List<SearchResult> parseResults(String body) {
        try {
            JsonNode results = objectMapper.readTree(body).path("web").path("results");
            List<SearchResult> parsed = new ArrayList<>();
            for (JsonNode node : results) {
                String url = node.path("url").asText("");
                if (url.isBlank()) {
                    continue;
                }
                parsed.add(SearchResult.builder()
                        .title(node.path("title").asText(""))
                        .url(url)
                        .description(node.path("description").asText(""))
                        .age(node.hasNonNull("age") ? node.get("age").asText() : null)
                        .build());
            }
            log.debug("Brave search returned {} results", parsed.size());
            return parsed;
        } catch (IOException e) {
            throw new CollaboratorException("Unreadable Brave search response: " + e.getMessage(), e);
        }
    }

    private void waitForRateLimit() {
        synchronized (pacingLock) {
            long elapsed = System.currentTimeMillis() - lastRequestTime;
            if (elapsed < config.getMinRequestIntervalMs()) {
                sleep(config.getMinRequestIntervalMs() - elapsed);
            }
            lastRequestTime = System.currentTimeMillis();
        }
    }

    private static void sleep(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CollaboratorException("Interrupted while waiting for the search rate limit", e);
        }
    }
}
