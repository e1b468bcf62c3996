package com.oracle.deepsearch.core.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.oracle.deepsearch.config.ToolsConfig;
import com.oracle.deepsearch.core.CollaboratorException;
import com.oracle.deepsearch.core.Extractor;
import com.oracle.deepsearch.model.ExtractionResult;
import com.oracle.deepsearch.model.QueryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Goal-driven content extraction through the Firecrawl extract API.
 * <p>
 * Submits an extract job with a JSON schema holding one string property per goal, then polls the
 * job until it completes. Goals the pages do not answer come back as {@link ExtractionResult#NOT_FOUND}.
 */
@Component
@Slf4j
public class FirecrawlExtractor implements Extractor {

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ToolsConfig.Firecrawl config;

    @Autowired
    public FirecrawlExtractor(ToolsConfig toolsConfig, ObjectMapper objectMapper) {
        this(HttpClient.newHttpClient(), toolsConfig.getFirecrawl(), objectMapper);
    }

    FirecrawlExtractor(HttpClient httpClient, ToolsConfig.Firecrawl config, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.config = config;
        this.objectMapper = objectMapper;
    }

    @Override
    public ExtractionResult extract(List<String> urls, List<String> goals) {
        if (config.getApiKey() == null || config.getApiKey().isBlank()) {
            throw new CollaboratorException("Firecrawl API key is not configured (research.tools.firecrawl.api-key)");
        }
        List<String> boundedGoals = goals.subList(0, Math.min(goals.size(), QueryConfig.MAX_GOALS));
        log.info("Starting content extraction for {} URLs", urls.size());

        ObjectNode body = objectMapper.createObjectNode();
        ArrayNode urlArray = body.putArray("urls");
        urls.forEach(urlArray::add);
        body.put("prompt", createPrompt(boundedGoals));
        body.set("schema", createSchema(boundedGoals));

        JsonNode submitted = send(HttpRequest.newBuilder()
                .uri(URI.create(config.getBaseUrl() + "/extract"))
                .timeout(Duration.ofSeconds(config.getTimeoutSeconds()))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + config.getApiKey())
                .POST(HttpRequest.BodyPublishers.ofString(body.toString()))
                .build());
        checkSuccess(submitted);

        JsonNode data = submitted.get("data");
        if (data == null || data.isNull()) {
            String jobId = submitted.path("id").asText("");
            if (jobId.isBlank()) {
                throw new CollaboratorException("Extraction failed: response carried neither data nor job id");
            }
            data = awaitJob(jobId);
        }

        Map<String, String> answers = new LinkedHashMap<>();
        for (int i = 0; i < boundedGoals.size(); i++) {
            String goalId = ExtractionResult.goalId(i);
            JsonNode answer = data.get(goalId);
            answers.put(goalId, answer == null || answer.isNull() || answer.asText().isBlank()
                    ? ExtractionResult.NOT_FOUND
                    : answer.asText());
        }
        return ExtractionResult.builder()
                .answers(answers)
                .sources(List.copyOf(urls))
                .build();
    }

    private JsonNode awaitJob(String jobId) {
        long deadline = System.currentTimeMillis() + Duration.ofSeconds(config.getTimeoutSeconds()).toMillis();
        HttpRequest statusRequest = HttpRequest.newBuilder()
                .uri(URI.create(config.getBaseUrl() + "/extract/" + jobId))
                .timeout(Duration.ofSeconds(config.getTimeoutSeconds()))
                .header("Authorization", "Bearer " + config.getApiKey())
                .GET()
                .build();

        while (true) {
            JsonNode status = send(statusRequest);
            checkSuccess(status);
            String state = status.path("status").asText("");
            switch (state) {
                case "completed":
                    return status.path("data");
                case "failed":
                case "cancelled":
                    throw new CollaboratorException("Extraction job " + jobId + " " + state + ": "
                            + status.path("error").asText("no details"));
                default:
                    break;
            }
            if (System.currentTimeMillis() >= deadline) {
                throw new CollaboratorException("Extraction job " + jobId + " timed out after "
                        + config.getTimeoutSeconds() + "s");
            }
            try {
                Thread.sleep(config.getPollIntervalMs());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CollaboratorException("Interrupted while waiting for extraction job " + jobId, e);
            }
        }
    }

    private JsonNode send(HttpRequest request) {
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new CollaboratorException("Firecrawl request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CollaboratorException("Firecrawl request interrupted", e);
        }
        if (response.statusCode() / 100 != 2) {
            log.error("Firecrawl API error: {} - {}", response.statusCode(), response.body());
            throw new CollaboratorException("Firecrawl API error: " + response.statusCode());
        }
        try {
            return objectMapper.readTree(response.body());
        } catch (IOException e) {
            throw new CollaboratorException("Unreadable Firecrawl response: " + e.getMessage(), e);
        }
    }

    private static void checkSuccess(JsonNode response) {
        if (!response.path("success").asBoolean(false)) {
            throw new CollaboratorException("Extraction failed: " + response.path("error").asText("Unknown error"));
        }
    }

    ObjectNode createSchema(List<String> goals) {
        ObjectNode schema = objectMapper.createObjectNode();
        schema.put("type", "object");
        ObjectNode properties = schema.putObject("properties");
        for (int i = 0; i < goals.size(); i++) {
            ObjectNode property = properties.putObject(ExtractionResult.goalId(i));
            property.put("type", "string");
            property.put("description", goals.get(i));
            if (i > 0) {
                property.put("default", ExtractionResult.NOT_FOUND);
            }
        }
        schema.putArray("required").add(ExtractionResult.goalId(0));
        return schema;
    }

    static String createPrompt(List<String> goals) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Provide ONLY factual, data-oriented information stated in these pages.\n\n");
        prompt.append("Answer each research goal directly and concisely:\n");
        for (String goal : goals) {
            prompt.append("- ").append(goal).append("\n");
        }
        prompt.append("\nRequirements:\n");
        prompt.append("1. Use only information explicitly stated in the sources\n");
        prompt.append("2. Prefer precise numbers, dates and statistics\n");
        prompt.append("3. Keep answers concise but complete\n");
        prompt.append("4. If a goal is not answered by the sources, answer \"")
                .append(ExtractionResult.NOT_FOUND).append("\"\n");
        prompt.append("5. No opinions, interpretation or speculation\n");
        return prompt.toString();
    }
}
