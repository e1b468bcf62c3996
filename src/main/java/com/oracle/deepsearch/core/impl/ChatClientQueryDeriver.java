package com.oracle.deepsearch.core.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.oracle.deepsearch.config.ResearchConfig;
import com.oracle.deepsearch.core.CollaboratorException;
import com.oracle.deepsearch.core.QueryDeriver;
import com.oracle.deepsearch.model.QueryConfig;
import com.oracle.deepsearch.service.PromptTemplateService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Asks the chat model for the next batch of search queries. Malformed entries are dropped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ChatClientQueryDeriver implements QueryDeriver {

    private final ChatClient.Builder chatClientBuilder;
    private volatile ChatClient chatClient;
    private final PromptTemplateService promptTemplateService;
    private final JsonResponseParser jsonResponseParser;
    private final ResearchConfig researchConfig;

    @Override
    public List<QueryConfig> derive(String topic, List<String> priorFindings, int batchSize) {
        String prompt = promptTemplateService.createQueryPrompt(topic, priorFindings, batchSize);

        String response = client().prompt()
                .user(prompt)
                .options(ChatOptions.builder()
                        .temperature(researchConfig.getDerivationTemperature())
                        .build())
                .call()
                .content();

        JsonNode root = jsonResponseParser.parse(response)
                .orElseThrow(() -> new CollaboratorException("Query derivation response was not JSON"));
        List<QueryConfig> queries = parseQueries(root, batchSize);
        log.info("Derived {} queries for topic '{}' from {} prior findings blocks",
                queries.size(), topic, priorFindings.size());
        return queries;
    }

    static List<QueryConfig> parseQueries(JsonNode root, int batchSize) {
        List<QueryConfig> queries = new ArrayList<>();
        for (JsonNode node : root.path("queries")) {
            if (queries.size() >= batchSize) {
                break;
            }
            String query = node.path("query").asText("").trim();
            List<String> goals = new ArrayList<>();
            node.path("goals").forEach(goal -> {
                String text = goal.asText("").trim();
                if (!text.isEmpty()) {
                    goals.add(text);
                }
            });
            if (query.isEmpty() || goals.isEmpty()) {
                log.warn("Dropping malformed derived query: {}", node);
                continue;
            }
            queries.add(QueryConfig.of(query, goals));
        }
        return queries;
    }

    private ChatClient client() {
        if (this.chatClient == null) {
            synchronized (this) {
                if (this.chatClient == null) {
                    this.chatClient = chatClientBuilder.build();
                }
            }
        }
        return chatClient;
    }
}
