package com.oracle.deepsearch.core.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.oracle.deepsearch.config.ResearchConfig;
import com.oracle.deepsearch.core.CollaboratorException;
import com.oracle.deepsearch.core.ReportSynthesizer;
import com.oracle.deepsearch.model.ResearchResults;
import com.oracle.deepsearch.service.PromptTemplateService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Component
@RequiredArgsConstructor
@Slf4j
public class ChatClientReportSynthesizer implements ReportSynthesizer {

    private final ChatClient.Builder chatClientBuilder;
    private volatile ChatClient chatClient;
    private final PromptTemplateService promptTemplateService;
    private final JsonResponseParser jsonResponseParser;
    private final ResearchConfig researchConfig;

    @Override
    public ResearchResults synthesize(String topic, List<String> allFindings) {
        log.info("Synthesizing report for '{}' from {} findings blocks", topic, allFindings.size());
        String prompt = promptTemplateService.createReportPrompt(topic, allFindings);

        String response = client().prompt()
                .user(prompt)
                .options(ChatOptions.builder()
                        .temperature(researchConfig.getSynthesisTemperature())
                        .build())
                .call()
                .content();

        if (response == null || response.isBlank()) {
            throw new CollaboratorException("Report synthesis returned an empty response");
        }
        return toResults(jsonResponseParser.parse(response), response);
    }

    static ResearchResults toResults(Optional<JsonNode> parsed, String rawResponse) {
        if (parsed.isEmpty() || !parsed.get().hasNonNull("mainReport")) {
            log.warn("Failed to parse synthesis JSON, using raw response as report");
            return ResearchResults.builder().mainReport(rawResponse.trim()).build();
        }
        JsonNode node = parsed.get();
        String notes = node.path("additionalNotes").asText("");
        return ResearchResults.builder()
                .mainReport(node.get("mainReport").asText())
                .keyLearnings(texts(node.path("keyLearnings")))
                .areasCovered(texts(node.path("areasCovered")))
                .areasToExplore(texts(node.path("areasToExplore")))
                .additionalNotes(notes.isBlank() ? null : notes)
                .build();
    }

    private static List<String> texts(JsonNode array) {
        List<String> values = new ArrayList<>();
        array.forEach(item -> {
            String text = item.asText("").trim();
            if (!text.isEmpty()) {
                values.add(text);
            }
        });
        return values;
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
