package com.oracle.deepsearch.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.anthropic.AnthropicChatModel;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.google.genai.GoogleGenAiChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.util.LinkedHashMap;
import java.util.Map;

@Configuration
@Slf4j
public class ChatClientConfig {

    static final String RESEARCH_SYSTEM_PROMPT = "You are a meticulous research assistant. "
            + "Work only from the material you are given and always answer in the exact JSON format requested.";

    /**
     * ChatClient.Builder shared by query derivation and report synthesis.
     * <p>
     * The provider named by {@code spring.ai.model.chat} wins when its model is present; otherwise the
     * first available of OpenAI, Anthropic and Google GenAI is used.
     */
    @Bean
    @Primary
    public ChatClient.Builder chatClientBuilder(
            @Value("${spring.ai.model.chat:openai}") String preferredProvider,
            ObjectProvider<OpenAiChatModel> openAiProvider,
            ObjectProvider<AnthropicChatModel> anthropicProvider,
            ObjectProvider<GoogleGenAiChatModel> googleProvider) {

        Map<String, ObjectProvider<? extends ChatModel>> candidates = new LinkedHashMap<>();
        candidates.put("openai", openAiProvider);
        candidates.put("anthropic", anthropicProvider);
        candidates.put("google-genai", googleProvider);

        ChatModel model = null;
        String chosen = null;
        ObjectProvider<? extends ChatModel> preferred = candidates.get(preferredProvider);
        if (preferred != null) {
            model = preferred.getIfAvailable();
            chosen = preferredProvider;
        }
        for (Map.Entry<String, ObjectProvider<? extends ChatModel>> candidate : candidates.entrySet()) {
            if (model != null) {
                break;
            }
            model = candidate.getValue().getIfAvailable();
            chosen = candidate.getKey();
        }

        if (model == null) {
            throw new IllegalStateException(
                "No chat model available for query derivation and report synthesis. Set RESEARCH_CHAT_PROVIDER "
                + "and the matching key (OPENAI_API_KEY, ANTHROPIC_API_KEY or GOOGLE_API_KEY).");
        }
        log.info("Research chat model provider: {}", chosen);

        return ChatClient.builder(model).defaultSystem(RESEARCH_SYSTEM_PROMPT);
    }
}
