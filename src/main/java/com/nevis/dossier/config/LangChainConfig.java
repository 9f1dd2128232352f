package com.nevis.dossier.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GeminiThinkingConfig;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@RequiredArgsConstructor
public class LangChainConfig {

    private final GeminiProperties geminiProperties;

    @Bean("reasoningChatModel")
    public ChatModel reasoningChatModel() {
        return GoogleAiGeminiChatModel.builder()
            .apiKey(geminiProperties.apiKey())
            .modelName(geminiProperties.modelName())
            .temperature(0.1)
            .topP(0.95)
            .timeout(geminiProperties.timeout())
            .maxRetries(geminiProperties.maxRetries())
            .logRequests(false)
            .logResponses(false)
            .build();
    }

    @Bean("directChatModel")
    public ChatModel directChatModel() {
        return GoogleAiGeminiChatModel.builder()
            .apiKey(geminiProperties.apiKey())
            .modelName(geminiProperties.modelName())
            .temperature(0.0)
            .timeout(geminiProperties.timeout())
            .maxRetries(geminiProperties.maxRetries())
            .thinkingConfig(GeminiThinkingConfig.builder()
                .includeThoughts(false)
                .thinkingBudget(0)
                .build())
            .build();
    }
}
