package com.architecture.memory.flowgrade.config;

import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Chat model used as the inference engine for graph extraction, problem analysis
 * and solution comparison. Reads API key and model name from application.yml.
 */
@Configuration
@Slf4j
public class OpenAIConfig {

    @Value("${openai.api-key}")
    private String apiKey;

    @Value("${openai.model.chat:gpt-4o}")
    private String chatModel;

    @Value("${openai.timeout:60}")
    private int timeoutSeconds;

    @Value("${openai.max-retries:3}")
    private int maxRetries;

    @Value("${openai.max-tokens:4096}")
    private int maxTokens;

    /**
     * The timeout here is the only bound on a collaborator call; a call that runs past it
     * fails and nothing is cached for it.
     */
    @Bean
    public ChatLanguageModel chatLanguageModel() {
        log.info("[OpenAI Config] Initializing ChatLanguageModel with model: {}", chatModel);

        return OpenAiChatModel.builder()
                .apiKey(apiKey)
                .modelName(chatModel)
                .temperature(0.0)
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .maxRetries(maxRetries)
                .maxTokens(maxTokens)
                .logRequests(false)
                .logResponses(false)
                .build();
    }
}
