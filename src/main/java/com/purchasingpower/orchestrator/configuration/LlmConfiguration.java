package com.purchasingpower.orchestrator.configuration;

import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Chat model used for relevance judgments, approval decisions and the built-in agents.
 *
 * MODEL: local Ollama model, deterministic (temperature 0) so repeated
 * validations of the same action agree.
 *
 * @since 1.0.0
 */
@Slf4j
@Configuration
public class LlmConfiguration {

    @Value("${app.llm.ollama.base-url:http://localhost:11434}")
    private String ollamaBaseUrl;

    @Value("${app.llm.ollama.model:qwen2.5:7b}")
    private String ollamaModel;

    @Value("${app.llm.ollama.timeout-seconds:60}")
    private int ollamaTimeoutSeconds;

    @Value("${app.llm.ollama.max-retries:2}")
    private int ollamaMaxRetries;

    @Bean("validationChatModel")
    public ChatLanguageModel validationChatModel() {
        log.info("🔧 Initializing validation chat model (Ollama)");
        log.info("   - URL: {}", ollamaBaseUrl);
        log.info("   - Model: {}", ollamaModel);

        ChatLanguageModel model = OllamaChatModel.builder()
                .baseUrl(ollamaBaseUrl)
                .modelName(ollamaModel)
                .timeout(Duration.ofSeconds(ollamaTimeoutSeconds))
                .temperature(0.0)
                .maxRetries(ollamaMaxRetries)
                .logRequests(false)
                .logResponses(false)
                .build();

        log.info("✅ Validation chat model initialized");
        return model;
    }
}
