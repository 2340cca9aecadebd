package com.purchasingpower.orchestrator.client;

/**
 * Opaque LLM invocation used by the relevance validator, the approval service and agents.
 *
 * <p>Implementations may block. Callers run them on an executor.
 *
 * @since 1.0.0
 */
public interface TextCompletion {

    /**
     * @param systemPrompt   instructions for the model
     * @param userPrompt     the actual question
     * @param conversationId optional conversation for context tracking, may be null
     * @return raw model output
     */
    String complete(String systemPrompt, String userPrompt, String conversationId);

    /**
     * Provider name, for logging.
     */
    String getProviderName();
}
