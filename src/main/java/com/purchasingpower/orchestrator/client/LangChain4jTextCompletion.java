package com.purchasingpower.orchestrator.client;

import com.purchasingpower.orchestrator.util.LogText;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.output.Response;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * {@link TextCompletion} backed by a LangChain4j chat model (Ollama by default).
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class LangChain4jTextCompletion implements TextCompletion {

    private final ChatLanguageModel chatModel;

    public LangChain4jTextCompletion(@Qualifier("validationChatModel") ChatLanguageModel chatModel) {
        this.chatModel = chatModel;
    }

    @Override
    public String complete(String systemPrompt, String userPrompt, String conversationId) {
        long start = System.currentTimeMillis();
        log.debug("🔵 LLM call [{}]: {}", conversationId, LogText.truncate(userPrompt, 200));

        try {
            Response<AiMessage> response = chatModel.generate(
                    SystemMessage.from(systemPrompt),
                    UserMessage.from(userPrompt));
            String text = response.content().text();

            log.debug("🟢 LLM call [{}] completed in {}ms: {}", conversationId,
                    System.currentTimeMillis() - start, LogText.truncate(text, 200));
            return text;
        } catch (RuntimeException e) {
            log.error("🔴 LLM call [{}] failed after {}ms: {}", conversationId,
                    System.currentTimeMillis() - start, e.getMessage());
            throw new RuntimeException("LLM completion failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String getProviderName() {
        return "langchain4j";
    }
}
