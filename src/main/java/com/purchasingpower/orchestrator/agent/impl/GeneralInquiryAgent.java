package com.purchasingpower.orchestrator.agent.impl;

import com.purchasingpower.orchestrator.agent.RequestTypeDispatchingAgent;
import com.purchasingpower.orchestrator.client.TextCompletion;
import com.purchasingpower.orchestrator.model.agent.AgentCapability;
import com.purchasingpower.orchestrator.model.agent.AgentIntent;
import com.purchasingpower.orchestrator.model.agent.AgentRequest;
import com.purchasingpower.orchestrator.model.agent.AgentResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Catch-all agent behind the GENERAL_INQUIRY intent, which is also the bus's fallback intent.
 *
 * <p>Request types:
 * <ul>
 *   <li>{@code answer} - answer the user's input directly (default)</li>
 *   <li>{@code summarize} - summarize the input, typically the output of a previous agent</li>
 * </ul>
 */
@Slf4j
@Component
public class GeneralInquiryAgent extends RequestTypeDispatchingAgent<GeneralInquiryAgent.RequestType> {

    public static final String AGENT_ID = "general-inquiry";

    public enum RequestType {
        ANSWER,
        SUMMARIZE
    }

    private static final String ANSWER_PROMPT = """
            You are a helpful assistant for a relationship-management platform.
            Answer the user's question concisely. If you do not know, say so.
            """;

    private static final String SUMMARIZE_PROMPT = """
            Summarize the following text in at most five sentences.
            Keep names, dates and amounts exactly as written.
            """;

    private final TextCompletion textCompletion;
    private final Executor executor;

    public GeneralInquiryAgent(TextCompletion textCompletion, @Qualifier("agentExecutor") Executor executor) {
        super(RequestType.class);
        this.textCompletion = textCompletion;
        this.executor = executor;
        on(RequestType.ANSWER, request -> complete(request, ANSWER_PROMPT));
        on(RequestType.SUMMARIZE, request -> complete(request, SUMMARIZE_PROMPT));
    }

    @Override
    protected RequestType defaultRequestType() {
        return RequestType.ANSWER;
    }

    @Override
    public AgentCapability describe() {
        return AgentCapability.builder()
                .agentId(AGENT_ID)
                .agentName("General Inquiry Agent")
                .description("Answers and summarizes free-form requests no specialized agent handles")
                .version("1.0.0")
                .supportedIntents(List.of(AgentIntent.GENERAL_INQUIRY))
                .supportedTasks(List.of("answer", "summarize"))
                .build();
    }

    private CompletableFuture<AgentResponse> complete(AgentRequest request, String systemPrompt) {
        return CompletableFuture.supplyAsync(() -> {
            String text = textCompletion.complete(systemPrompt, request.getOriginalUserInput(), request.getConversationId());
            return AgentResponse.builder()
                    .requestId(request.getId())
                    .traceId(request.getTraceId())
                    .agentId(AGENT_ID)
                    .success(true)
                    .content(text)
                    .confidence(0.6)
                    .data(Map.of("provider", textCompletion.getProviderName()))
                    .build();
        }, executor);
    }
}
