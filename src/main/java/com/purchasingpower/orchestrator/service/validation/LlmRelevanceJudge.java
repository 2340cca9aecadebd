package com.purchasingpower.orchestrator.service.validation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.orchestrator.client.TextCompletion;
import com.purchasingpower.orchestrator.model.action.ActionRelevanceResult;
import com.purchasingpower.orchestrator.model.action.ContactContext;
import com.purchasingpower.orchestrator.model.action.ScheduledAction;
import com.purchasingpower.orchestrator.model.action.ValidationMethod;
import com.purchasingpower.orchestrator.util.LogText;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Tier 3: asks the LLM whether a scheduled action is still appropriate.
 *
 * <p>Fails closed. Unparsable output, a missing field, an out-of-range confidence, a timeout or a
 * provider error all produce {@code relevant=false} with confidence 0 and a non-empty reasoning.
 * The returned future never completes exceptionally.
 */
@Slf4j
@Component
public class LlmRelevanceJudge {

    static final String PARSE_FAILURE = "Failed to parse LLM response";

    private static final String SYSTEM_PROMPT = """
            You validate whether previously scheduled customer-relationship actions are still appropriate.
            Executing a stale or harmful action is worse than skipping a useful one.
            Respond with a single JSON object and nothing else.
            """;

    private static final String USER_PROMPT = """
            Analyze whether the following scheduled action is still relevant given the current contact context and user preferences.

            SCHEDULED ACTION:
            - Type: %s
            - Description: %s
            - Scheduled At: %s
            - Execute At: %s
            - Relevance Criteria: %s

            CURRENT CONTACT CONTEXT:
            %s

            USER OVERRIDE PREFERENCES:
            %s

            EVALUATION INSTRUCTIONS:
            1. Determine if the action is still appropriate given the current context
            2. Consider if the contact's situation has changed since the action was scheduled
            3. Take the user's override preferences into account
            4. Provide a confidence score between 0.0 and 1.0

            Respond in JSON format:
            {
              "isRelevant": true/false,
              "confidenceScore": 0.0-1.0,
              "reason": "explanation",
              "recommendedAction": "proceed/reschedule/modify/cancel",
              "alternativeActions": ["action1", "action2"]
            }
            """;

    private final TextCompletion textCompletion;
    private final ObjectMapper objectMapper;
    private final Executor executor;

    public LlmRelevanceJudge(TextCompletion textCompletion,
                             ObjectMapper objectMapper,
                             @Qualifier("validationExecutor") Executor executor) {
        this.textCompletion = textCompletion;
        this.objectMapper = objectMapper;
        this.executor = executor;
    }

    public CompletableFuture<ActionRelevanceResult> judge(ScheduledAction action, ContactContext context,
                                                          Map<String, Object> userOverrides,
                                                          ActionRelevanceConfig config, String traceId) {
        String prompt;
        try {
            prompt = buildPrompt(action, context, userOverrides);
        } catch (RuntimeException e) {
            log.error("❌ [{}] Cannot build LLM validation prompt for action {}", traceId, action.getId(), e);
            return CompletableFuture.completedFuture(failClosed(action, traceId, "LLM validation failed: " + e.getMessage()));
        }
        log.debug("🤖 [{}] LLM relevance check for action {}: {}", traceId, action.getId(), LogText.truncate(prompt, 500));

        return CompletableFuture.supplyAsync(() -> textCompletion.complete(SYSTEM_PROMPT, prompt, traceId), executor)
                .orTimeout(config.getLlmTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .thenApply(raw -> parse(raw, action, traceId))
                .exceptionally(error -> {
                    Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
                    String reason = cause instanceof TimeoutException
                            ? "LLM validation timed out after " + config.getLlmTimeout().toSeconds() + "s"
                            : "LLM validation failed: " + cause.getMessage();
                    log.error("❌ [{}] {} for action {}", traceId, reason, action.getId());
                    return failClosed(action, traceId, reason);
                });
    }

    ActionRelevanceResult parse(String raw, ScheduledAction action, String traceId) {
        String json = LogText.extractJson(raw);
        if (json == null) {
            log.warn("[{}] LLM response contains no JSON object: {}", traceId, LogText.truncate(raw, 200));
            return failClosed(action, traceId, PARSE_FAILURE);
        }

        JsonNode node;
        try {
            node = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.warn("[{}] LLM response is not valid JSON: {}", traceId, e.getOriginalMessage());
            return failClosed(action, traceId, PARSE_FAILURE);
        }

        JsonNode relevant = node.get("isRelevant");
        JsonNode confidence = node.has("confidenceScore") ? node.get("confidenceScore") : node.get("confidence");
        if (relevant == null || !relevant.isBoolean() || confidence == null || !confidence.isNumber()
                || confidence.asDouble() < 0.0 || confidence.asDouble() > 1.0) {
            log.warn("[{}] LLM response is missing isRelevant/confidenceScore: {}", traceId, LogText.truncate(json, 200));
            return failClosed(action, traceId, PARSE_FAILURE);
        }

        String reason = node.hasNonNull("reason") ? node.get("reason").asText()
                : node.hasNonNull("reasoning") ? node.get("reasoning").asText() : "";
        List<String> alternatives = new ArrayList<>();
        JsonNode alternativeNodes = node.get("alternativeActions");
        if (alternativeNodes != null && alternativeNodes.isArray()) {
            alternativeNodes.forEach(a -> {
                if (!a.asText().isBlank()) {
                    alternatives.add(a.asText());
                }
            });
        }

        return base(action, traceId)
                .relevant(relevant.asBoolean())
                .confidenceScore(confidence.asDouble())
                .reasoning(reason.isBlank() ? "LLM validation" : reason)
                .recommendedAction(node.hasNonNull("recommendedAction") ? node.get("recommendedAction").asText() : null)
                .alternatives(List.copyOf(alternatives))
                .build();
    }

    private String buildPrompt(ScheduledAction action, ContactContext context, Map<String, Object> userOverrides) {
        return String.format(USER_PROMPT,
                action.getActionType(),
                action.getDescription(),
                action.getScheduledAt(),
                action.getExecuteAt(),
                toJson(action.getRelevanceCriteria()),
                toJson(context),
                userOverrides == null || userOverrides.isEmpty() ? "No user overrides specified." : toJson(userOverrides));
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize prompt input: " + e.getOriginalMessage(), e);
        }
    }

    private ActionRelevanceResult failClosed(ScheduledAction action, String traceId, String reason) {
        return base(action, traceId)
                .relevant(false)
                .confidenceScore(0.0)
                .reasoning(reason)
                .build();
    }

    private ActionRelevanceResult.ActionRelevanceResultBuilder base(ScheduledAction action, String traceId) {
        return ActionRelevanceResult.builder()
                .actionId(action.getId())
                .actionType(action.getActionType())
                .contactId(action.getContactId())
                .validationMethod(ValidationMethod.LLM)
                .checkedBy("LLM-" + getClass().getSimpleName())
                .traceId(traceId);
    }
}
