package com.purchasingpower.orchestrator.model.action;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one relevance check. Every pipeline call produces one and the audit log keeps it.
 *
 * @since 1.0.0
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ActionRelevanceResult {

    String actionId;

    String actionType;

    String contactId;

    boolean relevant;

    @Builder.Default
    double confidenceScore = 0.0;

    String reasoning;

    @Builder.Default
    Instant evaluatedAt = Instant.now();

    /**
     * Alternative action types suggested alongside the verdict
     */
    @Builder.Default
    List<String> alternatives = List.of();

    @Builder.Default
    List<String> failedCriteria = List.of();

    /**
     * proceed / reschedule / modify / cancel, when the LLM offered one
     */
    String recommendedAction;

    ValidationMethod validationMethod;

    String traceId;

    String checkedBy;

    public static ActionRelevanceResult failed(ScheduledAction action, String traceId, String reasoning) {
        return ActionRelevanceResult.builder()
                .actionId(action != null ? action.getId() : null)
                .actionType(action != null ? action.getActionType() : null)
                .contactId(action != null ? action.getContactId() : null)
                .relevant(false)
                .confidenceScore(0.0)
                .reasoning(reasoning)
                .validationMethod(ValidationMethod.ERROR)
                .traceId(traceId)
                .build();
    }
}
