package com.purchasingpower.orchestrator.model.action;

import com.purchasingpower.orchestrator.model.agent.UrgencyLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * An action waiting to be executed, as seen by the relevance validator.
 *
 * @since 1.0.0
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ScheduledAction {

    @Builder.Default
    private String id = UUID.randomUUID().toString();

    private String actionType;

    private String description;

    private String contactId;

    private String organizationId;

    private String scheduledByAgentId;

    @Builder.Default
    private Instant scheduledAt = Instant.now();

    private Instant executeAt;

    @Builder.Default
    private Map<String, Object> parameters = new HashMap<>();

    @Builder.Default
    private Map<String, Object> relevanceCriteria = new HashMap<>();

    @Builder.Default
    private ScheduledActionStatus status = ScheduledActionStatus.PENDING;

    private String suppressionReason;

    private String traceId;

    @Builder.Default
    private UrgencyLevel priority = UrgencyLevel.MEDIUM;

    @Builder.Default
    private ActionScope actionScope = ActionScope.HYBRID;

    private Instant lastRelevanceCheck;

    public ScheduledAction copy() {
        return toBuilder()
                .parameters(new HashMap<>(parameters))
                .relevanceCriteria(new HashMap<>(relevanceCriteria))
                .build();
    }

    public static ScheduledAction from(AgentAction action, String contactId, String organizationId) {
        return ScheduledAction.builder()
                .id(action.getId())
                .actionType(action.getActionType())
                .description(action.getDescription())
                .contactId(contactId)
                .organizationId(organizationId)
                .scheduledByAgentId(action.getAgentId())
                .executeAt(action.getSuggestedTiming() != null ? action.getSuggestedTiming() : Instant.now())
                .parameters(action.effectiveParameters())
                .relevanceCriteria(new HashMap<>(action.getRelevanceCriteria()))
                .traceId(action.getTraceId())
                .priority(action.getPriority())
                .actionScope(action.getActionScope())
                .build();
    }
}
