package com.purchasingpower.orchestrator.model.action;

import com.purchasingpower.orchestrator.model.agent.UrgencyLevel;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Any action an agent proposes: a recommendation, a resource assignment or a scheduled follow-up.
 *
 * <p>The shared validation fields live here. What differs per kind of action lives in
 * {@link #getPayload()}. Instances are immutable: the validation pipeline returns a stamped
 * copy through {@link #withValidation(String, double, boolean, String)}.
 *
 * <p>An action is compliant iff {@code validationReason} is non-empty, {@code confidenceScore}
 * lies in [0, 1] and either no approval is required or an approval request id is attached.
 *
 * @since 1.0.0
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class AgentAction {

    @Builder.Default
    String id = UUID.randomUUID().toString();

    String actionType;

    String description;

    /**
     * Agent that proposed the action
     */
    String agentId;

    String contactId;

    String organizationId;

    @Builder.Default
    UrgencyLevel priority = UrgencyLevel.MEDIUM;

    /**
     * Unset (NaN) until validation stamps it.
     */
    @Builder.Default
    double confidenceScore = Double.NaN;

    String validationReason;

    boolean requiresApproval;

    String approvalRequestId;

    @Builder.Default
    Map<String, Object> parameters = Map.of();

    /**
     * Conditions the action depends on (e.g. dealStatus=active)
     */
    @Builder.Default
    Map<String, Object> relevanceCriteria = Map.of();

    Instant suggestedTiming;

    String traceId;

    @Builder.Default
    ActionScope actionScope = ActionScope.HYBRID;

    ActionPayload payload;

    public AgentAction withValidation(String reason, double confidence, boolean approvalRequired, String approvalId) {
        return toBuilder()
                .validationReason(reason)
                .confidenceScore(confidence)
                .requiresApproval(approvalRequired)
                .approvalRequestId(approvalId)
                .build();
    }

    /**
     * Explicit parameters overlaid on the payload's own parameters.
     */
    public Map<String, Object> effectiveParameters() {
        Map<String, Object> merged = new HashMap<>();
        if (payload != null) {
            merged.putAll(payload.toParameters());
        }
        if (parameters != null) {
            merged.putAll(parameters);
        }
        return merged;
    }
}
