package com.purchasingpower.orchestrator.model.approval;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class UserApprovalResponse {

    String requestId;

    ApprovalDecision decision;

    String userId;

    String reason;

    /**
     * Keys: description, executeAt (ISO-8601), priority (LOW..CRITICAL); anything else goes to parameters.
     */
    @Builder.Default
    Map<String, Object> suggestedModifications = Map.of();

    boolean applyToSimilarActions;
}
