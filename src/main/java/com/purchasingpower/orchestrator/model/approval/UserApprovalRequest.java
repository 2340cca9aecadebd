package com.purchasingpower.orchestrator.model.approval;

import com.purchasingpower.orchestrator.model.action.ActionRelevanceResult;
import com.purchasingpower.orchestrator.model.action.ScheduledAction;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A pending request for a human to approve, reject, modify or defer an action.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserApprovalRequest {

    @Builder.Default
    private String requestId = UUID.randomUUID().toString();

    private ScheduledAction action;

    private ActionRelevanceResult relevanceResult;

    private String approvalReason;

    private String userId;

    /**
     * User overrides in force when the request was created, kept for the audit trail
     */
    @Builder.Default
    private Map<String, Object> originalUserOverrides = Map.of();

    @Builder.Default
    private List<ScheduledAction> alternativeActions = new ArrayList<>();

    @Builder.Default
    private Instant requestedAt = Instant.now();

    private Instant expiresAt;

    @Builder.Default
    private ApprovalStatus status = ApprovalStatus.PENDING;

    private String traceId;

    public boolean isExpired(Instant now) {
        return expiresAt != null && expiresAt.isBefore(now);
    }
}
