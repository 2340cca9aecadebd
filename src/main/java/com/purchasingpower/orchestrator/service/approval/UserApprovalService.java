package com.purchasingpower.orchestrator.service.approval;

import com.purchasingpower.orchestrator.model.action.ActionRelevanceResult;
import com.purchasingpower.orchestrator.model.action.ContactContext;
import com.purchasingpower.orchestrator.model.action.ScheduledAction;
import com.purchasingpower.orchestrator.model.approval.UserApprovalRequest;
import com.purchasingpower.orchestrator.model.approval.UserApprovalResponse;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Human-in-the-loop sign-off for actions the validator is not sure enough about.
 *
 * <p>Whether approval is needed depends on the configured {@link com.purchasingpower.orchestrator.model.approval.UserOverrideMode}.
 * Pending requests expire after the configured timeout.
 *
 * @since 1.0.0
 */
public interface UserApprovalService {

    /**
     * Fails safe: any error means approval is required.
     */
    boolean requiresUserApproval(ScheduledAction action, ActionRelevanceResult relevanceResult, String userId, String traceId);

    UserApprovalRequest createApprovalRequest(ScheduledAction action, ActionRelevanceResult relevanceResult, String userId,
                                              String reason, Map<String, Object> userOverrides, String traceId);

    /**
     * @return the action to execute, or empty when the request is unknown or the user rejected it
     */
    Optional<ScheduledAction> processApprovalResponse(UserApprovalResponse response);

    List<UserApprovalRequest> getPendingApprovals(String userId, boolean includeExpired);

    Optional<UserApprovalRequest> getApprovalRequest(String requestId);

    boolean llmRecommendsApproval(ScheduledAction action, ActionRelevanceResult relevanceResult,
                                  ContactContext context, String traceId);

    /**
     * Applies an approve or reject decision to pending requests of the same user with the same
     * action type and contact, scheduled within 24 hours of the original.
     *
     * @return number of requests settled
     */
    int applyBulkApproval(UserApprovalResponse response, String userId);

    /**
     * @return number of requests marked expired
     */
    int cleanupExpiredApprovals();
}
