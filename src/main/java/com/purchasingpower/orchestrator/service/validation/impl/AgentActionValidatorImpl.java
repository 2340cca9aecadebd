package com.purchasingpower.orchestrator.service.validation.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.orchestrator.model.action.ActionRelevanceRequest;
import com.purchasingpower.orchestrator.model.action.ActionRelevanceResult;
import com.purchasingpower.orchestrator.model.action.ActionScope;
import com.purchasingpower.orchestrator.model.action.AgentAction;
import com.purchasingpower.orchestrator.model.action.ContactContext;
import com.purchasingpower.orchestrator.model.action.ScheduledAction;
import com.purchasingpower.orchestrator.model.approval.UserApprovalRequest;
import com.purchasingpower.orchestrator.service.approval.UserApprovalService;
import com.purchasingpower.orchestrator.service.validation.ActionRelevanceValidator;
import com.purchasingpower.orchestrator.service.validation.AgentActionValidator;
import com.purchasingpower.orchestrator.service.validation.ScopePolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Converts agent actions to scheduled actions, runs them through the relevance validator and
 * applies the per-scope approval rules.
 *
 * <ul>
 *   <li>INNER_WORLD: no LLM, never needs approval</li>
 *   <li>HYBRID: LLM, approval depends on confidence and action type</li>
 *   <li>REAL_WORLD: full pipeline, always needs approval</li>
 * </ul>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AgentActionValidatorImpl implements AgentActionValidator {

    static final String VALIDATION_ERROR_REASON = "Validation error - requires manual review";
    static final String APPROVAL_REASON = "Action requires approval based on validation results";

    private static final double HYBRID_AUTO_APPROVE_CONFIDENCE = 0.9;
    private static final double HYBRID_APPROVAL_CONFIDENCE = 0.8;
    private static final Set<String> HIGH_RISK_ACTION_TYPES = Set.of(
            "risk_assessment", "compliance_check", "orchestration_decision", "intent_classification");

    private final ActionRelevanceValidator relevanceValidator;
    private final UserApprovalService approvalService;

    @Override
    public CompletableFuture<List<AgentAction>> validateAgentActions(List<AgentAction> actions, ContactContext context,
                                                                     String userId, Map<String, Object> userOverrides,
                                                                     String traceId) {
        if (actions == null || actions.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }
        log.info("🔍 [{}] Validating {} agent actions", traceId, actions.size());

        List<CompletableFuture<Optional<AgentAction>>> futures = actions.stream()
                .map(action -> safeValidate(action, context, userId, userOverrides, traceId))
                .toList();

        return CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new))
                .thenApply(ignored -> {
                    List<AgentAction> validated = futures.stream()
                            .map(CompletableFuture::join)
                            .flatMap(Optional::stream)
                            .toList();
                    log.info("✅ [{}] Validated {} actions, {} require approval, {} filtered out", traceId,
                            validated.size(),
                            validated.stream().filter(AgentAction::isRequiresApproval).count(),
                            actions.size() - validated.size());
                    return validated;
                });
    }

    private CompletableFuture<Optional<AgentAction>> safeValidate(AgentAction action, ContactContext context, String userId,
                                                                  Map<String, Object> userOverrides, String traceId) {
        CompletableFuture<Optional<AgentAction>> future;
        try {
            future = validateAgentAction(action, context, userId, userOverrides, traceId);
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        return future.exceptionally(error -> {
            log.error("❌ [{}] Error validating action {}, keeping it for manual review",
                    traceId, action != null ? action.getActionType() : null, error);
            if (action == null) {
                return Optional.empty();
            }
            return Optional.of(action.withValidation(VALIDATION_ERROR_REASON, 0.0, true, null));
        });
    }

    @Override
    public CompletableFuture<Optional<AgentAction>> validateAgentAction(AgentAction action, ContactContext context,
                                                                        String userId, Map<String, Object> userOverrides,
                                                                        String traceId) {
        Preconditions.checkArgument(action != null, "action is required");
        String trace = action.getTraceId() != null ? action.getTraceId() : traceId;
        ActionScope scope = action.getActionScope() != null ? action.getActionScope() : ActionScope.HYBRID;
        ScopePolicy policy = relevanceValidator.getValidationConfig().policyFor(scope);
        ScheduledAction scheduled = ScheduledAction.from(action,
                action.getContactId() != null ? action.getContactId() : context != null ? context.getContactId() : null,
                action.getOrganizationId() != null ? action.getOrganizationId() : context != null ? context.getOrganizationId() : null);

        log.debug("🔍 [{}] Validating {} action {} (scope {})", trace, action.getActionType(), action.getId(), scope);

        ActionRelevanceRequest request = ActionRelevanceRequest.builder()
                .action(scheduled)
                .currentContext(context)
                .useLlmValidation(policy.llmValidation())
                .userOverrides(userOverrides != null ? userOverrides : Map.of())
                .traceId(trace)
                .build();

        return relevanceValidator.validateActionRelevance(request).thenApply(result -> {
            String reason = label(scope) + ": " + result.getReasoning();
            if (!result.isRelevant()) {
                log.debug("🚫 [{}] Filtered out irrelevant {}: {}", trace, action.getActionType(), reason);
                return Optional.empty();
            }

            boolean approvalRequired = switch (scope) {
                case INNER_WORLD -> false;
                case HYBRID -> hybridRequiresApproval(scheduled, result, userId, trace);
                case REAL_WORLD -> true;
            };

            String approvalRequestId = null;
            if (approvalRequired) {
                UserApprovalRequest approval = approvalService.createApprovalRequest(
                        scheduled, result, userId, APPROVAL_REASON, userOverrides, trace);
                approvalRequestId = approval.getRequestId();
                log.info("📋 [{}] Created approval request {} for {}", trace, approvalRequestId, action.getActionType());
            }

            log.debug("✅ [{}] Validated {}: confidence={}, requiresApproval={}",
                    trace, action.getActionType(), result.getConfidenceScore(), approvalRequired);
            return Optional.of(action.withValidation(reason, result.getConfidenceScore(), approvalRequired, approvalRequestId));
        });
    }

    private boolean hybridRequiresApproval(ScheduledAction action, ActionRelevanceResult result, String userId, String traceId) {
        double confidence = result.getConfidenceScore();
        if (confidence >= HYBRID_AUTO_APPROVE_CONFIDENCE) {
            log.debug("🟢 [{}] Hybrid action auto-approved, confidence {}", traceId, confidence);
            return false;
        }
        if (confidence < HYBRID_APPROVAL_CONFIDENCE) {
            log.debug("🟡 [{}] Hybrid action requires approval, confidence {}", traceId, confidence);
            return true;
        }
        String type = Objects.toString(action.getActionType(), "").toLowerCase(Locale.ROOT);
        if (HIGH_RISK_ACTION_TYPES.contains(type)) {
            log.debug("🟡 [{}] Hybrid action requires approval, high-risk type {}", traceId, type);
            return true;
        }
        return approvalService.requiresUserApproval(action, result, userId, traceId);
    }

    private static String label(ActionScope scope) {
        return switch (scope) {
            case INNER_WORLD -> "InnerWorld";
            case HYBRID -> "Hybrid";
            case REAL_WORLD -> "RealWorld";
        };
    }
}
