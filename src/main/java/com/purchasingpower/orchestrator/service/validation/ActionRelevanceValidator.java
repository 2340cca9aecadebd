package com.purchasingpower.orchestrator.service.validation;

import com.purchasingpower.orchestrator.model.action.ActionRelevanceRequest;
import com.purchasingpower.orchestrator.model.action.ActionRelevanceResult;
import com.purchasingpower.orchestrator.model.action.ContactContext;
import com.purchasingpower.orchestrator.model.action.ScheduledAction;
import com.purchasingpower.orchestrator.workflow.CancellationSignal;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Decides whether previously scheduled actions should still execute.
 *
 * <p>Three tiers run cheapest first: static relevance criteria, contact-context freshness, and an
 * LLM judge. A conclusive tier stops the pipeline unless the action's scope asks for every tier.
 * Validation never fails: errors become a not-relevant result with method {@code ERROR}.
 *
 * @since 1.0.0
 */
public interface ActionRelevanceValidator {

    default CompletableFuture<ActionRelevanceResult> validateActionRelevance(ActionRelevanceRequest request) {
        return validateActionRelevance(request, CancellationSignal.none());
    }

    CompletableFuture<ActionRelevanceResult> validateActionRelevance(ActionRelevanceRequest request, CancellationSignal signal);

    default CompletableFuture<List<ActionRelevanceResult>> validateBatchActionRelevance(List<ActionRelevanceRequest> requests) {
        return validateBatchActionRelevance(requests, CancellationSignal.none());
    }

    /**
     * One result per request, in request order. Bounded parallelism; a failing item never fails the batch.
     */
    CompletableFuture<List<ActionRelevanceResult>> validateBatchActionRelevance(List<ActionRelevanceRequest> requests,
                                                                                CancellationSignal signal);

    ActionRelevanceResult evaluateRelevanceCriteria(Map<String, Object> criteria, ContactContext context, String traceId);

    CompletableFuture<ActionRelevanceResult> validateWithLlm(ScheduledAction action, ContactContext context,
                                                             Map<String, Object> userOverrides, String traceId);

    /**
     * Unvalidated alternatives scheduled one hour out. Empty for types without a mapping.
     */
    List<ScheduledAction> suggestAlternativeActions(ScheduledAction action, ContactContext context, String traceId);

    /**
     * Quick rule-only check, used before execution. Not audited.
     */
    boolean isActionStillRelevant(ScheduledAction action, ContactContext context, String traceId);

    ActionRelevanceConfig getValidationConfig();

    void updateValidationConfig(ActionRelevanceConfig config);

    List<ActionRelevanceResult> getValidationAuditLog(String contactId, Instant start, Instant end, String actionType);
}
