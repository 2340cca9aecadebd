package com.purchasingpower.orchestrator.service.validation.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.orchestrator.client.ContactContextLookup;
import com.purchasingpower.orchestrator.config.ActionRelevanceProperties;
import com.purchasingpower.orchestrator.model.action.ActionRelevanceRequest;
import com.purchasingpower.orchestrator.model.action.ActionRelevanceResult;
import com.purchasingpower.orchestrator.model.action.ContactContext;
import com.purchasingpower.orchestrator.model.action.ScheduledAction;
import com.purchasingpower.orchestrator.model.action.ScheduledActionStatus;
import com.purchasingpower.orchestrator.model.action.ValidationMethod;
import com.purchasingpower.orchestrator.service.validation.ActionRelevanceConfig;
import com.purchasingpower.orchestrator.service.validation.ActionRelevanceValidator;
import com.purchasingpower.orchestrator.service.validation.ContextFreshnessEvaluator;
import com.purchasingpower.orchestrator.service.validation.LlmRelevanceJudge;
import com.purchasingpower.orchestrator.service.validation.RelevanceCriteriaEvaluator;
import com.purchasingpower.orchestrator.service.validation.ScopePolicy;
import com.purchasingpower.orchestrator.service.validation.TierVerdict;
import com.purchasingpower.orchestrator.service.validation.ValidationAuditLog;
import com.purchasingpower.orchestrator.workflow.CancellationSignal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.IntStream;

/**
 * Three-tier relevance pipeline.
 *
 * <pre>
 * resolve context -> tier 1 criteria -> tier 2 freshness -> tier 3 LLM -> threshold -> audit
 * </pre>
 *
 * The config snapshot is read once per validation. {@link #updateValidationConfig} swaps it
 * atomically for validations that start afterwards.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class ActionRelevanceValidatorImpl implements ActionRelevanceValidator {

    private static final Map<String, List<String>> ALTERNATIVES = Map.of(
            "congrats_email", List.of("follow_up_email"),
            "appointment_reminder", List.of("reschedule_request"),
            "property_recommendation", List.of("market_update"));

    private static final Duration ALTERNATIVE_DELAY = Duration.ofHours(1);

    private final RelevanceCriteriaEvaluator criteriaEvaluator;
    private final ContextFreshnessEvaluator freshnessEvaluator;
    private final LlmRelevanceJudge llmJudge;
    private final ContactContextLookup contextLookup;
    private final ValidationAuditLog auditLog;
    private final AtomicReference<ActionRelevanceConfig> config;

    @Autowired
    public ActionRelevanceValidatorImpl(RelevanceCriteriaEvaluator criteriaEvaluator,
                                        ContextFreshnessEvaluator freshnessEvaluator,
                                        LlmRelevanceJudge llmJudge,
                                        ContactContextLookup contextLookup,
                                        ValidationAuditLog auditLog,
                                        ActionRelevanceProperties properties) {
        this(criteriaEvaluator, freshnessEvaluator, llmJudge, contextLookup, auditLog, properties.toConfig());
    }

    public ActionRelevanceValidatorImpl(RelevanceCriteriaEvaluator criteriaEvaluator,
                                        ContextFreshnessEvaluator freshnessEvaluator,
                                        LlmRelevanceJudge llmJudge,
                                        ContactContextLookup contextLookup,
                                        ValidationAuditLog auditLog,
                                        ActionRelevanceConfig initialConfig) {
        this.criteriaEvaluator = criteriaEvaluator;
        this.freshnessEvaluator = freshnessEvaluator;
        this.llmJudge = llmJudge;
        this.contextLookup = contextLookup;
        this.auditLog = auditLog;
        this.config = new AtomicReference<>(initialConfig);
        log.info("✅ Action relevance validator ready (llm={}, uncertainty={})",
                initialConfig.isEnableLlmValidation(), initialConfig.getDefaultActionOnUncertainty());
    }

    // ================================================================
    // SINGLE VALIDATION
    // ================================================================

    @Override
    public CompletableFuture<ActionRelevanceResult> validateActionRelevance(ActionRelevanceRequest request,
                                                                            CancellationSignal cancellation) {
        CancellationSignal signal = cancellation != null ? cancellation : CancellationSignal.none();
        ActionRelevanceConfig snapshot = config.get();
        ScheduledAction action = request != null ? request.getAction() : null;
        String traceId = traceIdOf(request, action);

        CompletableFuture<ActionRelevanceResult> pipeline;
        try {
            Preconditions.checkArgument(action != null, "action is required");
            if (signal.isCancelled()) {
                throw new CancellationException("validation cancelled: " + signal.getReason());
            }
            log.info("🔍 [{}] Validating relevance of {} action {} ({})",
                    traceId, action.getActionType(), action.getId(), action.getActionScope());
            pipeline = runPipeline(request, action, snapshot, signal, traceId);
        } catch (RuntimeException e) {
            pipeline = CompletableFuture.failedFuture(e);
        }

        return pipeline.handle((result, error) -> {
            ActionRelevanceResult outcome = result;
            if (error != null) {
                Throwable cause = unwrap(error);
                log.error("❌ [{}] Relevance validation failed for action {}: {}",
                        traceId, action != null ? action.getId() : null, cause.getMessage());
                outcome = ActionRelevanceResult.failed(action, traceId, "validation error: " + cause.getMessage());
            } else {
                log.info("{} [{}] Action {} relevant={} confidence={} via {}",
                        outcome.isRelevant() ? "✅" : "⚠️", traceId, outcome.getActionId(),
                        outcome.isRelevant(), String.format("%.2f", outcome.getConfidenceScore()),
                        outcome.getValidationMethod());
            }
            if (snapshot.isEnableAuditLogging()) {
                auditLog.record(outcome, snapshot.getAuditLogCapacity());
            }
            return outcome;
        });
    }

    private CompletableFuture<ActionRelevanceResult> runPipeline(ActionRelevanceRequest request, ScheduledAction action,
                                                                 ActionRelevanceConfig snapshot, CancellationSignal signal,
                                                                 String traceId) {
        ScopePolicy policy = snapshot.policyFor(action.getActionScope());
        ContactContext context = resolveContext(request.getCurrentContext(), action, snapshot, traceId);
        List<TierVerdict> verdicts = new ArrayList<>(2);

        TierVerdict criteria = criteriaEvaluator.evaluate(action.getRelevanceCriteria(), context, traceId);
        verdicts.add(criteria);
        if (criteria.isConclusive() && !policy.alwaysRunAllTiers()) {
            return CompletableFuture.completedFuture(finish(criteria.result(), action, policy, traceId));
        }

        TierVerdict freshness = freshnessEvaluator.evaluate(context, snapshot, traceId);
        verdicts.add(freshness);
        if (freshness.isConclusive() && !policy.alwaysRunAllTiers()) {
            return CompletableFuture.completedFuture(finish(freshness.result(), action, policy, traceId));
        }

        Optional<TierVerdict> stale = verdicts.stream().filter(TierVerdict::isStale).findFirst();
        // high-risk scopes ignore the per-request opt-out, only the global switch can disable the LLM tier
        boolean llmAllowed = snapshot.isEnableLlmValidation()
                && (policy.alwaysRunAllTiers() || (policy.llmValidation() && request.isUseLlmValidation()));
        if (!llmAllowed) {
            return CompletableFuture.completedFuture(
                    finish(resolveWithoutLlm(verdicts, stale, criteria, policy, snapshot), action, policy, traceId));
        }

        if (signal.isCancelled()) {
            throw new CancellationException("validation cancelled: " + signal.getReason());
        }

        boolean earlierConclusive = verdicts.stream().anyMatch(TierVerdict::isConclusive);
        return llmJudge.judge(action, context, request.getUserOverrides(), snapshot, traceId)
                .thenApply(llm -> {
                    ActionRelevanceResult combined;
                    if (stale.isPresent()) {
                        ActionRelevanceResult staleResult = stale.get().result();
                        combined = llm.toBuilder()
                                .relevant(false)
                                .confidenceScore(Math.max(staleResult.getConfidenceScore(), llm.getConfidenceScore()))
                                .reasoning(staleResult.getReasoning() + "; LLM: " + llm.getReasoning())
                                .failedCriteria(staleResult.getFailedCriteria())
                                .validationMethod(ValidationMethod.RULE_BASED_PLUS_LLM)
                                .build();
                    } else {
                        combined = llm.toBuilder()
                                .failedCriteria(criteria.result().getFailedCriteria())
                                .validationMethod(earlierConclusive ? ValidationMethod.RULE_BASED_PLUS_LLM : ValidationMethod.LLM)
                                .build();
                    }
                    return finish(combined, action, policy, traceId);
                });
    }

    private ActionRelevanceResult resolveWithoutLlm(List<TierVerdict> verdicts, Optional<TierVerdict> stale,
                                                    TierVerdict criteria, ScopePolicy policy,
                                                    ActionRelevanceConfig snapshot) {
        if (stale.isPresent()) {
            return stale.get().result();
        }
        Optional<TierVerdict> relevant = verdicts.stream().filter(TierVerdict::isConclusive).findFirst();
        if (relevant.isPresent()) {
            return relevant.get().result();
        }

        // Scopes that never consult the LLM settle on the criteria score.
        if (!policy.llmValidation()) {
            boolean passes = criteria.relevanceScore() >= policy.confidenceThreshold();
            return criteria.result().toBuilder()
                    .relevant(passes)
                    .confidenceScore(criteria.relevanceScore())
                    .reasoning(criteria.result().getReasoning() + String.format(" (score %.2f, threshold %.2f)",
                            criteria.relevanceScore(), policy.confidenceThreshold()))
                    .build();
        }

        boolean proceed = snapshot.proceedOnUncertainty();
        return criteria.result().toBuilder()
                .relevant(proceed)
                .confidenceScore(proceed ? policy.confidenceThreshold() : 1.0 - criteria.relevanceScore())
                .reasoning("Rule-based checks inconclusive and LLM validation unavailable; default action: "
                        + snapshot.getDefaultActionOnUncertainty())
                .build();
    }

    private ActionRelevanceResult finish(ActionRelevanceResult result, ScheduledAction action,
                                         ScopePolicy policy, String traceId) {
        ActionRelevanceResult.ActionRelevanceResultBuilder builder = result.toBuilder()
                .actionId(action.getId())
                .actionType(action.getActionType())
                .contactId(action.getContactId())
                .traceId(traceId)
                .evaluatedAt(Instant.now());

        boolean relevant = result.isRelevant();
        if (relevant && result.getConfidenceScore() < policy.confidenceThreshold()) {
            relevant = false;
            builder.relevant(false).reasoning(result.getReasoning() + String.format(
                    " (confidence %.2f below threshold %.2f)", result.getConfidenceScore(), policy.confidenceThreshold()));
        }
        if (!relevant && result.getAlternatives().isEmpty()) {
            builder.alternatives(ALTERNATIVES.getOrDefault(key(action.getActionType()), List.of()));
        }
        action.setLastRelevanceCheck(Instant.now());
        return builder.build();
    }

    private ContactContext resolveContext(ContactContext supplied, ScheduledAction action,
                                          ActionRelevanceConfig snapshot, String traceId) {
        Instant freshAfter = Instant.now().minus(Duration.ofMinutes(snapshot.getMaxContextAgeMinutes()));
        if (supplied != null && supplied.getRetrievedAt() != null && !supplied.getRetrievedAt().isBefore(freshAfter)) {
            return supplied;
        }
        if (action.getContactId() == null) {
            return supplied != null ? supplied : ContactContext.builder().organizationId(action.getOrganizationId()).build();
        }

        log.debug("[{}] Refreshing contact context for {}", traceId, action.getContactId());
        ContactContext fetched = contextLookup.lookup(action.getContactId(), action.getOrganizationId());
        if (fetched != null) {
            return fetched;
        }
        return supplied != null ? supplied
                : ContactContext.builder().contactId(action.getContactId()).organizationId(action.getOrganizationId()).build();
    }

    // ================================================================
    // BATCH
    // ================================================================

    @Override
    public CompletableFuture<List<ActionRelevanceResult>> validateBatchActionRelevance(List<ActionRelevanceRequest> requests,
                                                                                       CancellationSignal cancellation) {
        CancellationSignal signal = cancellation != null ? cancellation : CancellationSignal.none();
        if (requests == null || requests.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }
        int window = Math.max(1, config.get().getBatchParallelism());
        log.info("📦 Validating batch of {} actions ({} at a time)", requests.size(), window);

        ActionRelevanceResult[] results = new ActionRelevanceResult[requests.size()];
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (int from = 0; from < requests.size(); from += window) {
            int start = from;
            int stop = Math.min(requests.size(), from + window);
            chain = chain.thenCompose(ignored -> CompletableFuture.allOf(IntStream.range(start, stop)
                    .mapToObj(i -> safeValidate(requests.get(i), signal).thenAccept(r -> results[i] = r))
                    .toArray(CompletableFuture[]::new)));
        }
        return chain.thenApply(ignored -> List.copyOf(Arrays.asList(results)));
    }

    private CompletableFuture<ActionRelevanceResult> safeValidate(ActionRelevanceRequest request, CancellationSignal signal) {
        ScheduledAction action = request != null ? request.getAction() : null;
        String traceId = traceIdOf(request, action);
        if (signal.isCancelled()) {
            ActionRelevanceResult cancelled = ActionRelevanceResult.failed(action, traceId,
                    "validation error: batch cancelled: " + signal.getReason());
            ActionRelevanceConfig snapshot = config.get();
            if (snapshot.isEnableAuditLogging()) {
                auditLog.record(cancelled, snapshot.getAuditLogCapacity());
            }
            return CompletableFuture.completedFuture(cancelled);
        }
        try {
            return validateActionRelevance(request, signal)
                    .exceptionally(error -> ActionRelevanceResult.failed(action, traceId,
                            "validation error: " + unwrap(error).getMessage()));
        } catch (RuntimeException e) {
            log.error("❌ [{}] Batch item failed before validation started", traceId, e);
            return CompletableFuture.completedFuture(
                    ActionRelevanceResult.failed(action, traceId, "validation error: " + e.getMessage()));
        }
    }

    // ================================================================
    // INDIVIDUAL TIERS
    // ================================================================

    @Override
    public ActionRelevanceResult evaluateRelevanceCriteria(Map<String, Object> criteria, ContactContext context, String traceId) {
        return criteriaEvaluator.evaluate(criteria, context, traceId).result();
    }

    @Override
    public CompletableFuture<ActionRelevanceResult> validateWithLlm(ScheduledAction action, ContactContext context,
                                                                    Map<String, Object> userOverrides, String traceId) {
        Preconditions.checkArgument(action != null, "action is required");
        return llmJudge.judge(action, context, userOverrides, config.get(), traceId);
    }

    @Override
    public List<ScheduledAction> suggestAlternativeActions(ScheduledAction action, ContactContext context, String traceId) {
        if (action == null) {
            return List.of();
        }
        List<ScheduledAction> suggestions = ALTERNATIVES.getOrDefault(key(action.getActionType()), List.of()).stream()
                .map(type -> {
                    Map<String, Object> parameters = new HashMap<>(action.getParameters());
                    parameters.put("suggestedAlternativeOf", action.getId());
                    return ScheduledAction.builder()
                            .id(UUID.randomUUID().toString())
                            .actionType(type)
                            .description("Alternative to " + action.getActionType() + ": " + type.replace('_', ' '))
                            .contactId(action.getContactId())
                            .organizationId(action.getOrganizationId())
                            .scheduledByAgentId(action.getScheduledByAgentId())
                            .executeAt(Instant.now().plus(ALTERNATIVE_DELAY))
                            .parameters(parameters)
                            .status(ScheduledActionStatus.PENDING)
                            .traceId(traceId)
                            .priority(action.getPriority())
                            .actionScope(action.getActionScope())
                            .build();
                })
                .toList();
        log.debug("[{}] {} alternative(s) for {}", traceId, suggestions.size(), action.getActionType());
        return suggestions;
    }

    @Override
    public boolean isActionStillRelevant(ScheduledAction action, ContactContext context, String traceId) {
        if (action == null) {
            return false;
        }
        try {
            ActionRelevanceConfig snapshot = config.get();
            TierVerdict criteria = criteriaEvaluator.evaluate(action.getRelevanceCriteria(), context, traceId);
            if (criteria.isConclusive()) {
                return !criteria.isStale();
            }
            TierVerdict freshness = freshnessEvaluator.evaluate(context, snapshot, traceId);
            if (freshness.isConclusive()) {
                return !freshness.isStale();
            }
            return snapshot.proceedOnUncertainty()
                    || criteria.relevanceScore() >= snapshot.policyFor(action.getActionScope()).confidenceThreshold();
        } catch (RuntimeException e) {
            log.warn("⚠️ [{}] Quick relevance check failed for {}: {}", traceId, action.getId(), e.getMessage());
            return false;
        }
    }

    // ================================================================
    // CONFIG & AUDIT
    // ================================================================

    @Override
    public ActionRelevanceConfig getValidationConfig() {
        return config.get();
    }

    @Override
    public void updateValidationConfig(ActionRelevanceConfig newConfig) {
        Preconditions.checkArgument(newConfig != null, "config is required");
        Preconditions.checkArgument(newConfig.getMinimumConfidenceScore() >= 0.0 && newConfig.getMinimumConfidenceScore() <= 1.0,
                "minimumConfidenceScore must be within [0, 1]");
        Preconditions.checkArgument(newConfig.getBatchParallelism() >= 1, "batchParallelism must be positive");
        Preconditions.checkArgument(newConfig.getLlmTimeout() != null && !newConfig.getLlmTimeout().isNegative(),
                "llmTimeout must be non-negative");
        config.set(newConfig);
        log.info("✅ Validation config updated (llm={}, minConfidence={}, uncertainty={})",
                newConfig.isEnableLlmValidation(), newConfig.getMinimumConfidenceScore(),
                newConfig.getDefaultActionOnUncertainty());
    }

    @Override
    public List<ActionRelevanceResult> getValidationAuditLog(String contactId, Instant start, Instant end, String actionType) {
        return auditLog.query(contactId, start, end, actionType);
    }

    // ================================================================
    // HELPERS
    // ================================================================

    private static String traceIdOf(ActionRelevanceRequest request, ScheduledAction action) {
        if (request != null && request.getTraceId() != null) {
            return request.getTraceId();
        }
        if (action != null && action.getTraceId() != null) {
            return action.getTraceId();
        }
        return UUID.randomUUID().toString();
    }

    private static String key(String actionType) {
        return actionType == null ? "" : actionType.toLowerCase(Locale.ROOT);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }
}
