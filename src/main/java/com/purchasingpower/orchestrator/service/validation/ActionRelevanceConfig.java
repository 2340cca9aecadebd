package com.purchasingpower.orchestrator.service.validation;

import com.purchasingpower.orchestrator.model.action.ActionScope;
import com.purchasingpower.orchestrator.model.approval.UserOverrideMode;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable snapshot of the relevance validation settings.
 *
 * <p>Replaced as a whole by {@link ActionRelevanceValidator#updateValidationConfig}. A validation
 * reads the snapshot once when it starts, so a swap never affects a validation in flight.
 *
 * @since 1.0.0
 */
@Value
@Builder(toBuilder = true)
public class ActionRelevanceConfig {

    public static final String SUPPRESS = "suppress";
    public static final String PROCEED = "proceed";

    @Builder.Default
    Duration llmTimeout = Duration.ofSeconds(30);

    @Builder.Default
    boolean enableLlmValidation = true;

    /**
     * Threshold for scopes without their own policy.
     */
    @Builder.Default
    double minimumConfidenceScore = 0.7;

    /**
     * Supplied contact context older than this is fetched again.
     */
    @Builder.Default
    int maxContextAgeMinutes = 5;

    @Builder.Default
    boolean enableAuditLogging = true;

    @Builder.Default
    int auditLogCapacity = 10_000;

    /**
     * What an inconclusive verdict becomes when the LLM tier cannot run: suppress or proceed.
     */
    @Builder.Default
    String defaultActionOnUncertainty = SUPPRESS;

    /**
     * No interaction for this many days makes an action stale.
     */
    @Builder.Default
    int staleInteractionDays = 30;

    /**
     * An interaction within this many days, with non-negative sentiment, confirms relevance.
     */
    @Builder.Default
    int recentInteractionDays = 7;

    @Builder.Default
    double negativeSentimentThreshold = -0.5;

    @Builder.Default
    double positiveSentimentThreshold = 0.2;

    @Builder.Default
    Set<String> terminalContactStatuses = Set.of("closed", "lost", "inactive", "unsubscribed", "do_not_contact");

    @Builder.Default
    Map<ActionScope, ScopePolicy> scopePolicies = defaultScopePolicies();

    @Builder.Default
    UserOverrideMode overrideMode = UserOverrideMode.RISK_BASED;

    @Builder.Default
    double userApprovalThreshold = 0.8;

    @Builder.Default
    int userApprovalTimeoutMinutes = 60;

    @Builder.Default
    Set<String> alwaysRequireApprovalActions = Set.of();

    @Builder.Default
    Set<String> neverRequireApprovalActions = Set.of();

    @Builder.Default
    boolean enableBulkApproval = true;

    /**
     * Concurrent validations inside one batch.
     */
    @Builder.Default
    int batchParallelism = 5;

    public ScopePolicy policyFor(ActionScope scope) {
        ScopePolicy policy = scope != null ? scopePolicies.get(scope) : null;
        return policy != null ? policy : new ScopePolicy(minimumConfidenceScore, true, false);
    }

    public boolean proceedOnUncertainty() {
        return PROCEED.equalsIgnoreCase(defaultActionOnUncertainty);
    }

    public static ActionRelevanceConfig defaults() {
        return ActionRelevanceConfig.builder().build();
    }

    private static Map<ActionScope, ScopePolicy> defaultScopePolicies() {
        Map<ActionScope, ScopePolicy> policies = new EnumMap<>(ActionScope.class);
        policies.put(ActionScope.INNER_WORLD, ScopePolicy.innerWorld());
        policies.put(ActionScope.HYBRID, ScopePolicy.hybrid());
        policies.put(ActionScope.REAL_WORLD, ScopePolicy.realWorld());
        return Map.copyOf(policies);
    }
}
