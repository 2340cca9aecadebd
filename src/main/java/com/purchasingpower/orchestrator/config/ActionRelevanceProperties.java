package com.purchasingpower.orchestrator.config;

import com.purchasingpower.orchestrator.model.action.ActionScope;
import com.purchasingpower.orchestrator.model.approval.UserOverrideMode;
import com.purchasingpower.orchestrator.service.validation.ActionRelevanceConfig;
import com.purchasingpower.orchestrator.service.validation.ScopePolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Startup values for action relevance validation and user approval.
 *
 * <p>Properties are loaded from the {@code app.relevance} namespace in application.yml and turned
 * into the validator's initial {@link ActionRelevanceConfig}. Later changes go through
 * {@code ActionRelevanceValidator.updateValidationConfig}, not through these properties.
 * <pre>
 * app:
 *   relevance:
 *     llm-timeout: 30s
 *     enable-llm-validation: true
 *     minimum-confidence-score: 0.7
 *     default-action-on-uncertainty: suppress
 *     scopes:
 *       inner-world: { confidence-threshold: 0.5, llm-validation: false }
 *       hybrid:      { confidence-threshold: 0.7, llm-validation: true }
 *       real-world:  { confidence-threshold: 0.8, llm-validation: true, always-run-all-tiers: true }
 *     approval:
 *       override-mode: RISK_BASED
 *       threshold: 0.8
 *       always-require: [send_contract]
 * </pre>
 *
 * @since 1.0.0
 */
@Component
@ConfigurationProperties(prefix = "app.relevance")
@Validated
@Data
public class ActionRelevanceProperties {

    @NotNull
    private Duration llmTimeout = Duration.ofSeconds(30);

    private boolean enableLlmValidation = true;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double minimumConfidenceScore = 0.7;

    @Min(0)
    private int maxContextAgeMinutes = 5;

    private boolean enableAuditLogging = true;

    @Min(1)
    private int auditLogCapacity = 10_000;

    @Pattern(regexp = "(?i)suppress|proceed")
    private String defaultActionOnUncertainty = ActionRelevanceConfig.SUPPRESS;

    @Min(1)
    private int staleInteractionDays = 30;

    @Min(1)
    private int recentInteractionDays = 7;

    @Min(1)
    private int batchParallelism = 5;

    private Map<ActionScope, Scope> scopes = new EnumMap<>(ActionScope.class);

    @Valid
    private Approval approval = new Approval();

    @Data
    public static class Scope {

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double confidenceThreshold = 0.7;

        private boolean llmValidation = true;

        private boolean alwaysRunAllTiers = false;
    }

    @Data
    public static class Approval {

        @NotNull
        private UserOverrideMode overrideMode = UserOverrideMode.RISK_BASED;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double threshold = 0.8;

        @Min(1)
        private int timeoutMinutes = 60;

        private Set<String> alwaysRequire = new HashSet<>();

        private Set<String> neverRequire = new HashSet<>();

        private boolean bulkApprovalEnabled = true;
    }

    public ActionRelevanceConfig toConfig() {
        ActionRelevanceConfig defaults = ActionRelevanceConfig.defaults();

        Map<ActionScope, ScopePolicy> policies = new EnumMap<>(defaults.getScopePolicies());
        scopes.forEach((scope, settings) -> policies.put(scope,
                new ScopePolicy(settings.getConfidenceThreshold(), settings.isLlmValidation(), settings.isAlwaysRunAllTiers())));

        return defaults.toBuilder()
                .llmTimeout(llmTimeout)
                .enableLlmValidation(enableLlmValidation)
                .minimumConfidenceScore(minimumConfidenceScore)
                .maxContextAgeMinutes(maxContextAgeMinutes)
                .enableAuditLogging(enableAuditLogging)
                .auditLogCapacity(auditLogCapacity)
                .defaultActionOnUncertainty(defaultActionOnUncertainty)
                .staleInteractionDays(staleInteractionDays)
                .recentInteractionDays(recentInteractionDays)
                .batchParallelism(batchParallelism)
                .scopePolicies(Map.copyOf(policies))
                .overrideMode(approval.getOverrideMode())
                .userApprovalThreshold(approval.getThreshold())
                .userApprovalTimeoutMinutes(approval.getTimeoutMinutes())
                .alwaysRequireApprovalActions(Set.copyOf(approval.getAlwaysRequire()))
                .neverRequireApprovalActions(Set.copyOf(approval.getNeverRequire()))
                .enableBulkApproval(approval.isBulkApprovalEnabled())
                .build();
    }
}
