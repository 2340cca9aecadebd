package com.purchasingpower.orchestrator.service.validation;

/**
 * Validation rules for one action scope.
 *
 * @param confidenceThreshold minimum confidence a "relevant" verdict needs in this scope
 * @param llmValidation       whether the LLM tier may run at all
 * @param alwaysRunAllTiers   run every tier even when an earlier one is conclusive
 */
public record ScopePolicy(double confidenceThreshold, boolean llmValidation, boolean alwaysRunAllTiers) {

    public static ScopePolicy innerWorld() {
        return new ScopePolicy(0.5, false, false);
    }

    public static ScopePolicy hybrid() {
        return new ScopePolicy(0.7, true, false);
    }

    public static ScopePolicy realWorld() {
        return new ScopePolicy(0.8, true, true);
    }
}
