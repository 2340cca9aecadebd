package com.purchasingpower.orchestrator.service.validation;

import com.purchasingpower.orchestrator.model.action.ActionRelevanceResult;

/**
 * What one validation tier concluded.
 *
 * @param outcome        relevant, stale, or neither
 * @param result         the tier's result as it would be reported
 * @param relevanceScore 0.0 (stale) to 1.0 (relevant), used to settle inconclusive checks without the LLM
 */
public record TierVerdict(Outcome outcome, ActionRelevanceResult result, double relevanceScore) {

    public enum Outcome {
        RELEVANT,
        STALE,
        INCONCLUSIVE
    }

    public boolean isConclusive() {
        return outcome != Outcome.INCONCLUSIVE;
    }

    public boolean isStale() {
        return outcome == Outcome.STALE;
    }
}
