package com.purchasingpower.orchestrator.model.action;

/**
 * How far an action reaches beyond the orchestrator itself.
 * Drives how many validation tiers run and whether a human must approve.
 */
public enum ActionScope {

    /**
     * Internal, low-risk work (classification, enrichment). LLM tier skipped.
     */
    INNER_WORLD,

    /**
     * Internal decisions that can influence external actions.
     */
    HYBRID,

    /**
     * Reaches contacts directly (email, SMS, calls). Every tier runs.
     */
    REAL_WORLD
}
