package com.purchasingpower.orchestrator.model.approval;

/**
 * How the approval service decides whether a human must sign off on an action.
 */
public enum UserOverrideMode {
    ALWAYS_ASK,
    NEVER_ASK,
    /** Approval lists first, then the confidence threshold */
    RISK_BASED,
    LLM_DECISION
}
