package com.purchasingpower.orchestrator.model.action;

public enum ValidationMethod {
    RULE_BASED,
    CONTEXTUAL,
    LLM,
    RULE_BASED_PLUS_LLM,
    ERROR
}
