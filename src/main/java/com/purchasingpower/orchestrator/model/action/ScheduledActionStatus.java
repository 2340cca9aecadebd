package com.purchasingpower.orchestrator.model.action;

public enum ScheduledActionStatus {
    PENDING,
    VALIDATING,
    APPROVED,
    SUPPRESSED,
    EXECUTED,
    FAILED
}
