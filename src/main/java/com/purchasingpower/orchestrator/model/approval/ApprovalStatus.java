package com.purchasingpower.orchestrator.model.approval;

public enum ApprovalStatus {
    PENDING,
    APPROVED,
    REJECTED,
    MODIFIED,
    DEFERRED,
    EXPIRED
}
