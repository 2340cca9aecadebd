package com.purchasingpower.orchestrator.model.approval;

public enum ApprovalDecision {
    APPROVE,
    REJECT,
    MODIFY,
    DEFER
}
