package com.purchasingpower.orchestrator.model.workflow;

public enum WorkflowStatus {
    PROCESSING,
    COMPLETED,
    ERROR;

    public boolean isTerminal() {
        return this != PROCESSING;
    }
}
