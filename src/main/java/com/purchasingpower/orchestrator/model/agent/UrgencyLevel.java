package com.purchasingpower.orchestrator.model.agent;

public enum UrgencyLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
