package com.purchasingpower.orchestrator.model.agent;

/**
 * Classification of what a request is trying to accomplish.
 * Primary routing key for the communication bus.
 */
public enum AgentIntent {
    UNKNOWN,
    CONTACT_MANAGEMENT,
    INTERACTION_ANALYSIS,
    SCHEDULING_AND_TASKS,
    COMMUNICATION,
    MARKET_INTELLIGENCE,
    GENERAL_INQUIRY,
    DATA_ANALYSIS,
    REPORT_GENERATION,
    WORKFLOW_AUTOMATION,
    BUSINESS_INTELLIGENCE,
    INTENT_CLASSIFICATION,
    RESOURCE_MANAGEMENT,
    SERVICE_PROVIDER_RECOMMENDATION;

    /**
     * Lenient parse used for agent cards and HTTP input.
     * Accepts "generalInquiry", "general-inquiry" and "GENERAL_INQUIRY".
     *
     * @return the matching intent, or UNKNOWN
     */
    public static AgentIntent fromName(String name) {
        if (name == null || name.isBlank()) {
            return UNKNOWN;
        }
        String normalized = name.trim()
                .replaceAll("([a-z])([A-Z])", "$1_$2")
                .replace('-', '_')
                .replace(' ', '_')
                .toUpperCase();
        for (AgentIntent intent : values()) {
            if (intent.name().equals(normalized)) {
                return intent;
            }
        }
        return UNKNOWN;
    }
}
