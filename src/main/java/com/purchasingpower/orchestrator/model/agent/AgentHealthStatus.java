package com.purchasingpower.orchestrator.model.agent;

import java.time.Instant;

/**
 * Point-in-time health of a registered agent.
 */
public record AgentHealthStatus(
        String agentId,
        boolean healthy,
        String status,
        Instant lastChecked,
        long responseTimeMs,
        String errorMessage
) {
    public static final String REGISTERED = "Registered";
    public static final String HEALTHY = "Healthy";
    public static final String UNHEALTHY = "Unhealthy";
    public static final String INACTIVE = "Inactive";
    public static final String NOT_FOUND = "Not Found";

    public static AgentHealthStatus registered(String agentId) {
        return new AgentHealthStatus(agentId, true, REGISTERED, Instant.now(), 0, null);
    }

    public static AgentHealthStatus notFound(String agentId) {
        return new AgentHealthStatus(agentId, false, NOT_FOUND, Instant.now(), 0, "Agent not registered");
    }
}
