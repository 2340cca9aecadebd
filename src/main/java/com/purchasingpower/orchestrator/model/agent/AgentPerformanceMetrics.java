package com.purchasingpower.orchestrator.model.agent;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Rolling performance figures for one agent.
 * Used by the bus to rank candidates for an intent.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AgentPerformanceMetrics {

    /** Assumed success rate for an agent that has never been called. */
    public static final double UNOBSERVED_SUCCESS_RATE = 0.5;

    /** Assumed latency for an agent that has never been called. */
    public static final double UNOBSERVED_RESPONSE_TIME_MS = 1000;

    private String agentId;

    /**
     * Successful requests over total requests (0.0-1.0)
     */
    private double successRate;

    /**
     * Rolling average latency in milliseconds
     */
    private double averageResponseTimeMs;

    /**
     * Rolling average of the confidence agents report (0.0-1.0)
     */
    private double averageConfidence;

    private long totalRequests;

    private long successfulRequests;

    private Instant lastUpdated;

    public static AgentPerformanceMetrics unobserved(String agentId) {
        return AgentPerformanceMetrics.builder()
                .agentId(agentId)
                .successRate(UNOBSERVED_SUCCESS_RATE)
                .averageResponseTimeMs(UNOBSERVED_RESPONSE_TIME_MS)
                .lastUpdated(Instant.now())
                .build();
    }

    public AgentPerformanceMetrics copy() {
        return toBuilder().build();
    }
}
