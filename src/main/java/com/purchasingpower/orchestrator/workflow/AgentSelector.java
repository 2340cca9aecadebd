package com.purchasingpower.orchestrator.workflow;

import com.purchasingpower.orchestrator.model.agent.AgentCapability;
import com.purchasingpower.orchestrator.model.agent.AgentPerformanceMetrics;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Picks the agent to route to among the candidates for an intent.
 *
 * <p>Order: success rate descending, then average response time ascending, then agent id.
 * Inactive candidates are never chosen. Agents without metrics rank with the unobserved defaults.
 */
public final class AgentSelector {

    static final Comparator<AgentCapability> RANKING = Comparator
            .comparingDouble(AgentSelector::successRate).reversed()
            .thenComparingDouble(AgentSelector::averageResponseTime)
            .thenComparing(AgentCapability::getAgentId, Comparator.nullsLast(Comparator.naturalOrder()));

    private AgentSelector() {
    }

    public static Optional<AgentCapability> selectBest(List<AgentCapability> candidates) {
        if (candidates == null) {
            return Optional.empty();
        }
        return candidates.stream()
                .filter(AgentCapability::isActive)
                .min(RANKING);
    }

    private static double successRate(AgentCapability capability) {
        AgentPerformanceMetrics metrics = capability.getPerformanceMetrics();
        return metrics != null ? metrics.getSuccessRate() : AgentPerformanceMetrics.UNOBSERVED_SUCCESS_RATE;
    }

    private static double averageResponseTime(AgentCapability capability) {
        AgentPerformanceMetrics metrics = capability.getPerformanceMetrics();
        return metrics != null ? metrics.getAverageResponseTimeMs() : AgentPerformanceMetrics.UNOBSERVED_RESPONSE_TIME_MS;
    }
}
