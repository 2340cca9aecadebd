package com.purchasingpower.orchestrator.agent;

import com.purchasingpower.orchestrator.model.agent.AgentCapability;
import com.purchasingpower.orchestrator.model.agent.AgentHealthStatus;
import com.purchasingpower.orchestrator.model.agent.AgentIntent;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registered agents, their declared capabilities and rolling health/performance data.
 *
 * <p>Lookups never throw for unknown agents: they answer empty, false or a "Not Found" status.
 * Only invalid input (blank id, missing capability) raises.
 *
 * @since 1.0.0
 */
public interface AgentRegistry {

    /**
     * Register an agent.
     *
     * @return false when the id is already taken by an active agent. An inactive entry is replaced.
     */
    boolean registerAgent(String agentId, AgentHandle handle, AgentCapability capability);

    /**
     * Remove an agent. Calls already holding its handle complete normally.
     *
     * @return false if the agent was not registered
     */
    boolean unregisterAgent(String agentId);

    /**
     * Active capabilities supporting the intent, optionally narrowed to an industry.
     * Never null.
     */
    List<AgentCapability> findAgentsForIntent(AgentIntent intent, String industry);

    default List<AgentCapability> findAgentsForIntent(AgentIntent intent) {
        return findAgentsForIntent(intent, null);
    }

    Optional<AgentHandle> getAgentHandle(String agentId);

    Optional<AgentCapability> getAgentCapability(String agentId);

    List<AgentCapability> getAgentCapabilities();

    /**
     * Toggle routing eligibility without unregistering.
     *
     * @return false if the agent was not registered
     */
    boolean setAgentActive(String agentId, boolean active);

    /**
     * Fold one observed call into the agent's metrics. Unknown agents are ignored.
     */
    void updateAgentMetrics(String agentId, long responseTimeMs, boolean success, double confidence);

    /**
     * Cached health of every agent. Never refreshes.
     */
    Map<String, AgentHealthStatus> getAllAgentHealth();

    /**
     * Health of one agent, refreshed first when the cached value is stale.
     */
    AgentHealthStatus getAgentHealth(String agentId);

    boolean isAgentAvailable(String agentId);

    /**
     * Probe every registered agent. Used by the background health check.
     */
    void refreshAllHealth();
}
