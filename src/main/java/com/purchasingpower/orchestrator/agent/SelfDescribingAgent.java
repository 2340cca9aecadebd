package com.purchasingpower.orchestrator.agent;

import com.purchasingpower.orchestrator.model.agent.AgentCapability;

/**
 * An agent bean that knows its own capability and is registered at startup.
 */
public interface SelfDescribingAgent extends AgentHandle {

    AgentCapability describe();

    default String getAgentId() {
        return describe().getAgentId();
    }
}
