package com.purchasingpower.orchestrator.exception;

import lombok.Getter;

@Getter
public class AgentRegistrationException extends RuntimeException {

    private final String agentId;

    public AgentRegistrationException(String agentId, String message) {
        super(message);
        this.agentId = agentId;
    }
}
