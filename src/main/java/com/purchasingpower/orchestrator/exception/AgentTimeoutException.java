package com.purchasingpower.orchestrator.exception;

import lombok.Getter;

import java.time.Duration;

/**
 * An agent could not be reached in time: either no concurrency permit was granted within
 * the bounded wait, or the agent call itself exceeded its deadline.
 *
 * <p>Always retryable.
 */
@Getter
public class AgentTimeoutException extends RuntimeException {

    private final String agentId;
    private final Duration waited;

    public AgentTimeoutException(String message, String agentId, Duration waited) {
        super(message);
        this.agentId = agentId;
        this.waited = waited;
    }

    public boolean isRetryable() {
        return true;
    }
}
