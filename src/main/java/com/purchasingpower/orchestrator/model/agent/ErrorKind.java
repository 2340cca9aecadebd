package com.purchasingpower.orchestrator.model.agent;

/**
 * Failure category attached to an {@link AgentResponse}.
 *
 * <p>Only {@link #TIMEOUT} is retryable. Everything else is terminal for the request
 * that produced it.
 */
public enum ErrorKind {
    NONE(false),
    NOT_FOUND(false),
    TIMEOUT(true),
    VALIDATION_FAILURE(false),
    INTERNAL(false),
    CANCELLED(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
