package com.purchasingpower.orchestrator.agent;

import com.purchasingpower.orchestrator.model.agent.AgentRequest;
import com.purchasingpower.orchestrator.model.agent.AgentResponse;

import java.util.concurrent.CompletableFuture;

/**
 * Invocation surface every registered agent implements.
 *
 * <p>The bus owns timeouts, metrics and error conversion. Implementations only need to
 * answer the request, and may complete the future exceptionally.
 *
 * @since 1.0.0
 */
public interface AgentHandle {

    CompletableFuture<AgentResponse> executeTask(AgentRequest request);

    /**
     * Cheap liveness probe used by the health check. Throwing counts as unhealthy.
     */
    default boolean ping() {
        return true;
    }
}
