package com.purchasingpower.orchestrator.workflow;

import com.purchasingpower.orchestrator.model.agent.AgentRequest;
import com.purchasingpower.orchestrator.model.agent.AgentResponse;
import com.purchasingpower.orchestrator.model.workflow.WorkflowState;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Routes requests to registered agents and drives multi-step workflows.
 *
 * <p>Routing never completes exceptionally: every failure (no agent, timeout, agent error)
 * comes back as an {@link AgentResponse} with {@code success=false}.
 *
 * @since 1.0.0
 */
public interface AgentCommunicationBus {

    String METHOD_CUSTOM = "custom";
    String METHOD_FOUNDRY_WORKFLOW = "foundry_workflow";
    String METHOD_CONNECTED_AGENT = "connected_agent";

    Set<String> ORCHESTRATION_METHODS = Set.of(METHOD_CUSTOM, METHOD_FOUNDRY_WORKFLOW, METHOD_CONNECTED_AGENT);

    CompletableFuture<AgentResponse> routeRequest(AgentRequest request, CancellationSignal cancellation);

    default CompletableFuture<AgentResponse> routeRequest(AgentRequest request) {
        return routeRequest(request, CancellationSignal.none());
    }

    /**
     * Run a workflow from its initial request, following up hop by hop until an agent stops asking
     * for a follow-up, a hop fails, the hop limit is hit or the signal is cancelled.
     * Any prior state under the same id is replaced.
     */
    CompletableFuture<WorkflowState> executeWorkflow(String workflowId, AgentRequest initialRequest,
                                                     CancellationSignal cancellation);

    default CompletableFuture<WorkflowState> executeWorkflow(String workflowId, AgentRequest initialRequest) {
        return executeWorkflow(workflowId, initialRequest, CancellationSignal.none());
    }

    Optional<WorkflowState> getWorkflowState(String workflowId);

    /**
     * Applies to requests routed after the call, not to those in flight.
     *
     * @throws IllegalArgumentException for an unknown method
     */
    void setOrchestrationMethod(String method);

    String getOrchestrationMethod();
}
