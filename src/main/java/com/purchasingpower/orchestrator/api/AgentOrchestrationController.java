package com.purchasingpower.orchestrator.api;

import com.purchasingpower.orchestrator.agent.AgentRegistry;
import com.purchasingpower.orchestrator.model.agent.AgentCapability;
import com.purchasingpower.orchestrator.model.agent.AgentHealthStatus;
import com.purchasingpower.orchestrator.model.agent.AgentRequest;
import com.purchasingpower.orchestrator.model.agent.AgentResponse;
import com.purchasingpower.orchestrator.model.workflow.WorkflowState;
import com.purchasingpower.orchestrator.workflow.AgentCommunicationBus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * REST controller for routing, workflows and the agent catalog.
 *
 * @since 1.0.0
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class AgentOrchestrationController {

    private final AgentCommunicationBus bus;
    private final AgentRegistry registry;

    /**
     * Route one request to the best agent for its intent.
     *
     * POST /api/v1/agents/route
     */
    @PostMapping("/agents/route")
    public CompletableFuture<ResponseEntity<AgentResponse>> route(@RequestBody AgentRequest request) {
        log.info("🔵 [{}] Route request: intent={}", request.getTraceId(), request.getIntent());
        return bus.routeRequest(request)
                .thenApply(response -> ResponseEntity.status(response.getStatusCode()).body(response));
    }

    /**
     * Run a workflow to completion (or until it fails) and return its final state.
     *
     * POST /api/v1/workflows/{workflowId}
     */
    @PostMapping("/workflows/{workflowId}")
    public CompletableFuture<ResponseEntity<WorkflowState>> executeWorkflow(@PathVariable String workflowId,
                                                                            @RequestBody AgentRequest request) {
        log.info("🚀 [{}] Starting workflow {}", request.getTraceId(), workflowId);
        return bus.executeWorkflow(workflowId, request).thenApply(ResponseEntity::ok);
    }

    /**
     * GET /api/v1/workflows/{workflowId}
     */
    @GetMapping("/workflows/{workflowId}")
    public ResponseEntity<WorkflowState> getWorkflow(@PathVariable String workflowId) {
        return bus.getWorkflowState(workflowId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * GET /api/v1/agents
     */
    @GetMapping("/agents")
    public ResponseEntity<List<AgentCapability>> listAgents() {
        return ResponseEntity.ok(registry.getAgentCapabilities());
    }

    /**
     * GET /api/v1/agents/health
     */
    @GetMapping("/agents/health")
    public ResponseEntity<Map<String, AgentHealthStatus>> health() {
        return ResponseEntity.ok(registry.getAllAgentHealth());
    }

    /**
     * GET /api/v1/agents/{agentId}/health
     */
    @GetMapping("/agents/{agentId}/health")
    public ResponseEntity<AgentHealthStatus> agentHealth(@PathVariable String agentId) {
        AgentHealthStatus status = registry.getAgentHealth(agentId);
        return AgentHealthStatus.NOT_FOUND.equals(status.status())
                ? ResponseEntity.status(404).body(status)
                : ResponseEntity.ok(status);
    }

    /**
     * PUT /api/v1/orchestration/method  {"method": "connected_agent"}
     */
    @PutMapping("/orchestration/method")
    public ResponseEntity<Map<String, String>> setOrchestrationMethod(@RequestBody Map<String, String> body) {
        bus.setOrchestrationMethod(body.get("method"));
        return ResponseEntity.ok(Map.of("method", bus.getOrchestrationMethod()));
    }

    /**
     * GET /api/v1/orchestration/method
     */
    @GetMapping("/orchestration/method")
    public ResponseEntity<Map<String, String>> getOrchestrationMethod() {
        return ResponseEntity.ok(Map.of("method", bus.getOrchestrationMethod()));
    }
}
