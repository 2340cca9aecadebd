package com.purchasingpower.orchestrator.model.agent;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * A request routed through the communication bus.
 *
 * <p>Immutable once dispatched. A follow-up hop is a new instance built with
 * {@link #followUp(AgentResponse)}, never a mutation of the original.
 *
 * @since 1.0.0
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class AgentRequest {

    @Builder.Default
    String id = UUID.randomUUID().toString();

    @Builder.Default
    String traceId = UUID.randomUUID().toString();

    @Builder.Default
    AgentIntent intent = AgentIntent.UNKNOWN;

    /**
     * Agent-specific operation name (e.g. "answer", "summarize").
     * Agents that extend RequestTypeDispatchingAgent route on it.
     */
    String requestType;

    @Builder.Default
    String originalUserInput = "";

    String conversationId;

    @Builder.Default
    Map<String, Object> context = Map.of();

    @Builder.Default
    UrgencyLevel urgency = UrgencyLevel.MEDIUM;

    /**
     * Stamped by the bus when the request is routed.
     */
    String orchestrationMethod;

    String sourceAgentId;

    /**
     * Optional explicit target. Ignored when that agent is not active.
     */
    String targetAgentId;

    String userId;

    String industry;

    @Builder.Default
    Instant timestamp = Instant.now();

    /**
     * Derives the next hop of a workflow from a response that asked for a follow-up.
     */
    public AgentRequest followUp(AgentResponse response) {
        return AgentRequest.builder()
                .traceId(traceId)
                .intent(response.getNextIntent())
                .originalUserInput(response.getContent() != null ? response.getContent() : "")
                .conversationId(conversationId)
                .context(response.getData() != null ? response.getData() : Map.of())
                .urgency(urgency)
                .sourceAgentId(response.getAgentId())
                .userId(userId)
                .industry(industry)
                .build();
    }
}
