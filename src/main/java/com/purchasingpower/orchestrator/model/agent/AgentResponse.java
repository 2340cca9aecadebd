package com.purchasingpower.orchestrator.model.agent;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

/**
 * Result of one routed request. Produced exactly once per request.
 *
 * @since 1.0.0
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class AgentResponse {

    public static final String NO_SUITABLE_AGENTS = "No suitable agents available";

    String requestId;

    String traceId;

    boolean success;

    String content;

    /**
     * Human-readable message from the agent
     */
    String message;

    String errorMessage;

    @Builder.Default
    ErrorKind errorKind = ErrorKind.NONE;

    /**
     * HTTP-style status for hosts (200, 400, 404, 500, 503).
     */
    @Builder.Default
    int statusCode = 200;

    /**
     * Agent's own confidence in the result (0.0-1.0)
     */
    @Builder.Default
    double confidence = 1.0;

    long processingTimeMs;

    String agentId;

    boolean requiresFollowUp;

    AgentIntent nextIntent;

    @Builder.Default
    Map<String, Object> data = Map.of();

    String orchestrationMethod;

    @Builder.Default
    Instant timestamp = Instant.now();

    public boolean isRetryable() {
        return errorKind.isRetryable();
    }

    public boolean wantsFollowUp() {
        return requiresFollowUp && nextIntent != null;
    }

    public static AgentResponse failure(AgentRequest request, ErrorKind kind, int statusCode, String errorMessage) {
        return AgentResponse.builder()
                .requestId(request.getId())
                .traceId(request.getTraceId())
                .success(false)
                .confidence(0.0)
                .errorKind(kind)
                .statusCode(statusCode)
                .errorMessage(errorMessage)
                .message(errorMessage)
                .build();
    }

    public static AgentResponse noSuitableAgent(AgentRequest request) {
        return failure(request, ErrorKind.NOT_FOUND, 404, NO_SUITABLE_AGENTS);
    }
}
