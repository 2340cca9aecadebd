package com.purchasingpower.orchestrator.agent;

import com.purchasingpower.orchestrator.model.agent.AgentRequest;
import com.purchasingpower.orchestrator.model.agent.AgentResponse;
import com.purchasingpower.orchestrator.model.agent.ErrorKind;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Base class for agents that expose several operations selected by {@link AgentRequest#getRequestType()}.
 *
 * <p>Subclasses declare their operations as an enum and register one handler per constant.
 * A request type that does not map to a registered handler is answered with status 400
 * instead of reaching any handler.
 *
 * @param <T> the agent's request type enum
 * @since 1.0.0
 */
@Slf4j
public abstract class RequestTypeDispatchingAgent<T extends Enum<T>> implements SelfDescribingAgent {

    @FunctionalInterface
    public interface RequestHandler {
        CompletableFuture<AgentResponse> handle(AgentRequest request);
    }

    private final Class<T> requestTypes;
    private final Map<T, RequestHandler> handlers;

    protected RequestTypeDispatchingAgent(Class<T> requestTypes) {
        this.requestTypes = requestTypes;
        this.handlers = new EnumMap<>(requestTypes);
    }

    /**
     * Called by subclasses from their constructor.
     */
    protected final void on(T type, RequestHandler handler) {
        handlers.put(type, handler);
    }

    /**
     * Operation used when the request names none.
     */
    protected abstract T defaultRequestType();

    @Override
    public CompletableFuture<AgentResponse> executeTask(AgentRequest request) {
        String raw = request.getRequestType();
        log.debug("[{}] {} handling request type {}", request.getTraceId(), getAgentId(), raw);

        RequestHandler handler = resolve(raw);
        if (handler == null) {
            return CompletableFuture.completedFuture(unsupported(request, raw));
        }
        return handler.handle(request);
    }

    private RequestHandler resolve(String raw) {
        if (raw == null || raw.isBlank()) {
            return handlers.get(defaultRequestType());
        }
        String normalized = raw.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (T type : requestTypes.getEnumConstants()) {
            if (type.name().equals(normalized)) {
                return handlers.get(type);
            }
        }
        return null;
    }

    private AgentResponse unsupported(AgentRequest request, String raw) {
        log.warn("[{}] {} does not support request type '{}'", request.getTraceId(), getAgentId(), raw);
        return AgentResponse.failure(request, ErrorKind.VALIDATION_FAILURE, 400,
                        "Unsupported request type: " + raw)
                .toBuilder()
                .agentId(getAgentId())
                .build();
    }
}
