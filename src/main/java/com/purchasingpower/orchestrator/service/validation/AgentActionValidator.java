package com.purchasingpower.orchestrator.service.validation;

import com.purchasingpower.orchestrator.model.action.AgentAction;
import com.purchasingpower.orchestrator.model.action.ContactContext;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point agents use to validate the actions they propose before returning them.
 *
 * <p>Every returned action carries validation metadata (reason, confidence, approval flag and,
 * when approval is required, the approval request id). Irrelevant actions are dropped.
 *
 * @since 1.0.0
 */
public interface AgentActionValidator {

    /**
     * @param context      contact the actions concern; may be null
     * @param userId       user who would approve the actions
     * @param userOverrides user preferences, forwarded to the LLM and kept on approval requests
     * @return validated actions in input order, irrelevant ones removed
     */
    CompletableFuture<List<AgentAction>> validateAgentActions(List<AgentAction> actions, ContactContext context,
                                                              String userId, Map<String, Object> userOverrides,
                                                              String traceId);

    /**
     * @return the stamped action, or empty when it is no longer relevant
     */
    CompletableFuture<Optional<AgentAction>> validateAgentAction(AgentAction action, ContactContext context,
                                                                 String userId, Map<String, Object> userOverrides,
                                                                 String traceId);
}
