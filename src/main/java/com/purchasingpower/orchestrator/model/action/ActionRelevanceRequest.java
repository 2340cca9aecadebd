package com.purchasingpower.orchestrator.model.action;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class ActionRelevanceRequest {

    ScheduledAction action;

    /**
     * Fetched through ContactContextLookup when absent or older than the configured max age.
     */
    ContactContext currentContext;

    /**
     * Caller may veto the LLM tier. The action scope can still skip it.
     */
    @Builder.Default
    boolean useLlmValidation = true;

    @Builder.Default
    Map<String, Object> userOverrides = Map.of();

    String traceId;
}
