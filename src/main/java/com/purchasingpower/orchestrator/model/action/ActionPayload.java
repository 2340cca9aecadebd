package com.purchasingpower.orchestrator.model.action;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Map;

/**
 * Action-specific parameters of an {@link AgentAction}.
 *
 * <p>Validation never looks inside the payload. It only flattens it into the
 * scheduled action's parameters via {@link #toParameters()}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = RecommendationPayload.class, name = "recommendation"),
        @JsonSubTypes.Type(value = ResourceAssignmentPayload.class, name = "resource_assignment"),
        @JsonSubTypes.Type(value = FollowUpPayload.class, name = "follow_up")
})
public interface ActionPayload {

    Map<String, Object> toParameters();
}
