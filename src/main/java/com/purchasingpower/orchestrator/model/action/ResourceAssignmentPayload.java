package com.purchasingpower.orchestrator.model.action;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Assignment of a service provider or other resource to a contact.
 */
public record ResourceAssignmentPayload(String resourceId, String resourceType, String assignmentNote)
        implements ActionPayload {

    @Override
    public Map<String, Object> toParameters() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("resourceId", resourceId);
        params.put("resourceType", resourceType);
        if (assignmentNote != null) {
            params.put("assignmentNote", assignmentNote);
        }
        return params;
    }
}
