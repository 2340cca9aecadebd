package com.purchasingpower.orchestrator.model.action;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

public record FollowUpPayload(String channel, String messageTemplate, Instant dueAt) implements ActionPayload {

    @Override
    public Map<String, Object> toParameters() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("channel", channel);
        if (messageTemplate != null) {
            params.put("messageTemplate", messageTemplate);
        }
        if (dueAt != null) {
            params.put("dueAt", dueAt.toString());
        }
        return params;
    }
}
