package com.purchasingpower.orchestrator.model.action;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Next-best-action recommendation produced for a contact.
 */
public record RecommendationPayload(String recommendation, String channel, List<String> talkingPoints)
        implements ActionPayload {

    @Override
    public Map<String, Object> toParameters() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("recommendation", recommendation);
        if (channel != null) {
            params.put("channel", channel);
        }
        params.put("talkingPoints", talkingPoints != null ? List.copyOf(talkingPoints) : List.of());
        return params;
    }
}
