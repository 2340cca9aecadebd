package com.purchasingpower.orchestrator.model.action;

import com.purchasingpower.orchestrator.model.agent.UrgencyLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Current relationship snapshot of a contact, used to judge whether an action is still relevant.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ContactContext {

    private String contactId;

    private String organizationId;

    private String contactName;

    /**
     * Relationship stage (lead, active, client, closed, lost...)
     */
    private String contactStatus;

    /**
     * -1.0 (very negative) to 1.0 (very positive), null when unknown
     */
    private Double sentimentScore;

    @Builder.Default
    private UrgencyLevel urgencyLevel = UrgencyLevel.MEDIUM;

    private Instant lastInteraction;

    private String interactionSummary;

    /**
     * Free-form attributes (dealStatus, engagementLevel...) read by relevance criteria.
     */
    @Builder.Default
    private Map<String, Object> additionalData = new HashMap<>();

    @Builder.Default
    private Instant retrievedAt = Instant.now();
}
