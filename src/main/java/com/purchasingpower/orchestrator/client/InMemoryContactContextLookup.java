package com.purchasingpower.orchestrator.client;

import com.google.common.base.Preconditions;
import com.purchasingpower.orchestrator.model.action.ContactContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local contact snapshots, fed by whatever host owns contact data.
 * Unknown contacts get an empty snapshot so the contextual tier stays inconclusive.
 */
@Slf4j
@Component
public class InMemoryContactContextLookup implements ContactContextLookup {

    private final Map<String, ContactContext> contexts = new ConcurrentHashMap<>();

    public void put(ContactContext context) {
        Preconditions.checkNotNull(context, "context cannot be null");
        Preconditions.checkArgument(context.getContactId() != null, "contactId is required");
        contexts.put(key(context.getContactId(), context.getOrganizationId()), context);
    }

    @Override
    public ContactContext lookup(String contactId, String organizationId) {
        ContactContext stored = contexts.get(key(contactId, organizationId));
        if (stored == null) {
            log.debug("No stored context for contact {} in org {}", contactId, organizationId);
            return ContactContext.builder()
                    .contactId(contactId)
                    .organizationId(organizationId)
                    .build();
        }
        return stored.toBuilder().retrievedAt(Instant.now()).build();
    }

    private static String key(String contactId, String organizationId) {
        return organizationId + "/" + contactId;
    }
}
