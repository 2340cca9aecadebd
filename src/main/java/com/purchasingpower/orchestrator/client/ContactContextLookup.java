package com.purchasingpower.orchestrator.client;

import com.purchasingpower.orchestrator.model.action.ContactContext;

/**
 * Source of the current relationship snapshot for a contact.
 */
public interface ContactContextLookup {

    ContactContext lookup(String contactId, String organizationId);
}
