package com.purchasingpower.orchestrator.client;

import com.purchasingpower.orchestrator.model.audit.AuditEntry;

/**
 * Durable audit/compliance log writer.
 */
public interface AuditSink {

    void record(AuditEntry entry);
}
