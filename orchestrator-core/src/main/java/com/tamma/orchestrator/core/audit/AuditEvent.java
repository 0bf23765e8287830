package com.tamma.orchestrator.core.audit;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.Map;

/**
 * Immutable audit fact handed to the event sink.
 *
 * @param tags    low-cardinality correlation fields (taskId, workflowId, workerId)
 * @param payload event-specific details
 */
public record AuditEvent(
    AuditEventType type,
    Instant occurredAt,
    Map<String, String> tags,
    JsonNode payload
) {
    public AuditEvent {
        tags = tags != null ? Map.copyOf(tags) : Map.of();
    }
}
