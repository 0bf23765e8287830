package com.tamma.orchestrator.engine.audit;

import com.tamma.orchestrator.core.audit.AuditEvent;
import com.tamma.orchestrator.core.audit.AuditEventSink;
import com.tamma.orchestrator.core.audit.AuditEventType;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Keeps emitted audit events in memory.
 * Used with the in-memory store and in tests.
 */
public class InMemoryAuditEventSink implements AuditEventSink {

    private final List<AuditEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void emit(AuditEvent event) {
        events.add(event);
    }

    public List<AuditEvent> events() {
        return List.copyOf(events);
    }

    public List<AuditEvent> eventsOfType(AuditEventType type) {
        return events.stream()
            .filter(e -> e.type() == type)
            .collect(Collectors.toList());
    }

    public void clear() {
        events.clear();
    }
}
