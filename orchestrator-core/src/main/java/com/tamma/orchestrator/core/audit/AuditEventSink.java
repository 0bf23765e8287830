package com.tamma.orchestrator.core.audit;

/**
 * Destination for audit events. Storage of events is owned by an external collaborator.
 */
public interface AuditEventSink {

    /**
     * Deliver an event. Returns once the sink has accepted it.
     * 
     * @param event The event
     * @throws RuntimeException if the sink could not accept the event
     */
    void emit(AuditEvent event);
}
