package com.tamma.orchestrator.core.exception;

/**
 * Thrown when a blocking audit event could not be delivered to the event sink.
 * The state change that produced the event has already been persisted.
 */
public class AuditException extends OrchestratorException {

    public static final String ERROR_CODE = "AUDIT_EMIT_FAILED";

    public AuditException(String eventType, Throwable cause) {
        super(ERROR_CODE, "Failed to emit audit event " + eventType + ": " + cause.getMessage(), cause);
    }
}
