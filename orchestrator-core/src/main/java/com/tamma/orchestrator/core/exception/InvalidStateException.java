package com.tamma.orchestrator.core.exception;

/**
 * Thrown when an operation is not valid for the current status of an entity,
 * e.g. completing a task that is not running.
 */
public class InvalidStateException extends OrchestratorException {
    
    public static final String ERROR_CODE = "INVALID_STATE";
    
    public InvalidStateException(String entityType, String entityId, String currentState, String operation) {
        super(ERROR_CODE, String.format(
            "Cannot %s %s[%s] in state %s",
            operation, entityType, entityId, currentState
        ));
    }
    
    public InvalidStateException(String entityType, String currentState, String targetState) {
        super(ERROR_CODE, String.format(
            "Cannot transition %s from %s to %s",
            entityType, currentState, targetState
        ));
    }

    public InvalidStateException(String message) {
        super(ERROR_CODE, message);
    }
}
