package com.tamma.orchestrator.core.exception;

/**
 * Thrown when input to enqueue, registration or workflow operations is malformed.
 */
public class ValidationException extends OrchestratorException {
    
    public static final String ERROR_CODE = "VALIDATION_FAILED";
    
    public ValidationException(String message) {
        super(ERROR_CODE, message);
    }
    
    public ValidationException(String field, String reason) {
        super(ERROR_CODE, String.format("Invalid %s: %s", field, reason));
    }
}
