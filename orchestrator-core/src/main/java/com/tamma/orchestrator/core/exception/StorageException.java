package com.tamma.orchestrator.core.exception;

/**
 * Thrown when a durable store operation failed after the internal retry budget was exhausted,
 * or failed with a non-transient error.
 *
 * <p>The effect of the operation is unknown. Callers that depend on task durability must
 * escalate rather than assume success or failure.</p>
 */
public class StorageException extends OrchestratorException {
    
    public static final String ERROR_CODE = "STORAGE_FAILURE";

    private final String operation;
    private final int attempts;
    
    public StorageException(String operation, int attempts, Throwable cause) {
        super(ERROR_CODE, String.format(
            "Storage operation '%s' failed after %d attempt(s): %s",
            operation, attempts, cause.getMessage()
        ), cause);
        this.operation = operation;
        this.attempts = attempts;
    }

    public StorageException(String message) {
        super(ERROR_CODE, message);
        this.operation = null;
        this.attempts = 0;
    }

    public String getOperation() {
        return operation;
    }

    public int getAttempts() {
        return attempts;
    }
}
