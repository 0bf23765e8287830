package com.tamma.orchestrator.core.exception;

/**
 * Thrown when orchestrator startup aborts. The orchestrator is stopped when this is thrown.
 */
public class OrchestratorStartupException extends OrchestratorException {

    public static final String ERROR_CODE = "STARTUP_FAILED";

    private final String phase;

    public OrchestratorStartupException(String phase, String message) {
        super(ERROR_CODE, String.format("Startup failed during %s: %s", phase, message));
        this.phase = phase;
    }

    public OrchestratorStartupException(String phase, Throwable cause) {
        super(ERROR_CODE, String.format("Startup failed during %s: %s", phase, cause.getMessage()), cause);
        this.phase = phase;
    }

    public String getPhase() {
        return phase;
    }
}
