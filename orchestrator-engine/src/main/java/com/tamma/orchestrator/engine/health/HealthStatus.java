package com.tamma.orchestrator.engine.health;

/**
 * Binary health of a component or of the orchestrator as a whole.
 */
public enum HealthStatus {
    HEALTHY,
    UNHEALTHY;

    public boolean isHealthy() {
        return this == HEALTHY;
    }
}
