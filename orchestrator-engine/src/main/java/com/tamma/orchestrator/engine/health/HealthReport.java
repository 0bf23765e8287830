package com.tamma.orchestrator.engine.health;

import java.util.List;

/**
 * Aggregated orchestrator health. HEALTHY only if every component is healthy
 * and the orchestrator is in a phase that serves requests.
 */
public record HealthReport(
    HealthStatus status,
    String phase,
    List<ComponentHealth> components
) {
    public HealthReport {
        components = List.copyOf(components);
    }

    public static HealthReport aggregate(String phase, boolean phaseServing, List<ComponentHealth> components) {
        boolean allHealthy = components.stream().allMatch(ComponentHealth::isHealthy);
        HealthStatus status = phaseServing && allHealthy ? HealthStatus.HEALTHY : HealthStatus.UNHEALTHY;
        return new HealthReport(status, phase, components);
    }

    public boolean isHealthy() {
        return status.isHealthy();
    }
}
