package com.tamma.orchestrator.engine.health;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health of one component with free-form details.
 */
public record ComponentHealth(
    String component,
    HealthStatus status,
    Map<String, Object> details
) {
    public ComponentHealth {
        details = details != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(details))
            : Map.of();
    }

    public static ComponentHealth healthy(String component, Map<String, Object> details) {
        return new ComponentHealth(component, HealthStatus.HEALTHY, details);
    }

    public static ComponentHealth unhealthy(String component, Map<String, Object> details) {
        return new ComponentHealth(component, HealthStatus.UNHEALTHY, details);
    }

    public static ComponentHealth unhealthy(String component, Throwable error) {
        return unhealthy(component, Map.of("error", String.valueOf(error.getMessage())));
    }

    public boolean isHealthy() {
        return status.isHealthy();
    }
}
