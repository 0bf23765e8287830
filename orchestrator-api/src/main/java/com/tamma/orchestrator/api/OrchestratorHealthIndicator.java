package com.tamma.orchestrator.api;

import com.tamma.orchestrator.engine.health.ComponentHealth;
import com.tamma.orchestrator.engine.health.HealthReport;
import com.tamma.orchestrator.engine.lifecycle.Orchestrator;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Actuator health for the orchestrator.
 * Reports UP only while the orchestrator is RUNNING and every component is healthy:
 * - durable store reachability
 * - task queue stats and paused flag
 * - worker pool liveness
 * - workflow state counts
 */
@Component
public class OrchestratorHealthIndicator implements HealthIndicator {

    private final Orchestrator orchestrator;

    public OrchestratorHealthIndicator(Orchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public Health health() {
        try {
            HealthReport report = orchestrator.healthCheck();
            Health.Builder builder = report.isHealthy() ? Health.up() : Health.down();
            builder.withDetail("phase", report.phase());
            for (ComponentHealth component : report.components()) {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("status", component.status().name());
                details.putAll(component.details());
                builder.withDetail(component.component(), details);
            }
            return builder.build();
        } catch (Exception e) {
            return Health.down()
                .withException(e)
                .withDetail("phase", orchestrator.phase().name())
                .build();
        }
    }
}
