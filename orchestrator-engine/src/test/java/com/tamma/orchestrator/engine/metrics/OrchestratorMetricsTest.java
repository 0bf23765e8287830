package com.tamma.orchestrator.engine.metrics;

import com.tamma.orchestrator.core.model.TaskType;
import com.tamma.orchestrator.engine.lifecycle.OrchestratorPhase;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

public class OrchestratorMetricsTest {

    @Test
    @DisplayName("Counters and timer are tagged by task type")
    void testTaskMetrics() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        OrchestratorMetrics metrics = new OrchestratorMetrics();
        metrics.bindTo(registry);

        metrics.taskEnqueued(TaskType.GIT_OPERATION);
        metrics.taskEnqueued(TaskType.GIT_OPERATION);
        metrics.taskCompleted(TaskType.GIT_OPERATION, Duration.ofSeconds(2));
        metrics.taskFailed(TaskType.QUALITY_GATE);

        assertThat(registry.get(OrchestratorMetrics.TASKS_ENQUEUED).tag("type", "git-operation").counter().count())
            .isEqualTo(2.0);
        assertThat(registry.get(OrchestratorMetrics.TASK_DURATION).timer().count()).isEqualTo(1);
        assertThat(registry.get(OrchestratorMetrics.TASKS_FAILED).tag("type", "quality-gate").counter().count())
            .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Gauges follow pause state and phase")
    void testGauges() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        OrchestratorMetrics metrics = new OrchestratorMetrics();
        metrics.bindTo(registry);

        metrics.queuePaused(true);
        metrics.phaseChanged(OrchestratorPhase.DRAINING);

        assertThat(registry.get(OrchestratorMetrics.QUEUE_PAUSED).gauge().value()).isEqualTo(1.0);
        assertThat(registry.get(OrchestratorMetrics.ORCHESTRATOR_PHASE).gauge().value()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Recording before binding is harmless")
    void testUnbound() {
        OrchestratorMetrics metrics = new OrchestratorMetrics();

        assertThatCode(() -> {
            metrics.taskClaimed(TaskType.WORKFLOW_STEP);
            metrics.taskCompleted(TaskType.WORKFLOW_STEP, null);
        }).doesNotThrowAnyException();
    }
}
