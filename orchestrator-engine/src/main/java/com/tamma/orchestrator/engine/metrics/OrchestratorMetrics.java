package com.tamma.orchestrator.engine.metrics;

import com.tamma.orchestrator.core.model.TaskType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer metrics for the task queue and orchestrator lifecycle.
 * Until bound to a registry, recordings go to an empty composite registry and are dropped.
 *
 * Metrics exposed:
 * - Task transition counters tagged by task type
 * - Claim-to-completion timer
 * - Queue paused flag and orchestrator phase gauges
 */
public class OrchestratorMetrics implements MeterBinder {

    // Metric names
    public static final String TASKS_ENQUEUED = "tamma.tasks.enqueued";
    public static final String TASKS_CLAIMED = "tamma.tasks.claimed";
    public static final String TASKS_COMPLETED = "tamma.tasks.completed";
    public static final String TASKS_RETRIED = "tamma.tasks.retried";
    public static final String TASKS_FAILED = "tamma.tasks.failed";
    public static final String TASKS_CANCELLED = "tamma.tasks.cancelled";
    public static final String TASK_DURATION = "tamma.task.duration";
    public static final String QUEUE_PAUSED = "tamma.queue.paused";
    public static final String ORCHESTRATOR_PHASE = "tamma.orchestrator.phase";

    private volatile MeterRegistry registry = new CompositeMeterRegistry();

    private final AtomicInteger paused = new AtomicInteger(0);
    private final AtomicInteger phaseOrdinal = new AtomicInteger(0);

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;

        Gauge.builder(QUEUE_PAUSED, paused, AtomicInteger::get)
            .description("1 while the task queue refuses claims")
            .register(registry);
        Gauge.builder(ORCHESTRATOR_PHASE, phaseOrdinal, AtomicInteger::get)
            .description("Orchestrator phase (0 initializing, 1 running, 2 draining, 3 stopped)")
            .register(registry);
    }

    // ========== Task Metrics ==========

    public void taskEnqueued(TaskType type) {
        counter(TASKS_ENQUEUED, type, "Total tasks enqueued").increment();
    }

    public void taskClaimed(TaskType type) {
        counter(TASKS_CLAIMED, type, "Total tasks claimed by workers").increment();
    }

    public void taskCompleted(TaskType type, Duration duration) {
        counter(TASKS_COMPLETED, type, "Total tasks completed").increment();
        if (duration != null) {
            Timer.builder(TASK_DURATION)
                .tag("type", type.tag())
                .description("Claim to completion duration")
                .register(registry)
                .record(duration);
        }
    }

    public void taskRetryScheduled(TaskType type) {
        counter(TASKS_RETRIED, type, "Total failed attempts rescheduled for retry").increment();
    }

    public void taskFailed(TaskType type) {
        counter(TASKS_FAILED, type, "Total tasks failed permanently").increment();
    }

    public void taskCancelled(TaskType type) {
        counter(TASKS_CANCELLED, type, "Total tasks cancelled").increment();
    }

    // ========== Lifecycle Metrics ==========

    public void queuePaused(boolean isPaused) {
        paused.set(isPaused ? 1 : 0);
    }

    public void phaseChanged(Enum<?> phase) {
        phaseOrdinal.set(phase.ordinal());
    }

    private Counter counter(String name, TaskType type, String description) {
        return Counter.builder(name)
            .tag("type", type.tag())
            .description(description)
            .register(registry);
    }
}
