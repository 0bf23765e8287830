package com.tamma.orchestrator.recovery;

import com.tamma.orchestrator.core.exception.InvalidStateException;
import com.tamma.orchestrator.core.exception.NotFoundException;
import com.tamma.orchestrator.core.model.*;
import com.tamma.orchestrator.engine.lifecycle.Orchestrator;
import com.tamma.orchestrator.engine.lifecycle.OrchestratorPhase;
import com.tamma.orchestrator.engine.logging.LoggingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Reclaims tasks left RUNNING by workers that are no longer registered.
 *
 * Responsibilities:
 * - Find RUNNING tasks whose assigned worker has unregistered or stopped heartbeating
 * - Leave them alone until the heartbeat timeout has passed since the first claim
 * - Fail them with WORKER_LOST so the normal retry budget decides what happens next
 */
public class StaleTaskReaper {

    private static final Logger log = LoggerFactory.getLogger(StaleTaskReaper.class);

    public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(30);

    private final Orchestrator orchestrator;
    private final Clock clock;
    private final Duration interval;

    private final ScheduledExecutorService scheduler;
    private volatile boolean running = false;

    public StaleTaskReaper(Orchestrator orchestrator, Clock clock, Duration interval) {
        this.orchestrator = orchestrator;
        this.clock = clock;
        this.interval = interval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "stale-task-reaper");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Start periodic reaping.
     */
    public void start() {
        if (running) {
            log.warn("Stale task reaper already running");
            return;
        }
        running = true;
        scheduler.scheduleWithFixedDelay(
            this::reapSafely,
            interval.toMillis(),
            interval.toMillis(),
            TimeUnit.MILLISECONDS
        );
        log.info("Stale task reaper started (interval {}s)", interval.toSeconds());
    }

    /**
     * Stop periodic reaping. Calling it again is a no-op.
     */
    public void stop() {
        running = false;
        if (scheduler.isShutdown()) {
            return;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(10, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Stale task reaper stopped");
    }

    public boolean isRunning() {
        return running;
    }

    private void reapSafely() {
        if (!running) return;

        try {
            reapOnce();
        } catch (Exception e) {
            log.error("Error in stale task reaping", e);
        }
    }

    /**
     * Run one reaping pass.
     *
     * @return the tasks that were failed with WORKER_LOST
     */
    public List<Task> reapOnce() {
        OrchestratorPhase phase = orchestrator.phase();
        if (phase != OrchestratorPhase.RUNNING && phase != OrchestratorPhase.DRAINING) {
            return List.of();
        }

        Instant now = clock.instant();
        Duration timeout = orchestrator.heartbeatTimeout();
        Set<String> live = orchestrator.listWorkers().stream()
            .filter(worker -> !worker.isStaleAt(now, timeout))
            .map(Worker::workerId)
            .collect(Collectors.toSet());
        Instant cutoff = now.minus(timeout);

        List<Task> orphaned = orchestrator.listTasks(TaskFilter.byStatus(TaskStatus.RUNNING)).stream()
            .filter(task -> task.assignedWorkerId() == null || !live.contains(task.assignedWorkerId()))
            .filter(task -> task.startedAt() != null && task.startedAt().isBefore(cutoff))
            .collect(Collectors.toList());

        if (orphaned.isEmpty()) {
            return List.of();
        }
        log.info("Found {} running task(s) held by lost workers", orphaned.size());

        return orphaned.stream()
            .map(this::reap)
            .flatMap(Optional::stream)
            .collect(Collectors.toList());
    }

    private Optional<Task> reap(Task task) {
        try (var ctx = LoggingContext.forTask(task.taskId(), task.metadata().workflowId(),
                task.assignedWorkerId(), task.retryCount() + 1)) {
            TaskError error = TaskError.of(TaskError.WORKER_LOST,
                "Worker " + task.assignedWorkerId() + " is unregistered or missed its heartbeat");
            TaskResult result = orchestrator.fail(task.taskId(), error);
            log.warn("Reaped task {} from lost worker {}: {}", task.taskId(), task.assignedWorkerId(), result.outcome());
            return Optional.of(result.task());
        } catch (InvalidStateException | NotFoundException e) {
            // completed, cancelled or reaped elsewhere since the listing
            log.debug("Skipped reaping task {}: {}", task.taskId(), e.getMessage());
            return Optional.empty();
        }
    }
}
