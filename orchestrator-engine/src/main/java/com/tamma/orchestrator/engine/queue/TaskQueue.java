package com.tamma.orchestrator.engine.queue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tamma.orchestrator.core.audit.AuditEventType;
import com.tamma.orchestrator.core.exception.InvalidStateException;
import com.tamma.orchestrator.core.exception.NotFoundException;
import com.tamma.orchestrator.core.exception.StorageException;
import com.tamma.orchestrator.core.exception.ValidationException;
import com.tamma.orchestrator.core.model.*;
import com.tamma.orchestrator.core.repository.TaskRepository;
import com.tamma.orchestrator.core.time.IdGenerator;
import com.tamma.orchestrator.engine.audit.AuditEmitter;
import com.tamma.orchestrator.engine.health.ComponentHealth;
import com.tamma.orchestrator.engine.logging.LoggingContext;
import com.tamma.orchestrator.engine.metrics.OrchestratorMetrics;
import com.tamma.orchestrator.engine.storage.StorageRetryTemplate;
import com.tamma.orchestrator.engine.worker.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Owns the task lifecycle: enqueue, claim, complete, fail with retry, cancel.
 *
 * <p>Claims are delegated to the store as one atomic select-and-transition. Every later
 * transition is a conditional write fenced on the version that was read; a lost race is
 * re-read and re-evaluated. No lock is held across store calls.</p>
 */
public class TaskQueue {

    private static final Logger log = LoggerFactory.getLogger(TaskQueue.class);

    public static final String COMPONENT = "taskQueue";
    public static final int DEFAULT_STATS_WINDOW = 100;

    private static final int MAX_TRANSITION_ATTEMPTS = 10;

    private final TaskRepository tasks;
    private final WorkerPool workerPool;
    private final StorageRetryTemplate storage;
    private final AuditEmitter audit;
    private final OrchestratorMetrics metrics;
    private final Clock clock;
    private final IdGenerator ids;
    private final BackoffPolicy retryBackoff;
    private final int statsWindow;
    private final AtomicBoolean paused = new AtomicBoolean(false);

    public TaskQueue(
            TaskRepository tasks,
            WorkerPool workerPool,
            StorageRetryTemplate storage,
            AuditEmitter audit,
            OrchestratorMetrics metrics,
            Clock clock,
            IdGenerator ids,
            BackoffPolicy retryBackoff,
            int statsWindow) {
        this.tasks = tasks;
        this.workerPool = workerPool;
        this.storage = storage;
        this.audit = audit;
        this.metrics = metrics;
        this.clock = clock;
        this.ids = ids;
        this.retryBackoff = retryBackoff;
        this.statsWindow = statsWindow;
    }

    // ========== Enqueue ==========

    /**
     * Validate and durably insert a new PENDING task.
     *
     * @return The new task ID
     * @throws ValidationException if the submission is malformed
     */
    public UUID enqueue(TaskSubmission submission) {
        TaskSubmission validated = validate(submission);
        Task task = Task.create(ids.nextId(), validated, clock.instant());

        storage.run("task.insert", () -> tasks.insert(task));

        try (var ctx = LoggingContext.forTask(task.taskId(), task.metadata().workflowId(), null, 1)) {
            log.info("Enqueued {} task {} with priority {}", task.type().tag(), task.taskId(), task.priority());
        }
        metrics.taskEnqueued(task.type());
        ObjectNode payload = JsonNodeFactory.instance.objectNode()
            .put("type", task.type().tag())
            .put("priority", task.priority())
            .put("maxRetries", task.maxRetries());
        audit.emit(AuditEventType.TASK_ENQUEUED, tags(task), payload);
        return task.taskId();
    }

    private TaskSubmission validate(TaskSubmission submission) {
        if (submission == null) {
            throw new ValidationException("task submission is required");
        }
        if (submission.type() == null) {
            throw new ValidationException("type", "is required");
        }
        if (submission.priority() == null) {
            throw new ValidationException("priority", "is required");
        }
        int maxRetries = submission.maxRetries() != null ? submission.maxRetries() : TaskSubmission.DEFAULT_MAX_RETRIES;
        if (maxRetries < 0) {
            throw new ValidationException("maxRetries", "must be >= 0, was " + maxRetries);
        }
        Set<String> required = submission.requiredCapabilities() != null ? submission.requiredCapabilities() : Set.of();
        if (required.stream().anyMatch(c -> c == null || c.isBlank())) {
            throw new ValidationException("requiredCapabilities", "capability tags must not be blank");
        }
        return new TaskSubmission(
            submission.type(),
            submission.priority(),
            submission.payload(),
            maxRetries,
            submission.scheduledAt(),
            required,
            submission.metadata()
        );
    }

    // ========== Claim ==========

    /**
     * Atomically hand the best eligible task to a worker.
     * Never blocks. Returns empty when paused or the worker has no free slot, and when
     * nothing is eligible.
     */
    public Optional<Task> claim(String workerId, Set<String> capabilities) {
        if (paused.get()) {
            return Optional.empty();
        }
        UUID reservation = ids.nextId();
        if (!workerPool.reserveSlot(workerId, reservation)) {
            log.debug("Worker {} has no free slot, nothing claimed", workerId);
            return Optional.empty();
        }

        Instant now = clock.instant();
        Optional<Task> claimed;
        try {
            claimed = storage.execute("task.claim", () -> tasks.claimNext(workerId, capabilities, now));
        } catch (RuntimeException e) {
            workerPool.cancelReservation(workerId, reservation);
            throw e;
        }
        if (claimed.isEmpty()) {
            workerPool.cancelReservation(workerId, reservation);
            return claimed;
        }

        Task task = claimed.get();
        workerPool.confirmReservation(workerId, reservation, task.taskId());
        try (var ctx = LoggingContext.forTask(task.taskId(), task.metadata().workflowId(), workerId, task.retryCount() + 1)) {
            log.info("Task {} claimed by worker {}", task.taskId(), workerId);
        }
        metrics.taskClaimed(task.type());
        audit.emit(AuditEventType.TASK_CLAIMED, tags(task), attemptPayload(task));
        return claimed;
    }

    // ========== Complete / Fail ==========

    /**
     * Mark a running task completed and store its result.
     *
     * @throws NotFoundException if the task is unknown
     * @throws InvalidStateException if the task is not running
     */
    public TaskResult complete(UUID taskId, JsonNode result) {
        Task[] previous = new Task[1];
        Task completed = transition(taskId, "complete", current -> {
            requireRunning(current, "complete");
            previous[0] = current;
            return current.withCompleted(result, clock.instant());
        });

        String workerId = previous[0].assignedWorkerId();
        workerPool.completeTask(workerId, taskId);
        try (var ctx = LoggingContext.forTask(taskId, completed.metadata().workflowId(), workerId, completed.retryCount() + 1)) {
            log.info("Task {} completed", taskId);
        }
        metrics.taskCompleted(completed.type(), completed.duration().orElse(null));
        audit.emit(AuditEventType.TASK_COMPLETED, tags(completed, workerId), attemptPayload(completed));
        return TaskResult.completed(completed);
    }

    /**
     * Record a failed attempt. Reschedules with backoff while retries remain,
     * otherwise fails the task permanently.
     *
     * @throws NotFoundException if the task is unknown
     * @throws InvalidStateException if the task is not running
     */
    public TaskResult fail(UUID taskId, TaskError error) {
        if (error == null) {
            throw new ValidationException("error", "is required");
        }
        Task[] previous = new Task[1];
        Task updated = transition(taskId, "fail", current -> {
            requireRunning(current, "fail");
            previous[0] = current;
            Instant now = clock.instant();
            if (current.hasRetriesLeft()) {
                Duration delay = retryBackoff.computeBackoff(current.retryCount() + 1);
                return current.withRetryScheduled(error, now.plus(delay));
            }
            return current.withFailed(error, now);
        });

        String workerId = previous[0].assignedWorkerId();
        workerPool.failTask(workerId, taskId);

        ObjectNode payload = attemptPayload(updated)
            .put("errorCode", error.code())
            .put("errorMessage", error.message());
        try (var ctx = LoggingContext.forTask(taskId, updated.metadata().workflowId(), workerId, previous[0].retryCount() + 1)) {
            if (updated.status() == TaskStatus.PENDING) {
                log.warn("Task {} failed with {}, retry {}/{} scheduled at {}",
                    taskId, error.code(), updated.retryCount(), updated.maxRetries(), updated.scheduledAt());
                metrics.taskRetryScheduled(updated.type());
                payload.put("scheduledAt", updated.scheduledAt().toString());
                audit.emit(AuditEventType.TASK_RETRY_SCHEDULED, tags(updated, workerId), payload);
                return TaskResult.retryScheduled(updated);
            }
            log.error("Task {} failed permanently after {} attempt(s): {} {}",
                taskId, updated.retryCount() + 1, error.code(), error.message());
        }
        metrics.taskFailed(updated.type());
        audit.emit(AuditEventType.TASK_FAILED_PERMANENTLY, tags(updated, workerId), payload);
        return TaskResult.failedPermanently(updated);
    }

    // ========== Cancel ==========

    /**
     * Cancel a pending or running task. Cancelling a cancelled task returns it unchanged.
     * A running attempt is not interrupted; its worker slot is released.
     *
     * @throws InvalidStateException if the task already completed or failed
     */
    public Task cancel(UUID taskId) {
        Task[] previous = new Task[1];
        Task cancelled = transition(taskId, "cancel", current -> {
            previous[0] = current;
            if (current.status() == TaskStatus.CANCELLED) {
                return current;
            }
            if (!current.status().canTransitionTo(TaskStatus.CANCELLED)) {
                throw new InvalidStateException("Task", taskId.toString(), current.status().name(), "cancel");
            }
            return current.withCancelled(clock.instant());
        });

        if (previous[0].status() == TaskStatus.CANCELLED) {
            log.debug("Task {} already cancelled", taskId);
            return cancelled;
        }
        if (previous[0].status() == TaskStatus.RUNNING) {
            workerPool.releaseTask(previous[0].assignedWorkerId(), taskId);
        }
        log.info("Task {} cancelled from {}", taskId, previous[0].status());
        metrics.taskCancelled(cancelled.type());
        audit.emit(AuditEventType.TASK_CANCELLED, tags(cancelled),
            JsonNodeFactory.instance.objectNode().put("previousStatus", previous[0].status().name()));
        return cancelled;
    }

    // ========== Reads ==========

    public Task getTask(UUID taskId) {
        return storage.execute("task.find", () -> tasks.findById(taskId))
            .orElseThrow(() -> new NotFoundException("Task", taskId.toString()));
    }

    public List<Task> listTasks(TaskFilter filter) {
        return storage.execute("task.list", () -> tasks.find(filter != null ? filter : TaskFilter.all()));
    }

    public TaskStats stats() {
        Map<TaskStatus, Long> counts = storage.execute("task.countByStatus", tasks::countByStatus);
        Optional<TaskRepository.DurationSample> sample =
            storage.execute("task.averageDuration", () -> tasks.averageRecentDuration(statsWindow));
        return new TaskStats(
            counts,
            sample.map(TaskRepository.DurationSample::average).orElse(Duration.ZERO),
            sample.map(TaskRepository.DurationSample::sampleSize).orElse(0),
            paused.get()
        );
    }

    // ========== Pause / Resume ==========

    public void pause() {
        if (paused.compareAndSet(false, true)) {
            log.info("Task queue paused, claims suspended");
            metrics.queuePaused(true);
        }
    }

    public void resume() {
        if (paused.compareAndSet(true, false)) {
            log.info("Task queue resumed");
            metrics.queuePaused(false);
        }
    }

    public boolean isPaused() {
        return paused.get();
    }

    public ComponentHealth health() {
        try {
            Map<TaskStatus, Long> counts = tasks.countByStatus();
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("pending", counts.getOrDefault(TaskStatus.PENDING, 0L));
            details.put("running", counts.getOrDefault(TaskStatus.RUNNING, 0L));
            details.put("paused", paused.get());
            return ComponentHealth.healthy(COMPONENT, details);
        } catch (RuntimeException e) {
            return ComponentHealth.unhealthy(COMPONENT, e);
        }
    }

    // ========== Helper Methods ==========

    /**
     * Read, apply and conditionally write until the write lands on the version that was read.
     * A change function that returns its input unchanged writes nothing.
     */
    private Task transition(UUID taskId, String operation, Function<Task, Task> change) {
        for (int attempt = 1; attempt <= MAX_TRANSITION_ATTEMPTS; attempt++) {
            Task current = getTask(taskId);
            Task next = change.apply(current);
            if (next == current) {
                return current;
            }
            boolean written = storage.execute("task." + operation, () -> tasks.updateIfCurrent(next));
            if (written) {
                return next;
            }
            log.debug("Task {} changed concurrently during {} (attempt {}), re-reading", taskId, operation, attempt);
        }
        throw new StorageException(String.format(
            "Task %s kept changing concurrently; gave up %s after %d attempts", taskId, operation, MAX_TRANSITION_ATTEMPTS));
    }

    private static void requireRunning(Task task, String operation) {
        if (task.status() != TaskStatus.RUNNING) {
            throw new InvalidStateException("Task", task.taskId().toString(), task.status().name(), operation);
        }
    }

    private static Map<String, String> tags(Task task) {
        return tags(task, task.assignedWorkerId());
    }

    private static Map<String, String> tags(Task task, String workerId) {
        Map<String, String> tags = new LinkedHashMap<>();
        tags.put("taskId", task.taskId().toString());
        tags.put("taskType", task.type().tag());
        if (task.metadata().workflowId() != null) {
            tags.put("workflowId", task.metadata().workflowId().toString());
        }
        if (workerId != null) {
            tags.put("workerId", workerId);
        }
        return tags;
    }

    private static ObjectNode attemptPayload(Task task) {
        return JsonNodeFactory.instance.objectNode()
            .put("status", task.status().name())
            .put("retryCount", task.retryCount())
            .put("maxRetries", task.maxRetries());
    }
}
