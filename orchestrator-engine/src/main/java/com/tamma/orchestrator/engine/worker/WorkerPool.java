package com.tamma.orchestrator.engine.worker;

import com.tamma.orchestrator.core.audit.AuditEventType;
import com.tamma.orchestrator.core.exception.NotFoundException;
import com.tamma.orchestrator.core.exception.ValidationException;
import com.tamma.orchestrator.core.model.Worker;
import com.tamma.orchestrator.core.repository.WorkerRepository;
import com.tamma.orchestrator.engine.audit.AuditEmitter;
import com.tamma.orchestrator.engine.health.ComponentHealth;
import com.tamma.orchestrator.engine.logging.LoggingContext;
import com.tamma.orchestrator.engine.storage.StorageRetryTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;

/**
 * Tracks worker registrations, heartbeats and task assignments.
 *
 * <p>Assignment bookkeeping only feeds capacity decisions. Task records are owned by the
 * task queue and never touched here. Stale workers are excluded from availability but
 * stay registered until explicitly unregistered.</p>
 */
public class WorkerPool {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    public static final String COMPONENT = "workerPool";

    private final WorkerRepository workers;
    private final StorageRetryTemplate storage;
    private final AuditEmitter audit;
    private final Clock clock;
    private final Duration heartbeatTimeout;
    private final int defaultMaxConcurrency;

    public WorkerPool(
            WorkerRepository workers,
            StorageRetryTemplate storage,
            AuditEmitter audit,
            Clock clock,
            Duration heartbeatTimeout,
            int defaultMaxConcurrency) {
        this.workers = workers;
        this.storage = storage;
        this.audit = audit;
        this.clock = clock;
        this.heartbeatTimeout = heartbeatTimeout;
        this.defaultMaxConcurrency = defaultMaxConcurrency;
    }

    // ========== Registration ==========

    public Worker registerWorker(String workerId, Set<String> capabilities) {
        return registerWorker(workerId, capabilities, defaultMaxConcurrency);
    }

    /**
     * Register a worker, or refresh an existing registration.
     * Re-registering replaces capabilities and concurrency and keeps current assignments.
     */
    public Worker registerWorker(String workerId, Set<String> capabilities, int maxConcurrency) {
        if (workerId == null || workerId.isBlank()) {
            throw new ValidationException("workerId", "must not be blank");
        }
        if (capabilities == null || capabilities.isEmpty()) {
            throw new ValidationException("capabilities", "at least one capability is required");
        }
        if (capabilities.stream().anyMatch(c -> c == null || c.isBlank())) {
            throw new ValidationException("capabilities", "capability tags must not be blank");
        }
        if (maxConcurrency < 1) {
            throw new ValidationException("maxConcurrency", "must be >= 1");
        }

        Instant now = clock.instant();
        Worker worker = storage.execute("worker.register",
            () -> workers.upsert(workerId, Set.copyOf(capabilities), maxConcurrency, now));

        try (var ctx = LoggingContext.forWorker(workerId)) {
            log.info("Registered worker {} with capabilities {} (max concurrency {})",
                workerId, worker.capabilities(), maxConcurrency);
        }
        audit.emit(AuditEventType.WORKER_REGISTERED, Map.of("workerId", workerId));
        return worker;
    }

    /**
     * Remove a worker. Tasks it is running stay RUNNING.
     *
     * @return true if the worker was registered
     */
    public boolean unregisterWorker(String workerId) {
        Optional<Worker> existing = storage.execute("worker.find", () -> workers.findById(workerId));
        boolean removed = storage.execute("worker.unregister", () -> workers.delete(workerId));
        if (removed) {
            existing.filter(w -> !w.currentTaskIds().isEmpty()).ifPresent(w ->
                log.warn("Unregistered worker {} while it still holds tasks {}", workerId, w.currentTaskIds()));
            log.info("Unregistered worker {}", workerId);
            audit.emit(AuditEventType.WORKER_UNREGISTERED, Map.of("workerId", workerId));
        }
        return removed;
    }

    public void heartbeat(String workerId) {
        boolean found = storage.execute("worker.heartbeat", () -> workers.touchHeartbeat(workerId, clock.instant()));
        if (!found) {
            throw new NotFoundException("Worker", workerId);
        }
        log.trace("Heartbeat from worker {}", workerId);
    }

    // ========== Queries ==========

    public Worker getWorker(String workerId) {
        return findWorker(workerId).orElseThrow(() -> new NotFoundException("Worker", workerId));
    }

    public Optional<Worker> findWorker(String workerId) {
        return storage.execute("worker.find", () -> workers.findById(workerId));
    }

    public List<Worker> listWorkers() {
        return storage.execute("worker.list", workers::findAll);
    }

    /**
     * Fresh workers carrying every required capability that still have capacity.
     */
    public List<Worker> getAvailableWorkers(Set<String> requiredCapabilities) {
        Set<String> required = requiredCapabilities != null ? requiredCapabilities : Set.of();
        return listWorkers().stream()
            .filter(w -> w.hasCapabilities(required))
            .filter(this::isAvailable)
            .collect(Collectors.toList());
    }

    public List<Worker> getAvailableWorkers() {
        return getAvailableWorkers(Set.of());
    }

    public boolean isAvailable(Worker worker) {
        return !isStale(worker) && worker.hasCapacity();
    }

    public boolean isStale(Worker worker) {
        return worker.isStaleAt(clock.instant(), heartbeatTimeout);
    }

    public Duration getHeartbeatTimeout() {
        return heartbeatTimeout;
    }

    // ========== Assignment Bookkeeping ==========

    /**
     * Hold a slot on the worker before a task is picked, so racing claims for the same
     * worker never exceed its maxConcurrency. The slot is later either confirmed with the
     * claimed task id or cancelled.
     *
     * @return false if the worker is unknown or already full
     */
    public boolean reserveSlot(String workerId, UUID reservationId) {
        return storage.execute("worker.reserveSlot", () -> workers.reserveSlot(workerId, reservationId));
    }

    public void confirmReservation(String workerId, UUID reservationId, UUID taskId) {
        track("worker.confirmReservation", workerId, taskId, () -> workers.replaceTask(workerId, reservationId, taskId));
    }

    public void cancelReservation(String workerId, UUID reservationId) {
        track("worker.cancelReservation", workerId, reservationId, () -> workers.removeTask(workerId, reservationId));
    }

    public void assignTask(String workerId, UUID taskId) {
        track("worker.assignTask", workerId, taskId, () -> workers.addTask(workerId, taskId));
    }

    public void completeTask(String workerId, UUID taskId) {
        track("worker.completeTask", workerId, taskId, () -> workers.removeTask(workerId, taskId));
    }

    public void failTask(String workerId, UUID taskId) {
        track("worker.failTask", workerId, taskId, () -> workers.removeTask(workerId, taskId));
    }

    /**
     * Free the slot of a task that stopped running for another reason (cancellation, reaping).
     */
    public void releaseTask(String workerId, UUID taskId) {
        track("worker.releaseTask", workerId, taskId, () -> workers.removeTask(workerId, taskId));
    }

    private void track(String operation, String workerId, UUID taskId, BooleanSupplier change) {
        if (workerId == null) {
            return;
        }
        boolean found = storage.execute(operation, change::getAsBoolean);
        if (!found) {
            log.debug("{} ignored for unknown worker {} (task {})", operation, workerId, taskId);
        }
    }

    // ========== Health ==========

    public ComponentHealth health() {
        try {
            List<Worker> all = workers.findAll();
            long available = all.stream().filter(this::isAvailable).count();
            long stale = all.stream().filter(this::isStale).count();
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("registered", all.size());
            details.put("available", available);
            details.put("stale", stale);
            return ComponentHealth.healthy(COMPONENT, details);
        } catch (RuntimeException e) {
            return ComponentHealth.unhealthy(COMPONENT, e);
        }
    }
}
