package com.tamma.orchestrator.engine.lifecycle;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tamma.orchestrator.core.audit.AuditEventSink;
import com.tamma.orchestrator.core.audit.AuditEventType;
import com.tamma.orchestrator.core.exception.InvalidStateException;
import com.tamma.orchestrator.core.exception.OrchestratorException;
import com.tamma.orchestrator.core.exception.OrchestratorStartupException;
import com.tamma.orchestrator.core.model.*;
import com.tamma.orchestrator.core.repository.DurableStore;
import com.tamma.orchestrator.core.time.IdGenerator;
import com.tamma.orchestrator.core.time.MonotonicClock;
import com.tamma.orchestrator.engine.audit.AuditEmitter;
import com.tamma.orchestrator.engine.audit.Slf4jAuditEventSink;
import com.tamma.orchestrator.engine.health.ComponentHealth;
import com.tamma.orchestrator.engine.health.HealthReport;
import com.tamma.orchestrator.engine.metrics.OrchestratorMetrics;
import com.tamma.orchestrator.engine.queue.TaskQueue;
import com.tamma.orchestrator.engine.state.StateManager;
import com.tamma.orchestrator.engine.storage.StorageRetryTemplate;
import com.tamma.orchestrator.engine.worker.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Top-level coordinator. Wires the task queue, worker pool and state manager over one
 * durable store and runs the startup and shutdown protocols.
 *
 * Startup:
 * 1. Open the durable store and verify it is reachable
 * 2. Build the task queue, worker pool and state manager
 * 3. Open transports and accept submissions and registrations
 * 4. Self health-check, abort if anything is unhealthy
 * 5. Announce startup with the component inventory
 *
 * Shutdown:
 * 1. Pause the task queue
 * 2. Wait for running tasks and active workflows to reach zero, up to the drain timeout
 * 3. Stop accepting heartbeats and registrations, close transports
 * 4. Close the durable store
 * 5. Announce shutdown, including whether the drain timed out
 *
 * Constructed once per process and passed to whatever needs it.
 */
public class Orchestrator {

    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);

    private final DurableStore store;
    private final AuditEmitter audit;
    private final Clock clock;
    private final IdGenerator ids;
    private final OrchestratorSettings settings;
    private final List<Transport> transports;
    private final ActiveWorkProbe activeWork;
    private final OrchestratorMetrics metrics;
    private final List<StartupHook> startupHooks;

    private final AtomicReference<OrchestratorPhase> phase = new AtomicReference<>(OrchestratorPhase.INITIALIZING);
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean acceptingSubmissions = new AtomicBoolean(false);
    private final AtomicBoolean acceptingHeartbeats = new AtomicBoolean(false);
    private final AtomicBoolean storeAvailable = new AtomicBoolean(false);
    private final List<Transport> openTransports = new ArrayList<>();

    private volatile TaskQueue taskQueue;
    private volatile WorkerPool workerPool;
    private volatile StateManager stateManager;
    private volatile ShutdownReport lastShutdownReport;

    private Orchestrator(Builder builder) {
        this.store = Objects.requireNonNull(builder.store, "store");
        this.clock = MonotonicClock.of(builder.clock);
        this.audit = new AuditEmitter(builder.auditSink, clock);
        this.ids = builder.ids;
        this.settings = builder.settings;
        this.transports = List.copyOf(builder.transports);
        this.activeWork = builder.activeWork;
        this.metrics = builder.metrics;
        this.startupHooks = List.copyOf(builder.startupHooks);
    }

    public static Builder builder() {
        return new Builder();
    }

    // ========== Startup ==========

    /**
     * Run the startup protocol. On any failure the orchestrator ends STOPPED with
     * everything it opened closed again.
     *
     * @throws OrchestratorStartupException if a startup phase failed
     * @throws InvalidStateException if start was already called
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            throw new InvalidStateException("Orchestrator", "orchestrator", phase.get().name(), "start");
        }
        log.info("Starting orchestrator with {} store", store.name());

        String step = "store";
        try {
            store.open();
            if (!store.isReachable()) {
                throw new OrchestratorStartupException(step, "durable store " + store.name() + " is not reachable");
            }
            storeAvailable.set(true);

            step = "components";
            StorageRetryTemplate storage = new StorageRetryTemplate(
                settings.storageRetryAttempts(), settings.storageBackoff());
            workerPool = new WorkerPool(store.workers(), storage, audit, clock,
                settings.heartbeatTimeout(), settings.defaultMaxConcurrency());
            taskQueue = new TaskQueue(store.tasks(), workerPool, storage, audit, metrics, clock, ids,
                settings.taskBackoff(), settings.statsWindow());
            stateManager = new StateManager(store.workflowStates(), storage, audit, clock, ids);

            step = "transports";
            for (Transport transport : transports) {
                transport.open();
                openTransports.add(transport);
                log.info("Opened transport {}", transport.name());
            }
            acceptingSubmissions.set(true);
            acceptingHeartbeats.set(true);

            step = "health";
            HealthReport health = healthCheck();
            if (!health.isHealthy()) {
                throw new OrchestratorStartupException(step, "unhealthy components " + unhealthyNames(health));
            }

            step = "announce";
            audit.emit(AuditEventType.ORCHESTRATOR_STARTED, Map.of("store", store.name()), inventory());
        } catch (RuntimeException e) {
            throw abortStartup(step, e);
        }

        transitionTo(OrchestratorPhase.RUNNING);
        log.info("Orchestrator running");
        runStartupHooks();
    }

    private OrchestratorStartupException abortStartup(String step, RuntimeException cause) {
        log.error("Orchestrator startup failed during {}: {}", step, cause.getMessage());
        OrchestratorStartupException failure = cause instanceof OrchestratorStartupException startup
            ? startup
            : new OrchestratorStartupException(step, cause);

        acceptingSubmissions.set(false);
        acceptingHeartbeats.set(false);
        try {
            ObjectNode payload = JsonNodeFactory.instance.objectNode()
                .put("phase", step)
                .put("error", String.valueOf(cause.getMessage()));
            audit.emit(AuditEventType.ORCHESTRATOR_STARTUP_FAILED, Map.of("store", store.name()), payload);
        } catch (RuntimeException emitFailure) {
            failure.addSuppressed(emitFailure);
        }
        closeTransports();
        closeStore();
        transitionTo(OrchestratorPhase.STOPPED);
        audit.close();
        return failure;
    }

    private void runStartupHooks() {
        for (StartupHook hook : startupHooks) {
            try {
                hook.afterStartup(this);
            } catch (RuntimeException e) {
                log.error("Startup hook {} failed: {}", hook.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }

    private JsonNode inventory() {
        ObjectNode payload = JsonNodeFactory.instance.objectNode().put("store", store.name());
        ArrayNode components = payload.putArray("components");
        components.add(TaskQueue.COMPONENT).add(WorkerPool.COMPONENT).add(StateManager.COMPONENT);
        ArrayNode transportNames = payload.putArray("transports");
        transports.forEach(t -> transportNames.add(t.name()));
        payload.put("heartbeatTimeoutMs", settings.heartbeatTimeout().toMillis());
        payload.put("drainTimeoutMs", settings.drainTimeout().toMillis());
        return payload;
    }

    // ========== Shutdown ==========

    /**
     * Run the shutdown protocol. Idempotent: only the first call from RUNNING does anything.
     *
     * @return true if this call performed the shutdown
     */
    public boolean shutdown() {
        if (!phase.compareAndSet(OrchestratorPhase.RUNNING, OrchestratorPhase.DRAINING)) {
            log.debug("Shutdown requested in phase {}, nothing to do", phase.get());
            return false;
        }
        metrics.phaseChanged(OrchestratorPhase.DRAINING);
        log.info("Orchestrator draining (timeout {}ms)", settings.drainTimeout().toMillis());

        acceptingSubmissions.set(false);
        taskQueue.pause();

        ShutdownReport report = drain();

        acceptingHeartbeats.set(false);
        closeTransports();

        storeAvailable.set(false);
        closeStore();

        lastShutdownReport = report;
        try {
            ObjectNode payload = JsonNodeFactory.instance.objectNode()
                .put("drainTimedOut", report.drainTimedOut())
                .put("drainDurationMs", report.drainDuration().toMillis())
                .put("runningTasks", report.runningTaskIds().size())
                .put("activeWorkflows", report.activeWorkflowIds().size());
            audit.emit(AuditEventType.ORCHESTRATOR_STOPPED, Map.of("store", store.name()), payload);
        } catch (RuntimeException e) {
            log.error("Failed to announce shutdown: {}", e.getMessage());
        } finally {
            transitionTo(OrchestratorPhase.STOPPED);
            audit.close();
        }
        log.info("Orchestrator stopped (drain timed out: {})", report.drainTimedOut());
        return true;
    }

    /**
     * Wait until nothing is running, measured on the monotonic system timer so a frozen
     * or adjusted wall clock cannot stall the deadline.
     */
    private ShutdownReport drain() {
        long startNanos = System.nanoTime();
        long deadlineNanos = startNanos + settings.drainTimeout().toNanos();

        while (true) {
            long running = countRunning();
            Set<UUID> workflows = activeWork.activeWorkflowIds();
            if (running == 0 && workflows.isEmpty()) {
                log.info("Drain complete, no running work");
                return new ShutdownReport(false, Duration.ofNanos(System.nanoTime() - startNanos), List.of(), Set.of());
            }
            long remainingNanos = deadlineNanos - System.nanoTime();
            if (remainingNanos <= 0) {
                List<UUID> runningTasks = runningTaskIds();
                log.warn("Drain timeout reached with {} task(s) still running {} and {} active workflow(s) {}",
                    runningTasks.size(), runningTasks, workflows.size(), workflows);
                return new ShutdownReport(true, Duration.ofNanos(System.nanoTime() - startNanos), runningTasks, workflows);
            }
            log.debug("Still waiting for {} running task(s) and {} active workflow(s)", running, workflows.size());
            try {
                TimeUnit.NANOSECONDS.sleep(Math.min(settings.drainPollInterval().toNanos(), remainingNanos));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while draining, stopping the wait");
                List<UUID> runningTasks = runningTaskIds();
                return new ShutdownReport(true, Duration.ofNanos(System.nanoTime() - startNanos),
                    runningTasks, activeWork.activeWorkflowIds());
            }
        }
    }

    private long countRunning() {
        try {
            return taskQueue.stats().running();
        } catch (OrchestratorException e) {
            log.warn("Could not read task stats while draining: {}", e.getMessage());
            return -1;
        }
    }

    private List<UUID> runningTaskIds() {
        try {
            return taskQueue.listTasks(TaskFilter.byStatus(TaskStatus.RUNNING).withLimit(Integer.MAX_VALUE)).stream()
                .map(Task::taskId)
                .collect(Collectors.toList());
        } catch (OrchestratorException e) {
            log.warn("Could not list running tasks: {}", e.getMessage());
            return List.of();
        }
    }

    private void closeTransports() {
        for (int i = openTransports.size() - 1; i >= 0; i--) {
            Transport transport = openTransports.get(i);
            try {
                transport.close();
                log.info("Closed transport {}", transport.name());
            } catch (RuntimeException e) {
                log.warn("Failed to close transport {}: {}", transport.name(), e.getMessage());
            }
        }
        openTransports.clear();
    }

    private void closeStore() {
        try {
            store.close();
        } catch (RuntimeException e) {
            log.error("Failed to close durable store {}: {}", store.name(), e.getMessage());
        }
    }

    private void transitionTo(OrchestratorPhase target) {
        OrchestratorPhase current = phase.get();
        if (!current.canTransitionTo(target)) {
            throw new InvalidStateException("Orchestrator", current.name(), target.name());
        }
        phase.set(target);
        metrics.phaseChanged(target);
    }

    public OrchestratorPhase phase() {
        return phase.get();
    }

    public Optional<ShutdownReport> lastShutdownReport() {
        return Optional.ofNullable(lastShutdownReport);
    }

    // ========== Health ==========

    /**
     * HEALTHY only if every component is healthy and the orchestrator is serving
     * (RUNNING, or INITIALIZING during the startup self-check).
     */
    public HealthReport healthCheck() {
        OrchestratorPhase current = phase.get();
        List<ComponentHealth> components = new ArrayList<>();
        components.add(storeHealth());
        if (taskQueue != null) {
            components.add(taskQueue.health());
            components.add(workerPool.health());
            components.add(stateManager.health());
        }
        boolean serving = current == OrchestratorPhase.RUNNING
            || (current == OrchestratorPhase.INITIALIZING && acceptingSubmissions.get());
        return HealthReport.aggregate(current.name(), serving, components);
    }

    private ComponentHealth storeHealth() {
        Map<String, Object> details = Map.of("type", store.name(), "open", store.isOpen());
        try {
            return store.isOpen() && store.isReachable()
                ? ComponentHealth.healthy("durableStore", details)
                : ComponentHealth.unhealthy("durableStore", details);
        } catch (RuntimeException e) {
            return ComponentHealth.unhealthy("durableStore", e);
        }
    }

    private static String unhealthyNames(HealthReport report) {
        return report.components().stream()
            .filter(c -> !c.isHealthy())
            .map(c -> c.component() + c.details())
            .collect(Collectors.joining(", "));
    }

    // ========== Task Operations ==========

    public UUID enqueue(TaskSubmission submission) {
        requireAcceptingSubmissions("enqueue");
        return taskQueue.enqueue(submission);
    }

    /**
     * Hand the calling worker its next task. Stale or fully loaded workers get nothing,
     * as does everyone once draining has begun.
     *
     * @throws com.tamma.orchestrator.core.exception.NotFoundException if the worker is not registered
     */
    public Optional<Task> claim(String workerId) {
        if (!acceptingSubmissions.get()) {
            if (phase.get() == OrchestratorPhase.DRAINING) {
                return Optional.empty();
            }
            throw notServing("claim");
        }
        Worker worker = workerPool.getWorker(workerId);
        if (workerPool.isStale(worker)) {
            log.debug("Stale worker {} asked for work, heartbeat required first", workerId);
            return Optional.empty();
        }
        if (!worker.hasCapacity()) {
            return Optional.empty();
        }
        // the queue reserves the slot atomically, this check only skips obvious misses
        return taskQueue.claim(workerId, worker.capabilities());
    }

    public TaskResult complete(UUID taskId, JsonNode result) {
        requireStore("complete");
        return taskQueue.complete(taskId, result);
    }

    public TaskResult fail(UUID taskId, TaskError error) {
        requireStore("fail");
        return taskQueue.fail(taskId, error);
    }

    public Task cancel(UUID taskId) {
        requireStore("cancel");
        return taskQueue.cancel(taskId);
    }

    public Task getTask(UUID taskId) {
        requireStore("getTask");
        return taskQueue.getTask(taskId);
    }

    public List<Task> listTasks(TaskFilter filter) {
        requireStore("listTasks");
        return taskQueue.listTasks(filter);
    }

    public TaskStats stats() {
        requireStore("stats");
        return taskQueue.stats();
    }

    // ========== Worker Operations ==========

    /**
     * Registrations stay open while draining, until transports close.
     */
    public Worker registerWorker(String workerId, Set<String> capabilities) {
        requireAcceptingHeartbeats("registerWorker");
        return workerPool.registerWorker(workerId, capabilities);
    }

    public Worker registerWorker(String workerId, Set<String> capabilities, int maxConcurrency) {
        requireAcceptingHeartbeats("registerWorker");
        return workerPool.registerWorker(workerId, capabilities, maxConcurrency);
    }

    public boolean unregisterWorker(String workerId) {
        requireAcceptingHeartbeats("unregisterWorker");
        return workerPool.unregisterWorker(workerId);
    }

    public void heartbeat(String workerId) {
        requireAcceptingHeartbeats("heartbeat");
        workerPool.heartbeat(workerId);
    }

    public Worker getWorker(String workerId) {
        requireStore("getWorker");
        return workerPool.getWorker(workerId);
    }

    public List<Worker> listWorkers() {
        requireStore("listWorkers");
        return workerPool.listWorkers();
    }

    public List<Worker> getAvailableWorkers(Set<String> requiredCapabilities) {
        requireStore("getAvailableWorkers");
        return workerPool.getAvailableWorkers(requiredCapabilities);
    }

    public Duration heartbeatTimeout() {
        return settings.heartbeatTimeout();
    }

    // ========== Workflow Operations ==========

    public UUID createWorkflow(WorkflowStateDraft draft) {
        requireAcceptingSubmissions("createWorkflow");
        return stateManager.createWorkflowState(draft);
    }

    public WorkflowState updateWorkflow(UUID workflowId, WorkflowStateUpdate update) {
        requireStore("updateWorkflow");
        return stateManager.updateWorkflowState(workflowId, update);
    }

    public WorkflowState archiveWorkflow(UUID workflowId) {
        requireStore("archiveWorkflow");
        return stateManager.archiveWorkflowState(workflowId);
    }

    public void deleteWorkflow(UUID workflowId) {
        requireStore("deleteWorkflow");
        stateManager.deleteWorkflowState(workflowId);
    }

    public WorkflowState getWorkflow(UUID workflowId) {
        requireStore("getWorkflow");
        return stateManager.getWorkflowState(workflowId);
    }

    public List<WorkflowState> listWorkflows(WorkflowFilter filter) {
        requireStore("listWorkflows");
        return stateManager.listWorkflowStates(filter);
    }

    public List<WorkflowStateHistoryEntry> workflowHistory(UUID workflowId) {
        requireStore("workflowHistory");
        return stateManager.getWorkflowHistory(workflowId);
    }

    // ========== Phase Guards ==========

    private void requireAcceptingSubmissions(String operation) {
        if (!acceptingSubmissions.get()) {
            throw notServing(operation);
        }
    }

    private void requireAcceptingHeartbeats(String operation) {
        if (!acceptingHeartbeats.get()) {
            throw notServing(operation);
        }
    }

    private void requireStore(String operation) {
        if (!storeAvailable.get() || taskQueue == null) {
            throw notServing(operation);
        }
    }

    private InvalidStateException notServing(String operation) {
        return new InvalidStateException("Orchestrator", "orchestrator", phase.get().name(), operation);
    }

    // ========== Builder ==========

    public static class Builder {
        private DurableStore store;
        private AuditEventSink auditSink = new Slf4jAuditEventSink();
        private Clock clock = Clock.systemUTC();
        private IdGenerator ids = IdGenerator.random();
        private OrchestratorSettings settings = OrchestratorSettings.defaults();
        private final List<Transport> transports = new ArrayList<>();
        private ActiveWorkProbe activeWork = ActiveWorkProbe.none();
        private OrchestratorMetrics metrics = new OrchestratorMetrics();
        private final List<StartupHook> startupHooks = new ArrayList<>();

        public Builder store(DurableStore store) {
            this.store = store;
            return this;
        }

        public Builder auditSink(AuditEventSink auditSink) {
            this.auditSink = auditSink;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder idGenerator(IdGenerator ids) {
            this.ids = ids;
            return this;
        }

        public Builder settings(OrchestratorSettings settings) {
            this.settings = settings;
            return this;
        }

        public Builder transport(Transport transport) {
            this.transports.add(transport);
            return this;
        }

        public Builder transports(Collection<? extends Transport> transports) {
            this.transports.addAll(transports);
            return this;
        }

        public Builder activeWorkProbe(ActiveWorkProbe activeWork) {
            this.activeWork = activeWork;
            return this;
        }

        public Builder metrics(OrchestratorMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder startupHook(StartupHook hook) {
            this.startupHooks.add(hook);
            return this;
        }

        public Builder startupHooks(Collection<? extends StartupHook> hooks) {
            this.startupHooks.addAll(hooks);
            return this;
        }

        public Orchestrator build() {
            return new Orchestrator(this);
        }
    }
}
