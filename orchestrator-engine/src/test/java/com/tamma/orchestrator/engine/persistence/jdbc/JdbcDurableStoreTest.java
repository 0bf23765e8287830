package com.tamma.orchestrator.engine.persistence.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.TextNode;
import com.tamma.orchestrator.core.exception.OptimisticLockException;
import com.tamma.orchestrator.core.model.*;
import com.tamma.orchestrator.core.test.TimeController;
import com.tamma.orchestrator.core.time.IdGenerator;
import com.tamma.orchestrator.engine.audit.AuditEmitter;
import com.tamma.orchestrator.engine.audit.InMemoryAuditEventSink;
import com.tamma.orchestrator.engine.metrics.OrchestratorMetrics;
import com.tamma.orchestrator.engine.queue.TaskQueue;
import com.tamma.orchestrator.engine.state.StateManager;
import com.tamma.orchestrator.engine.state.WorkflowStateFields;
import com.tamma.orchestrator.engine.storage.StorageRetryTemplate;
import com.tamma.orchestrator.engine.worker.WorkerPool;
import org.junit.jupiter.api.*;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;

import static org.assertj.core.api.Assertions.*;

/**
 * Runs the task queue, worker pool and state manager against PostgreSQL.
 */
@Testcontainers(disabledWithoutDocker = true)
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class JdbcDurableStoreTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15")
        .withDatabaseName("orchestrator_test")
        .withUsername("test")
        .withPassword("test");

    private static final Set<String> CAPS = Set.of("workflow-step", "docker");

    private DriverManagerDataSource dataSource;
    private JdbcDurableStore store;
    private TimeController time;
    private InMemoryAuditEventSink auditSink;
    private AuditEmitter audit;
    private WorkerPool workerPool;
    private TaskQueue taskQueue;
    private StateManager stateManager;

    @BeforeAll
    void createSchema() {
        dataSource = new DriverManagerDataSource(postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
        new ResourceDatabasePopulator(new ClassPathResource("schema.sql")).execute(dataSource);
    }

    @BeforeEach
    void setUp() {
        new JdbcTemplate(dataSource).execute("TRUNCATE tasks, workers, workflow_states, workflow_state_history");

        time = TimeController.frozen();
        auditSink = new InMemoryAuditEventSink();
        audit = new AuditEmitter(auditSink, time);
        store = new JdbcDurableStore(dataSource, new ObjectMapper());
        store.open();

        StorageRetryTemplate storage = StorageRetryTemplate.withDefaults();
        workerPool = new WorkerPool(store.workers(), storage, audit, time, Duration.ofSeconds(30), 1);
        taskQueue = new TaskQueue(store.tasks(), workerPool, storage, audit, new OrchestratorMetrics(),
            time, IdGenerator.random(), BackoffPolicy.taskDefault(), TaskQueue.DEFAULT_STATS_WINDOW);
        stateManager = new StateManager(store.workflowStates(), storage, audit, time, IdGenerator.random());
    }

    @AfterEach
    void tearDown() {
        audit.close();
        store.close();
    }

    private UUID enqueue(int priority, Set<String> required) {
        return taskQueue.enqueue(TaskSubmission.builder()
            .type(TaskType.WORKFLOW_STEP)
            .priority(priority)
            .requiredCapabilities(required)
            .payload(JsonNodeFactory.instance.objectNode().put("step", priority))
            .build());
    }

    @Test
    @DisplayName("Store answers the reachability probe")
    void testReachable() {
        assertThat(store.isReachable()).isTrue();
        assertThat(store.isOpen()).isTrue();
    }

    @Test
    @DisplayName("Task round trip through claim, retry and completion")
    void testTaskLifecycle() {
        workerPool.registerWorker("w1", CAPS, 4);
        UUID low = enqueue(1, Set.of());
        UUID high = enqueue(9, Set.of("docker"));
        enqueue(5, Set.of("gpu"));

        Task claimed = taskQueue.claim("w1", CAPS).orElseThrow();
        assertThat(claimed.taskId()).isEqualTo(high);
        assertThat(claimed.status()).isEqualTo(TaskStatus.RUNNING);
        assertThat(claimed.startedAt()).isEqualTo(time.now());
        assertThat(claimed.payload().get("step").asInt()).isEqualTo(9);
        assertThat(workerPool.getWorker("w1").currentTaskIds()).containsExactly(high);

        TaskResult retry = taskQueue.fail(high, TaskError.of("FLAKY", "network"));
        assertThat(retry.outcome()).isEqualTo(TaskOutcome.RETRY_SCHEDULED);
        assertThat(retry.task().scheduledAt()).isEqualTo(time.now().plusSeconds(1));

        assertThat(taskQueue.claim("w1", CAPS).orElseThrow().taskId()).isEqualTo(low);

        time.advanceSeconds(2);
        Task again = taskQueue.claim("w1", CAPS).orElseThrow();
        assertThat(again.taskId()).isEqualTo(high);
        assertThat(again.retryCount()).isEqualTo(1);
        assertThat(again.lastError()).isEqualTo(TaskError.of("FLAKY", "network"));

        TaskResult done = taskQueue.complete(high, JsonNodeFactory.instance.objectNode().put("pr", 7));
        assertThat(done.task().result().get("pr").asInt()).isEqualTo(7);

        TaskStats stats = taskQueue.stats();
        assertThat(stats.count(TaskStatus.COMPLETED)).isEqualTo(1);
        assertThat(stats.running()).isEqualTo(1);
        assertThat(stats.pending()).isEqualTo(1);
        assertThat(stats.averageDuration()).isEqualTo(Duration.ofSeconds(2));
        assertThat(workerPool.getWorker("w1").currentTaskIds()).containsExactly(low);
    }

    @Test
    @DisplayName("Concurrent claimants never receive the same row")
    void testConcurrentClaims() throws Exception {
        int tasks = 60;
        int workers = 10;
        for (int i = 0; i < tasks; i++) {
            enqueue(i % 3, Set.of());
        }
        for (int i = 0; i < workers; i++) {
            workerPool.registerWorker("w" + i, CAPS, tasks);
        }

        ExecutorService executor = Executors.newFixedThreadPool(workers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<List<UUID>>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < workers; i++) {
                String workerId = "w" + i;
                futures.add(executor.submit(() -> {
                    start.await();
                    List<UUID> mine = new ArrayList<>();
                    Optional<Task> next;
                    while ((next = taskQueue.claim(workerId, CAPS)).isPresent()) {
                        mine.add(next.get().taskId());
                    }
                    return mine;
                }));
            }
            start.countDown();

            List<UUID> all = new ArrayList<>();
            for (Future<List<UUID>> future : futures) {
                all.addAll(future.get(60, TimeUnit.SECONDS));
            }
            assertThat(all).hasSize(tasks).doesNotHaveDuplicates();
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Racing claims for one worker stay within its concurrency limit")
    void testSingleWorkerSlotReservation() throws Exception {
        int claimers = 8;
        for (int i = 0; i < claimers; i++) {
            enqueue(1, Set.of());
        }
        workerPool.registerWorker("solo", CAPS, 1);

        ExecutorService executor = Executors.newFixedThreadPool(claimers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Optional<Task>>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < claimers; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return taskQueue.claim("solo", CAPS);
                }));
            }
            start.countDown();

            long claimed = 0;
            for (Future<Optional<Task>> future : futures) {
                if (future.get(60, TimeUnit.SECONDS).isPresent()) {
                    claimed++;
                }
            }
            assertThat(claimed).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }

        assertThat(workerPool.getWorker("solo").currentTaskIds()).hasSize(1);
        assertThat(store.tasks().find(TaskFilter.byStatus(TaskStatus.RUNNING))).hasSize(1);
    }

    @Test
    @DisplayName("Stale version writes are refused")
    void testConditionalWrite() {
        UUID taskId = enqueue(1, Set.of());
        Task pending = store.tasks().findById(taskId).orElseThrow();
        Task cancelled = pending.withCancelled(time.now());

        assertThat(store.tasks().updateIfCurrent(cancelled)).isTrue();
        assertThat(store.tasks().updateIfCurrent(cancelled)).isFalse();
        assertThat(store.tasks().find(TaskFilter.byStatus(TaskStatus.CANCELLED))).hasSize(1);
    }

    @Test
    @DisplayName("Worker registration keeps assignments and tracks heartbeats")
    void testWorkers() {
        workerPool.registerWorker("w1", Set.of("git-operation"), 2);
        UUID taskId = UUID.randomUUID();
        workerPool.assignTask("w1", taskId);
        workerPool.assignTask("w1", taskId);

        time.advanceSeconds(10);
        Worker refreshed = workerPool.registerWorker("w1", Set.of("git-operation", "docker"), 3);

        assertThat(refreshed.currentTaskIds()).containsExactly(taskId);
        assertThat(refreshed.capabilities()).containsExactlyInAnyOrder("git-operation", "docker");
        assertThat(refreshed.lastHeartbeatAt()).isEqualTo(time.now());

        workerPool.releaseTask("w1", taskId);
        assertThat(workerPool.getWorker("w1").currentTaskIds()).isEmpty();
        assertThat(workerPool.unregisterWorker("w1")).isTrue();
        assertThat(workerPool.listWorkers()).isEmpty();
    }

    @Test
    @DisplayName("Workflow history is written with each update and survives deletion")
    void testWorkflowHistory() {
        UUID workflowId = stateManager.createWorkflowState(WorkflowStateDraft.builder()
            .issueRef("issue-1")
            .repositoryRef("tamma/core")
            .context(JsonNodeFactory.instance.objectNode().put("branch", "main"))
            .metadata(new WorkflowMetadata(2, List.of("infra"), null))
            .build());
        WorkflowState initial = stateManager.getWorkflowState(workflowId);

        time.advanceSeconds(1);
        stateManager.updateWorkflowState(workflowId, WorkflowStateUpdate.status(WorkflowStatus.RUNNING));
        time.advanceSeconds(1);
        stateManager.updateWorkflowState(workflowId, WorkflowStateUpdate.builder()
            .currentStep(2)
            .contextEntry("pr", TextNode.valueOf("#12"))
            .build());

        WorkflowState current = stateManager.getWorkflowState(workflowId);
        List<WorkflowStateHistoryEntry> history = stateManager.getWorkflowHistory(workflowId);

        assertThat(current.version()).isEqualTo(2);
        assertThat(history).extracting(WorkflowStateHistoryEntry::sequence).containsExactly(1L, 2L);
        assertThat(WorkflowStateFields.replay(initial, history)).isEqualTo(current);

        stateManager.deleteWorkflowState(workflowId);
        assertThat(stateManager.getWorkflowHistory(workflowId)).hasSize(2);
    }

    @Test
    @DisplayName("Update against an outdated version is rejected and leaves no history")
    void testWorkflowOptimisticLock() {
        UUID workflowId = stateManager.createWorkflowState(WorkflowStateDraft.builder().build());
        WorkflowState stale = stateManager.getWorkflowState(workflowId);
        stateManager.updateWorkflowState(workflowId, WorkflowStateUpdate.status(WorkflowStatus.RUNNING));

        WorkflowState conflicting = stale.toBuilder().currentStep(5).version(1).build();
        WorkflowStateHistoryEntry entry = WorkflowStateFields.diff(UUID.randomUUID(), stale, conflicting);
        // stored version is already 1, so a write expecting 0 must fail
        assertThatThrownBy(() -> store.workflowStates().update(conflicting, entry))
            .isInstanceOf(OptimisticLockException.class);
        assertThat(stateManager.getWorkflowHistory(workflowId)).hasSize(1);
    }
}
