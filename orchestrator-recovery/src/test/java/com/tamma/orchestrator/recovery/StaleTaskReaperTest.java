package com.tamma.orchestrator.recovery;

import com.tamma.orchestrator.core.model.*;
import com.tamma.orchestrator.core.test.TimeController;
import com.tamma.orchestrator.engine.audit.InMemoryAuditEventSink;
import com.tamma.orchestrator.engine.lifecycle.Orchestrator;
import com.tamma.orchestrator.engine.lifecycle.OrchestratorSettings;
import com.tamma.orchestrator.engine.persistence.InMemoryDurableStore;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for reaping tasks held by lost workers.
 */
public class StaleTaskReaperTest {

    private static final Set<String> CAPS = Set.of("workflow-step");
    private static final Duration HEARTBEAT_TIMEOUT = Duration.ofSeconds(30);

    private TimeController time;
    private Orchestrator orchestrator;
    private StaleTaskReaper reaper;

    @BeforeEach
    void setUp() {
        time = TimeController.frozen();
        orchestrator = Orchestrator.builder()
            .store(new InMemoryDurableStore())
            .auditSink(new InMemoryAuditEventSink())
            .clock(time)
            .settings(OrchestratorSettings.builder()
                .heartbeatTimeout(HEARTBEAT_TIMEOUT)
                .drainTimeout(Duration.ZERO)
                .build())
            .build();
        orchestrator.start();
        reaper = new StaleTaskReaper(orchestrator, time, Duration.ofMinutes(10));
    }

    @AfterEach
    void tearDown() {
        reaper.stop();
        orchestrator.shutdown();
    }

    private UUID enqueueStep(int maxRetries) {
        return orchestrator.enqueue(TaskSubmission.builder()
            .type(TaskType.WORKFLOW_STEP)
            .priority(1)
            .maxRetries(maxRetries)
            .build());
    }

    private Task claimAs(String workerId) {
        orchestrator.registerWorker(workerId, CAPS);
        return orchestrator.claim(workerId).orElseThrow();
    }

    @Test
    @DisplayName("A task held by an unregistered worker is rescheduled with WORKER_LOST")
    void testReapsTaskOfUnregisteredWorker() {
        UUID taskId = enqueueStep(3);
        claimAs("worker-1");
        orchestrator.unregisterWorker("worker-1");
        time.advance(HEARTBEAT_TIMEOUT.plusSeconds(1));

        List<Task> reaped = reaper.reapOnce();

        assertThat(reaped).extracting(Task::taskId).containsExactly(taskId);
        Task task = orchestrator.getTask(taskId);
        assertThat(task.status()).isEqualTo(TaskStatus.PENDING);
        assertThat(task.retryCount()).isEqualTo(1);
        assertThat(task.assignedWorkerId()).isNull();
        assertThat(task.lastError().code()).isEqualTo(TaskError.WORKER_LOST);
    }

    @Test
    @DisplayName("A task is left alone until the heartbeat timeout has passed since its claim")
    void testGracePeriod() {
        UUID taskId = enqueueStep(3);
        claimAs("worker-1");
        orchestrator.unregisterWorker("worker-1");
        time.advance(HEARTBEAT_TIMEOUT.minusSeconds(1));

        assertThat(reaper.reapOnce()).isEmpty();
        assertThat(orchestrator.getTask(taskId).status()).isEqualTo(TaskStatus.RUNNING);
    }

    @Test
    @DisplayName("A worker that keeps heartbeating keeps its task")
    void testLiveWorkerKeepsTask() {
        UUID taskId = enqueueStep(3);
        claimAs("worker-1");

        time.advance(Duration.ofSeconds(20));
        orchestrator.heartbeat("worker-1");
        time.advance(Duration.ofSeconds(20));

        assertThat(reaper.reapOnce()).isEmpty();
        assertThat(orchestrator.getTask(taskId).status()).isEqualTo(TaskStatus.RUNNING);
    }

    @Test
    @DisplayName("A registered worker that stopped heartbeating loses its task and its slot")
    void testStaleWorkerLosesTask() {
        UUID taskId = enqueueStep(3);
        claimAs("worker-1");
        time.advance(HEARTBEAT_TIMEOUT.plusSeconds(1));

        assertThat(reaper.reapOnce()).extracting(Task::taskId).containsExactly(taskId);
        assertThat(orchestrator.getWorker("worker-1").currentTaskIds()).isEmpty();
    }

    @Test
    @DisplayName("A reaped task on its last attempt fails permanently")
    void testLastAttemptFails() {
        UUID taskId = enqueueStep(0);
        claimAs("worker-1");
        orchestrator.unregisterWorker("worker-1");
        time.advance(HEARTBEAT_TIMEOUT.plusSeconds(1));

        reaper.reapOnce();

        Task task = orchestrator.getTask(taskId);
        assertThat(task.status()).isEqualTo(TaskStatus.FAILED);
        assertThat(task.lastError().code()).isEqualTo(TaskError.WORKER_LOST);
    }

    @Test
    @DisplayName("Reaping does nothing once the orchestrator has stopped")
    void testNoReapingWhenStopped() {
        enqueueStep(3);
        claimAs("worker-1");
        time.advance(HEARTBEAT_TIMEOUT.plusSeconds(1));
        orchestrator.shutdown();

        assertThat(reaper.reapOnce()).isEmpty();
    }

    @Test
    @DisplayName("Start and stop toggle the periodic reaper")
    void testStartStop() {
        assertThat(reaper.isRunning()).isFalse();

        reaper.start();
        assertThat(reaper.isRunning()).isTrue();

        reaper.stop();
        assertThat(reaper.isRunning()).isFalse();
    }
}
