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
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for restart recovery of running workflows.
 */
public class WorkflowRecoveryServiceTest {

    private TimeController time;
    private InMemoryDurableStore store;
    private Orchestrator orchestrator;

    @BeforeEach
    void setUp() {
        time = TimeController.frozen();
        store = new InMemoryDurableStore();
    }

    @AfterEach
    void tearDown() {
        if (orchestrator != null) {
            orchestrator.shutdown();
        }
    }

    private Orchestrator startOrchestrator(WorkflowRecoveryService recovery) {
        Orchestrator.Builder builder = Orchestrator.builder()
            .store(store)
            .auditSink(new InMemoryAuditEventSink())
            .clock(time)
            .settings(OrchestratorSettings.builder().drainTimeout(Duration.ZERO).build());
        if (recovery != null) {
            builder.startupHook(recovery);
        }
        Orchestrator started = builder.build();
        started.start();
        return started;
    }

    private UUID runningWorkflow(Orchestrator target, int step, Integer priority) {
        UUID workflowId = target.createWorkflow(WorkflowStateDraft.builder()
            .issueRef("issue-" + step)
            .repositoryRef("acme/widgets")
            .metadata(new WorkflowMetadata(priority, List.of(), null))
            .build());
        return target.updateWorkflow(workflowId, WorkflowStateUpdate.builder()
            .status(WorkflowStatus.RUNNING)
            .currentStep(step)
            .build()).workflowId();
    }

    /**
     * Simulate a crash: the first process leaves state behind and stops.
     */
    private void restart() {
        orchestrator.shutdown();
        orchestrator = null;
    }

    @Test
    @DisplayName("A running workflow without live work has its current step requeued")
    void testRequeueOrphanedWorkflow() {
        orchestrator = startOrchestrator(null);
        UUID workflowId = runningWorkflow(orchestrator, 3, 7);
        restart();

        WorkflowRecoveryService recovery = new WorkflowRecoveryService(RecoveryMode.REQUEUE);
        orchestrator = startOrchestrator(recovery);

        RecoveryReport report = recovery.getLastReport();
        assertThat(report.requeued()).containsExactly(workflowId);
        assertThat(report.resumed()).isEmpty();

        List<Task> tasks = orchestrator.listTasks(TaskFilter.byWorkflow(workflowId));
        assertThat(tasks).hasSize(1);
        Task task = tasks.get(0);
        assertThat(task.type()).isEqualTo(TaskType.WORKFLOW_STEP);
        assertThat(task.status()).isEqualTo(TaskStatus.PENDING);
        assertThat(task.priority()).isEqualTo(7);
        assertThat(task.metadata().stepNumber()).isEqualTo(3);
        assertThat(task.payload().get("recovered").asBoolean()).isTrue();
        assertThat(orchestrator.getWorkflow(workflowId).status()).isEqualTo(WorkflowStatus.RUNNING);
    }

    @Test
    @DisplayName("A running workflow with a pending task is resumed as is")
    void testResumeWorkflowWithLiveTask() {
        orchestrator = startOrchestrator(null);
        UUID workflowId = runningWorkflow(orchestrator, 1, null);
        orchestrator.enqueue(TaskSubmission.builder()
            .type(TaskType.WORKFLOW_STEP)
            .priority(1)
            .metadata(TaskMetadata.forWorkflowStep(workflowId, 1))
            .build());
        restart();

        WorkflowRecoveryService recovery = new WorkflowRecoveryService(RecoveryMode.REQUEUE);
        orchestrator = startOrchestrator(recovery);

        assertThat(recovery.getLastReport().resumed()).containsExactly(workflowId);
        assertThat(orchestrator.listTasks(TaskFilter.byWorkflow(workflowId))).hasSize(1);
    }

    @Test
    @DisplayName("FAIL mode marks orphaned workflows FAILED")
    void testFailMode() {
        orchestrator = startOrchestrator(null);
        UUID workflowId = runningWorkflow(orchestrator, 2, null);
        restart();

        WorkflowRecoveryService recovery = new WorkflowRecoveryService(RecoveryMode.FAIL);
        orchestrator = startOrchestrator(recovery);

        assertThat(recovery.getLastReport().failed()).containsExactly(workflowId);
        WorkflowState state = orchestrator.getWorkflow(workflowId);
        assertThat(state.status()).isEqualTo(WorkflowStatus.FAILED);
        assertThat(state.context().has("recoveryFailure")).isTrue();
        assertThat(orchestrator.listTasks(TaskFilter.byWorkflow(workflowId))).isEmpty();
    }

    @Test
    @DisplayName("Workflows that are not running are left untouched")
    void testIgnoresNonRunningWorkflows() {
        orchestrator = startOrchestrator(null);
        UUID pending = orchestrator.createWorkflow(WorkflowStateDraft.builder().issueRef("issue-9").build());
        UUID completed = runningWorkflow(orchestrator, 4, null);
        orchestrator.updateWorkflow(completed, WorkflowStateUpdate.status(WorkflowStatus.COMPLETED));
        restart();

        WorkflowRecoveryService recovery = new WorkflowRecoveryService(RecoveryMode.REQUEUE);
        orchestrator = startOrchestrator(recovery);

        assertThat(recovery.getLastReport().total()).isZero();
        assertThat(orchestrator.getWorkflow(pending).status()).isEqualTo(WorkflowStatus.PENDING);
        assertThat(orchestrator.listTasks(TaskFilter.all())).isEmpty();
    }

    @Test
    @DisplayName("Every running workflow is recovered, beyond a single listing page")
    void testRecoversBeyondDefaultListingLimit() {
        int workflows = WorkflowFilter.DEFAULT_LIMIT + 5;
        orchestrator = startOrchestrator(null);
        for (int i = 0; i < workflows; i++) {
            runningWorkflow(orchestrator, 1, null);
        }
        UUID withLiveTask = runningWorkflow(orchestrator, 2, null);
        for (int i = 0; i < TaskFilter.DEFAULT_LIMIT + 1; i++) {
            orchestrator.enqueue(TaskSubmission.builder()
                .type(TaskType.WORKFLOW_STEP)
                .priority(1)
                .metadata(TaskMetadata.forWorkflowStep(withLiveTask, 2))
                .build());
        }
        restart();

        WorkflowRecoveryService recovery = new WorkflowRecoveryService(RecoveryMode.REQUEUE);
        orchestrator = startOrchestrator(recovery);

        RecoveryReport report = recovery.getLastReport();
        assertThat(report.requeued()).hasSize(workflows).doesNotContain(withLiveTask);
        assertThat(report.resumed()).containsExactly(withLiveTask);
        assertThat(report.errors()).isEmpty();
        assertThat(orchestrator.stats().pending()).isEqualTo(workflows + TaskFilter.DEFAULT_LIMIT + 1);
    }

    @Test
    @DisplayName("Recovery can be run on demand against a running orchestrator")
    void testRecoverOnDemand() {
        orchestrator = startOrchestrator(null);
        UUID first = runningWorkflow(orchestrator, 1, null);
        UUID second = runningWorkflow(orchestrator, 5, null);

        RecoveryReport report = new WorkflowRecoveryService(RecoveryMode.REQUEUE).recover(orchestrator);

        assertThat(report.requeued()).containsExactlyInAnyOrder(first, second);
        assertThat(orchestrator.stats().pending()).isEqualTo(2);
    }
}
