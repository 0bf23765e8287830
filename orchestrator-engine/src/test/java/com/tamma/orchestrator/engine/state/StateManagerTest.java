package com.tamma.orchestrator.engine.state;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.tamma.orchestrator.core.audit.AuditEventType;
import com.tamma.orchestrator.core.exception.InvalidStateException;
import com.tamma.orchestrator.core.exception.NotFoundException;
import com.tamma.orchestrator.core.exception.ValidationException;
import com.tamma.orchestrator.core.model.*;
import com.tamma.orchestrator.engine.support.EngineFixture;
import org.junit.jupiter.api.*;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for workflow state updates, history and replay.
 */
public class StateManagerTest {

    private EngineFixture fixture;
    private StateManager manager;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture();
        manager = fixture.stateManager;
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private UUID create() {
        ObjectNode context = JsonNodeFactory.instance.objectNode().put("branch", "feature/42");
        return manager.createWorkflowState(WorkflowStateDraft.builder()
            .issueRef("issue-42")
            .repositoryRef("tamma/core")
            .context(context)
            .build());
    }

    @Test
    @DisplayName("New workflow starts PENDING at version 0 with no history")
    void testCreate() {
        UUID workflowId = create();
        WorkflowState state = manager.getWorkflowState(workflowId);

        assertThat(state.status()).isEqualTo(WorkflowStatus.PENDING);
        assertThat(state.version()).isZero();
        assertThat(state.createdAt()).isEqualTo(fixture.time.now());
        assertThat(state.context().get("branch").asText()).isEqualTo("feature/42");
        assertThat(manager.getWorkflowHistory(workflowId)).isEmpty();
        assertThat(fixture.auditSink.eventsOfType(AuditEventType.WORKFLOW_CREATED)).hasSize(1);
    }

    @Test
    @DisplayName("Create rejects a negative step or a non-object context")
    void testCreateValidation() {
        assertThatThrownBy(() -> manager.createWorkflowState(WorkflowStateDraft.builder().initialStep(-1).build()))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> manager.createWorkflowState(WorkflowStateDraft.builder()
                .context(TextNode.valueOf("not an object")).build()))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("Every update bumps version, updatedAt and appends exactly one history entry")
    void testHistoryCompleteness() {
        UUID workflowId = create();

        fixture.time.advanceSeconds(1);
        manager.updateWorkflowState(workflowId, WorkflowStateUpdate.status(WorkflowStatus.RUNNING));
        fixture.time.advanceSeconds(1);
        manager.updateWorkflowState(workflowId, WorkflowStateUpdate.builder()
            .currentStep(3)
            .contextEntry("pr", TextNode.valueOf("#7"))
            .build());
        fixture.time.advanceSeconds(1);
        WorkflowState done = manager.updateWorkflowState(workflowId, WorkflowStateUpdate.status(WorkflowStatus.COMPLETED));

        assertThat(done.version()).isEqualTo(3);
        assertThat(done.updatedAt()).isEqualTo(fixture.time.now());
        assertThat(done.startedAt()).isNotNull();
        assertThat(done.completedAt()).isEqualTo(fixture.time.now());
        assertThat(done.context().get("branch").asText()).isEqualTo("feature/42");
        assertThat(done.context().get("pr").asText()).isEqualTo("#7");

        List<WorkflowStateHistoryEntry> history = manager.getWorkflowHistory(workflowId);
        assertThat(history).extracting(WorkflowStateHistoryEntry::sequence).containsExactly(1L, 2L, 3L);
        assertThat(history.get(0).changedFields()).containsExactly("status", "startedAt");
        assertThat(history.get(1).changedFields()).containsExactly("currentStep", "context");
        assertThat(history.get(1).previousValues().get("currentStep").asInt()).isZero();
        assertThat(history.get(1).newValues().get("currentStep").asInt()).isEqualTo(3);
        assertThat(history.get(2).changedFields()).containsExactly("status", "completedAt");
        assertThat(fixture.auditSink.eventsOfType(AuditEventType.WORKFLOW_UPDATED)).hasSize(3);
    }

    @Test
    @DisplayName("Replaying history reconstructs the current state and rewinding restores the initial one")
    void testReplayAndRewind() {
        UUID workflowId = create();
        WorkflowState initial = manager.getWorkflowState(workflowId);

        fixture.time.advanceSeconds(1);
        manager.updateWorkflowState(workflowId, WorkflowStateUpdate.status(WorkflowStatus.RUNNING));
        fixture.time.advanceSeconds(1);
        manager.updateWorkflowState(workflowId, WorkflowStateUpdate.builder()
            .currentStep(2)
            .metadata(new WorkflowMetadata(5, List.of("backend"), "alice"))
            .build());
        fixture.time.advanceSeconds(1);
        manager.updateWorkflowState(workflowId, WorkflowStateUpdate.status(WorkflowStatus.PAUSED));
        fixture.time.advanceSeconds(1);
        manager.updateWorkflowState(workflowId, WorkflowStateUpdate.builder()
            .status(WorkflowStatus.RUNNING)
            .context(JsonNodeFactory.instance.objectNode().put("replaced", true))
            .build());

        WorkflowState current = manager.getWorkflowState(workflowId);
        List<WorkflowStateHistoryEntry> history = manager.getWorkflowHistory(workflowId);

        assertThat(WorkflowStateFields.replay(initial, history)).isEqualTo(current);
        assertThat(WorkflowStateFields.rewind(current, history)).isEqualTo(initial);
    }

    @Test
    @DisplayName("Illegal status transitions are rejected without writing")
    void testIllegalTransition() {
        UUID workflowId = create();

        assertThatThrownBy(() -> manager.updateWorkflowState(workflowId, WorkflowStateUpdate.status(WorkflowStatus.COMPLETED)))
            .isInstanceOf(InvalidStateException.class);
        assertThatThrownBy(() -> manager.updateWorkflowState(workflowId, WorkflowStateUpdate.status(WorkflowStatus.ARCHIVED)))
            .isInstanceOf(InvalidStateException.class);

        assertThat(manager.getWorkflowState(workflowId).version()).isZero();
        assertThat(manager.getWorkflowHistory(workflowId)).isEmpty();
    }

    @Test
    @DisplayName("currentStep never moves backwards")
    void testStepMonotonic() {
        UUID workflowId = create();
        manager.updateWorkflowState(workflowId, WorkflowStateUpdate.builder().currentStep(4).build());

        assertThatThrownBy(() -> manager.updateWorkflowState(workflowId, WorkflowStateUpdate.builder().currentStep(3).build()))
            .isInstanceOf(ValidationException.class);
        assertThat(manager.getWorkflowState(workflowId).currentStep()).isEqualTo(4);
    }

    @Test
    @DisplayName("Replacing and merging context in one update is rejected")
    void testContextConflict() {
        UUID workflowId = create();

        assertThatThrownBy(() -> manager.updateWorkflowState(workflowId, WorkflowStateUpdate.builder()
                .context(JsonNodeFactory.instance.objectNode())
                .contextEntry("a", TextNode.valueOf("b"))
                .build()))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("Archive is idempotent and archived workflows accept no updates")
    void testArchive() {
        UUID workflowId = create();

        WorkflowState archived = manager.archiveWorkflowState(workflowId);
        WorkflowState again = manager.archiveWorkflowState(workflowId);

        assertThat(archived.status()).isEqualTo(WorkflowStatus.ARCHIVED);
        assertThat(again.version()).isEqualTo(archived.version());
        assertThat(manager.getWorkflowHistory(workflowId)).hasSize(1);
        assertThatThrownBy(() -> manager.updateWorkflowState(workflowId, WorkflowStateUpdate.status(WorkflowStatus.RUNNING)))
            .isInstanceOf(InvalidStateException.class);
    }

    @Test
    @DisplayName("Delete removes the state but keeps its history")
    void testDeleteKeepsHistory() {
        UUID workflowId = create();
        manager.updateWorkflowState(workflowId, WorkflowStateUpdate.status(WorkflowStatus.RUNNING));

        manager.deleteWorkflowState(workflowId);

        assertThatThrownBy(() -> manager.getWorkflowState(workflowId)).isInstanceOf(NotFoundException.class);
        assertThat(manager.getWorkflowHistory(workflowId)).hasSize(1);
        assertThatThrownBy(() -> manager.deleteWorkflowState(workflowId)).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> manager.getWorkflowHistory(UUID.randomUUID())).isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("Listing and counting by status")
    void testListAndCount() {
        UUID running = create();
        create();
        manager.updateWorkflowState(running, WorkflowStateUpdate.status(WorkflowStatus.RUNNING));

        assertThat(manager.listWorkflowStates(WorkflowFilter.byStatus(WorkflowStatus.RUNNING)))
            .extracting(WorkflowState::workflowId)
            .containsExactly(running);
        assertThat(manager.listWorkflowStates(WorkflowFilter.byRepository("tamma/core"))).hasSize(2);
        assertThat(manager.countByStatus())
            .containsEntry(WorkflowStatus.PENDING, 1L)
            .containsEntry(WorkflowStatus.RUNNING, 1L)
            .containsEntry(WorkflowStatus.ARCHIVED, 0L);
    }
}
