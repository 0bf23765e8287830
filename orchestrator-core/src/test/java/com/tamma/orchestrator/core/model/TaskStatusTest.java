package com.tamma.orchestrator.core.model;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

class TaskStatusTest {

    @Test
    void isTerminal_shouldIdentifyTerminalStates() {
        assertTrue(TaskStatus.COMPLETED.isTerminal());
        assertTrue(TaskStatus.FAILED.isTerminal());
        assertTrue(TaskStatus.CANCELLED.isTerminal());
        
        assertFalse(TaskStatus.PENDING.isTerminal());
        assertFalse(TaskStatus.RUNNING.isTerminal());
    }

    @Test
    void canTransitionTo_fromPending_shouldAllowClaimOrCancel() {
        assertTrue(TaskStatus.PENDING.canTransitionTo(TaskStatus.RUNNING));
        assertTrue(TaskStatus.PENDING.canTransitionTo(TaskStatus.CANCELLED));
        
        assertFalse(TaskStatus.PENDING.canTransitionTo(TaskStatus.COMPLETED));
        assertFalse(TaskStatus.PENDING.canTransitionTo(TaskStatus.FAILED));
    }

    @Test
    void canTransitionTo_fromRunning_shouldAllowEveryOutcomeAndRetry() {
        assertTrue(TaskStatus.RUNNING.canTransitionTo(TaskStatus.COMPLETED));
        assertTrue(TaskStatus.RUNNING.canTransitionTo(TaskStatus.FAILED));
        assertTrue(TaskStatus.RUNNING.canTransitionTo(TaskStatus.CANCELLED));
        assertTrue(TaskStatus.RUNNING.canTransitionTo(TaskStatus.PENDING));
    }

    @Test
    void canTransitionTo_fromTerminalStates_shouldNotAllowAny() {
        for (TaskStatus target : TaskStatus.values()) {
            assertFalse(TaskStatus.COMPLETED.canTransitionTo(target));
            assertFalse(TaskStatus.FAILED.canTransitionTo(target));
            assertFalse(TaskStatus.CANCELLED.canTransitionTo(target));
        }
    }
}
