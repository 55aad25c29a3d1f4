package com.agentscheduler.core.model;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

class TaskStatusTest {

    @Test
    void isTerminal_shouldIdentifyTerminalStates() {
        assertTrue(TaskStatus.COMPLETED.isTerminal());
        assertTrue(TaskStatus.FAILED.isTerminal());
        assertTrue(TaskStatus.CANCELED.isTerminal());

        assertFalse(TaskStatus.QUEUED.isTerminal());
        assertFalse(TaskStatus.RUNNING.isTerminal());
        assertFalse(TaskStatus.BLOCKED.isTerminal());
    }

    @Test
    void canTransitionTo_fromQueued_shouldAllowRunningFailedCanceled() {
        assertTrue(TaskStatus.QUEUED.canTransitionTo(TaskStatus.RUNNING));
        assertTrue(TaskStatus.QUEUED.canTransitionTo(TaskStatus.FAILED));
        assertTrue(TaskStatus.QUEUED.canTransitionTo(TaskStatus.CANCELED));

        assertFalse(TaskStatus.QUEUED.canTransitionTo(TaskStatus.BLOCKED));
        assertFalse(TaskStatus.QUEUED.canTransitionTo(TaskStatus.COMPLETED));
    }

    @Test
    void canTransitionTo_fromRunning_shouldAllowProgressAndOutcomes() {
        assertTrue(TaskStatus.RUNNING.canTransitionTo(TaskStatus.RUNNING));
        assertTrue(TaskStatus.RUNNING.canTransitionTo(TaskStatus.BLOCKED));
        assertTrue(TaskStatus.RUNNING.canTransitionTo(TaskStatus.COMPLETED));
        assertTrue(TaskStatus.RUNNING.canTransitionTo(TaskStatus.FAILED));
        assertTrue(TaskStatus.RUNNING.canTransitionTo(TaskStatus.CANCELED));

        assertFalse(TaskStatus.RUNNING.canTransitionTo(TaskStatus.QUEUED));
    }

    @Test
    void canTransitionTo_fromBlocked_shouldAllowResumeOrAbort() {
        assertTrue(TaskStatus.BLOCKED.canTransitionTo(TaskStatus.RUNNING));
        assertTrue(TaskStatus.BLOCKED.canTransitionTo(TaskStatus.FAILED));
        assertTrue(TaskStatus.BLOCKED.canTransitionTo(TaskStatus.CANCELED));

        assertFalse(TaskStatus.BLOCKED.canTransitionTo(TaskStatus.COMPLETED));
        assertFalse(TaskStatus.BLOCKED.canTransitionTo(TaskStatus.BLOCKED));
    }

    @Test
    void canTransitionTo_fromTerminal_shouldAllowNothing() {
        for (TaskStatus terminal : new TaskStatus[] {TaskStatus.COMPLETED, TaskStatus.FAILED, TaskStatus.CANCELED}) {
            for (TaskStatus target : TaskStatus.values()) {
                assertFalse(terminal.canTransitionTo(target), terminal + " -> " + target);
            }
        }
    }
}
