package io.hermes.spec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class TaskStateTest {

    @Test
    public void testTerminalStatesAllowNoTransition() {
        for (TaskState terminal : new TaskState[]{TaskState.COMPLETED, TaskState.FAILED, TaskState.CANCELLED}) {
            assertTrue(terminal.isFinal());
            for (TaskState target : TaskState.values()) {
                assertFalse(terminal.canTransitionTo(target), terminal + " -> " + target);
            }
        }
    }

    @Test
    public void testCompletionOnlyFromRunning() {
        assertFalse(TaskState.CREATED.canTransitionTo(TaskState.COMPLETED));
        assertFalse(TaskState.ASSIGNED.canTransitionTo(TaskState.COMPLETED));
        assertTrue(TaskState.RUNNING.canTransitionTo(TaskState.COMPLETED));
    }

    @Test
    public void testReassignmentAllowedBeforeStart() {
        assertTrue(TaskState.CREATED.canTransitionTo(TaskState.ASSIGNED));
        assertTrue(TaskState.ASSIGNED.canTransitionTo(TaskState.ASSIGNED));
        assertFalse(TaskState.RUNNING.canTransitionTo(TaskState.ASSIGNED));
    }

    @Test
    public void testFailAndCancelFromAnyNonTerminalState() {
        for (TaskState state : TaskState.values()) {
            if (!state.isFinal()) {
                assertTrue(state.canTransitionTo(TaskState.FAILED));
                assertTrue(state.canTransitionTo(TaskState.CANCELLED));
            }
        }
    }

    @Test
    public void testWireValues() {
        assertEquals("running", TaskState.RUNNING.value());
        assertEquals(TaskState.CANCELLED, TaskState.fromValue("cancelled"));
        assertThrows(IllegalArgumentException.class, () -> TaskState.fromValue("working"));
    }
}
