package com.pipeline.core.model;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

class TaskStatusTest {

    @Test
    void isTerminal_shouldIdentifyTerminalStates() {
        assertTrue(TaskStatus.COMPLETED.isTerminal());
        assertTrue(TaskStatus.FAILED.isTerminal());
        assertTrue(TaskStatus.CANCELLED.isTerminal());

        assertFalse(TaskStatus.PENDING.isTerminal());
        assertFalse(TaskStatus.PROCESSING.isTerminal());
    }

    @Test
    void blocksDependents_shouldOnlyHoldForFailedAndCancelled() {
        assertTrue(TaskStatus.FAILED.blocksDependents());
        assertTrue(TaskStatus.CANCELLED.blocksDependents());

        assertFalse(TaskStatus.COMPLETED.blocksDependents());
        assertFalse(TaskStatus.PENDING.blocksDependents());
        assertFalse(TaskStatus.PROCESSING.blocksDependents());
    }

    @Test
    void canTransitionTo_fromPending_shouldAllowProcessingOrCancelled() {
        assertTrue(TaskStatus.PENDING.canTransitionTo(TaskStatus.PROCESSING));
        assertTrue(TaskStatus.PENDING.canTransitionTo(TaskStatus.CANCELLED));

        assertFalse(TaskStatus.PENDING.canTransitionTo(TaskStatus.COMPLETED));
        assertFalse(TaskStatus.PENDING.canTransitionTo(TaskStatus.FAILED));
    }

    @Test
    void canTransitionTo_fromProcessing_shouldAllowOutcomes() {
        assertTrue(TaskStatus.PROCESSING.canTransitionTo(TaskStatus.COMPLETED));
        assertTrue(TaskStatus.PROCESSING.canTransitionTo(TaskStatus.FAILED));
        assertTrue(TaskStatus.PROCESSING.canTransitionTo(TaskStatus.CANCELLED));

        assertFalse(TaskStatus.PROCESSING.canTransitionTo(TaskStatus.PENDING));
    }

    @Test
    void canTransitionTo_fromFailed_shouldOnlyAllowRetry() {
        assertTrue(TaskStatus.FAILED.canTransitionTo(TaskStatus.PENDING));

        assertFalse(TaskStatus.FAILED.canTransitionTo(TaskStatus.PROCESSING));
        assertFalse(TaskStatus.FAILED.canTransitionTo(TaskStatus.COMPLETED));
    }

    @Test
    void canTransitionTo_fromCompletedOrCancelled_shouldAllowNothing() {
        for (TaskStatus target : TaskStatus.values()) {
            assertFalse(TaskStatus.COMPLETED.canTransitionTo(target));
            assertFalse(TaskStatus.CANCELLED.canTransitionTo(target));
        }
    }

    @Test
    void wireName_shouldBeLowercase() {
        assertEquals("pending", TaskStatus.PENDING.wireName());
        assertEquals("cancelled", TaskStatus.CANCELLED.toString());
    }
}
