package com.jobscheduler.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class JobStatusTest {

    @Test
    public void testTerminalStatesAreFinal() {
        for (JobStatus terminal : new JobStatus[]{JobStatus.COMPLETED, JobStatus.FAILED, JobStatus.CANCELLED}) {
            assertTrue(terminal.isTerminal());
            assertFalse(terminal.isCancellable());
            for (JobStatus target : JobStatus.values()) {
                assertFalse(terminal.canTransitionTo(target), terminal + " -> " + target);
            }
        }
    }

    @Test
    public void testAttemptLifecycle() {
        assertTrue(JobStatus.PENDING.canTransitionTo(JobStatus.RUNNING));
        assertTrue(JobStatus.PENDING.canTransitionTo(JobStatus.CANCELLED));
        assertFalse(JobStatus.PENDING.canTransitionTo(JobStatus.COMPLETED), "Must run before completing");

        assertTrue(JobStatus.RUNNING.canTransitionTo(JobStatus.COMPLETED));
        assertTrue(JobStatus.RUNNING.canTransitionTo(JobStatus.FAILED));
        assertTrue(JobStatus.RUNNING.canTransitionTo(JobStatus.PENDING), "Retry, re-arm and reclaim");
        assertFalse(JobStatus.RUNNING.canTransitionTo(JobStatus.CANCELLED), "Running jobs cannot be cancelled");
    }

    @Test
    public void testPriorityWeights() {
        assertEquals(JobPriority.URGENT, JobPriority.fromWeight(3));
        assertEquals(JobPriority.LOW, JobPriority.fromWeight(0));
        assertThrows(IllegalArgumentException.class, () -> JobPriority.fromWeight(7));
    }

    @Test
    public void testFailureCodePrefix() {
        assertEquals("[HANDLER_NOT_FOUND] no handler", FailureCode.HANDLER_NOT_FOUND.format("no handler"));
    }
}
