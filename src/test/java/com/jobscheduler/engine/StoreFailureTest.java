package com.jobscheduler.engine;

import com.jobscheduler.core.AttemptOutcome;
import com.jobscheduler.core.ExecutionStatus;
import com.jobscheduler.core.InvalidScheduleException;
import com.jobscheduler.core.JobPriority;
import com.jobscheduler.core.JobStatus;
import com.jobscheduler.core.ScheduleType;
import com.jobscheduler.db.ExecutionRecord;
import com.jobscheduler.db.ExecutionRepository;
import com.jobscheduler.db.JobRecord;
import com.jobscheduler.db.JobRepository;
import com.jobscheduler.testing.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Store outages must be survived: the engine backs off and keeps polling, and
 * an attempt whose outcome cannot be written still gives its lock back. An
 * attempt that lost its lock writes nothing at all.
 */
@ExtendWith(MockitoExtension.class)
class StoreFailureTest {
    private static final Instant T0 = Instant.parse("2024-01-15T10:00:00Z");
    private static final String WORKER = "worker-1";

    @Mock
    private JobRepository jobs;
    @Mock
    private ExecutionRepository executions;

    private HandlerRegistry registry;
    private MutableClock clock;
    private ExecutionEngine engine;

    @BeforeEach
    void setUp() {
        registry = new HandlerRegistry();
        clock = new MutableClock(T0);
        engine = new ExecutionEngine(WORKER, 2, Duration.ofMillis(20), Duration.ofSeconds(300),
                jobs, executions, registry, new NextRunCalculator(), clock);
    }

    @AfterEach
    void tearDown() {
        engine.stop();
        engine.shutdownRunners(Duration.ofSeconds(1));
    }

    @Test
    void pollPropagatesStoreErrorToTheLoop() throws Exception {
        SQLException outage = new SQLException("connection refused");
        when(jobs.selectDueUnlocked(anyInt(), any())).thenThrow(outage);

        SQLException thrown = assertThrows(SQLException.class, () -> engine.pollOnce());
        assertSame(outage, thrown);
    }

    @Test
    void loopKeepsPollingThroughOutage() throws Exception {
        when(jobs.selectDueUnlocked(anyInt(), any()))
                .thenThrow(new SQLException("connection refused"))
                .thenThrow(new SQLException("connection refused"))
                .thenReturn(Collections.emptyList());

        Thread loop = new Thread(engine, "test-engine");
        loop.start();
        try {
            verify(jobs, timeout(3000).atLeast(4)).selectDueUnlocked(anyInt(), any());
            assertTrue(loop.isAlive(), "Outage must not end the loop");
        } finally {
            engine.stop();
            loop.join(2000);
        }
        assertFalse(loop.isAlive());
        assertTrue(engine.getPasses() >= 2, "Passes after the outage complete normally");
    }

    @Test
    void claimedJobsStillRunWhenALaterClaimFails() throws Exception {
        when(jobs.selectDueUnlocked(anyInt(), any())).thenReturn(List.of(record("job_a"), record("job_b")));
        when(jobs.tryClaim(eq("job_a"), eq(WORKER), any(), any())).thenReturn(true);
        when(jobs.tryClaim(eq("job_b"), eq(WORKER), any(), any())).thenThrow(new SQLException("deadlock"));
        when(jobs.confirmPendingAndMarkRunning("job_a", WORKER, T0)).thenReturn(false);

        assertThrows(SQLException.class, () -> engine.pollOnce());

        verify(jobs).confirmPendingAndMarkRunning("job_a", WORKER, T0);
        verify(jobs).releaseLock("job_a", WORKER);
        assertEquals(1, engine.getAbandonedCount());
    }

    @Test
    void lockIsReleasedWhenOutcomeCannotBeWritten() throws Exception {
        registry.register("report", params -> "done");
        when(jobs.confirmPendingAndMarkRunning("job_a", WORKER, T0)).thenReturn(true);
        when(jobs.findById("job_a")).thenReturn(record("job_a"));
        when(jobs.complete("job_a", WORKER, "\"done\"", null, T0)).thenReturn(true);
        doThrow(new SQLException("disk full")).when(executions).insert(any(ExecutionRecord.class));

        AttemptOutcome outcome = attempt("job_a", new NextRunCalculator()).call();

        assertEquals(AttemptOutcome.Result.ABANDONED, outcome.getResult());
        verify(jobs).releaseLock("job_a", WORKER);
    }

    @Test
    void outcomeIsDroppedWhenAnotherWorkerTookTheJob() throws Exception {
        registry.register("report", params -> "done");
        when(jobs.confirmPendingAndMarkRunning("job_a", WORKER, T0)).thenReturn(true);
        when(jobs.findById("job_a")).thenReturn(record("job_a"));
        when(jobs.complete(anyString(), anyString(), any(), any(), any())).thenReturn(false);

        AttemptOutcome outcome = attempt("job_a", new NextRunCalculator()).call();

        assertEquals(AttemptOutcome.Result.ABANDONED, outcome.getResult());
        verify(executions, never()).insert(any(ExecutionRecord.class));
        verify(jobs, never()).failOrRetry(anyString(), anyString(), any(), any(), any(), any());
        verify(jobs).releaseLock("job_a", WORKER);
    }

    @Test
    void cronWithoutFurtherFiringIsAuditedAsFailed() throws Exception {
        NextRunCalculator calculator = mock(NextRunCalculator.class);
        JobRecord job = record("job_cron");
        job.setScheduleType(ScheduleType.CRON);
        job.setScheduleExpression("0 0 1 1 *");
        String error = "Cron expression '0 0 1 1 *' has no firing after " + T0;

        registry.register("report", params -> "done");
        when(jobs.confirmPendingAndMarkRunning("job_cron", WORKER, T0)).thenReturn(true);
        when(jobs.findById("job_cron")).thenReturn(job);
        when(calculator.nextRunAfter(ScheduleType.CRON, "0 0 1 1 *", T0))
                .thenThrow(new InvalidScheduleException(error));
        when(jobs.failOrRetry("job_cron", WORKER, error, null, JobStatus.FAILED, T0)).thenReturn(true);

        AttemptOutcome outcome = attempt("job_cron", calculator).call();

        assertEquals(AttemptOutcome.Result.FAILED, outcome.getResult());
        ArgumentCaptor<ExecutionRecord> written = ArgumentCaptor.forClass(ExecutionRecord.class);
        verify(executions).insert(written.capture());
        assertEquals(ExecutionStatus.FAILED, written.getValue().getStatus());
        assertEquals(error, written.getValue().getErrorMessage());
        verify(jobs, never()).complete(anyString(), anyString(), any(), any(), any());
    }

    @Test
    void lockRefreshFailureSurfacesToItsLoop() throws Exception {
        when(jobs.refreshLock(eq(WORKER), any())).thenThrow(new SQLException("timeout"));

        LockMaintenanceLoop maintenance = new LockMaintenanceLoop(WORKER, Duration.ofSeconds(10),
                Duration.ofSeconds(300), jobs, clock);

        assertThrows(SQLException.class, maintenance::refresh);
    }

    private JobAttempt attempt(String jobId, NextRunCalculator calculator) {
        return new JobAttempt(jobId, WORKER, jobs, executions, registry, calculator, clock);
    }

    private static JobRecord record(String jobId) {
        JobRecord job = new JobRecord();
        job.setJobId(jobId);
        job.setJobType("report");
        job.setParameters(Map.of());
        job.setPriority(JobPriority.NORMAL);
        job.setScheduleType(ScheduleType.ONCE);
        job.setNextRunAt(T0);
        job.setStatus(JobStatus.RUNNING);
        job.setCurrentAttempt(1);
        job.setMaxRetries(3);
        job.setRetryDelaySeconds(60);
        job.setLockedBy(WORKER);
        job.setCreatedAt(T0);
        return job;
    }
}
