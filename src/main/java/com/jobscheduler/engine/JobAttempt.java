package com.jobscheduler.engine;

import com.jobscheduler.core.AttemptOutcome;
import com.jobscheduler.core.ExecutionStatus;
import com.jobscheduler.core.FailureCode;
import com.jobscheduler.core.InvalidScheduleException;
import com.jobscheduler.core.JobHandler;
import com.jobscheduler.core.JobStatus;
import com.jobscheduler.db.Columns;
import com.jobscheduler.db.ExecutionRecord;
import com.jobscheduler.db.ExecutionRepository;
import com.jobscheduler.db.JobRecord;
import com.jobscheduler.db.JobRepository;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One attempt of a job this worker has already claimed.
 *
 * <p><b>Execution Flow:</b></p>
 * <ol>
 *   <li>Confirm the claim and move the job to RUNNING; if another worker got
 *       there first the attempt is abandoned</li>
 *   <li>Look up the handler; an unregistered type fails the attempt with
 *       {@link FailureCode#HANDLER_NOT_FOUND}</li>
 *   <li>Invoke the handler with the stored parameters and await its result</li>
 *   <li>Success: complete a ONCE job or re-arm a recurring one with
 *       {@code current_attempt} reset to 0, then write an execution row</li>
 *   <li>Failure: schedule a retry after the fixed delay or mark the job FAILED
 *       once {@code current_attempt > max_retries}, then write an execution row</li>
 * </ol>
 *
 * <p>The job row is only written while this worker still holds the lock. If
 * the lock expired and another worker took the job over, the outcome is
 * dropped and the attempt counts as abandoned.</p>
 *
 * <p>The lock is released in a {@code finally} block whatever happened,
 * including a store error while the outcome was being written.</p>
 *
 * <p>Retry eligibility is attempt-count only. Every handler exception or
 * error is retried the same way, whatever its type.</p>
 */
public class JobAttempt implements Callable<AttemptOutcome> {
    private static final Logger logger = Logger.getLogger(JobAttempt.class.getName());

    private final String jobId;
    private final String workerId;
    private final JobRepository jobs;
    private final ExecutionRepository executions;
    private final HandlerRegistry registry;
    private final NextRunCalculator calculator;
    private final Clock clock;

    public JobAttempt(String jobId, String workerId, JobRepository jobs, ExecutionRepository executions,
                      HandlerRegistry registry, NextRunCalculator calculator, Clock clock) {
        this.jobId = jobId;
        this.workerId = workerId;
        this.jobs = jobs;
        this.executions = executions;
        this.registry = registry;
        this.calculator = calculator;
        this.clock = clock;
    }

    public String getJobId() {
        return jobId;
    }

    @Override
    public AttemptOutcome call() {
        try {
            return runClaimed();
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "Store error during attempt of job " + jobId, e);
            return AttemptOutcome.abandoned(jobId, "store error: " + e.getMessage());
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Unexpected error during attempt of job " + jobId, e);
            return AttemptOutcome.abandoned(jobId, "unexpected error: " + e);
        } finally {
            releaseLock();
        }
    }

    private AttemptOutcome runClaimed() throws SQLException {
        Instant startedAt = clock.instant();

        if (!jobs.confirmPendingAndMarkRunning(jobId, workerId, startedAt)) {
            // Another worker advanced the job between our claim and now
            logger.fine("Job " + jobId + " no longer pending for " + workerId + ", abandoning");
            return AttemptOutcome.abandoned(jobId, "job advanced by another worker");
        }

        JobRecord job = jobs.findById(jobId);
        if (job == null) {
            return AttemptOutcome.abandoned(jobId, "job disappeared after confirm");
        }

        logger.info("Running job " + jobId + " (" + job.getJobType() + ") attempt "
                + job.getCurrentAttempt() + "/" + (job.getMaxRetries() + 1));

        Optional<JobHandler> handler = registry.lookup(job.getJobType());
        if (handler.isEmpty()) {
            String error = FailureCode.HANDLER_NOT_FOUND.format(
                    "No handler registered for job type '" + job.getJobType() + "'");
            logger.warning("Job " + jobId + ": " + error);
            return recordFailure(job, startedAt, error, 0L);
        }

        long startNanos = System.nanoTime();
        Object value;
        try {
            value = handler.get().handle(job.getParameters());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return recordFailure(job, startedAt, handlerError(e), elapsedMs(startNanos));
        } catch (Exception e) {
            logger.log(Level.WARNING, "Handler for job " + jobId + " failed", e);
            return recordFailure(job, startedAt, handlerError(e), elapsedMs(startNanos));
        } catch (Error e) {
            logger.log(Level.SEVERE, "Handler for job " + jobId + " threw an error", e);
            AttemptOutcome outcome = recordFailure(job, startedAt, handlerError(e), elapsedMs(startNanos));
            if (e instanceof VirtualMachineError) {
                throw e;
            }
            return outcome;
        }

        return recordSuccess(job, startedAt, value, elapsedMs(startNanos));
    }

    private AttemptOutcome recordSuccess(JobRecord job, Instant startedAt, Object value, long durationMs)
            throws SQLException {
        Instant completedAt = clock.instant();
        String resultJson = Columns.resultToJson(value);

        Instant nextRunAt;
        try {
            nextRunAt = calculator.nextRunAfter(job.getScheduleType(), job.getScheduleExpression(), completedAt);
        } catch (InvalidScheduleException e) {
            // A cron that never fires again cannot be re-armed
            logger.log(Level.SEVERE, "Cannot re-arm job " + jobId, e);
            if (!jobs.failOrRetry(jobId, workerId, e.getMessage(), null, JobStatus.FAILED, completedAt)) {
                return lostOwnership();
            }
            executions.insert(execution(job, ExecutionStatus.FAILED, startedAt, completedAt, durationMs,
                    e.getMessage(), resultJson));
            return AttemptOutcome.failed(jobId, false, e.getMessage(), durationMs);
        }

        if (!jobs.complete(jobId, workerId, resultJson, nextRunAt, completedAt)) {
            return lostOwnership();
        }
        executions.insert(execution(job, ExecutionStatus.SUCCESS, startedAt, completedAt, durationMs,
                null, resultJson));

        if (nextRunAt == null) {
            logger.info("Job " + jobId + " completed in " + durationMs + "ms");
        } else {
            logger.info("Job " + jobId + " succeeded in " + durationMs + "ms, next run at " + nextRunAt);
        }
        return AttemptOutcome.succeeded(jobId, value, durationMs);
    }

    private AttemptOutcome recordFailure(JobRecord job, Instant startedAt, String error, long durationMs)
            throws SQLException {
        Instant failedAt = clock.instant();
        boolean exhausted = job.getCurrentAttempt() > job.getMaxRetries();
        Instant retryAt = exhausted ? null : failedAt.plusSeconds(job.getRetryDelaySeconds());

        if (!jobs.failOrRetry(jobId, workerId, error, retryAt,
                exhausted ? JobStatus.FAILED : JobStatus.PENDING, failedAt)) {
            return lostOwnership();
        }
        executions.insert(execution(job, exhausted ? ExecutionStatus.FAILED : ExecutionStatus.RETRY_SCHEDULED,
                startedAt, failedAt, durationMs, error, null));

        if (exhausted) {
            logger.warning("Job " + jobId + " failed after " + job.getCurrentAttempt() + " attempts: " + error);
        } else {
            logger.info("Job " + jobId + " will retry at " + retryAt + " (attempt "
                    + job.getCurrentAttempt() + "/" + (job.getMaxRetries() + 1) + ")");
        }
        return AttemptOutcome.failed(jobId, !exhausted, error, durationMs);
    }

    private AttemptOutcome lostOwnership() {
        // The lock expired mid-run and the job now belongs to someone else
        logger.warning("Job " + jobId + " was taken over while " + workerId + " ran it, outcome discarded");
        return AttemptOutcome.abandoned(jobId, "lock lost before the outcome was written");
    }

    private ExecutionRecord execution(JobRecord job, ExecutionStatus status, Instant startedAt, Instant completedAt,
                                      long durationMs, String error, String resultJson) {
        ExecutionRecord execution = new ExecutionRecord();
        execution.setExecutionId("exec_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12));
        execution.setJobId(jobId);
        execution.setAttemptNumber(job.getCurrentAttempt());
        execution.setWorkerId(workerId);
        execution.setStartedAt(startedAt);
        execution.setCompletedAt(completedAt);
        execution.setDurationMs(durationMs);
        execution.setStatus(status);
        execution.setErrorMessage(error);
        execution.setParametersUsed(job.getParameters());
        execution.setEnvironmentInfo(EnvironmentInfo.capture(workerId, completedAt));
        execution.setResult(resultJson);
        return execution;
    }

    private void releaseLock() {
        try {
            jobs.releaseLock(jobId, workerId);
        } catch (SQLException e) {
            // The lock will expire and be reclaimed by the cleanup loop
            logger.log(Level.SEVERE, "Failed to release lock on job " + jobId, e);
        }
    }

    private static String handlerError(Throwable e) {
        return FailureCode.HANDLER_ERROR.format(e.getClass().getSimpleName() + ": " + e.getMessage());
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
