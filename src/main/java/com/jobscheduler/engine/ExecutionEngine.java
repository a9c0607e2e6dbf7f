package com.jobscheduler.engine;

import com.jobscheduler.core.AttemptOutcome;
import com.jobscheduler.db.ExecutionRepository;
import com.jobscheduler.db.JobRecord;
import com.jobscheduler.db.JobRepository;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The poll-claim-dispatch loop of one worker.
 *
 * <p><b>Poll cycle:</b></p>
 * <ol>
 *   <li>Fetch up to {@code 2 * maxConcurrentJobs} due, unlocked jobs, ordered by
 *       priority then due time. Extra candidates cover claim races lost to other workers.</li>
 *   <li>Claim candidates in order until {@code maxConcurrentJobs} are held. A lost
 *       race is expected and logged at FINE only.</li>
 *   <li>Run the claimed jobs concurrently on the handler pool and wait for the
 *       whole batch before polling again.</li>
 *   <li>When nothing was due or nothing could be claimed, sleep one poll interval.</li>
 * </ol>
 *
 * <p>Store errors are logged and the loop backs off one poll interval; they
 * never end the worker. Lock refresh and cleanup run in their own loops, so a
 * slow batch only delays new dispatches.</p>
 *
 * <p><b>Thread Safety:</b> the loop runs on one supervisor thread; attempts run
 * on a fixed pool of {@code maxConcurrentJobs} threads and share no mutable
 * state beyond the counters.</p>
 *
 * @see JobAttempt
 */
public class ExecutionEngine extends BackgroundLoop {
    private static final Logger logger = Logger.getLogger(ExecutionEngine.class.getName());

    private final String workerId;
    private final int maxConcurrentJobs;
    private final Duration lockTtl;
    private final JobRepository jobs;
    private final ExecutionRepository executions;
    private final HandlerRegistry registry;
    private final NextRunCalculator calculator;
    private final Clock clock;
    private final ExecutorService executorService;

    private final AtomicLong succeeded = new AtomicLong();
    private final AtomicLong retried = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong abandoned = new AtomicLong();

    public ExecutionEngine(String workerId, int maxConcurrentJobs, Duration pollInterval, Duration lockTtl,
                           JobRepository jobs, ExecutionRepository executions, HandlerRegistry registry,
                           NextRunCalculator calculator, Clock clock) {
        super("execution-engine", pollInterval);
        if (maxConcurrentJobs < 1) {
            throw new IllegalArgumentException("maxConcurrentJobs must be at least 1, got " + maxConcurrentJobs);
        }
        this.workerId = workerId;
        this.maxConcurrentJobs = maxConcurrentJobs;
        this.lockTtl = lockTtl;
        this.jobs = jobs;
        this.executions = executions;
        this.registry = registry;
        this.calculator = calculator;
        this.clock = clock;
        this.executorService = Executors.newFixedThreadPool(maxConcurrentJobs, new RunnerThreadFactory());

        logger.info("Execution engine for " + workerId + " initialized with " + maxConcurrentJobs + " runners");
    }

    @Override
    protected boolean runOnce() throws SQLException, InterruptedException {
        return pollOnce() > 0;
    }

    /**
     * Run one poll cycle and wait for every claimed job to finish.
     *
     * @return the number of jobs claimed in this cycle
     * @throws SQLException if the store could not be polled and nothing was claimed
     * @throws InterruptedException if interrupted while waiting for the batch
     */
    public int pollOnce() throws SQLException, InterruptedException {
        Instant now = clock.instant();
        List<JobRecord> candidates = jobs.selectDueUnlocked(maxConcurrentJobs * 2, now);
        if (candidates.isEmpty()) {
            return 0;
        }

        List<JobAttempt> batch = new ArrayList<>();
        SQLException claimError = null;

        for (JobRecord candidate : candidates) {
            if (batch.size() >= maxConcurrentJobs || isStopRequested()) {
                break;
            }
            try {
                if (jobs.tryClaim(candidate.getJobId(), workerId, lockTtl, now)) {
                    batch.add(new JobAttempt(candidate.getJobId(), workerId, jobs, executions,
                            registry, calculator, clock));
                } else {
                    logger.fine("Lost claim race for job " + candidate.getJobId());
                }
            } catch (SQLException e) {
                claimError = e;
                break;
            }
        }

        // Jobs already claimed still run; their locks would otherwise sit until expiry
        if (!batch.isEmpty()) {
            runBatch(batch);
        }
        if (claimError != null) {
            throw claimError;
        }
        return batch.size();
    }

    private void runBatch(List<JobAttempt> batch) throws InterruptedException {
        logger.fine("Dispatching " + batch.size() + " jobs");
        List<Future<AttemptOutcome>> futures = executorService.invokeAll(batch);

        for (int i = 0; i < futures.size(); i++) {
            Future<AttemptOutcome> future = futures.get(i);
            try {
                count(future.get());
            } catch (ExecutionException e) {
                abandoned.incrementAndGet();
                logger.log(Level.SEVERE, "Attempt of job " + batch.get(i).getJobId() + " crashed", e.getCause());
            }
        }
    }

    private void count(AttemptOutcome outcome) {
        switch (outcome.getResult()) {
            case SUCCEEDED -> succeeded.incrementAndGet();
            case RETRY_SCHEDULED -> retried.incrementAndGet();
            case FAILED -> failed.incrementAndGet();
            case ABANDONED -> abandoned.incrementAndGet();
        }
    }

    /**
     * Stop the handler pool: wait for running attempts, then interrupt them.
     * Call after the loop itself has been stopped.
     */
    public void shutdownRunners(Duration timeout) {
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                logger.warning("Running jobs did not finish within " + timeout + ", interrupting");
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public String getWorkerId() {
        return workerId;
    }

    public long getSucceededCount() {
        return succeeded.get();
    }

    public long getRetriedCount() {
        return retried.get();
    }

    public long getFailedCount() {
        return failed.get();
    }

    public long getAbandonedCount() {
        return abandoned.get();
    }

    private static final class RunnerThreadFactory implements ThreadFactory {
        private final AtomicInteger sequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "job-runner-" + sequence.incrementAndGet());
            thread.setDaemon(false);
            return thread;
        }
    }
}
