package com.jobscheduler.api;

import com.jobscheduler.config.SchedulerConfig;
import com.jobscheduler.core.JobStatus;
import com.jobscheduler.db.Database;
import com.jobscheduler.db.ExecutionRepository;
import com.jobscheduler.db.JobRepository;
import com.jobscheduler.engine.BackgroundLoop;
import com.jobscheduler.engine.CleanupLoop;
import com.jobscheduler.engine.ExecutionEngine;
import com.jobscheduler.engine.HandlerRegistry;
import com.jobscheduler.engine.LockMaintenanceLoop;
import com.jobscheduler.engine.LoopSupervisor;
import com.jobscheduler.engine.NextRunCalculator;
import org.json.JSONObject;

import java.sql.SQLException;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One worker: the handler registry, the scheduler API and the three
 * supervised loops (execution engine, lock maintenance, cleanup) over a
 * shared store.
 *
 * <p><b>Lifecycle:</b></p>
 * <ol>
 *   <li>Construct with an initialized {@link Database}</li>
 *   <li>Register handlers on {@link #getRegistry()}</li>
 *   <li>{@link #start()} starts the loops; jobs may be scheduled before or after</li>
 *   <li>{@link #stop()} stops the loops, waits for running jobs up to the
 *       shutdown timeout and releases every lock this worker still holds</li>
 * </ol>
 *
 * <p>The database is owned by the caller and is not closed by {@link #stop()}.</p>
 */
public class PersistentJobService {
    private static final Logger logger = Logger.getLogger(PersistentJobService.class.getName());

    private final SchedulerConfig config;
    private final JobRepository jobs;
    private final HandlerRegistry registry;
    private final JobScheduler scheduler;
    private final ExecutionEngine engine;
    private final LockMaintenanceLoop lockMaintenance;
    private final CleanupLoop cleanup;
    private final LoopSupervisor supervisor;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile boolean stopped = false;

    public PersistentJobService(SchedulerConfig config, Database database) {
        this(config, database, Clock.systemUTC());
    }

    public PersistentJobService(SchedulerConfig config, Database database, Clock clock) {
        this.config = config;
        this.jobs = new JobRepository(database);
        ExecutionRepository executions = new ExecutionRepository(database);
        NextRunCalculator calculator = new NextRunCalculator();
        String workerId = config.getWorkerId();

        this.registry = new HandlerRegistry();
        this.scheduler = new JobScheduler(jobs, executions, calculator, workerId, clock);
        this.engine = new ExecutionEngine(workerId, config.getMaxConcurrentJobs(), config.getPollInterval(),
                config.getLockTtl(), jobs, executions, registry, calculator, clock);
        this.lockMaintenance = new LockMaintenanceLoop(workerId, config.getLockRefreshInterval(),
                config.getLockTtl(), jobs, clock);
        this.cleanup = new CleanupLoop(config.getCleanupInterval(), config.getExecutionRetention(),
                jobs, executions, clock);

        List<BackgroundLoop> loops = List.of(engine, lockMaintenance, cleanup);
        this.supervisor = new LoopSupervisor(loops, config.getPollInterval());
    }

    /**
     * Start the three loops. Calling it twice is a no-op.
     *
     * @throws IllegalStateException if the service was already stopped; build a new one instead
     */
    public void start() {
        if (stopped) {
            throw new IllegalStateException("Job service " + config.getWorkerId() + " cannot be restarted");
        }
        if (!running.compareAndSet(false, true)) {
            logger.warning("Job service " + config.getWorkerId() + " is already running");
            return;
        }
        logger.info("Starting job service " + config);
        supervisor.start();
    }

    /**
     * Graceful shutdown. Safe to call more than once.
     */
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        stopped = true;
        logger.info("Stopping job service " + config.getWorkerId());

        supervisor.stop(config.getShutdownTimeout());
        engine.shutdownRunners(config.getShutdownTimeout());

        // Lets other workers pick up our jobs now instead of after lock expiry
        try {
            int released = jobs.releaseAllLocks(config.getWorkerId());
            if (released > 0) {
                logger.info("Released " + released + " locks held by " + config.getWorkerId());
            }
        } catch (SQLException e) {
            logger.log(Level.WARNING, "Failed to release locks on shutdown; they will expire", e);
        }

        logger.info("Job service " + config.getWorkerId() + " stopped");
    }

    /**
     * Snapshot of this worker for dashboards: engine counters, loop restarts
     * and job counts per status.
     */
    public JSONObject getStatus() {
        JSONObject status = new JSONObject();
        status.put("worker_id", config.getWorkerId());
        status.put("running", running.get());
        status.put("registered_types", registry.registeredTypes());

        JSONObject attempts = new JSONObject();
        attempts.put("succeeded", engine.getSucceededCount());
        attempts.put("retry_scheduled", engine.getRetriedCount());
        attempts.put("failed", engine.getFailedCount());
        attempts.put("abandoned", engine.getAbandonedCount());
        status.put("attempts", attempts);

        JSONObject restarts = new JSONObject();
        for (BackgroundLoop loop : supervisor.getLoops()) {
            restarts.put(loop.getName(), supervisor.getRestartCount(loop.getName()));
        }
        status.put("loop_restarts", restarts);

        try {
            JSONObject jobsByStatus = new JSONObject();
            for (Map.Entry<JobStatus, Integer> entry : jobs.countByStatus().entrySet()) {
                jobsByStatus.put(entry.getKey().name(), entry.getValue());
            }
            status.put("jobs", jobsByStatus);
        } catch (SQLException e) {
            logger.log(Level.WARNING, "Job counts unavailable", e);
            status.put("jobs_error", e.getMessage());
        }

        return status;
    }

    public boolean isRunning() {
        return running.get();
    }

    public HandlerRegistry getRegistry() {
        return registry;
    }

    public JobScheduler getScheduler() {
        return scheduler;
    }

    public ExecutionEngine getEngine() {
        return engine;
    }

    public LockMaintenanceLoop getLockMaintenance() {
        return lockMaintenance;
    }

    public CleanupLoop getCleanup() {
        return cleanup;
    }

    public SchedulerConfig getConfig() {
        return config;
    }
}
