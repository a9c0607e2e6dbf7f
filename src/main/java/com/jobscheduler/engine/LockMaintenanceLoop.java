package com.jobscheduler.engine;

import com.jobscheduler.db.JobRepository;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.util.logging.Logger;

/**
 * Extends the locks of every RUNNING job this worker owns, once per refresh
 * interval, to {@code now + lockTtl}. A handler may legitimately outlive one
 * TTL window; without the refresh the cleanup loop would hand its job to
 * another worker while it is still running.
 */
public class LockMaintenanceLoop extends BackgroundLoop {
    private static final Logger logger = Logger.getLogger(LockMaintenanceLoop.class.getName());

    private final String workerId;
    private final Duration lockTtl;
    private final JobRepository jobs;
    private final Clock clock;

    public LockMaintenanceLoop(String workerId, Duration refreshInterval, Duration lockTtl,
                               JobRepository jobs, Clock clock) {
        super("lock-maintenance", refreshInterval);
        this.workerId = workerId;
        this.lockTtl = lockTtl;
        this.jobs = jobs;
        this.clock = clock;
    }

    @Override
    protected boolean runOnce() throws SQLException {
        refresh();
        return false;
    }

    /**
     * @return the number of locks extended
     */
    public int refresh() throws SQLException {
        int refreshed = jobs.refreshLock(workerId, clock.instant().plus(lockTtl));
        if (refreshed > 0) {
            logger.fine("Refreshed " + refreshed + " locks held by " + workerId);
        }
        return refreshed;
    }
}
