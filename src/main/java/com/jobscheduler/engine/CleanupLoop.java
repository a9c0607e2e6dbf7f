package com.jobscheduler.engine;

import com.jobscheduler.db.ExecutionRepository;
import com.jobscheduler.db.JobRepository;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.logging.Logger;

/**
 * Coarse-grained housekeeping: reclaims jobs whose lock expired without a
 * refresh (the owner crashed or was partitioned) and purges execution rows
 * older than the retention window. Both steps are idempotent, and a failure
 * in one does not skip the other.
 */
public class CleanupLoop extends BackgroundLoop {
    private static final Logger logger = Logger.getLogger(CleanupLoop.class.getName());

    private final Duration retention;
    private final JobRepository jobs;
    private final ExecutionRepository executions;
    private final Clock clock;

    public CleanupLoop(Duration cleanupInterval, Duration retention, JobRepository jobs,
                       ExecutionRepository executions, Clock clock) {
        super("cleanup", cleanupInterval);
        this.retention = retention;
        this.jobs = jobs;
        this.executions = executions;
        this.clock = clock;
    }

    @Override
    protected boolean runOnce() throws SQLException {
        cleanup();
        return false;
    }

    /**
     * Run both housekeeping steps against the current time.
     *
     * @throws SQLException the first store error, with any later one suppressed
     */
    public void cleanup() throws SQLException {
        Instant now = clock.instant();
        SQLException failure = null;

        try {
            int reclaimed = jobs.reclaimExpired(now);
            if (reclaimed > 0) {
                logger.warning("Reclaimed " + reclaimed + " jobs with expired locks");
            }
        } catch (SQLException e) {
            failure = e;
        }

        try {
            int purged = executions.purgeOlderThan(now.minus(retention));
            if (purged > 0) {
                logger.info("Purged " + purged + " executions older than " + retention.toDays() + " days");
            }
        } catch (SQLException e) {
            if (failure == null) {
                failure = e;
            } else {
                failure.addSuppressed(e);
            }
        }

        if (failure != null) {
            throw failure;
        }
    }
}
