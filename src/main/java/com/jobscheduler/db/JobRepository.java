package com.jobscheduler.db;

import com.jobscheduler.core.DuplicateJobIdException;
import com.jobscheduler.core.JobPriority;
import com.jobscheduler.core.JobStatus;
import com.jobscheduler.core.ScheduleType;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Job store primitives over the {@code jobs} table.
 *
 * <p>Every ownership decision is a single conditional statement, so the
 * engine never needs a read followed by a separate write to know whether it
 * owns a job. {@link #tryClaim} is the only mutual-exclusion primitive;
 * {@link #confirmPendingAndMarkRunning} re-validates under a row lock before a
 * job becomes RUNNING.</p>
 *
 * <p>All methods use PreparedStatement and try-with-resources. Times are
 * passed in by the caller so that every worker decision is made against one
 * consistent {@code now}.</p>
 */
public class JobRepository {
    private static final Logger logger = Logger.getLogger(JobRepository.class.getName());

    private static final List<JobStatus> LIVE_STATUSES = statusesWhere(status -> !status.isTerminal());
    private static final List<JobStatus> CANCELLABLE_STATUSES = statusesWhere(JobStatus::isCancellable);

    private static final String SELECT_COLUMNS =
            "job_id, job_type, parameters, priority, schedule_type, schedule_expression, next_run_at, " +
            "status, current_attempt, max_retries, retry_delay_seconds, locked_by, locked_at, " +
            "lock_expires_at, result, error_message, job_group, created_by, created_at, started_at, " +
            "last_run_at, completed_at, failed_at";

    private final Database database;

    public JobRepository(Database database) {
        this.database = database;
    }

    /**
     * Insert a new job in PENDING state.
     *
     * @param job the job to insert; status, attempt and lock fields are ignored
     * @throws DuplicateJobIdException if the job id already exists
     * @throws SQLException if database operation fails
     */
    public void insertJob(JobRecord job) throws SQLException {
        String sql = "INSERT INTO jobs (job_id, job_type, parameters, priority, schedule_type, " +
                     "schedule_expression, next_run_at, status, current_attempt, max_retries, " +
                     "retry_delay_seconds, job_group, created_by, created_at) " +
                     "VALUES (?, ?, ?, ?, ?, ?, ?, ?, 0, ?, ?, ?, ?, ?)";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, job.getJobId());
            stmt.setString(2, job.getJobType());
            stmt.setString(3, Columns.toJson(job.getParameters()));
            stmt.setInt(4, job.getPriority().getWeight());
            stmt.setString(5, job.getScheduleType().name());
            stmt.setString(6, job.getScheduleExpression());
            stmt.setTimestamp(7, Columns.toTimestamp(job.getNextRunAt()));
            stmt.setString(8, JobStatus.PENDING.name());
            stmt.setInt(9, job.getMaxRetries());
            stmt.setInt(10, job.getRetryDelaySeconds());
            stmt.setString(11, job.getJobGroup());
            stmt.setString(12, job.getCreatedBy());
            stmt.setTimestamp(13, Columns.toTimestamp(job.getCreatedAt()));

            stmt.executeUpdate();
            logger.fine("Inserted job " + job.getJobId() + " (" + job.getJobType() + ")");

        } catch (SQLException e) {
            if (isUniqueViolation(e)) {
                throw new DuplicateJobIdException(job.getJobId(), e);
            }
            throw e;
        }
    }

    /**
     * Retrieve a job by its ID.
     *
     * @param jobId the job ID
     * @return the job, or null if not found
     * @throws SQLException if database operation fails
     */
    public JobRecord findById(String jobId) throws SQLException {
        String sql = "SELECT " + SELECT_COLUMNS + " FROM jobs WHERE job_id = ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, jobId);

            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return mapRow(rs);
                }
            }
        }

        return null;
    }

    /**
     * Due, unlocked PENDING jobs: {@code next_run_at <= now} and either no lock
     * or an expired one. Ordered by priority (DESC) then next_run_at (ASC).
     * The ordering is a tie-break only; it never preempts running jobs.
     *
     * @param limit maximum number of jobs to return
     * @param now the reference time
     * @return candidates in claim order
     * @throws SQLException if database operation fails
     */
    public List<JobRecord> selectDueUnlocked(int limit, Instant now) throws SQLException {
        String sql = "SELECT " + SELECT_COLUMNS + " FROM jobs " +
                     "WHERE status = ? AND next_run_at <= ? " +
                     "AND (locked_by IS NULL OR lock_expires_at <= ?) " +
                     "ORDER BY priority DESC, next_run_at ASC LIMIT ?";
        List<JobRecord> jobs = new ArrayList<>();

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, JobStatus.PENDING.name());
            stmt.setTimestamp(2, Columns.toTimestamp(now));
            stmt.setTimestamp(3, Columns.toTimestamp(now));
            stmt.setInt(4, limit);

            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    jobs.add(mapRow(rs));
                }
            }
        }

        return jobs;
    }

    /**
     * Atomically take the lock on a job.
     *
     * <p>One conditional UPDATE: it only matches when the job is unlocked or its
     * lock has expired, so concurrent workers racing on the same row produce
     * exactly one winner.</p>
     *
     * @param jobId the job to claim
     * @param workerId the claiming worker
     * @param lockTtl how long the claim stays valid without refresh
     * @param now the reference time
     * @return true if this worker now holds the lock
     * @throws SQLException if database operation fails
     */
    public boolean tryClaim(String jobId, String workerId, Duration lockTtl, Instant now) throws SQLException {
        String sql = "UPDATE jobs SET locked_by = ?, locked_at = ?, lock_expires_at = ? " +
                     "WHERE job_id = ? AND (locked_by IS NULL OR lock_expires_at <= ?)";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, workerId);
            stmt.setTimestamp(2, Columns.toTimestamp(now));
            stmt.setTimestamp(3, Columns.toTimestamp(now.plus(lockTtl)));
            stmt.setString(4, jobId);
            stmt.setTimestamp(5, Columns.toTimestamp(now));

            return stmt.executeUpdate() == 1;
        }
    }

    /**
     * Move a claimed job to RUNNING.
     *
     * <p>Runs in one transaction holding the row lock ({@code SELECT ... FOR UPDATE}).
     * The job must still be PENDING, still be due and still be locked by
     * {@code workerId}; otherwise another worker already advanced it (or
     * reclaimed an expired lock) and nothing is changed. On success {@code current_attempt} is
     * incremented and {@code started_at}/{@code last_run_at} are set.</p>
     *
     * @param jobId the claimed job
     * @param workerId the worker holding the claim
     * @param now the reference time
     * @return true if the job is now RUNNING for this worker
     * @throws SQLException if database operation fails
     */
    public boolean confirmPendingAndMarkRunning(String jobId, String workerId, Instant now) throws SQLException {
        String selectSql = "SELECT status, locked_by, next_run_at FROM jobs WHERE job_id = ? FOR UPDATE";
        String updateSql = "UPDATE jobs SET status = ?, started_at = ?, last_run_at = ?, " +
                           "current_attempt = current_attempt + 1 WHERE job_id = ?";

        try (Connection conn = database.getConnection()) {
            conn.setAutoCommit(false);
            try {
                String status;
                String lockedBy;
                Instant nextRunAt;
                try (PreparedStatement stmt = conn.prepareStatement(selectSql)) {
                    stmt.setString(1, jobId);
                    try (ResultSet rs = stmt.executeQuery()) {
                        if (!rs.next()) {
                            conn.rollback();
                            return false;
                        }
                        status = rs.getString("status");
                        lockedBy = rs.getString("locked_by");
                        nextRunAt = Columns.getInstant(rs, "next_run_at");
                    }
                }

                // A stale candidate list can claim a recurring job that another worker just re-armed
                boolean due = nextRunAt != null && !nextRunAt.isAfter(now);
                if (!JobStatus.PENDING.name().equals(status) || !workerId.equals(lockedBy) || !due) {
                    conn.rollback();
                    return false;
                }

                try (PreparedStatement stmt = conn.prepareStatement(updateSql)) {
                    stmt.setString(1, JobStatus.RUNNING.name());
                    stmt.setTimestamp(2, Columns.toTimestamp(now));
                    stmt.setTimestamp(3, Columns.toTimestamp(now));
                    stmt.setString(4, jobId);
                    stmt.executeUpdate();
                }

                conn.commit();
                return true;

            } catch (SQLException e) {
                rollbackQuietly(conn, e);
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        }
    }

    /**
     * Record a successful run.
     *
     * <p>With {@code nextRunAt == null} (ONCE jobs) the job becomes COMPLETED and
     * {@code completed_at} is stamped. Otherwise the job is re-armed: PENDING,
     * the new {@code next_run_at}, and {@code current_attempt} reset to 0.
     * Lock fields are left alone; the caller releases the lock.</p>
     *
     * @param jobId the job
     * @param workerId the worker that ran the attempt; nothing is written unless it still holds the lock
     * @param resultJson the handler result as JSON, may be null
     * @param nextRunAt the next run for recurring jobs, or null
     * @param now completion time
     * @return false if the job is no longer RUNNING under {@code workerId}
     * @throws SQLException if database operation fails
     */
    public boolean complete(String jobId, String workerId, String resultJson, Instant nextRunAt, Instant now)
            throws SQLException {
        String sql;
        if (nextRunAt == null) {
            sql = "UPDATE jobs SET status = ?, result = ?, error_message = NULL, completed_at = ? " +
                  "WHERE job_id = ? AND status = ? AND locked_by = ?";
        } else {
            sql = "UPDATE jobs SET status = ?, result = ?, error_message = NULL, next_run_at = ?, " +
                  "current_attempt = 0 WHERE job_id = ? AND status = ? AND locked_by = ?";
        }

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, nextRunAt == null ? JobStatus.COMPLETED.name() : JobStatus.PENDING.name());
            stmt.setString(2, resultJson);
            stmt.setTimestamp(3, Columns.toTimestamp(nextRunAt == null ? now : nextRunAt));
            stmt.setString(4, jobId);
            stmt.setString(5, JobStatus.RUNNING.name());
            stmt.setString(6, workerId);

            return applied(stmt.executeUpdate(), "complete", jobId, workerId);
        }
    }

    /**
     * Record a failed run: either schedule a retry or mark the job FAILED.
     *
     * @param jobId the job
     * @param workerId the worker that ran the attempt; nothing is written unless it still holds the lock
     * @param errorMessage the error to store
     * @param nextRunAt when to retry, or null when the job has failed for good
     * @param newStatus PENDING (retry) or FAILED
     * @param now failure time, stamped as {@code failed_at} when FAILED
     * @return false if the job is no longer RUNNING under {@code workerId}
     * @throws IllegalArgumentException if {@code newStatus} is not a legal outcome of a RUNNING job
     * @throws SQLException if database operation fails
     */
    public boolean failOrRetry(String jobId, String workerId, String errorMessage, Instant nextRunAt,
                               JobStatus newStatus, Instant now) throws SQLException {
        if (newStatus == JobStatus.COMPLETED || !JobStatus.RUNNING.canTransitionTo(newStatus)) {
            throw new IllegalArgumentException("failOrRetry only moves to PENDING or FAILED, got " + newStatus.name());
        }

        String sql;
        if (newStatus == JobStatus.FAILED) {
            sql = "UPDATE jobs SET status = ?, error_message = ?, failed_at = ? " +
                  "WHERE job_id = ? AND status = ? AND locked_by = ?";
        } else {
            sql = "UPDATE jobs SET status = ?, error_message = ?, next_run_at = ? " +
                  "WHERE job_id = ? AND status = ? AND locked_by = ?";
        }

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, newStatus.name());
            stmt.setString(2, errorMessage);
            stmt.setTimestamp(3, Columns.toTimestamp(newStatus == JobStatus.FAILED ? now : nextRunAt));
            stmt.setString(4, jobId);
            stmt.setString(5, JobStatus.RUNNING.name());
            stmt.setString(6, workerId);

            return applied(stmt.executeUpdate(), "failOrRetry", jobId, workerId);
        }
    }

    private static boolean applied(int rows, String operation, String jobId, String workerId) {
        if (rows == 0) {
            logger.warning(operation + ": job " + jobId + " is not RUNNING under " + workerId + ", nothing written");
            return false;
        }
        return true;
    }

    /**
     * Clear the lock fields, but only if {@code ownerWorkerId} still holds the lock.
     *
     * @return true if a lock was released
     * @throws SQLException if database operation fails
     */
    public boolean releaseLock(String jobId, String ownerWorkerId) throws SQLException {
        String sql = "UPDATE jobs SET locked_by = NULL, locked_at = NULL, lock_expires_at = NULL " +
                     "WHERE job_id = ? AND locked_by = ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, jobId);
            stmt.setString(2, ownerWorkerId);
            return stmt.executeUpdate() > 0;
        }
    }

    /**
     * Release every lock held by a worker. Used on shutdown to shorten the time
     * other workers wait for expiry-based reclaim.
     *
     * @return the number of locks released
     * @throws SQLException if database operation fails
     */
    public int releaseAllLocks(String workerId) throws SQLException {
        String sql = "UPDATE jobs SET locked_by = NULL, locked_at = NULL, lock_expires_at = NULL " +
                     "WHERE locked_by = ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, workerId);
            return stmt.executeUpdate();
        }
    }

    /**
     * Extend the lock of every RUNNING job owned by a worker.
     *
     * @param workerId the owning worker
     * @param newExpiry the new {@code lock_expires_at}
     * @return the number of locks extended
     * @throws SQLException if database operation fails
     */
    public int refreshLock(String workerId, Instant newExpiry) throws SQLException {
        String sql = "UPDATE jobs SET lock_expires_at = ? WHERE status = ? AND locked_by = ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setTimestamp(1, Columns.toTimestamp(newExpiry));
            stmt.setString(2, JobStatus.RUNNING.name());
            stmt.setString(3, workerId);
            return stmt.executeUpdate();
        }
    }

    /**
     * Reclaim jobs whose lock expired without being refreshed (owner crashed or
     * partitioned). Non-terminal jobs are unlocked and reset to PENDING; a
     * terminal job that still carries an expired lock only has the lock cleared,
     * so finished ONCE jobs never run again. RUNNING jobs that lost their lock
     * altogether (released on shutdown, or finalization failed) are reset too.
     * Idempotent.
     *
     * @param now the reference time
     * @return the number of jobs reset to PENDING
     * @throws SQLException if database operation fails
     */
    public int reclaimExpired(Instant now) throws SQLException {
        String resetSql = "UPDATE jobs SET status = ?, locked_by = NULL, locked_at = NULL, lock_expires_at = NULL " +
                          "WHERE locked_by IS NOT NULL AND lock_expires_at <= ? AND status IN (" +
                          placeholders(LIVE_STATUSES.size()) + ")";
        String clearSql = "UPDATE jobs SET locked_by = NULL, locked_at = NULL, lock_expires_at = NULL " +
                          "WHERE locked_by IS NOT NULL AND lock_expires_at <= ?";
        String orphanSql = "UPDATE jobs SET status = ? WHERE status = ? AND locked_by IS NULL";

        try (Connection conn = database.getConnection()) {
            conn.setAutoCommit(false);
            try {
                int reclaimed;
                try (PreparedStatement stmt = conn.prepareStatement(resetSql)) {
                    stmt.setString(1, JobStatus.PENDING.name());
                    stmt.setTimestamp(2, Columns.toTimestamp(now));
                    bindStatuses(stmt, 3, LIVE_STATUSES);
                    reclaimed = stmt.executeUpdate();
                }

                int cleared;
                try (PreparedStatement stmt = conn.prepareStatement(clearSql)) {
                    stmt.setTimestamp(1, Columns.toTimestamp(now));
                    cleared = stmt.executeUpdate();
                }

                try (PreparedStatement stmt = conn.prepareStatement(orphanSql)) {
                    stmt.setString(1, JobStatus.PENDING.name());
                    stmt.setString(2, JobStatus.RUNNING.name());
                    reclaimed += stmt.executeUpdate();
                }

                conn.commit();
                if (cleared > 0) {
                    logger.info("Cleared " + cleared + " stale locks on terminal jobs");
                }
                return reclaimed;

            } catch (SQLException e) {
                rollbackQuietly(conn, e);
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        }
    }

    /**
     * Cancel a job that has not started: only {@link JobStatus#isCancellable()
     * cancellable} jobs move to CANCELLED. Running and terminal jobs are left untouched.
     *
     * @param jobId the job to cancel
     * @param now stamped as {@code completed_at}
     * @return true if the job was cancelled
     * @throws SQLException if database operation fails
     */
    public boolean cancel(String jobId, Instant now) throws SQLException {
        String sql = "UPDATE jobs SET status = ?, completed_at = ? WHERE job_id = ? AND status IN (" +
                     placeholders(CANCELLABLE_STATUSES.size()) + ")";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, JobStatus.CANCELLED.name());
            stmt.setTimestamp(2, Columns.toTimestamp(now));
            stmt.setString(3, jobId);
            bindStatuses(stmt, 4, CANCELLABLE_STATUSES);

            return stmt.executeUpdate() > 0;
        }
    }

    /**
     * All jobs in a group, oldest first.
     *
     * @throws SQLException if database operation fails
     */
    public List<JobRecord> findByGroup(String jobGroup) throws SQLException {
        String sql = "SELECT " + SELECT_COLUMNS + " FROM jobs WHERE job_group = ? ORDER BY created_at ASC";
        List<JobRecord> jobs = new ArrayList<>();

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, jobGroup);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    jobs.add(mapRow(rs));
                }
            }
        }

        return jobs;
    }

    /**
     * Jobs in a given status, oldest first. Lets a monitor poll FAILED jobs.
     *
     * @throws SQLException if database operation fails
     */
    public List<JobRecord> findByStatus(JobStatus status, int limit) throws SQLException {
        String sql = "SELECT " + SELECT_COLUMNS + " FROM jobs WHERE status = ? ORDER BY created_at ASC LIMIT ?";
        List<JobRecord> jobs = new ArrayList<>();

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, status.name());
            stmt.setInt(2, limit);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    jobs.add(mapRow(rs));
                }
            }
        }

        return jobs;
    }

    /**
     * Number of jobs per status. Every status is present, zero when unused.
     *
     * @throws SQLException if database operation fails
     */
    public Map<JobStatus, Integer> countByStatus() throws SQLException {
        String sql = "SELECT status, COUNT(*) AS cnt FROM jobs GROUP BY status";
        Map<JobStatus, Integer> counts = new EnumMap<>(JobStatus.class);
        for (JobStatus status : JobStatus.values()) {
            counts.put(status, 0);
        }

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {

            while (rs.next()) {
                counts.put(JobStatus.valueOf(rs.getString("status")), rs.getInt("cnt"));
            }
        }

        return counts;
    }

    private static boolean isUniqueViolation(SQLException e) {
        // SQLState class 23 = integrity constraint violation
        return e instanceof SQLIntegrityConstraintViolationException
                || (e.getSQLState() != null && e.getSQLState().startsWith("23"));
    }

    private static void rollbackQuietly(Connection conn, SQLException cause) {
        try {
            conn.rollback();
        } catch (SQLException rollbackEx) {
            cause.addSuppressed(rollbackEx);
        }
    }

    private JobRecord mapRow(ResultSet rs) throws SQLException {
        JobRecord job = new JobRecord();

        job.setJobId(rs.getString("job_id"));
        job.setJobType(rs.getString("job_type"));
        job.setParameters(Columns.fromJson(rs.getString("parameters")));
        job.setPriority(JobPriority.fromWeight(rs.getInt("priority")));
        job.setScheduleType(ScheduleType.valueOf(rs.getString("schedule_type")));
        job.setScheduleExpression(rs.getString("schedule_expression"));
        job.setNextRunAt(Columns.getInstant(rs, "next_run_at"));
        job.setStatus(JobStatus.valueOf(rs.getString("status")));
        job.setCurrentAttempt(rs.getInt("current_attempt"));
        job.setMaxRetries(rs.getInt("max_retries"));
        job.setRetryDelaySeconds(rs.getInt("retry_delay_seconds"));
        job.setLockedBy(rs.getString("locked_by"));
        job.setLockedAt(Columns.getInstant(rs, "locked_at"));
        job.setLockExpiresAt(Columns.getInstant(rs, "lock_expires_at"));
        job.setResult(rs.getString("result"));
        job.setErrorMessage(rs.getString("error_message"));
        job.setJobGroup(rs.getString("job_group"));
        job.setCreatedBy(rs.getString("created_by"));
        job.setCreatedAt(Columns.getInstant(rs, "created_at"));
        job.setStartedAt(Columns.getInstant(rs, "started_at"));
        job.setLastRunAt(Columns.getInstant(rs, "last_run_at"));
        job.setCompletedAt(Columns.getInstant(rs, "completed_at"));
        job.setFailedAt(Columns.getInstant(rs, "failed_at"));

        return job;
    }

    private static List<JobStatus> statusesWhere(Predicate<JobStatus> filter) {
        return Arrays.stream(JobStatus.values()).filter(filter).collect(Collectors.toUnmodifiableList());
    }

    private static String placeholders(int count) {
        return String.join(", ", Collections.nCopies(count, "?"));
    }

    private static void bindStatuses(PreparedStatement stmt, int firstIndex, List<JobStatus> statuses)
            throws SQLException {
        for (int i = 0; i < statuses.size(); i++) {
            stmt.setString(firstIndex + i, statuses.get(i).name());
        }
    }
}
