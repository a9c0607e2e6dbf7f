package com.jobscheduler.db;

import com.jobscheduler.core.ExecutionStatus;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Append-only audit trail in {@code job_executions}. Rows are written once per
 * attempt and only ever deleted by the retention purge.
 */
public class ExecutionRepository {
    private static final Logger logger = Logger.getLogger(ExecutionRepository.class.getName());

    private final Database database;

    public ExecutionRepository(Database database) {
        this.database = database;
    }

    /**
     * Write one execution row.
     *
     * @param execution the attempt to record
     * @throws SQLException if database operation fails
     */
    public void insert(ExecutionRecord execution) throws SQLException {
        String sql = "INSERT INTO job_executions (execution_id, job_id, attempt_number, worker_id, started_at, " +
                     "completed_at, duration_ms, status, error_message, parameters_used, environment_info, result) " +
                     "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, execution.getExecutionId());
            stmt.setString(2, execution.getJobId());
            stmt.setInt(3, execution.getAttemptNumber());
            stmt.setString(4, execution.getWorkerId());
            stmt.setTimestamp(5, Columns.toTimestamp(execution.getStartedAt()));
            stmt.setTimestamp(6, Columns.toTimestamp(execution.getCompletedAt()));
            stmt.setLong(7, execution.getDurationMs());
            stmt.setString(8, execution.getStatus().getCode());
            stmt.setString(9, execution.getErrorMessage());
            stmt.setString(10, Columns.toJson(execution.getParametersUsed()));
            stmt.setString(11, execution.getEnvironmentInfo());
            stmt.setString(12, execution.getResult());

            stmt.executeUpdate();
        }
    }

    /**
     * Every recorded attempt of a job, oldest first.
     *
     * @throws SQLException if database operation fails
     */
    public List<ExecutionRecord> findByJobId(String jobId) throws SQLException {
        String sql = "SELECT * FROM job_executions WHERE job_id = ? ORDER BY started_at ASC, attempt_number ASC";
        List<ExecutionRecord> executions = new ArrayList<>();

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, jobId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    executions.add(mapRow(rs));
                }
            }
        }

        return executions;
    }

    public int countByJobId(String jobId) throws SQLException {
        String sql = "SELECT COUNT(*) AS cnt FROM job_executions WHERE job_id = ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, jobId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? rs.getInt("cnt") : 0;
            }
        }
    }

    /**
     * Delete executions that completed before the cutoff. Idempotent.
     *
     * @param cutoff rows with {@code completed_at} strictly before this are deleted
     * @return the number of rows deleted
     * @throws SQLException if database operation fails
     */
    public int purgeOlderThan(Instant cutoff) throws SQLException {
        String sql = "DELETE FROM job_executions WHERE completed_at < ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setTimestamp(1, Columns.toTimestamp(cutoff));
            int deleted = stmt.executeUpdate();
            if (deleted > 0) {
                logger.fine("Purged " + deleted + " executions completed before " + cutoff);
            }
            return deleted;
        }
    }

    private ExecutionRecord mapRow(ResultSet rs) throws SQLException {
        ExecutionRecord execution = new ExecutionRecord();

        execution.setExecutionId(rs.getString("execution_id"));
        execution.setJobId(rs.getString("job_id"));
        execution.setAttemptNumber(rs.getInt("attempt_number"));
        execution.setWorkerId(rs.getString("worker_id"));
        execution.setStartedAt(Columns.getInstant(rs, "started_at"));
        execution.setCompletedAt(Columns.getInstant(rs, "completed_at"));
        execution.setDurationMs(rs.getLong("duration_ms"));
        execution.setStatus(ExecutionStatus.fromCode(rs.getString("status")));
        execution.setErrorMessage(rs.getString("error_message"));
        execution.setParametersUsed(Columns.fromJson(rs.getString("parameters_used")));
        execution.setEnvironmentInfo(rs.getString("environment_info"));
        execution.setResult(rs.getString("result"));

        return execution;
    }
}
