package com.jobscheduler.db;

import com.jobscheduler.core.JobPriority;
import com.jobscheduler.core.JobStatus;
import com.jobscheduler.core.JobView;
import com.jobscheduler.core.ScheduleType;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;

/**
 * One row of the {@code jobs} table.
 */
public class JobRecord {
    private String jobId;
    private String jobType;
    private Map<String, Object> parameters = Collections.emptyMap();
    private JobPriority priority = JobPriority.NORMAL;
    private ScheduleType scheduleType = ScheduleType.ONCE;
    private String scheduleExpression;
    private Instant nextRunAt;
    private JobStatus status = JobStatus.PENDING;
    private int currentAttempt;
    private int maxRetries;
    private int retryDelaySeconds;
    private String lockedBy;
    private Instant lockedAt;
    private Instant lockExpiresAt;
    private String result;
    private String errorMessage;
    private String jobGroup;
    private String createdBy;
    private Instant createdAt;
    private Instant startedAt;
    private Instant lastRunAt;
    private Instant completedAt;
    private Instant failedAt;

    /**
     * A job is owned while a worker holds an unexpired lock on it.
     *
     * @param now the reference time
     * @return true if {@code locked_by} is set and {@code lock_expires_at} is after now
     */
    public boolean isOwnedAt(Instant now) {
        return lockedBy != null && lockExpiresAt != null && lockExpiresAt.isAfter(now);
    }

    /**
     * Snapshot for status queries.
     */
    public JobView toView() {
        return JobView.builder()
                .jobId(jobId)
                .jobType(jobType)
                .status(status)
                .priority(priority)
                .schedule(scheduleType, scheduleExpression)
                .attempts(currentAttempt, maxRetries)
                .nextRunAt(nextRunAt)
                .createdAt(createdAt)
                .lastRunAt(lastRunAt)
                .completedAt(completedAt)
                .failedAt(failedAt)
                .lockedBy(lockedBy)
                .jobGroup(jobGroup)
                .errorMessage(errorMessage)
                .build();
    }

    // Getters and Setters
    public String getJobId() {
        return jobId;
    }

    public void setJobId(String jobId) {
        this.jobId = jobId;
    }

    public String getJobType() {
        return jobType;
    }

    public void setJobType(String jobType) {
        this.jobType = jobType;
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }

    public void setParameters(Map<String, Object> parameters) {
        this.parameters = parameters != null ? parameters : Collections.emptyMap();
    }

    public JobPriority getPriority() {
        return priority;
    }

    public void setPriority(JobPriority priority) {
        this.priority = priority;
    }

    public ScheduleType getScheduleType() {
        return scheduleType;
    }

    public void setScheduleType(ScheduleType scheduleType) {
        this.scheduleType = scheduleType;
    }

    public String getScheduleExpression() {
        return scheduleExpression;
    }

    public void setScheduleExpression(String scheduleExpression) {
        this.scheduleExpression = scheduleExpression;
    }

    public Instant getNextRunAt() {
        return nextRunAt;
    }

    public void setNextRunAt(Instant nextRunAt) {
        this.nextRunAt = nextRunAt;
    }

    public JobStatus getStatus() {
        return status;
    }

    public void setStatus(JobStatus status) {
        this.status = status;
    }

    public int getCurrentAttempt() {
        return currentAttempt;
    }

    public void setCurrentAttempt(int currentAttempt) {
        this.currentAttempt = currentAttempt;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public int getRetryDelaySeconds() {
        return retryDelaySeconds;
    }

    public void setRetryDelaySeconds(int retryDelaySeconds) {
        this.retryDelaySeconds = retryDelaySeconds;
    }

    public String getLockedBy() {
        return lockedBy;
    }

    public void setLockedBy(String lockedBy) {
        this.lockedBy = lockedBy;
    }

    public Instant getLockedAt() {
        return lockedAt;
    }

    public void setLockedAt(Instant lockedAt) {
        this.lockedAt = lockedAt;
    }

    public Instant getLockExpiresAt() {
        return lockExpiresAt;
    }

    public void setLockExpiresAt(Instant lockExpiresAt) {
        this.lockExpiresAt = lockExpiresAt;
    }

    public String getResult() {
        return result;
    }

    public void setResult(String result) {
        this.result = result;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public String getJobGroup() {
        return jobGroup;
    }

    public void setJobGroup(String jobGroup) {
        this.jobGroup = jobGroup;
    }

    public String getCreatedBy() {
        return createdBy;
    }

    public void setCreatedBy(String createdBy) {
        this.createdBy = createdBy;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public Instant getLastRunAt() {
        return lastRunAt;
    }

    public void setLastRunAt(Instant lastRunAt) {
        this.lastRunAt = lastRunAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(Instant completedAt) {
        this.completedAt = completedAt;
    }

    public Instant getFailedAt() {
        return failedAt;
    }

    public void setFailedAt(Instant failedAt) {
        this.failedAt = failedAt;
    }

    @Override
    public String toString() {
        return "JobRecord{jobId=" + jobId + ", type=" + jobType + ", status=" + status.name()
                + ", attempt=" + currentAttempt + "/" + maxRetries + ", nextRunAt=" + nextRunAt
                + ", lockedBy=" + lockedBy + "}";
    }
}
