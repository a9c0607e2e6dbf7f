package com.jobscheduler.core;

import org.json.JSONObject;

import java.time.Instant;

/**
 * Read-only snapshot of a job, returned by status queries.
 *
 * <p>Built once from a store row and never updated; query again to observe
 * later transitions.</p>
 */
public final class JobView {
    private final String jobId;
    private final String jobType;
    private final JobStatus status;
    private final JobPriority priority;
    private final ScheduleType scheduleType;
    private final String scheduleExpression;
    private final int currentAttempt;
    private final int maxRetries;
    private final Instant nextRunAt;
    private final Instant createdAt;
    private final Instant lastRunAt;
    private final Instant completedAt;
    private final Instant failedAt;
    private final String lockedBy;
    private final String jobGroup;
    private final String errorMessage;

    private JobView(Builder b) {
        this.jobId = b.jobId;
        this.jobType = b.jobType;
        this.status = b.status;
        this.priority = b.priority;
        this.scheduleType = b.scheduleType;
        this.scheduleExpression = b.scheduleExpression;
        this.currentAttempt = b.currentAttempt;
        this.maxRetries = b.maxRetries;
        this.nextRunAt = b.nextRunAt;
        this.createdAt = b.createdAt;
        this.lastRunAt = b.lastRunAt;
        this.completedAt = b.completedAt;
        this.failedAt = b.failedAt;
        this.lockedBy = b.lockedBy;
        this.jobGroup = b.jobGroup;
        this.errorMessage = b.errorMessage;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getJobId() {
        return jobId;
    }

    public String getJobType() {
        return jobType;
    }

    public JobStatus getStatus() {
        return status;
    }

    public JobPriority getPriority() {
        return priority;
    }

    public ScheduleType getScheduleType() {
        return scheduleType;
    }

    public String getScheduleExpression() {
        return scheduleExpression;
    }

    public int getCurrentAttempt() {
        return currentAttempt;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public Instant getNextRunAt() {
        return nextRunAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastRunAt() {
        return lastRunAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public Instant getFailedAt() {
        return failedAt;
    }

    public String getLockedBy() {
        return lockedBy;
    }

    public String getJobGroup() {
        return jobGroup;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    /**
     * Render as a JSON document for dashboards. Null fields are emitted as
     * JSON null; timestamps are ISO-8601 UTC.
     */
    public JSONObject toJson() {
        JSONObject json = new JSONObject();
        json.put("job_id", jobId);
        json.put("job_type", jobType);
        json.put("status", status.name());
        json.put("priority", priority.name());
        json.put("schedule_type", scheduleType.name());
        json.put("schedule_expression", orNull(scheduleExpression));
        json.put("current_attempt", currentAttempt);
        json.put("max_retries", maxRetries);
        json.put("next_run_at", orNull(nextRunAt));
        json.put("created_at", orNull(createdAt));
        json.put("last_run_at", orNull(lastRunAt));
        json.put("completed_at", orNull(completedAt));
        json.put("failed_at", orNull(failedAt));
        json.put("locked_by", orNull(lockedBy));
        json.put("job_group", orNull(jobGroup));
        json.put("error_message", orNull(errorMessage));
        return json;
    }

    private static Object orNull(Object value) {
        if (value == null) {
            return JSONObject.NULL;
        }
        return value instanceof Instant ? value.toString() : value;
    }

    @Override
    public String toString() {
        return "JobView{" + jobId + " " + jobType + " " + status.name()
                + " attempt " + currentAttempt + "/" + (maxRetries + 1) + "}";
    }

    public static final class Builder {
        private String jobId;
        private String jobType;
        private JobStatus status;
        private JobPriority priority = JobPriority.NORMAL;
        private ScheduleType scheduleType = ScheduleType.ONCE;
        private String scheduleExpression;
        private int currentAttempt;
        private int maxRetries;
        private Instant nextRunAt;
        private Instant createdAt;
        private Instant lastRunAt;
        private Instant completedAt;
        private Instant failedAt;
        private String lockedBy;
        private String jobGroup;
        private String errorMessage;

        private Builder() {
        }

        public Builder jobId(String jobId) {
            this.jobId = jobId;
            return this;
        }

        public Builder jobType(String jobType) {
            this.jobType = jobType;
            return this;
        }

        public Builder status(JobStatus status) {
            this.status = status;
            return this;
        }

        public Builder priority(JobPriority priority) {
            this.priority = priority;
            return this;
        }

        public Builder schedule(ScheduleType scheduleType, String scheduleExpression) {
            this.scheduleType = scheduleType;
            this.scheduleExpression = scheduleExpression;
            return this;
        }

        public Builder attempts(int currentAttempt, int maxRetries) {
            this.currentAttempt = currentAttempt;
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder nextRunAt(Instant nextRunAt) {
            this.nextRunAt = nextRunAt;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder lastRunAt(Instant lastRunAt) {
            this.lastRunAt = lastRunAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder failedAt(Instant failedAt) {
            this.failedAt = failedAt;
            return this;
        }

        public Builder lockedBy(String lockedBy) {
            this.lockedBy = lockedBy;
            return this;
        }

        public Builder jobGroup(String jobGroup) {
            this.jobGroup = jobGroup;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public JobView build() {
            if (jobId == null || jobType == null || status == null) {
                throw new IllegalStateException("jobId, jobType and status are required");
            }
            return new JobView(this);
        }
    }
}
