package com.jobscheduler.db;

import com.jobscheduler.core.ExecutionStatus;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;

/**
 * One immutable row of {@code job_executions}: a single attempt of a job.
 * {@code jobId} is a back-reference only. Executions are purged by age,
 * jobs never are.
 */
public class ExecutionRecord {
    private String executionId;
    private String jobId;
    private int attemptNumber;
    private String workerId;
    private Instant startedAt;
    private Instant completedAt;
    private long durationMs;
    private ExecutionStatus status;
    private String errorMessage;
    private Map<String, Object> parametersUsed = Collections.emptyMap();
    private String environmentInfo;
    private String result;

    public String getExecutionId() {
        return executionId;
    }

    public void setExecutionId(String executionId) {
        this.executionId = executionId;
    }

    public String getJobId() {
        return jobId;
    }

    public void setJobId(String jobId) {
        this.jobId = jobId;
    }

    public int getAttemptNumber() {
        return attemptNumber;
    }

    public void setAttemptNumber(int attemptNumber) {
        this.attemptNumber = attemptNumber;
    }

    public String getWorkerId() {
        return workerId;
    }

    public void setWorkerId(String workerId) {
        this.workerId = workerId;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(Instant completedAt) {
        this.completedAt = completedAt;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public void setDurationMs(long durationMs) {
        this.durationMs = durationMs;
    }

    public ExecutionStatus getStatus() {
        return status;
    }

    public void setStatus(ExecutionStatus status) {
        this.status = status;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public Map<String, Object> getParametersUsed() {
        return parametersUsed;
    }

    public void setParametersUsed(Map<String, Object> parametersUsed) {
        this.parametersUsed = parametersUsed != null ? parametersUsed : Collections.emptyMap();
    }

    public String getEnvironmentInfo() {
        return environmentInfo;
    }

    public void setEnvironmentInfo(String environmentInfo) {
        this.environmentInfo = environmentInfo;
    }

    public String getResult() {
        return result;
    }

    public void setResult(String result) {
        this.result = result;
    }
}
