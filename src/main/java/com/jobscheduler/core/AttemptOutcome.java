package com.jobscheduler.core;

/**
 * What happened to one claimed job during a poll cycle.
 *
 * <p>ABANDONED usually means the attempt never reached the handler: another
 * worker had already moved the job on, which is expected under contention.
 * It is also reported when the outcome could not be written; the job is then
 * left to lock expiry and reclaim.</p>
 */
public final class AttemptOutcome {

    public enum Result {
        SUCCEEDED,
        RETRY_SCHEDULED,
        FAILED,
        ABANDONED
    }

    private final String jobId;
    private final Result result;
    private final Object value;
    private final String errorMessage;
    private final long durationMs;

    private AttemptOutcome(String jobId, Result result, Object value, String errorMessage, long durationMs) {
        this.jobId = jobId;
        this.result = result;
        this.value = value;
        this.errorMessage = errorMessage;
        this.durationMs = durationMs;
    }

    public static AttemptOutcome succeeded(String jobId, Object value, long durationMs) {
        return new AttemptOutcome(jobId, Result.SUCCEEDED, value, null, durationMs);
    }

    public static AttemptOutcome failed(String jobId, boolean retryScheduled, String errorMessage, long durationMs) {
        return new AttemptOutcome(jobId, retryScheduled ? Result.RETRY_SCHEDULED : Result.FAILED,
                null, errorMessage, durationMs);
    }

    public static AttemptOutcome abandoned(String jobId, String reason) {
        return new AttemptOutcome(jobId, Result.ABANDONED, null, reason, 0L);
    }

    public String getJobId() {
        return jobId;
    }

    public Result getResult() {
        return result;
    }

    public boolean isSuccess() {
        return result == Result.SUCCEEDED;
    }

    public Object getValue() {
        return value;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public long getDurationMs() {
        return durationMs;
    }

    @Override
    public String toString() {
        return "AttemptOutcome{jobId=" + jobId + ", result=" + result
                + (errorMessage != null ? ", error=" + errorMessage : "")
                + ", durationMs=" + durationMs + "}";
    }
}
