package com.jobscheduler.core;

/**
 * Outcome recorded on an immutable execution row.
 */
public enum ExecutionStatus {
    SUCCESS("success"),
    FAILED("failed"),
    RETRY_SCHEDULED("retry_scheduled");

    private final String code;

    ExecutionStatus(String code) {
        this.code = code;
    }

    /**
     * @return the value stored in {@code job_executions.status}
     */
    public String getCode() {
        return code;
    }

    public static ExecutionStatus fromCode(String code) {
        for (ExecutionStatus status : values()) {
            if (status.code.equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown execution status: " + code);
    }
}
