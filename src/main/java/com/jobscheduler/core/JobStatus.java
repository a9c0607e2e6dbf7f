package com.jobscheduler.core;

/**
 * Lifecycle states of a persisted job.
 *
 * <p>State Transitions:</p>
 * <ul>
 *   <li>PENDING → RUNNING: job claimed and confirmed by a worker</li>
 *   <li>PENDING/RETRYING → CANCELLED: cancelled before the next run</li>
 *   <li>RUNNING → COMPLETED: ONCE job succeeded</li>
 *   <li>RUNNING → PENDING: recurring job re-armed, or failed attempt with retries left</li>
 *   <li>RUNNING → FAILED: retries exhausted</li>
 *   <li>RUNNING → PENDING: expired lock reclaimed after a worker crash</li>
 * </ul>
 *
 * <p>Thread Safety: This enum is immutable and thread-safe.</p>
 *
 * @see #canTransitionTo(JobStatus)
 */
public enum JobStatus {
    PENDING("Pending"),
    RUNNING("Running"),
    COMPLETED("Completed"),
    FAILED("Failed"),
    CANCELLED("Cancelled"),
    RETRYING("Retrying");

    private final String displayName;

    JobStatus(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Get the human-readable display name for this status.
     *
     * @return the display name (e.g., "Completed", "Failed")
     */
    public String getDisplayName() {
        return displayName;
    }

    /**
     * Check if this status is terminal. Terminal jobs stay in the table as an
     * audit trail and are never picked up again.
     *
     * @return true for COMPLETED, FAILED and CANCELLED
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Check if a job in this status may still be cancelled.
     *
     * @return true for PENDING and RETRYING
     */
    public boolean isCancellable() {
        return this == PENDING || this == RETRYING;
    }

    /**
     * Validate if a transition to a new status is legal.
     *
     * <p>Key Invariant: once a job reaches a terminal state it cannot
     * transition to any other state.</p>
     *
     * @param newStatus the target status
     * @return true if the transition is allowed
     */
    public boolean canTransitionTo(JobStatus newStatus) {
        if (this.isTerminal()) {
            return false;
        }

        return switch (this) {
            case PENDING -> newStatus == RUNNING || newStatus == CANCELLED;
            case RETRYING -> newStatus == PENDING || newStatus == CANCELLED;
            case RUNNING -> newStatus == COMPLETED || newStatus == FAILED || newStatus == PENDING;
            default -> false;
        };
    }

    @Override
    public String toString() {
        return displayName;
    }
}
