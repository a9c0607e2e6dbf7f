package com.jobscheduler.core;

/**
 * How {@code next_run_at} is recomputed after a successful run.
 */
public enum ScheduleType {
    /** Runs once; terminal after success, failure or cancellation. */
    ONCE,
    /** Re-armed {@code interval_seconds} after each successful run. */
    INTERVAL,
    /** Re-armed at the next cron firing after each successful run. */
    CRON;

    public boolean isRecurring() {
        return this != ONCE;
    }
}
