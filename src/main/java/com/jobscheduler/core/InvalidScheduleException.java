package com.jobscheduler.core;

/**
 * Thrown synchronously by the scheduling API when a request can never run:
 * an unparsable cron expression, a non-positive interval, a blank job type or
 * a negative retry policy. Raised at call time, never at first execution.
 */
public class InvalidScheduleException extends IllegalArgumentException {

    public InvalidScheduleException(String message) {
        super(message);
    }

    public InvalidScheduleException(String message, Throwable cause) {
        super(message, cause);
    }
}
