package com.jobscheduler.core;

/**
 * Classifies why an attempt failed. Both codes go through the same
 * retry-or-fail accounting; the code only prefixes the stored error message.
 */
public enum FailureCode {
    HANDLER_NOT_FOUND,
    HANDLER_ERROR;

    /**
     * Format an error message with this code as prefix, e.g.
     * {@code [HANDLER_ERROR] IllegalStateException: boom}.
     */
    public String format(String message) {
        return "[" + name() + "] " + message;
    }
}
