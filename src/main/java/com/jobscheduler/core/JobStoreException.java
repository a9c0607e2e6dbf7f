package com.jobscheduler.core;

/**
 * Unchecked wrapper for a {@link java.sql.SQLException} raised while the
 * scheduling API talks to the job store. Background loops never see it; they
 * handle the checked exception themselves and back off.
 */
public class JobStoreException extends RuntimeException {

    public JobStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
