package com.jobscheduler.core;

/**
 * Thrown when a job is inserted with a {@code job_id} that already exists.
 *
 * <p>Job ids are generated by the scheduler, so a collision means the caller
 * must retry with a fresh id. Nothing is written when this is thrown.</p>
 *
 * @see com.jobscheduler.db.JobRepository#insertJob(com.jobscheduler.db.JobRecord)
 */
public class DuplicateJobIdException extends RuntimeException {

    private final String jobId;

    /**
     * Create a new DuplicateJobIdException.
     *
     * @param jobId the colliding id
     * @param cause the underlying constraint violation
     */
    public DuplicateJobIdException(String jobId, Throwable cause) {
        super("Job id already exists: " + jobId, cause);
        this.jobId = jobId;
    }

    /**
     * @return the id that collided
     */
    public String getJobId() {
        return jobId;
    }
}
