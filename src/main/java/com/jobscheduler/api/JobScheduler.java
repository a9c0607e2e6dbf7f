package com.jobscheduler.api;

import com.jobscheduler.core.InvalidScheduleException;
import com.jobscheduler.core.JobOptions;
import com.jobscheduler.core.JobPriority;
import com.jobscheduler.core.JobStatus;
import com.jobscheduler.core.JobStoreException;
import com.jobscheduler.core.JobView;
import com.jobscheduler.core.ScheduleType;
import com.jobscheduler.db.ExecutionRecord;
import com.jobscheduler.db.ExecutionRepository;
import com.jobscheduler.db.JobRecord;
import com.jobscheduler.db.JobRepository;
import com.jobscheduler.engine.NextRunCalculator;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Public entry points to create, cancel and query jobs.
 *
 * <p>Every call writes to or reads from the store before it returns, so a
 * caller holding a returned job id can query its status straight away.
 * Only validation errors surface synchronously; handler failures are
 * observable later through {@link #getJobStatus(String)} and
 * {@link #getExecutions(String)}.</p>
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * String id = scheduler.scheduleRecurringJob("nightly_report", "0 2 * * *",
 *         JobOptions.defaults().priority(JobPriority.HIGH).jobGroup("reports"));
 * scheduler.getJobStatus(id).ifPresent(view -> System.out.println(view.toJson()));
 * }</pre>
 *
 * <p>Store failures surface as {@link JobStoreException}; a colliding job id
 * as {@link com.jobscheduler.core.DuplicateJobIdException}.</p>
 */
public class JobScheduler {
    private static final Logger logger = Logger.getLogger(JobScheduler.class.getName());

    private final JobRepository jobs;
    private final ExecutionRepository executions;
    private final NextRunCalculator calculator;
    private final String createdBy;
    private final Clock clock;

    public JobScheduler(JobRepository jobs, ExecutionRepository executions, NextRunCalculator calculator,
                        String createdBy, Clock clock) {
        this.jobs = jobs;
        this.executions = executions;
        this.calculator = calculator;
        this.createdBy = createdBy;
        this.clock = clock;
    }

    /**
     * Schedule a ONCE job.
     *
     * @return the new job id
     * @throws InvalidScheduleException if the job type is blank, runAt is null or the retry policy is negative
     */
    public String scheduleJob(String jobType, Instant runAt, Map<String, Object> parameters,
                              JobPriority priority, int maxRetries, String jobGroup) {
        return scheduleJob(jobType, runAt, options(parameters, priority, maxRetries, jobGroup));
    }

    public String scheduleJob(String jobType, Instant runAt, JobOptions options) {
        if (runAt == null) {
            throw new InvalidScheduleException("runAt is required for a one-off job");
        }
        return insert(jobType, ScheduleType.ONCE, null, runAt, options);
    }

    /**
     * Schedule a CRON job. The first run is the next firing after now.
     *
     * @return the new job id
     * @throws InvalidScheduleException if the cron expression does not parse
     */
    public String scheduleRecurringJob(String jobType, String cronExpression, Map<String, Object> parameters,
                                       JobPriority priority, int maxRetries, String jobGroup) {
        return scheduleRecurringJob(jobType, cronExpression, options(parameters, priority, maxRetries, jobGroup));
    }

    public String scheduleRecurringJob(String jobType, String cronExpression, JobOptions options) {
        String expression = cronExpression == null ? null : cronExpression.trim();
        Instant firstRun = calculator.nextRunAfter(ScheduleType.CRON, expression, clock.instant());
        return insert(jobType, ScheduleType.CRON, expression, firstRun, options);
    }

    /**
     * Schedule an INTERVAL job. The first run is {@code now + intervalSeconds}.
     *
     * @return the new job id
     * @throws InvalidScheduleException if the interval is not positive or longer than
     *         {@link NextRunCalculator#MAX_INTERVAL_SECONDS}
     */
    public String scheduleIntervalJob(String jobType, long intervalSeconds, Map<String, Object> parameters,
                                      JobPriority priority, int maxRetries, String jobGroup) {
        return scheduleIntervalJob(jobType, intervalSeconds, options(parameters, priority, maxRetries, jobGroup));
    }

    public String scheduleIntervalJob(String jobType, long intervalSeconds, JobOptions options) {
        String expression = String.valueOf(intervalSeconds);
        Instant firstRun = calculator.nextRunAfter(ScheduleType.INTERVAL, expression, clock.instant());
        return insert(jobType, ScheduleType.INTERVAL, expression, firstRun, options);
    }

    /**
     * Cancel a job that has not started. RUNNING and terminal jobs are left alone.
     *
     * @return true if the job moved to CANCELLED
     */
    public boolean cancelJob(String jobId) {
        try {
            boolean cancelled = jobs.cancel(jobId, clock.instant());
            if (cancelled) {
                logger.info("Cancelled job " + jobId);
            } else {
                logger.fine("Job " + jobId + " not cancellable (running, finished or unknown)");
            }
            return cancelled;
        } catch (SQLException e) {
            throw new JobStoreException("Failed to cancel job " + jobId, e);
        }
    }

    public Optional<JobView> getJobStatus(String jobId) {
        try {
            JobRecord job = jobs.findById(jobId);
            return job == null ? Optional.empty() : Optional.of(job.toView());
        } catch (SQLException e) {
            throw new JobStoreException("Failed to load job " + jobId, e);
        }
    }

    /**
     * Audit trail of a job, oldest attempt first. Purged rows are gone.
     */
    public List<ExecutionRecord> getExecutions(String jobId) {
        try {
            return executions.findByJobId(jobId);
        } catch (SQLException e) {
            throw new JobStoreException("Failed to load executions of job " + jobId, e);
        }
    }

    public List<JobView> findJobsByGroup(String jobGroup) {
        try {
            return jobs.findByGroup(jobGroup).stream()
                    .map(JobRecord::toView)
                    .collect(Collectors.toList());
        } catch (SQLException e) {
            throw new JobStoreException("Failed to load job group " + jobGroup, e);
        }
    }

    /**
     * Jobs in one status, oldest first. A monitor can poll FAILED jobs with this.
     */
    public List<JobView> findJobsByStatus(JobStatus status, int limit) {
        try {
            return jobs.findByStatus(status, limit).stream()
                    .map(JobRecord::toView)
                    .collect(Collectors.toList());
        } catch (SQLException e) {
            throw new JobStoreException("Failed to load " + status.name() + " jobs", e);
        }
    }

    public Map<JobStatus, Integer> getStatusCounts() {
        try {
            return jobs.countByStatus();
        } catch (SQLException e) {
            throw new JobStoreException("Failed to count jobs", e);
        }
    }

    private String insert(String jobType, ScheduleType scheduleType, String expression, Instant nextRunAt,
                          JobOptions options) {
        validate(jobType, options);

        JobRecord job = new JobRecord();
        job.setJobId(newJobId());
        job.setJobType(jobType.trim());
        job.setParameters(options.getParameters());
        job.setPriority(options.getPriority());
        job.setScheduleType(scheduleType);
        job.setScheduleExpression(expression);
        job.setNextRunAt(nextRunAt);
        job.setStatus(JobStatus.PENDING);
        job.setMaxRetries(options.getMaxRetries());
        job.setRetryDelaySeconds(options.getRetryDelaySeconds());
        job.setJobGroup(options.getJobGroup());
        job.setCreatedBy(createdBy);
        job.setCreatedAt(clock.instant());

        try {
            jobs.insertJob(job);
        } catch (SQLException e) {
            throw new JobStoreException("Failed to schedule job of type " + jobType, e);
        }

        logger.info("Scheduled " + scheduleType.name() + " job " + job.getJobId() + " (" + job.getJobType()
                + ") first run at " + nextRunAt);
        return job.getJobId();
    }

    private static void validate(String jobType, JobOptions options) {
        if (jobType == null || jobType.isBlank()) {
            throw new InvalidScheduleException("Job type must not be blank");
        }
        if (options == null) {
            throw new InvalidScheduleException("Job options must not be null");
        }
        if (options.getMaxRetries() < 0) {
            throw new InvalidScheduleException("maxRetries must not be negative, got " + options.getMaxRetries());
        }
        if (options.getRetryDelaySeconds() < 0) {
            throw new InvalidScheduleException("retryDelaySeconds must not be negative, got "
                    + options.getRetryDelaySeconds());
        }
    }

    private static JobOptions options(Map<String, Object> parameters, JobPriority priority, int maxRetries,
                                      String jobGroup) {
        return JobOptions.defaults()
                .parameters(parameters)
                .priority(priority)
                .maxRetries(maxRetries)
                .jobGroup(jobGroup);
    }

    private static String newJobId() {
        return "job_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }
}
