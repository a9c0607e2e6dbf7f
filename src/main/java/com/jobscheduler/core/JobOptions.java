package com.jobscheduler.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Optional settings for a scheduling call.
 *
 * <p><b>Usage:</b></p>
 * <pre>{@code
 * scheduler.scheduleJob("send_receipt", runAt, JobOptions.defaults()
 *         .parameters(Map.of("orderId", 42))
 *         .priority(JobPriority.HIGH)
 *         .maxRetries(5)
 *         .jobGroup("receipts"));
 * }</pre>
 */
public class JobOptions {
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final int DEFAULT_RETRY_DELAY_SECONDS = 60;

    private Map<String, Object> parameters = Collections.emptyMap();
    private JobPriority priority = JobPriority.NORMAL;
    private int maxRetries = DEFAULT_MAX_RETRIES;
    private int retryDelaySeconds = DEFAULT_RETRY_DELAY_SECONDS;
    private String jobGroup;

    public static JobOptions defaults() {
        return new JobOptions();
    }

    public JobOptions parameters(Map<String, Object> parameters) {
        this.parameters = parameters == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        return this;
    }

    public JobOptions priority(JobPriority priority) {
        this.priority = priority == null ? JobPriority.NORMAL : priority;
        return this;
    }

    public JobOptions maxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
        return this;
    }

    public JobOptions retryDelaySeconds(int retryDelaySeconds) {
        this.retryDelaySeconds = retryDelaySeconds;
        return this;
    }

    public JobOptions jobGroup(String jobGroup) {
        this.jobGroup = jobGroup;
        return this;
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }

    public JobPriority getPriority() {
        return priority;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public int getRetryDelaySeconds() {
        return retryDelaySeconds;
    }

    public String getJobGroup() {
        return jobGroup;
    }
}
