package com.jobscheduler.config;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Read-only worker configuration, shared by the three loops.
 *
 * <p>Recognized keys (seconds unless noted):</p>
 * <ul>
 *   <li>{@code poll_interval_seconds} - sleep between polls when nothing is due (default 30)</li>
 *   <li>{@code lock_ttl_seconds} - how long a claim is valid without refresh (default 300)</li>
 *   <li>{@code lock_refresh_interval_seconds} - lock maintenance period, must be below the TTL (default 120)</li>
 *   <li>{@code max_concurrent_jobs} - jobs run concurrently per poll cycle (default 3)</li>
 *   <li>{@code cleanup_interval_seconds} - reclaim/purge period (default 3600)</li>
 *   <li>{@code execution_retention_days} - execution history kept, in days (default 30)</li>
 *   <li>{@code shutdown_timeout_seconds} - wait for in-flight attempts on stop (default 60)</li>
 *   <li>{@code worker_id} - lock ownership token (default {@link WorkerIdentity#current()})</li>
 *   <li>{@code db.url}, {@code db.user}, {@code db.password}, {@code db.pool_size} - JDBC settings</li>
 * </ul>
 *
 * <p>{@link #load()} reads {@code scheduler.properties} from the classpath and
 * then applies JVM system properties prefixed with {@code scheduler.}.</p>
 */
public final class SchedulerConfig {
    private static final Logger logger = Logger.getLogger(SchedulerConfig.class.getName());

    public static final String RESOURCE = "scheduler.properties";
    public static final String SYSTEM_PREFIX = "scheduler.";

    private final Duration pollInterval;
    private final Duration lockTtl;
    private final Duration lockRefreshInterval;
    private final int maxConcurrentJobs;
    private final Duration cleanupInterval;
    private final Duration executionRetention;
    private final Duration shutdownTimeout;
    private final String workerId;
    private final String dbUrl;
    private final String dbUser;
    private final String dbPassword;
    private final int dbPoolSize;

    private SchedulerConfig(Builder builder) {
        this.pollInterval = builder.pollInterval;
        this.lockTtl = builder.lockTtl;
        this.lockRefreshInterval = builder.lockRefreshInterval;
        this.maxConcurrentJobs = builder.maxConcurrentJobs;
        this.cleanupInterval = builder.cleanupInterval;
        this.executionRetention = builder.executionRetention;
        this.shutdownTimeout = builder.shutdownTimeout;
        this.workerId = builder.workerId != null ? builder.workerId : WorkerIdentity.current();
        this.dbUrl = builder.dbUrl;
        this.dbUser = builder.dbUser;
        this.dbPassword = builder.dbPassword;
        this.dbPoolSize = builder.dbPoolSize;
        validate();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Defaults, overridden by {@code scheduler.properties} on the classpath,
     * overridden by {@code -Dscheduler.<key>} system properties.
     */
    public static SchedulerConfig load() {
        Properties props = new Properties();
        try (InputStream in = SchedulerConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                props.load(in);
            } else {
                logger.info(RESOURCE + " not found on classpath, using defaults");
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + RESOURCE, e);
        }

        for (String name : System.getProperties().stringPropertyNames()) {
            if (name.startsWith(SYSTEM_PREFIX)) {
                props.setProperty(name.substring(SYSTEM_PREFIX.length()), System.getProperty(name));
            }
        }

        return fromProperties(props);
    }

    /**
     * Build a config from flat properties. Missing keys keep their defaults.
     *
     * @throws IllegalArgumentException if a value is not a number or fails validation
     */
    public static SchedulerConfig fromProperties(Properties props) {
        Builder builder = builder();

        if (props.containsKey("poll_interval_seconds")) {
            builder.pollInterval(Duration.ofSeconds(longValue(props, "poll_interval_seconds")));
        }
        if (props.containsKey("lock_ttl_seconds")) {
            builder.lockTtl(Duration.ofSeconds(longValue(props, "lock_ttl_seconds")));
        }
        if (props.containsKey("lock_refresh_interval_seconds")) {
            builder.lockRefreshInterval(Duration.ofSeconds(longValue(props, "lock_refresh_interval_seconds")));
        }
        if (props.containsKey("max_concurrent_jobs")) {
            builder.maxConcurrentJobs((int) longValue(props, "max_concurrent_jobs"));
        }
        if (props.containsKey("cleanup_interval_seconds")) {
            builder.cleanupInterval(Duration.ofSeconds(longValue(props, "cleanup_interval_seconds")));
        }
        if (props.containsKey("execution_retention_days")) {
            builder.executionRetention(Duration.ofDays(longValue(props, "execution_retention_days")));
        }
        if (props.containsKey("shutdown_timeout_seconds")) {
            builder.shutdownTimeout(Duration.ofSeconds(longValue(props, "shutdown_timeout_seconds")));
        }

        String workerId = props.getProperty("worker_id");
        if (workerId != null && !workerId.isBlank()) {
            builder.workerId(workerId.trim());
        }

        builder.database(
                props.getProperty("db.url", Builder.DEFAULT_DB_URL),
                props.getProperty("db.user", Builder.DEFAULT_DB_USER),
                props.getProperty("db.password", ""),
                props.containsKey("db.pool_size") ? (int) longValue(props, "db.pool_size") : Builder.DEFAULT_POOL_SIZE);

        return builder.build();
    }

    private static long longValue(Properties props, String key) {
        String raw = props.getProperty(key).trim();
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Config key " + key + " must be an integer, got '" + raw + "'", e);
        }
    }

    private void validate() {
        requirePositive("poll_interval", pollInterval);
        requirePositive("lock_ttl", lockTtl);
        requirePositive("lock_refresh_interval", lockRefreshInterval);
        requirePositive("cleanup_interval", cleanupInterval);
        requirePositive("execution_retention", executionRetention);
        if (shutdownTimeout.isNegative()) {
            throw new IllegalArgumentException("shutdown_timeout must not be negative");
        }
        if (maxConcurrentJobs < 1) {
            throw new IllegalArgumentException("max_concurrent_jobs must be at least 1, got " + maxConcurrentJobs);
        }
        // A refresh slower than the TTL lets cleanup reclaim locks of live jobs
        if (lockRefreshInterval.compareTo(lockTtl) >= 0) {
            throw new IllegalArgumentException("lock_refresh_interval (" + lockRefreshInterval
                    + ") must be shorter than lock_ttl (" + lockTtl + ")");
        }
        if (dbPoolSize < 1) {
            throw new IllegalArgumentException("db.pool_size must be at least 1, got " + dbPoolSize);
        }
        if (workerId.isBlank()) {
            throw new IllegalArgumentException("worker_id must not be blank");
        }
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive, got " + value);
        }
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public Duration getLockTtl() {
        return lockTtl;
    }

    public Duration getLockRefreshInterval() {
        return lockRefreshInterval;
    }

    public int getMaxConcurrentJobs() {
        return maxConcurrentJobs;
    }

    public Duration getCleanupInterval() {
        return cleanupInterval;
    }

    public Duration getExecutionRetention() {
        return executionRetention;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public String getWorkerId() {
        return workerId;
    }

    public String getDbUrl() {
        return dbUrl;
    }

    public String getDbUser() {
        return dbUser;
    }

    public String getDbPassword() {
        return dbPassword;
    }

    public int getDbPoolSize() {
        return dbPoolSize;
    }

    @Override
    public String toString() {
        return "SchedulerConfig{workerId=" + workerId
                + ", pollInterval=" + pollInterval
                + ", lockTtl=" + lockTtl
                + ", lockRefreshInterval=" + lockRefreshInterval
                + ", maxConcurrentJobs=" + maxConcurrentJobs
                + ", cleanupInterval=" + cleanupInterval
                + ", executionRetention=" + executionRetention
                + ", dbUrl=" + dbUrl + "}";
    }

    public static final class Builder {
        static final String DEFAULT_DB_URL = "jdbc:h2:./jobscheduler;AUTO_SERVER=TRUE";
        static final String DEFAULT_DB_USER = "sa";
        static final int DEFAULT_POOL_SIZE = 10;

        private Duration pollInterval = Duration.ofSeconds(30);
        private Duration lockTtl = Duration.ofSeconds(300);
        private Duration lockRefreshInterval = Duration.ofSeconds(120);
        private int maxConcurrentJobs = 3;
        private Duration cleanupInterval = Duration.ofHours(1);
        private Duration executionRetention = Duration.ofDays(30);
        private Duration shutdownTimeout = Duration.ofSeconds(60);
        private String workerId;
        private String dbUrl = DEFAULT_DB_URL;
        private String dbUser = DEFAULT_DB_USER;
        private String dbPassword = "";
        private int dbPoolSize = DEFAULT_POOL_SIZE;

        private Builder() {
        }

        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder lockTtl(Duration lockTtl) {
            this.lockTtl = lockTtl;
            return this;
        }

        public Builder lockRefreshInterval(Duration lockRefreshInterval) {
            this.lockRefreshInterval = lockRefreshInterval;
            return this;
        }

        public Builder maxConcurrentJobs(int maxConcurrentJobs) {
            this.maxConcurrentJobs = maxConcurrentJobs;
            return this;
        }

        public Builder cleanupInterval(Duration cleanupInterval) {
            this.cleanupInterval = cleanupInterval;
            return this;
        }

        public Builder executionRetention(Duration executionRetention) {
            this.executionRetention = executionRetention;
            return this;
        }

        public Builder shutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
            return this;
        }

        public Builder workerId(String workerId) {
            this.workerId = workerId;
            return this;
        }

        public Builder database(String url, String user, String password, int poolSize) {
            this.dbUrl = url;
            this.dbUser = user;
            this.dbPassword = password;
            this.dbPoolSize = poolSize;
            return this;
        }

        public SchedulerConfig build() {
            return new SchedulerConfig(this);
        }
    }
}
