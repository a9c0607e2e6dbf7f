package com.jobscheduler.app;

import com.jobscheduler.api.JobScheduler;
import com.jobscheduler.api.PersistentJobService;
import com.jobscheduler.config.SchedulerConfig;
import com.jobscheduler.core.JobOptions;
import com.jobscheduler.core.JobPriority;
import com.jobscheduler.db.Database;
import com.jobscheduler.jobs.EmailNotificationHandler;
import com.jobscheduler.jobs.FailingHandler;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Command-line entry point: runs one worker until the JVM is asked to stop.
 *
 * <p>Configuration comes from {@code scheduler.properties} and
 * {@code -Dscheduler.<key>} overrides. Pass {@code --demo} to schedule a few
 * sample jobs on startup.</p>
 */
public class WorkerMain {
    private static final Logger logger = Logger.getLogger(WorkerMain.class.getName());

    public static void main(String[] args) {
        configureLogging();
        logger.info("=== Persistent Job Scheduler Starting ===");

        Database database = null;
        try {
            SchedulerConfig config = SchedulerConfig.load();

            // 1. Database and schema
            database = new Database(config.getDbUrl(), config.getDbUser(), config.getDbPassword(),
                    config.getDbPoolSize());
            database.initialize();

            // 2. Worker with its handlers
            PersistentJobService service = new PersistentJobService(config, database);
            service.getRegistry().register(EmailNotificationHandler.TYPE, new EmailNotificationHandler());
            service.getRegistry().register(FailingHandler.TYPE, new FailingHandler());

            if (hasFlag(args, "--demo")) {
                submitDemoJobs(service.getScheduler());
            }

            // 3. Loops, and a hook that stops them on Ctrl+C
            CountDownLatch stopped = new CountDownLatch(1);
            Database ownedDatabase = database;
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutdown signal received");
                service.stop();
                ownedDatabase.close();
                stopped.countDown();
            }, "scheduler-shutdown"));

            service.start();
            logger.info("=== Worker " + config.getWorkerId() + " is running, press Ctrl+C to stop ===");

            stopped.await();

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Main thread interrupted");
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Fatal error during startup", e);
            if (database != null) {
                database.close();
            }
            System.exit(1);
        }
    }

    private static void submitDemoJobs(JobScheduler scheduler) {
        Instant now = Instant.now();

        scheduler.scheduleJob(EmailNotificationHandler.TYPE, now, JobOptions.defaults()
                .parameters(Map.of("to", "ops@example.com", "subject", "Worker started"))
                .priority(JobPriority.HIGH)
                .jobGroup("demo"));

        scheduler.scheduleIntervalJob(EmailNotificationHandler.TYPE, 60, JobOptions.defaults()
                .parameters(Map.of("to", "digest@example.com", "subject", "Minute digest"))
                .jobGroup("demo"));

        scheduler.scheduleRecurringJob(EmailNotificationHandler.TYPE, "*/5 * * * *", JobOptions.defaults()
                .parameters(Map.of("to", "reports@example.com", "subject", "Five-minute report"))
                .jobGroup("demo"));

        scheduler.scheduleJob(FailingHandler.TYPE, now, JobOptions.defaults()
                .parameters(Map.of("task_name", "flaky-import", "reason", "upstream timeout", "fail_times", 1))
                .maxRetries(2)
                .retryDelaySeconds(5)
                .jobGroup("demo"));

        logger.info("Submitted demo jobs in group 'demo'");
    }

    private static boolean hasFlag(String[] args, String flag) {
        for (String arg : args) {
            if (flag.equals(arg)) {
                return true;
            }
        }
        return false;
    }

    // Bundled logging.properties, unless -Djava.util.logging.config.file points elsewhere
    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = WorkerMain.class.getClassLoader().getResourceAsStream("logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("Could not load logging.properties: " + e.getMessage());
        }
    }
}
