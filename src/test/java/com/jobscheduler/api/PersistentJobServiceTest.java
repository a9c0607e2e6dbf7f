package com.jobscheduler.api;

import com.jobscheduler.config.SchedulerConfig;
import com.jobscheduler.core.ExecutionStatus;
import com.jobscheduler.core.JobOptions;
import com.jobscheduler.core.JobStatus;
import com.jobscheduler.db.Database;
import com.jobscheduler.db.ExecutionRecord;
import com.jobscheduler.db.JobRecord;
import com.jobscheduler.db.JobRepository;
import com.jobscheduler.jobs.FailingHandler;
import com.jobscheduler.testing.TestDatabases;
import org.json.JSONObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Whole workers running their real loops against a shared in-memory store.
 */
public class PersistentJobServiceTest {

    private Database database;
    private final List<PersistentJobService> services = new ArrayList<>();

    @BeforeEach
    public void setUp() throws SQLException {
        database = TestDatabases.fresh();
    }

    @AfterEach
    public void tearDown() {
        services.forEach(PersistentJobService::stop);
        database.close();
    }

    @Test
    public void testJobRunsToCompletion() throws Exception {
        PersistentJobService service = newService("worker-a", Duration.ofSeconds(2));
        service.getRegistry().register("echo", params -> params.get("message"));
        service.start();

        String id = service.getScheduler().scheduleJob("echo", Instant.now(),
                JobOptions.defaults().parameters(Map.of("message", "hello")));

        awaitStatus(service, id, JobStatus.COMPLETED);

        List<ExecutionRecord> history = service.getScheduler().getExecutions(id);
        assertEquals(1, history.size());
        assertEquals(ExecutionStatus.SUCCESS, history.get(0).getStatus());
        assertEquals("\"hello\"", history.get(0).getResult());
        assertNull(service.getScheduler().getJobStatus(id).orElseThrow().getLockedBy());

        JSONObject status = service.getStatus();
        assertEquals("worker-a", status.getString("worker_id"));
        assertTrue(status.getBoolean("running"));
        assertEquals(1, status.getJSONObject("attempts").getLong("succeeded"));
        assertEquals(1, status.getJSONObject("jobs").getInt("COMPLETED"));
        assertEquals("echo", status.getJSONArray("registered_types").getString(0));
        assertEquals(0, status.getJSONObject("loop_restarts").getInt("execution-engine"));
    }

    @Test
    public void testFailingJobRetriesThenSucceeds() throws Exception {
        PersistentJobService service = newService("worker-a", Duration.ofSeconds(2));
        FailingHandler failing = new FailingHandler();
        service.getRegistry().register(FailingHandler.TYPE, failing);
        service.start();

        String id = service.getScheduler().scheduleJob(FailingHandler.TYPE, Instant.now(),
                JobOptions.defaults()
                        .parameters(Map.of("task_name", "flaky-import", "fail_times", 2))
                        .maxRetries(3)
                        .retryDelaySeconds(0));

        awaitStatus(service, id, JobStatus.COMPLETED);

        assertEquals(3, failing.getInvocationCount("flaky-import"));
        List<ExecutionRecord> history = service.getScheduler().getExecutions(id);
        assertEquals(List.of(ExecutionStatus.RETRY_SCHEDULED, ExecutionStatus.RETRY_SCHEDULED, ExecutionStatus.SUCCESS),
                List.of(history.get(0).getStatus(), history.get(1).getStatus(), history.get(2).getStatus()));
    }

    @Test
    public void testTwoWorkersRunEachJobExactlyOnce() throws Exception {
        Map<String, AtomicInteger> runs = new ConcurrentHashMap<>();
        PersistentJobService first = newService("worker-a", Duration.ofSeconds(2));
        PersistentJobService second = newService("worker-b", Duration.ofSeconds(2));
        for (PersistentJobService service : List.of(first, second)) {
            service.getRegistry().register("count", params -> {
                runs.computeIfAbsent((String) params.get("key"), k -> new AtomicInteger()).incrementAndGet();
                Thread.sleep(5);
                return null;
            });
        }

        Instant now = Instant.now();
        for (int i = 0; i < 30; i++) {
            first.getScheduler().scheduleJob("count", now, JobOptions.defaults().parameters(Map.of("key", "k" + i)));
        }
        first.start();
        second.start();

        await(() -> first.getScheduler().getStatusCounts().get(JobStatus.COMPLETED) == 30);

        assertEquals(30, runs.size());
        runs.forEach((key, count) -> assertEquals(1, count.get(), "Job " + key + " ran more than once"));
        long attempts = first.getEngine().getSucceededCount() + second.getEngine().getSucceededCount();
        assertEquals(30, attempts);
    }

    @Test
    public void testStopReleasesLocksOfInterruptedJobs() throws Exception {
        PersistentJobService service = newService("worker-a", Duration.ofMillis(300));
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch never = new CountDownLatch(1);
        service.getRegistry().register("stuck", params -> {
            started.countDown();
            never.await(30, TimeUnit.SECONDS);
            return null;
        });
        service.start();

        String id = service.getScheduler().scheduleJob("stuck", Instant.now(), JobOptions.defaults());
        assertTrue(started.await(5, TimeUnit.SECONDS));

        service.stop();

        assertFalse(service.isRunning());
        JobRecord job = new JobRepository(database).findById(id);
        assertNull(job.getLockedBy(), "Another worker can take the job over at once");
        assertThrows(IllegalStateException.class, service::start);
    }

    @Test
    public void testStartTwiceIsNoOp() {
        PersistentJobService service = newService("worker-a", Duration.ofSeconds(1));
        service.start();
        service.start();
        assertTrue(service.isRunning());
        service.stop();
        service.stop();
        assertFalse(service.isRunning());
    }

    private PersistentJobService newService(String workerId, Duration shutdownTimeout) {
        SchedulerConfig config = SchedulerConfig.builder()
                .workerId(workerId)
                .pollInterval(Duration.ofMillis(50))
                .lockTtl(Duration.ofSeconds(10))
                .lockRefreshInterval(Duration.ofSeconds(2))
                .maxConcurrentJobs(3)
                .cleanupInterval(Duration.ofSeconds(1))
                .shutdownTimeout(shutdownTimeout)
                .build();
        PersistentJobService service = new PersistentJobService(config, database);
        services.add(service);
        return service;
    }

    private static void awaitStatus(PersistentJobService service, String jobId, JobStatus expected)
            throws InterruptedException {
        await(() -> service.getScheduler().getJobStatus(jobId).orElseThrow().getStatus() == expected);
    }

    private static void await(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("Condition not met within 10s");
            }
            Thread.sleep(20);
        }
    }
}
