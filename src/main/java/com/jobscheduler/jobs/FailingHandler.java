package com.jobscheduler.jobs;

import com.jobscheduler.core.JobHandler;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * A handler that fails by design to exercise retry and failure accounting.
 *
 * <p>Parameters: {@code task_name} (required), {@code reason}, and an optional
 * {@code fail_times}: fail that many invocations of the task, then succeed.
 * Without it the task fails until it is marked fixed with {@link #fixTask(String)}.</p>
 */
public class FailingHandler implements JobHandler {
    private static final Logger logger = Logger.getLogger(FailingHandler.class.getName());

    public static final String TYPE = "failing_task";

    private final Set<String> fixedTasks = ConcurrentHashMap.newKeySet();
    private final Map<String, AtomicInteger> invocations = new ConcurrentHashMap<>();

    @Override
    public Object handle(Map<String, Object> parameters) {
        Object taskName = parameters.get("task_name");
        if (taskName == null) {
            throw new IllegalArgumentException("Invalid failure data: task_name is required");
        }
        String task = taskName.toString();
        Object reason = parameters.getOrDefault("reason", "unspecified");

        int invocation = invocations.computeIfAbsent(task, k -> new AtomicInteger()).incrementAndGet();
        Object failTimes = parameters.get("fail_times");
        boolean recovered = failTimes instanceof Number && invocation > ((Number) failTimes).intValue();

        if (recovered || fixedTasks.contains(task)) {
            logger.info("Task " + task + " succeeded on invocation " + invocation);
            return Map.of("task_name", task, "invocation", invocation);
        }

        logger.warning("Task " + task + " is failing: " + reason);
        throw new IllegalStateException("Simulated failure: " + reason + " (Task: " + task + ")");
    }

    /**
     * Mark a task as fixed so its next invocation succeeds.
     */
    public void fixTask(String taskName) {
        fixedTasks.add(taskName);
        logger.info("Task marked as fixed: " + taskName);
    }

    public int getInvocationCount(String taskName) {
        AtomicInteger count = invocations.get(taskName);
        return count == null ? 0 : count.get();
    }
}
