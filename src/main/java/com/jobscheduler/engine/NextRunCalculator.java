package com.jobscheduler.engine;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinition;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import com.jobscheduler.core.InvalidScheduleException;
import com.jobscheduler.core.ScheduleType;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * Computes {@code next_run_at} for recurring jobs.
 *
 * <ul>
 *   <li>CRON: five-field UNIX cron, evaluated in UTC; the next firing strictly after the reference time</li>
 *   <li>INTERVAL: reference time plus a positive number of seconds, at most about a century</li>
 *   <li>ONCE: never re-armed, so there is no next run</li>
 * </ul>
 *
 * <p>The same validation runs when a job is scheduled and when it is re-armed,
 * so a bad expression is rejected at call time rather than at first execution.</p>
 */
public final class NextRunCalculator {
    /** About a century; anything longer is a typo, not a schedule. */
    public static final long MAX_INTERVAL_SECONDS = Duration.ofDays(36_500).getSeconds();

    private static final CronDefinition CRON_DEFINITION = CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX);

    private final CronParser parser = new CronParser(CRON_DEFINITION);

    /**
     * Reject an expression that can never produce a run time.
     *
     * @throws InvalidScheduleException if the expression does not parse for its type
     */
    public void validate(ScheduleType scheduleType, String expression) {
        switch (scheduleType) {
            case CRON -> parseCron(expression);
            case INTERVAL -> parseIntervalSeconds(expression);
            case ONCE -> {
                // nothing to parse
            }
        }
    }

    /**
     * The run after {@code reference}.
     *
     * @param scheduleType the job's schedule type
     * @param expression cron expression or interval seconds
     * @param reference completion time of the last run, or now for a new job
     * @return the next run time, or null for ONCE jobs
     * @throws InvalidScheduleException if the expression is invalid or a cron never fires again
     */
    public Instant nextRunAfter(ScheduleType scheduleType, String expression, Instant reference) {
        return switch (scheduleType) {
            case CRON -> nextCronFiring(parseCron(expression), expression, reference);
            case INTERVAL -> plusInterval(reference, parseIntervalSeconds(expression));
            case ONCE -> null;
        };
    }

    /**
     * @throws InvalidScheduleException if the value is not a positive integer
     *         no larger than {@link #MAX_INTERVAL_SECONDS}
     */
    public long parseIntervalSeconds(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidScheduleException("Interval seconds are required");
        }
        long seconds;
        try {
            seconds = Long.parseLong(expression.trim());
        } catch (NumberFormatException e) {
            throw new InvalidScheduleException("Interval must be whole seconds, got '" + expression + "'", e);
        }
        if (seconds <= 0) {
            throw new InvalidScheduleException("Interval must be positive, got " + seconds);
        }
        if (seconds > MAX_INTERVAL_SECONDS) {
            throw new InvalidScheduleException("Interval must be at most " + MAX_INTERVAL_SECONDS
                    + " seconds, got " + seconds);
        }
        return seconds;
    }

    private static Instant plusInterval(Instant reference, long seconds) {
        try {
            return reference.plusSeconds(seconds);
        } catch (DateTimeException | ArithmeticException e) {
            throw new InvalidScheduleException("Interval of " + seconds + "s overflows from " + reference, e);
        }
    }

    private Cron parseCron(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidScheduleException("Cron expression is required");
        }
        try {
            Cron cron = parser.parse(expression.trim());
            cron.validate();
            return cron;
        } catch (IllegalArgumentException e) {
            throw new InvalidScheduleException("Invalid cron expression '" + expression + "': " + e.getMessage(), e);
        }
    }

    private static Instant nextCronFiring(Cron cron, String expression, Instant reference) {
        ZonedDateTime base = ZonedDateTime.ofInstant(reference, ZoneOffset.UTC);
        return ExecutionTime.forCron(cron).nextExecution(base)
                .map(ZonedDateTime::toInstant)
                .orElseThrow(() -> new InvalidScheduleException("Cron expression '" + expression
                        + "' has no firing after " + reference));
    }
}
