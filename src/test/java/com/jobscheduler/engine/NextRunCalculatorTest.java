package com.jobscheduler.engine;

import com.jobscheduler.core.InvalidScheduleException;
import com.jobscheduler.core.ScheduleType;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

public class NextRunCalculatorTest {

    private final NextRunCalculator calculator = new NextRunCalculator();

    @Test
    public void testCronNextFiringIsStrictlyAfterReference() {
        Instant onTheHour = Instant.parse("2024-01-15T10:00:00Z");

        assertEquals(Instant.parse("2024-01-15T11:00:00Z"),
                calculator.nextRunAfter(ScheduleType.CRON, "0 * * * *", onTheHour),
                "A reference exactly on a firing moves to the following one");
        assertEquals(Instant.parse("2024-01-15T10:05:00Z"),
                calculator.nextRunAfter(ScheduleType.CRON, "*/5 * * * *", Instant.parse("2024-01-15T10:01:30Z")));
    }

    @Test
    public void testCronIsEvaluatedInUtc() {
        assertEquals(Instant.parse("2024-01-16T02:00:00Z"),
                calculator.nextRunAfter(ScheduleType.CRON, "0 2 * * *", Instant.parse("2024-01-15T10:00:00Z")));
    }

    @Test
    public void testIntervalAddsSeconds() {
        Instant reference = Instant.parse("2024-01-15T10:00:07Z");
        assertEquals(reference.plusSeconds(60), calculator.nextRunAfter(ScheduleType.INTERVAL, "60", reference));
        assertEquals(reference.plusSeconds(90), calculator.nextRunAfter(ScheduleType.INTERVAL, " 90 ", reference));
    }

    @Test
    public void testIntervalIsBounded() {
        Instant reference = Instant.parse("2024-01-15T10:00:00Z");
        long max = NextRunCalculator.MAX_INTERVAL_SECONDS;

        assertEquals(reference.plusSeconds(max),
                calculator.nextRunAfter(ScheduleType.INTERVAL, String.valueOf(max), reference));
        assertThrows(InvalidScheduleException.class,
                () -> calculator.validate(ScheduleType.INTERVAL, String.valueOf(max + 1)));
        assertThrows(InvalidScheduleException.class,
                () -> calculator.nextRunAfter(ScheduleType.INTERVAL, String.valueOf(Long.MAX_VALUE), reference));
        assertThrows(InvalidScheduleException.class,
                () -> calculator.nextRunAfter(ScheduleType.INTERVAL, "60", Instant.MAX));
    }

    @Test
    public void testOnceHasNoNextRun() {
        assertNull(calculator.nextRunAfter(ScheduleType.ONCE, null, Instant.parse("2024-01-15T10:00:00Z")));
    }

    @Test
    public void testInvalidExpressionsAreRejected() {
        assertThrows(InvalidScheduleException.class, () -> calculator.validate(ScheduleType.CRON, "not a cron"));
        assertThrows(InvalidScheduleException.class, () -> calculator.validate(ScheduleType.CRON, "61 * * * *"));
        assertThrows(InvalidScheduleException.class, () -> calculator.validate(ScheduleType.CRON, ""));
        assertThrows(InvalidScheduleException.class, () -> calculator.validate(ScheduleType.INTERVAL, "0"));
        assertThrows(InvalidScheduleException.class, () -> calculator.validate(ScheduleType.INTERVAL, "-5"));
        assertThrows(InvalidScheduleException.class, () -> calculator.validate(ScheduleType.INTERVAL, "1.5"));
        assertThrows(InvalidScheduleException.class, () -> calculator.validate(ScheduleType.INTERVAL, null));

        assertDoesNotThrow(() -> calculator.validate(ScheduleType.CRON, "0 2 * * 1-5"));
        assertDoesNotThrow(() -> calculator.validate(ScheduleType.ONCE, null));
    }
}
