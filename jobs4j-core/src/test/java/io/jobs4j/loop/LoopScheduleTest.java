package io.jobs4j.loop;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LoopScheduleTest {

    @Test
    void parseShouldPickScheduleKind() {
        assertEquals(LoopSchedule.Kind.INTERVAL, LoopSchedule.parse("5 minutes", ZoneOffset.UTC).kind());
        assertEquals(LoopSchedule.Kind.DAILY, LoopSchedule.parse("AT 09:00,18:30", ZoneOffset.UTC).kind());
        assertEquals(LoopSchedule.Kind.CRON, LoopSchedule.parse("*/5 * * * *", ZoneOffset.UTC).kind());
    }

    @Test
    void intervalScheduleShouldAddIntervalToPreviousDueTime() {
        LoopSchedule schedule = LoopSchedule.interval(Duration.ofSeconds(30));
        Instant due = Instant.parse("2026-01-01T00:00:00Z");

        assertFalse(schedule.isWallClock());
        assertEquals(due.plusSeconds(30), schedule.next(due));
    }

    @Test
    void dailyScheduleShouldSortTimes() {
        LoopSchedule schedule = LoopSchedule.daily(LocalTime.of(18, 0), LocalTime.of(6, 0));

        assertTrue(schedule.isWallClock());
        assertEquals(LocalTime.of(6, 0), schedule.times().get(0));
        assertEquals(Instant.parse("2026-01-01T18:00:00Z"), schedule.next(Instant.parse("2026-01-01T07:00:00Z")));
    }

    @Test
    void negativeIntervalShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> LoopSchedule.interval(Duration.ofSeconds(-1)));
    }
}
