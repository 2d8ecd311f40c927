package io.jobs4j.utils;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IntervalParserTest {

    @Test
    void parseHumanDurationShouldWork() {
        assertEquals(Duration.ofMinutes(5), IntervalParser.parseDuration("5 minutes"));
        assertEquals(Duration.ofHours(27), IntervalParser.parseDuration("1 day 3 hours"));
    }

    @Test
    void parseDurationShouldSupportCompactAndNumericForms() {
        assertEquals(Duration.ofSeconds(90), IntervalParser.parseDuration("90"));
        assertEquals(Duration.ofMillis(250), IntervalParser.parseDuration("250ms"));
        assertEquals(Duration.ofDays(14), IntervalParser.parseDuration("2w"));
    }

    @Test
    void parseDurationShouldRejectCronAndDuplicates() {
        assertThrows(IllegalArgumentException.class, () -> IntervalParser.parseDuration("*/5 * * * *"));
        assertThrows(IllegalArgumentException.class, () -> IntervalParser.parseDuration("1 hour 2 hours"));
        assertThrows(IllegalArgumentException.class, () -> IntervalParser.parseDuration(" "));
    }

    @Test
    void parseCronDurationShouldSupportFiveFieldCron() {
        Duration duration = IntervalParser.parseCronDuration("*/5 * * * *", ZoneOffset.UTC,
                Instant.parse("2026-01-01T00:01:00Z"));
        assertEquals(Duration.ofMinutes(4), duration);
    }

    @Test
    void nextCronTimeShouldBeStrictlyAfter() {
        Instant next = IntervalParser.nextCronTime("*/5 * * * *", ZoneOffset.UTC, Instant.parse("2026-01-01T00:05:00Z"));
        assertEquals(Instant.parse("2026-01-01T00:10:00Z"), next);
    }

    @Test
    void nextDailyTimeShouldRollOverToTomorrow() {
        List<LocalTime> times = List.of(LocalTime.of(10, 0), LocalTime.of(18, 30));

        assertEquals(Instant.parse("2026-01-01T18:30:00Z"),
                IntervalParser.nextDailyTime(times, ZoneId.of("UTC"), Instant.parse("2026-01-01T10:00:00Z")));
        assertEquals(Instant.parse("2026-01-02T10:00:00Z"),
                IntervalParser.nextDailyTime(times, ZoneId.of("UTC"), Instant.parse("2026-01-01T19:00:00Z")));
    }

    @Test
    void looksLikeCronShouldRecognizeValidSpec() {
        assertTrue(IntervalParser.looksLikeCron("0 */10 * * * *"));
        assertFalse(IntervalParser.looksLikeCron("5 minutes"));
    }
}
