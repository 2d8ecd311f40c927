package io.jobs4j.loop;

import io.jobs4j.utils.IntervalParser;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Cadence of a {@link PeriodicLoop}: a relative interval, a set of daily wall-clock times, or a
 * Quartz cron expression.
 */
public final class LoopSchedule {

    public enum Kind {
        INTERVAL,
        DAILY,
        CRON
    }

    private final Kind kind;
    private final Duration interval;
    private final List<LocalTime> times;
    private final String cron;
    private final ZoneId zone;

    private LoopSchedule(Kind kind, Duration interval, List<LocalTime> times, String cron, ZoneId zone) {
        this.kind = kind;
        this.interval = interval;
        this.times = times;
        this.cron = cron;
        this.zone = zone;
    }

    /**
     * Run again {@code interval} after the previous iteration was due. A zero interval runs
     * iterations back to back.
     */
    public static LoopSchedule interval(Duration interval) {
        Objects.requireNonNull(interval, "interval must not be null");
        if (interval.isNegative()) {
            throw new IllegalArgumentException("interval must not be negative");
        }
        return new LoopSchedule(Kind.INTERVAL, interval, List.of(), null, ZoneOffset.UTC);
    }

    public static LoopSchedule immediate() {
        return interval(Duration.ZERO);
    }

    public static LoopSchedule daily(ZoneId zone, LocalTime... times) {
        Objects.requireNonNull(zone, "zone must not be null");
        if (times == null || times.length == 0) {
            throw new IllegalArgumentException("at least one daily time is required");
        }
        List<LocalTime> sorted = Arrays.stream(times)
                .map(t -> Objects.requireNonNull(t, "times must not contain null"))
                .sorted()
                .distinct()
                .toList();
        return new LoopSchedule(Kind.DAILY, Duration.ZERO, sorted, null, zone);
    }

    public static LoopSchedule daily(LocalTime... times) {
        return daily(ZoneOffset.UTC, times);
    }

    public static LoopSchedule cron(String expression, ZoneId zone) {
        Objects.requireNonNull(expression, "expression must not be null");
        Objects.requireNonNull(zone, "zone must not be null");
        String normalized = IntervalParser.normalizeCron(expression);
        if (!IntervalParser.looksLikeCron(normalized)) {
            throw new IllegalArgumentException("Invalid cron expression: " + expression);
        }
        return new LoopSchedule(Kind.CRON, Duration.ZERO, List.of(), normalized, zone);
    }

    /**
     * Parses {@code "AT 09:00,18:30"} as daily times, cron expressions as cron, and everything
     * else as a human readable interval ("5 minutes", "30s", "90").
     */
    public static LoopSchedule parse(String spec, ZoneId zone) {
        Objects.requireNonNull(spec, "spec must not be null");
        String s = spec.trim();
        if (s.regionMatches(true, 0, "AT ", 0, 3)) {
            LocalTime[] times = Arrays.stream(s.substring(3).split(","))
                    .map(String::trim)
                    .map(LocalTime::parse)
                    .toArray(LocalTime[]::new);
            return daily(zone, times);
        }
        if (IntervalParser.looksLikeCron(s)) {
            return cron(s, zone);
        }
        return interval(IntervalParser.parseDuration(s));
    }

    public Kind kind() {
        return kind;
    }

    /** Wall-clock schedules sleep before each iteration instead of after it. */
    public boolean isWallClock() {
        return kind != Kind.INTERVAL;
    }

    public Duration interval() {
        return interval;
    }

    public List<LocalTime> times() {
        return times;
    }

    public String cron() {
        return cron;
    }

    public ZoneId zone() {
        return zone;
    }

    /**
     * Next due instant strictly after {@code after} for wall-clock schedules, or
     * {@code after + interval} for interval schedules.
     */
    public Instant next(Instant after) {
        return switch (kind) {
            case INTERVAL -> after.plus(interval);
            case DAILY -> IntervalParser.nextDailyTime(times, zone, after);
            case CRON -> IntervalParser.nextCronTime(cron, zone, after);
        };
    }

    @Override
    public String toString() {
        return switch (kind) {
            case INTERVAL -> "interval(" + interval + ")";
            case DAILY -> "daily(" + times + " " + zone + ")";
            case CRON -> "cron(" + cron + " " + zone + ")";
        };
    }
}
