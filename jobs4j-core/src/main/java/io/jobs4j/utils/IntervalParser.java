package io.jobs4j.utils;

import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.List;
import java.util.Objects;
import java.util.TimeZone;

/**
 * Parses loop cadences and schedule recurrence intervals.
 * <p>
 * Supported formats:
 * <ul>
 *   <li>Numeric seconds: "90"</li>
 *   <li>Compact intervals: "30s", "5m", "2h", "1d", "1w"</li>
 *   <li>Human-readable intervals: "5 minutes", "2 hours", "1 day 3 hours"</li>
 *   <li>Cron expressions (5 or 6 fields), evaluated by Quartz {@link CronExpression}</li>
 * </ul>
 */
public final class IntervalParser {
    private IntervalParser() {
    }

    /**
     * Parses a fixed interval. Cron expressions are rejected since they have no fixed length.
     */
    public static Duration parseDuration(String spec) {
        if (spec == null) {
            throw new IllegalArgumentException("spec must not be null");
        }
        String s = spec.trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("spec must not be empty");
        }
        if (looksLikeCron(s)) {
            throw new IllegalArgumentException("cron expression has no fixed interval: " + spec);
        }
        return parseHumanDuration(s);
    }

    /**
     * Duration from {@code from} to the next cron occurrence.
     */
    public static Duration parseCronDuration(String cron, ZoneId zone, Instant from) {
        return Duration.between(from, nextCronTime(cron, zone, from));
    }

    /**
     * Next occurrence of {@code cron} strictly after {@code after}.
     */
    public static Instant nextCronTime(String cron, ZoneId zone, Instant after) {
        Objects.requireNonNull(zone, "zone must not be null");
        Objects.requireNonNull(after, "after must not be null");
        String normalized = normalizeCron(cron);
        CronExpression exp;
        try {
            exp = new CronExpression(normalized);
        } catch (ParseException ex) {
            throw new IllegalArgumentException("Invalid cron expression: " + cron, ex);
        }
        exp.setTimeZone(TimeZone.getTimeZone(zone));

        Date nextDate = exp.getNextValidTimeAfter(Date.from(after));
        if (nextDate == null) {
            throw new IllegalArgumentException("Cron expression produced no next execution time: " + cron);
        }
        return nextDate.toInstant();
    }

    /**
     * Next of the given daily wall-clock times strictly after {@code after}, in {@code zone}.
     */
    public static Instant nextDailyTime(List<LocalTime> times, ZoneId zone, Instant after) {
        if (times == null || times.isEmpty()) {
            throw new IllegalArgumentException("times must not be empty");
        }
        Objects.requireNonNull(zone, "zone must not be null");
        Objects.requireNonNull(after, "after must not be null");

        ZonedDateTime base = ZonedDateTime.ofInstant(after, zone);
        LocalDate day = base.toLocalDate();
        Instant best = null;
        // today and tomorrow always cover the next slot
        for (int offset = 0; offset <= 1 && best == null; offset++) {
            for (LocalTime time : times) {
                Instant candidate = ZonedDateTime.of(day.plusDays(offset), time, zone).toInstant();
                if (candidate.isAfter(after) && (best == null || candidate.isBefore(best))) {
                    best = candidate;
                }
            }
        }
        return best;
    }

    /**
     * Normalize cron expressions:
     * - Accepts 6-field Spring cron.
     * - Accepts 5-field cron by prepending seconds "0".
     */
    public static String normalizeCron(String spec) {
        if (spec == null) {
            throw new IllegalArgumentException("spec must not be null");
        }
        String s = spec.trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("spec must not be empty");
        }

        String[] parts = s.split("\\s+");
        if (parts.length == 5) {
            return toQuartzCron("0", parts[0], parts[1], parts[2], parts[3], parts[4]);
        }
        if (parts.length == 6) {
            return toQuartzCron(parts[0], parts[1], parts[2], parts[3], parts[4], parts[5]);
        }
        return s;
    }

    private static String toQuartzCron(String sec, String min, String hour, String dayOfMonth, String month, String dayOfWeek) {
        String dom = dayOfMonth;
        String dow = dayOfWeek;

        if ("*".equals(dom) && "*".equals(dow)) {
            dow = "?";
        } else if ("*".equals(dow)) {
            dow = "?";
        } else if ("*".equals(dom)) {
            dom = "?";
        }

        return String.join(" ", sec, min, hour, dom, month, dow);
    }

    /**
     * Returns true if the string can be parsed as a Quartz {@link CronExpression}.
     */
    public static boolean looksLikeCron(String spec) {
        if (spec == null || spec.isBlank()) {
            return false;
        }
        String[] parts = spec.trim().split("\\s+");
        if (parts.length < 5) {
            return false;
        }
        return CronExpression.isValidExpression(normalizeCron(spec));
    }

    public static Duration parseHumanDuration(String input) {
        Objects.requireNonNull(input, "input must not be null");
        String s = input.trim().toLowerCase();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("Interval string must not be empty");
        }

        if (s.matches("^\\d+$")) {
            long seconds;
            try {
                seconds = Long.parseLong(s);
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Interval seconds out of range: " + input);
            }
            if (seconds <= 0) {
                throw new IllegalArgumentException("Interval seconds must be positive: " + input);
            }
            return Duration.ofSeconds(seconds);
        }

        if (s.matches("^\\d+\\s*(ms|[smhdw])$")) {
            String digits = s.replaceAll("[^0-9]", "");
            String u = s.replaceAll("[0-9\\s]", "");
            long n = Long.parseLong(digits);
            return switch (u) {
                case "ms" -> Duration.ofMillis(n);
                case "s" -> Duration.ofSeconds(n);
                case "m" -> Duration.ofMinutes(n);
                case "h" -> Duration.ofHours(n);
                case "d" -> Duration.ofDays(n);
                case "w" -> Duration.ofDays(7L * n);
                default -> throw new IllegalArgumentException("Unsupported compact unit: " + u);
            };
        }

        String[] parts = s.split("\\s+");
        if (parts.length % 2 != 0) {
            throw new IllegalArgumentException("Invalid interval format. Expected pairs like '3 minutes': " + input);
        }

        boolean seenWeek = false, seenDay = false, seenHour = false, seenMinute = false, seenSecond = false, seenMilli = false;
        Duration total = Duration.ZERO;

        for (int i = 0; i < parts.length; i += 2) {
            long n;
            try {
                n = Long.parseLong(parts[i]);
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Invalid number in interval: " + parts[i]);
            }
            if (n < 0) {
                throw new IllegalArgumentException("Interval values must be non-negative");
            }

            String unit = parts[i + 1];
            if (unit.endsWith("s")) {
                unit = unit.substring(0, unit.length() - 1);
            }

            switch (unit) {
                case "week" -> {
                    if (seenWeek) throw new IllegalArgumentException("Duplicate unit: week");
                    seenWeek = true;
                    total = total.plus(ChronoUnit.WEEKS.getDuration().multipliedBy(n));
                }
                case "day" -> {
                    if (seenDay) throw new IllegalArgumentException("Duplicate unit: day");
                    seenDay = true;
                    total = total.plusDays(n);
                }
                case "hour" -> {
                    if (seenHour) throw new IllegalArgumentException("Duplicate unit: hour");
                    seenHour = true;
                    total = total.plusHours(n);
                }
                case "minute" -> {
                    if (seenMinute) throw new IllegalArgumentException("Duplicate unit: minute");
                    seenMinute = true;
                    total = total.plusMinutes(n);
                }
                case "second" -> {
                    if (seenSecond) throw new IllegalArgumentException("Duplicate unit: second");
                    seenSecond = true;
                    total = total.plusSeconds(n);
                }
                case "millisecond" -> {
                    if (seenMilli) throw new IllegalArgumentException("Duplicate unit: millisecond");
                    seenMilli = true;
                    total = total.plusMillis(n);
                }
                default -> throw new IllegalArgumentException("Unsupported interval unit: " + parts[i + 1]);
            }
        }

        return total;
    }
}
