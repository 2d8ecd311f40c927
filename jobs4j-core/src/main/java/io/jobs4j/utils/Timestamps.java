package io.jobs4j.utils;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Epoch nanosecond timestamps used in runtime and schedule identifiers.
 */
public final class Timestamps {

    private static final AtomicLong LAST_UNIQUE = new AtomicLong();

    private Timestamps() {
    }

    public static long epochNanos(Instant instant) {
        return Math.addExact(Math.multiplyExact(instant.getEpochSecond(), 1_000_000_000L), instant.getNano());
    }

    public static Instant fromEpochNanos(long nanos) {
        return Instant.ofEpochSecond(Math.floorDiv(nanos, 1_000_000_000L), Math.floorMod(nanos, 1_000_000_000L));
    }

    public static long nowNanos() {
        return epochNanos(Instant.now());
    }

    /**
     * Current epoch nanoseconds, strictly greater than every value returned before in this process.
     */
    public static long uniqueNowNanos() {
        long now = nowNanos();
        return LAST_UNIQUE.updateAndGet(prev -> Math.max(prev + 1, now));
    }
}
