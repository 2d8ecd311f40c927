package io.jobs4j.loop;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Randomized exponential backoff for reconnecting loops.
 *
 * <p>Each call to {@link #delay()} doubles the upper bound of the next delay, capped at
 * {@code base * 2^maxExponent} and at one minute. If no delay was requested for longer than the
 * reset window, the exponent starts over.
 */
public final class ExponentialBackoff {

    private static final long MAX_DELAY_MS = 60_000L;

    private final long baseMillis;
    private final int maxExponent;
    private final long resetWindowMillis;

    private int exponent;
    private long lastInvocation;

    public ExponentialBackoff() {
        this(Duration.ofSeconds(1), 10);
    }

    public ExponentialBackoff(Duration base, int maxExponent) {
        if (base == null || base.isNegative() || base.isZero()) {
            throw new IllegalArgumentException("base must be a positive duration");
        }
        if (maxExponent < 0 || maxExponent > 20) {
            throw new IllegalArgumentException("maxExponent must be between 0 and 20");
        }
        this.baseMillis = base.toMillis();
        this.maxExponent = maxExponent;
        this.resetWindowMillis = baseMillis * (1L << (maxExponent + 1));
        this.lastInvocation = System.currentTimeMillis();
    }

    public synchronized Duration delay() {
        long now = System.currentTimeMillis();
        if (now - lastInvocation > resetWindowMillis) {
            exponent = 0;
        }
        lastInvocation = now;

        exponent = Math.min(exponent + 1, maxExponent);
        long bound = Math.min(baseMillis * (1L << exponent), MAX_DELAY_MS);
        return Duration.ofMillis(ThreadLocalRandom.current().nextLong(bound + 1));
    }
}
