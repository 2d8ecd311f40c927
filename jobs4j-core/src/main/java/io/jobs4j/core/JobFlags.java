package io.jobs4j.core;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Integer bitmask of a job's boolean state.
 *
 * <p>Groups of flags are read and written in one step, so checks like "told to stop and not yet
 * stopping" see a consistent value even when another thread flips a bit concurrently.
 */
public final class JobFlags {

    /* ==== lifecycle ==== */
    public static final int INITIALIZED = 1;
    public static final int IS_INITIALIZING = 1 << 1;
    public static final int IS_STARTING = 1 << 2;
    public static final int IS_IDLING = 1 << 3;
    public static final int TOLD_TO_STOP = 1 << 4;
    public static final int TOLD_TO_STOP_BY_SELF = 1 << 5;
    public static final int TOLD_TO_STOP_BY_FORCE = 1 << 6;
    public static final int IS_STOPPING = 1 << 7;
    public static final int STOPPED = 1 << 8;
    public static final int TOLD_TO_RESTART = 1 << 9;
    public static final int SKIP_NEXT_RUN = 1 << 10;
    public static final int COMPLETED = 1 << 11;
    public static final int TOLD_TO_COMPLETE = 1 << 12;
    public static final int KILLED = 1 << 13;
    public static final int TOLD_TO_BE_KILLED = 1 << 14;
    public static final int INTERNAL_STARTUP_KILL = 1 << 15;
    public static final int EXTERNAL_STARTUP_KILL = 1 << 16;

    /* ==== event mixins ==== */
    public static final int CLEAR_EVENTS_AT_STARTUP = 1 << 17;
    public static final int ALLOW_EVENT_QUEUE_OVERFLOW = 1 << 18;
    public static final int BLOCK_EVENTS_ON_STOP = 1 << 19;
    public static final int START_ON_EVENT_DISPATCH = 1 << 20;
    public static final int BLOCK_EVENTS_WHILE_STOPPED = 1 << 21;
    public static final int ALLOW_DOUBLE_EVENT_DISPATCH = 1 << 22;
    public static final int EVENT_DISPATCH_ENABLED = 1 << 23;
    public static final int STOP_ON_EMPTY_EVENT_QUEUE = 1 << 24;
    public static final int OE_HANDLE_ONLY_INITIAL_EVENTS = 1 << 25;
    public static final int AWAIT_EVENT_DISPATCH = 1 << 26;
    public static final int STOP_ON_EVENT_DISPATCH_TIMEOUT = 1 << 27;
    public static final int STOPPING_BY_EVENT_DISPATCH_TIMEOUT = 1 << 28;
    public static final int STOPPING_BY_EMPTY_EVENT_QUEUE = 1 << 29;
    public static final int ALLOW_EVENT_SESSION_QUEUE_OVERFLOW = 1 << 30;

    public static final int DONE = COMPLETED | KILLED;
    public static final int TOLD_TO_FINISH = TOLD_TO_COMPLETE | TOLD_TO_BE_KILLED;

    private final AtomicInteger bits = new AtomicInteger();

    public int get() {
        return bits.get();
    }

    /** True if every bit of {@code mask} is set. */
    public boolean has(int mask) {
        return (bits.get() & mask) == mask;
    }

    /** True if at least one bit of {@code mask} is set. */
    public boolean hasAny(int mask) {
        return (bits.get() & mask) != 0;
    }

    public void set(int mask) {
        bits.getAndUpdate(b -> b | mask);
    }

    public void clear(int mask) {
        bits.getAndUpdate(b -> b & ~mask);
    }

    public void set(int mask, boolean value) {
        if (value) {
            set(mask);
        } else {
            clear(mask);
        }
    }

    /**
     * Sets {@code mask} only if none of {@code unlessAny} is currently set.
     *
     * @return whether the bits were set
     */
    public boolean setUnless(int mask, int unlessAny) {
        while (true) {
            int current = bits.get();
            if ((current & unlessAny) != 0) {
                return false;
            }
            if (bits.compareAndSet(current, current | mask)) {
                return true;
            }
        }
    }

    @Override
    public String toString() {
        return "JobFlags{" + Integer.toBinaryString(bits.get()) + "}";
    }
}
