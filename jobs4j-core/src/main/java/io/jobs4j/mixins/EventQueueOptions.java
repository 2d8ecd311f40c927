package io.jobs4j.mixins;

import java.time.Duration;

/**
 * Event queue behavior of an event job.
 *
 * <p>{@code startOnEventDispatch} is ignored when {@code blockEventsWhileStopped} or
 * {@code clearEventsAtStartup} is set, since the triggering event would be dropped anyway.
 */
public final class EventQueueOptions {

    private final int maxQueueSize;
    private final boolean allowQueueOverflow;
    private final boolean blockEventsOnStop;
    private final boolean startOnEventDispatch;
    private final boolean blockEventsWhileStopped;
    private final boolean clearEventsAtStartup;
    private final boolean allowDoubleDispatch;
    private final boolean stopOnEmptyQueue;
    private final int maxHandlingsPerIteration;
    private final boolean handleOnlyInitialEvents;
    private final boolean awaitEventDispatch;
    private final Duration dispatchTimeout;
    private final boolean stopOnDispatchTimeout;
    private final int maxConcurrency;
    private final int maxSessionQueueSize;
    private final boolean allowSessionQueueOverflow;

    private EventQueueOptions(Builder b) {
        this.maxQueueSize = b.maxQueueSize;
        this.allowQueueOverflow = b.allowQueueOverflow;
        this.blockEventsOnStop = b.blockEventsOnStop;
        this.startOnEventDispatch = b.startOnEventDispatch;
        this.blockEventsWhileStopped = b.blockEventsWhileStopped;
        this.clearEventsAtStartup = b.clearEventsAtStartup;
        this.allowDoubleDispatch = b.allowDoubleDispatch;
        this.stopOnEmptyQueue = b.stopOnEmptyQueue;
        this.maxHandlingsPerIteration = b.maxHandlingsPerIteration;
        this.handleOnlyInitialEvents = b.handleOnlyInitialEvents;
        this.awaitEventDispatch = b.awaitEventDispatch;
        this.dispatchTimeout = b.dispatchTimeout;
        this.stopOnDispatchTimeout = b.stopOnDispatchTimeout;
        this.maxConcurrency = b.maxConcurrency;
        this.maxSessionQueueSize = b.maxSessionQueueSize;
        this.allowSessionQueueOverflow = b.allowSessionQueueOverflow;
    }

    public static EventQueueOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** 0 means unbounded. */
    public int maxQueueSize() {
        return maxQueueSize;
    }

    public boolean allowQueueOverflow() {
        return allowQueueOverflow;
    }

    public boolean blockEventsOnStop() {
        return blockEventsOnStop;
    }

    public boolean startOnEventDispatch() {
        return startOnEventDispatch;
    }

    public boolean blockEventsWhileStopped() {
        return blockEventsWhileStopped;
    }

    public boolean clearEventsAtStartup() {
        return clearEventsAtStartup;
    }

    public boolean allowDoubleDispatch() {
        return allowDoubleDispatch;
    }

    public boolean stopOnEmptyQueue() {
        return stopOnEmptyQueue;
    }

    /** 0 means no per-iteration limit. */
    public int maxHandlingsPerIteration() {
        return maxHandlingsPerIteration;
    }

    public boolean handleOnlyInitialEvents() {
        return handleOnlyInitialEvents;
    }

    public boolean awaitEventDispatch() {
        return awaitEventDispatch;
    }

    public Duration dispatchTimeout() {
        return dispatchTimeout;
    }

    public boolean stopOnDispatchTimeout() {
        return stopOnDispatchTimeout;
    }

    public int maxConcurrency() {
        return maxConcurrency;
    }

    /** 0 means unbounded. */
    public int maxSessionQueueSize() {
        return maxSessionQueueSize;
    }

    public boolean allowSessionQueueOverflow() {
        return allowSessionQueueOverflow;
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.maxQueueSize = maxQueueSize;
        b.allowQueueOverflow = allowQueueOverflow;
        b.blockEventsOnStop = blockEventsOnStop;
        b.startOnEventDispatch = startOnEventDispatch;
        b.blockEventsWhileStopped = blockEventsWhileStopped;
        b.clearEventsAtStartup = clearEventsAtStartup;
        b.allowDoubleDispatch = allowDoubleDispatch;
        b.stopOnEmptyQueue = stopOnEmptyQueue;
        b.maxHandlingsPerIteration = maxHandlingsPerIteration;
        b.handleOnlyInitialEvents = handleOnlyInitialEvents;
        b.awaitEventDispatch = awaitEventDispatch;
        b.dispatchTimeout = dispatchTimeout;
        b.stopOnDispatchTimeout = stopOnDispatchTimeout;
        b.maxConcurrency = maxConcurrency;
        b.maxSessionQueueSize = maxSessionQueueSize;
        b.allowSessionQueueOverflow = allowSessionQueueOverflow;
        return b;
    }

    public static final class Builder {
        private int maxQueueSize;
        private boolean allowQueueOverflow;
        private boolean blockEventsOnStop = true;
        private boolean startOnEventDispatch;
        private boolean blockEventsWhileStopped = true;
        private boolean clearEventsAtStartup = true;
        private boolean allowDoubleDispatch;
        private boolean stopOnEmptyQueue;
        private int maxHandlingsPerIteration;
        private boolean handleOnlyInitialEvents;
        private boolean awaitEventDispatch = true;
        private Duration dispatchTimeout;
        private boolean stopOnDispatchTimeout;
        private int maxConcurrency = 2;
        private int maxSessionQueueSize;
        private boolean allowSessionQueueOverflow;

        public Builder maxQueueSize(int maxQueueSize) {
            this.maxQueueSize = Math.max(0, maxQueueSize);
            return this;
        }

        /**
         * When the queue is full, drop the oldest event instead of the new one.
         */
        public Builder allowQueueOverflow(boolean allowQueueOverflow) {
            this.allowQueueOverflow = allowQueueOverflow;
            return this;
        }

        public Builder blockEventsOnStop(boolean blockEventsOnStop) {
            this.blockEventsOnStop = blockEventsOnStop;
            return this;
        }

        public Builder startOnEventDispatch(boolean startOnEventDispatch) {
            this.startOnEventDispatch = startOnEventDispatch;
            return this;
        }

        public Builder blockEventsWhileStopped(boolean blockEventsWhileStopped) {
            this.blockEventsWhileStopped = blockEventsWhileStopped;
            return this;
        }

        public Builder clearEventsAtStartup(boolean clearEventsAtStartup) {
            this.clearEventsAtStartup = clearEventsAtStartup;
            return this;
        }

        public Builder allowDoubleDispatch(boolean allowDoubleDispatch) {
            this.allowDoubleDispatch = allowDoubleDispatch;
            return this;
        }

        public Builder stopOnEmptyQueue(boolean stopOnEmptyQueue) {
            this.stopOnEmptyQueue = stopOnEmptyQueue;
            return this;
        }

        public Builder maxHandlingsPerIteration(int maxHandlingsPerIteration) {
            this.maxHandlingsPerIteration = Math.max(0, maxHandlingsPerIteration);
            return this;
        }

        public Builder handleOnlyInitialEvents(boolean handleOnlyInitialEvents) {
            this.handleOnlyInitialEvents = handleOnlyInitialEvents;
            return this;
        }

        public Builder awaitEventDispatch(boolean awaitEventDispatch) {
            this.awaitEventDispatch = awaitEventDispatch;
            return this;
        }

        public Builder dispatchTimeout(Duration dispatchTimeout) {
            if (dispatchTimeout != null && dispatchTimeout.isNegative()) {
                throw new IllegalArgumentException("dispatchTimeout must not be negative");
            }
            this.dispatchTimeout = dispatchTimeout;
            return this;
        }

        public Builder stopOnDispatchTimeout(boolean stopOnDispatchTimeout) {
            this.stopOnDispatchTimeout = stopOnDispatchTimeout;
            return this;
        }

        public Builder maxConcurrency(int maxConcurrency) {
            this.maxConcurrency = Math.max(1, maxConcurrency);
            return this;
        }

        public Builder maxSessionQueueSize(int maxSessionQueueSize) {
            this.maxSessionQueueSize = Math.max(0, maxSessionQueueSize);
            return this;
        }

        public Builder allowSessionQueueOverflow(boolean allowSessionQueueOverflow) {
            this.allowSessionQueueOverflow = allowSessionQueueOverflow;
            return this;
        }

        public EventQueueOptions build() {
            return new EventQueueOptions(this);
        }
    }
}
