package io.jobs4j.mixins;

import io.jobs4j.core.JobFlags;
import io.jobs4j.core.JobStopReason;
import io.jobs4j.events.JobEvent;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Event queue shared by the single and multi event mixins.
 *
 * <p>Queue options that are plain switches live in the host's {@link JobFlags}, so they can be
 * flipped at runtime and read together with the job's lifecycle bits.
 */
public abstract class EventQueueMixin<E extends JobEvent> implements JobMixin, EventSource {

    protected final MixinHost host;
    protected final EventQueueOptions options;

    private final Set<Class<? extends JobEvent>> eventTypes;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final ArrayDeque<JobEvent> queue = new ArrayDeque<>();

    // bumped to wake up and abort every pending wait
    private int waitGeneration;

    protected EventQueueMixin(MixinHost host, Set<Class<? extends E>> eventTypes, EventQueueOptions options) {
        this.host = Objects.requireNonNull(host, "host must not be null");
        this.options = options != null ? options : EventQueueOptions.defaults();
        Objects.requireNonNull(eventTypes, "eventTypes must not be null");
        if (eventTypes.isEmpty()) {
            throw new IllegalArgumentException("eventTypes must not be empty");
        }
        this.eventTypes = Set.copyOf(eventTypes);

        JobFlags flags = host.flags();
        flags.set(JobFlags.EVENT_DISPATCH_ENABLED);
        flags.set(JobFlags.ALLOW_EVENT_QUEUE_OVERFLOW, this.options.allowQueueOverflow());
        flags.set(JobFlags.BLOCK_EVENTS_ON_STOP, this.options.blockEventsOnStop());
        flags.set(JobFlags.BLOCK_EVENTS_WHILE_STOPPED, this.options.blockEventsWhileStopped());
        flags.set(JobFlags.CLEAR_EVENTS_AT_STARTUP, this.options.clearEventsAtStartup());
        flags.set(JobFlags.ALLOW_DOUBLE_EVENT_DISPATCH, this.options.allowDoubleDispatch());
        flags.set(JobFlags.STOP_ON_EMPTY_EVENT_QUEUE, this.options.stopOnEmptyQueue());
        flags.set(JobFlags.OE_HANDLE_ONLY_INITIAL_EVENTS, this.options.handleOnlyInitialEvents());
        flags.set(JobFlags.AWAIT_EVENT_DISPATCH, this.options.awaitEventDispatch());
        flags.set(JobFlags.STOP_ON_EVENT_DISPATCH_TIMEOUT, this.options.stopOnDispatchTimeout());
        flags.set(JobFlags.START_ON_EVENT_DISPATCH, this.options.startOnEventDispatch()
                && !this.options.blockEventsWhileStopped()
                && !this.options.clearEventsAtStartup());
    }

    @Override
    public Set<Class<? extends JobEvent>> eventTypes() {
        return eventTypes;
    }

    @Override
    public boolean eventCheck(JobEvent event) {
        return true;
    }

    @Override
    public boolean allowsDoubleDispatch() {
        return host.flags().has(JobFlags.ALLOW_DOUBLE_EVENT_DISPATCH);
    }

    @Override
    public boolean addEvent(JobEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        JobFlags flags = host.flags();
        if (!flags.has(JobFlags.EVENT_DISPATCH_ENABLED)) {
            return false;
        }
        if (flags.has(JobFlags.BLOCK_EVENTS_ON_STOP) && host.isStopping()) {
            return false;
        }
        boolean running = host.isRunning();
        if (flags.has(JobFlags.BLOCK_EVENTS_WHILE_STOPPED) && !running) {
            return false;
        }

        lock.lock();
        try {
            int max = options.maxQueueSize();
            if (max > 0 && queue.size() >= max) {
                if (!flags.has(JobFlags.ALLOW_EVENT_QUEUE_OVERFLOW)) {
                    return false;
                }
                queue.pollFirst();
            }
            queue.addLast(event);
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }

        if (!running && flags.has(JobFlags.START_ON_EVENT_DISPATCH)) {
            host.start();
        }
        return true;
    }

    @Override
    public JobEvent nextEvent(Duration timeout) throws InterruptedException, TimeoutException {
        lock.lock();
        try {
            int generation = waitGeneration;
            long remaining = timeout != null ? timeout.toNanos() : Long.MAX_VALUE;
            while (queue.isEmpty()) {
                if (generation != waitGeneration) {
                    throw new CancellationException("event wait of " + host.identifier() + " was cancelled");
                }
                if (timeout == null) {
                    notEmpty.await();
                } else {
                    if (remaining <= 0L) {
                        throw new TimeoutException("no event dispatched to " + host.identifier() + " within " + timeout);
                    }
                    remaining = notEmpty.awaitNanos(remaining);
                }
            }
            return queue.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean waitForEventDispatch(Duration timeout) throws InterruptedException {
        lock.lock();
        try {
            int generation = waitGeneration;
            long remaining = timeout != null ? timeout.toNanos() : Long.MAX_VALUE;
            while (queue.isEmpty()) {
                if (generation != waitGeneration) {
                    throw new CancellationException("event wait of " + host.identifier() + " was cancelled");
                }
                if (timeout == null) {
                    notEmpty.await();
                } else {
                    if (remaining <= 0L) {
                        return false;
                    }
                    remaining = notEmpty.awaitNanos(remaining);
                }
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    public int eventQueueSize() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean eventQueueIsEmpty() {
        return eventQueueSize() == 0;
    }

    public List<JobEvent> queuedEvents() {
        lock.lock();
        try {
            return List.copyOf(queue);
        } finally {
            lock.unlock();
        }
    }

    public void clearEventQueue() {
        lock.lock();
        try {
            queue.clear();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Rejects further dispatched events until {@link #unblockQueue()}.
     */
    public void blockQueue() {
        host.flags().clear(JobFlags.EVENT_DISPATCH_ENABLED);
    }

    public void unblockQueue() {
        host.flags().set(JobFlags.EVENT_DISPATCH_ENABLED);
    }

    public boolean queueIsBlocked() {
        return !host.flags().has(JobFlags.EVENT_DISPATCH_ENABLED);
    }

    @Override
    public void onMixinStart() throws Exception {
        if (host.flags().has(JobFlags.CLEAR_EVENTS_AT_STARTUP)) {
            clearEventQueue();
        }
    }

    @Override
    public void onMixinStop() {
        cancelWaits();
    }

    @Override
    public void onMixinStopCleanup() {
        host.flags().clear(JobFlags.STOPPING_BY_EVENT_DISPATCH_TIMEOUT | JobFlags.STOPPING_BY_EMPTY_EVENT_QUEUE);
    }

    @Override
    public JobStopReason stoppingReason() {
        JobFlags flags = host.flags();
        if (flags.has(JobFlags.STOPPING_BY_EVENT_DISPATCH_TIMEOUT)) {
            return JobStopReason.Internal.EVENT_DISPATCH_TIMEOUT;
        }
        if (flags.has(JobFlags.STOPPING_BY_EMPTY_EVENT_QUEUE)) {
            return JobStopReason.Internal.EMPTY_EVENT_QUEUE;
        }
        return null;
    }

    /* ==== helpers for routines ==== */

    protected JobEvent pollEvent() {
        lock.lock();
        try {
            return queue.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    protected void reinsertEvent(JobEvent event) {
        lock.lock();
        try {
            queue.addFirst(event);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops the job gracefully if the queue is empty and stopping on an empty queue is enabled.
     *
     * @return whether a stop was requested
     */
    protected boolean stopIfQueueEmpty() {
        if (host.flags().has(JobFlags.STOP_ON_EMPTY_EVENT_QUEUE) && eventQueueIsEmpty()) {
            host.flags().set(JobFlags.STOPPING_BY_EMPTY_EVENT_QUEUE);
            host.stop(false);
            return true;
        }
        return false;
    }

    /**
     * Waits for the next event while marking the job idle. On a timeout the job is stopped if so
     * configured.
     *
     * @return the event, or {@code null} if none arrived in time
     */
    protected JobEvent awaitNextEvent() throws InterruptedException {
        boolean timedOut = false;
        JobEvent event = null;
        host.markIdling(true);
        try {
            event = nextEvent(options.dispatchTimeout());
        } catch (TimeoutException e) {
            timedOut = true;
        } finally {
            host.markIdling(false);
        }
        if (timedOut && host.flags().has(JobFlags.STOP_ON_EVENT_DISPATCH_TIMEOUT)) {
            host.flags().set(JobFlags.STOPPING_BY_EVENT_DISPATCH_TIMEOUT);
            host.stop(false);
        }
        return event;
    }

    @SuppressWarnings("unchecked")
    protected E cast(JobEvent event) {
        return (E) event;
    }

    private void cancelWaits() {
        lock.lock();
        try {
            waitGeneration++;
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }
}
