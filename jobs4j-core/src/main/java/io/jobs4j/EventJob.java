package io.jobs4j;

import io.jobs4j.events.JobEvent;
import io.jobs4j.mixins.EventJobMixin;
import io.jobs4j.mixins.EventQueueOptions;
import io.jobs4j.loop.LoopSchedule;

import java.util.Objects;
import java.util.Set;

/**
 * A job that reacts to events dispatched by its manager, one event at a time.
 *
 * <p>Subclasses implement {@link #onEvent(JobEvent)}. The event queue is configured through
 * {@link EventQueueOptions}.
 */
public abstract class EventJob<E extends JobEvent> extends ManagedJob {

    private final EventJobMixin<E> events;
    private volatile E lastEvent;

    protected EventJob(Set<Class<? extends E>> eventTypes) {
        this(eventTypes, EventQueueOptions.defaults());
    }

    protected EventJob(Set<Class<? extends E>> eventTypes, EventQueueOptions options) {
        this(eventTypes, options, null, true);
    }

    /**
     * @param count number of run iterations per start, {@code null} for unlimited
     */
    protected EventJob(Set<Class<? extends E>> eventTypes, EventQueueOptions options, Integer count, boolean reconnect) {
        super(LoopSchedule.immediate(), count, reconnect);
        Objects.requireNonNull(eventTypes, "eventTypes must not be null");
        this.events = new EventJobMixin<>(mixinHost(), eventTypes, options, new EventJobMixin.Handler<>() {
            @Override
            public void onEvent(E event) throws Exception {
                lastEvent = event;
                EventJob.this.onEvent(event);
            }

            @Override
            public void onEventError(E event, Exception error) {
                EventJob.this.onEventError(event, error);
            }

            @Override
            public boolean eventCheck(E event) {
                return EventJob.this.eventCheck(event);
            }
        });
        addMixin(events);
    }

    protected abstract void onEvent(E event) throws Exception;

    protected void onEventError(E event, Exception error) {
        onRunError(error);
    }

    /**
     * Final filter for dispatched events, after the type check.
     */
    protected boolean eventCheck(E event) {
        return true;
    }

    /**
     * Events are handled by the event queue routine, which runs before this hook.
     */
    @Override
    protected void onRun() throws Exception {
    }

    public final E getLastEvent() {
        return lastEvent;
    }

    public final int getEventQueueSize() {
        return events.eventQueueSize();
    }

    public final void clearEventQueue() {
        events.clearEventQueue();
    }

    public final void blockQueue() {
        events.blockQueue();
    }

    public final void unblockQueue() {
        events.unblockQueue();
    }

    public final boolean queueIsBlocked() {
        return events.queueIsBlocked();
    }

    /**
     * Blocks the event queue until the returned handle is closed.
     */
    public final AutoCloseable queueBlocker() {
        events.blockQueue();
        return events::unblockQueue;
    }
}
