package io.jobs4j;

import io.jobs4j.events.JobEvent;
import io.jobs4j.loop.LoopSchedule;
import io.jobs4j.mixins.EventQueueOptions;
import io.jobs4j.mixins.EventSession;
import io.jobs4j.mixins.MultiEventJobMixin;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A job that handles several dispatched events at once, each in its own {@link EventSession}.
 * At most {@link EventQueueOptions#maxConcurrency()} sessions run at the same time; the rest wait
 * in the event queue.
 */
public abstract class MultiEventJob<E extends JobEvent> extends ManagedJob {

    private final MultiEventJobMixin<E> sessions;

    protected MultiEventJob(Set<Class<? extends E>> eventTypes) {
        this(eventTypes, EventQueueOptions.defaults());
    }

    protected MultiEventJob(Set<Class<? extends E>> eventTypes, EventQueueOptions options) {
        super(LoopSchedule.immediate(), null, true);
        Objects.requireNonNull(eventTypes, "eventTypes must not be null");
        this.sessions = new MultiEventJobMixin<>(mixinHost(), eventTypes, options, new MultiEventJobMixin.SessionHandler<>() {
            @Override
            public void onEventSession(EventSession<E> session) throws Exception {
                MultiEventJob.this.onEventSession(session);
            }

            @Override
            public void onEventSessionError(EventSession<E> session, Exception error) {
                MultiEventJob.this.onEventSessionError(session, error);
            }

            @Override
            public boolean eventCheck(E event) {
                return MultiEventJob.this.eventCheck(event);
            }
        });
        addMixin(sessions);
    }

    /**
     * Handles one event. Runs on the manager's job executor, concurrently with other sessions.
     */
    protected abstract void onEventSession(EventSession<E> session) throws Exception;

    protected void onEventSessionError(EventSession<E> session, Exception error) {
        onRunError(error);
    }

    protected boolean eventCheck(E event) {
        return true;
    }

    @Override
    protected void onRun() throws Exception {
    }

    public final int getEventQueueSize() {
        return sessions.eventQueueSize();
    }

    public final void clearEventQueue() {
        sessions.clearEventQueue();
    }

    public final int getActiveSessionCount() {
        return sessions.activeSessionCount();
    }

    public final List<EventSession<E>> getActiveSessions() {
        return sessions.activeSessions();
    }

    /**
     * Oldest finished session, or {@code null}.
     */
    public final EventSession<E> pollFinishedSession() {
        return sessions.pollFinishedSession();
    }

    public final void blockQueue() {
        sessions.blockQueue();
    }

    public final void unblockQueue() {
        sessions.unblockQueue();
    }
}
