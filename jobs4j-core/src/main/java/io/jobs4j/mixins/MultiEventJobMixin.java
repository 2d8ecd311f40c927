package io.jobs4j.mixins;

import io.jobs4j.core.JobFlags;
import io.jobs4j.events.JobEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Handles queued events concurrently, each in its own {@link EventSession} on the host's
 * executor, with at most {@code maxConcurrency} sessions active at once.
 *
 * <p>Finished sessions are kept in a bounded queue the job drains with
 * {@link #pollFinishedSession()}. When that queue has no room left and overflow is disabled, new
 * events stay queued until the job makes room.
 */
public class MultiEventJobMixin<E extends JobEvent> extends EventQueueMixin<E> {
    private static final Logger log = LoggerFactory.getLogger(MultiEventJobMixin.class);

    public interface SessionHandler<E extends JobEvent> {

        void onEventSession(EventSession<E> session) throws Exception;

        default void onEventSessionError(EventSession<E> session, Exception error) {
            log.warn("event session failed event={} msg={}", session.event(), error.getMessage(), error);
        }

        default boolean eventCheck(E event) {
            return true;
        }
    }

    private final SessionHandler<E> handler;
    private final ReentrantLock sessionLock = new ReentrantLock();
    private final Condition sessionFinished = sessionLock.newCondition();
    private final List<EventSession<E>> activeSessions = new ArrayList<>();
    private final ArrayDeque<EventSession<E>> finishedSessions = new ArrayDeque<>();

    public MultiEventJobMixin(MixinHost host, Set<Class<? extends E>> eventTypes, EventQueueOptions options, SessionHandler<E> handler) {
        super(host, eventTypes, options);
        this.handler = Objects.requireNonNull(handler, "handler must not be null");
        host.flags().set(JobFlags.ALLOW_EVENT_SESSION_QUEUE_OVERFLOW, this.options.allowSessionQueueOverflow());
    }

    @Override
    public boolean eventCheck(JobEvent event) {
        return handler.eventCheck(cast(event));
    }

    @Override
    public void mixinRoutine() throws Exception {
        sessionLock.lock();
        try {
            if (activeSessions.isEmpty() && stopIfQueueEmpty()) {
                return;
            }
            while (activeSessions.size() >= options.maxConcurrency()) {
                sessionFinished.await();
            }
        } finally {
            sessionLock.unlock();
        }

        JobEvent event = eventQueueIsEmpty() && host.flags().has(JobFlags.AWAIT_EVENT_DISPATCH) ? awaitNextEvent() : pollEvent();
        while (event != null) {
            if (!startSession(event)) {
                reinsertEvent(event);
                return;
            }
            if (!hasConcurrencySpace()) {
                return;
            }
            event = pollEvent();
        }
    }

    private boolean hasConcurrencySpace() {
        sessionLock.lock();
        try {
            return activeSessions.size() < options.maxConcurrency();
        } finally {
            sessionLock.unlock();
        }
    }

    private boolean startSession(JobEvent raw) {
        EventSession<E> session = new EventSession<>(cast(raw));
        sessionLock.lock();
        try {
            int max = options.maxSessionQueueSize();
            if (max > 0 && finishedSessions.size() + activeSessions.size() >= max) {
                if (!host.flags().has(JobFlags.ALLOW_EVENT_SESSION_QUEUE_OVERFLOW) || finishedSessions.isEmpty()) {
                    return false;
                }
                finishedSessions.pollFirst();
            }
            activeSessions.add(session);
            session.attach(host.executor().submit(() -> runSession(session)));
            return true;
        } finally {
            sessionLock.unlock();
        }
    }

    private void runSession(EventSession<E> session) {
        try {
            handler.onEventSession(session);
        } catch (Exception e) {
            session.fail(e);
            if (!Thread.currentThread().isInterrupted()) {
                try {
                    handler.onEventSessionError(session, e);
                } catch (RuntimeException hookError) {
                    log.warn("event session error hook failed id={} msg={}", host.identifier(), hookError.getMessage(), hookError);
                }
            }
        } finally {
            sessionLock.lock();
            try {
                if (activeSessions.remove(session)) {
                    finishedSessions.addLast(session);
                }
                sessionFinished.signalAll();
            } finally {
                sessionLock.unlock();
            }
        }
    }

    public int activeSessionCount() {
        sessionLock.lock();
        try {
            return activeSessions.size();
        } finally {
            sessionLock.unlock();
        }
    }

    public List<EventSession<E>> activeSessions() {
        sessionLock.lock();
        try {
            return List.copyOf(activeSessions);
        } finally {
            sessionLock.unlock();
        }
    }

    public EventSession<E> pollFinishedSession() {
        sessionLock.lock();
        try {
            return finishedSessions.pollFirst();
        } finally {
            sessionLock.unlock();
        }
    }

    public int finishedSessionCount() {
        sessionLock.lock();
        try {
            return finishedSessions.size();
        } finally {
            sessionLock.unlock();
        }
    }

    @Override
    public void onMixinStop() {
        super.onMixinStop();
        List<EventSession<E>> cancelled;
        sessionLock.lock();
        try {
            cancelled = new ArrayList<>(activeSessions);
            activeSessions.clear();
            sessionFinished.signalAll();
        } finally {
            sessionLock.unlock();
        }
        for (EventSession<E> session : cancelled) {
            session.cancel();
        }
        if (!cancelled.isEmpty()) {
            log.debug("event sessions cancelled id={} count={}", host.identifier(), cancelled.size());
        }
    }
}
