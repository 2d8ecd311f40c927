package io.jobs4j.mixins;

import io.jobs4j.events.JobEvent;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;

/**
 * One event being handled concurrently by a {@link MultiEventJobMixin}.
 */
public final class EventSession<E extends JobEvent> {

    private final E event;
    private final Instant timestamp = Instant.now();
    private final Map<String, Object> data = new ConcurrentHashMap<>();
    private volatile Future<?> future;
    private volatile Exception error;

    EventSession(E event) {
        this.event = event;
    }

    public E event() {
        return event;
    }

    public Instant timestamp() {
        return timestamp;
    }

    /**
     * Free-form per-session state for the handler.
     */
    public Map<String, Object> data() {
        return data;
    }

    public Future<?> future() {
        return future;
    }

    void attach(Future<?> future) {
        this.future = future;
    }

    public Exception error() {
        return error;
    }

    void fail(Exception error) {
        this.error = error;
    }

    public boolean isDone() {
        Future<?> f = future;
        return f != null && f.isDone();
    }

    public boolean isCancelled() {
        Future<?> f = future;
        return f != null && f.isCancelled();
    }

    boolean cancel() {
        Future<?> f = future;
        return f != null && f.cancel(true);
    }

    @Override
    public String toString() {
        return "EventSession{event=" + event + ", timestamp=" + timestamp + ", done=" + isDone() + "}";
    }
}
