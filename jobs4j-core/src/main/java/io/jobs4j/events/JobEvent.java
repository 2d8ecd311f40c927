package io.jobs4j.events;

import io.jobs4j.JobProxy;

import java.time.Instant;

/**
 * Base class of everything a {@code JobManager} can dispatch to event jobs.
 *
 * <p>Each receiving job gets its own {@link #copy()}, so subclasses holding mutable state should
 * override it to copy that state as well.
 */
public class JobEvent implements Cloneable {

    private final Instant timestamp;
    private volatile JobProxy dispatcher;

    public JobEvent() {
        this(Instant.now());
    }

    public JobEvent(Instant timestamp) {
        this.timestamp = timestamp != null ? timestamp : Instant.now();
    }

    public Instant timestamp() {
        return timestamp;
    }

    /**
     * The job that dispatched this event, or {@code null} before dispatch.
     */
    public JobProxy dispatcher() {
        return dispatcher;
    }

    /**
     * Set once by the manager at dispatch time.
     */
    public void assignDispatcher(JobProxy dispatcher) {
        if (this.dispatcher == null) {
            this.dispatcher = dispatcher;
        }
    }

    public JobEvent copy() {
        try {
            return (JobEvent) clone();
        } catch (CloneNotSupportedException e) {
            throw new IllegalStateException("event " + getClass().getName() + " cannot be copied", e);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{timestamp=" + timestamp + "}";
    }
}
