package io.jobs4j.mixins;

import io.jobs4j.events.JobEvent;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Capability of receiving events dispatched by a job manager.
 */
public interface EventSource {

    /**
     * Event classes this source wants. Subclasses of them are delivered as well.
     */
    Set<Class<? extends JobEvent>> eventTypes();

    /**
     * Final filter applied to each dispatched copy before {@link #addEvent(JobEvent)}.
     */
    boolean eventCheck(JobEvent event);

    /**
     * @return whether the event was queued
     */
    boolean addEvent(JobEvent event);

    /**
     * Removes and returns the oldest queued event, waiting for one if the queue is empty.
     *
     * @param timeout maximum wait, {@code null} to wait indefinitely
     * @throws TimeoutException if no event arrived in time
     */
    JobEvent nextEvent(Duration timeout) throws InterruptedException, TimeoutException;

    /**
     * Waits until at least one event is queued.
     *
     * @return false if the timeout elapsed first
     */
    boolean waitForEventDispatch(Duration timeout) throws InterruptedException;

    /**
     * Whether events already handed to a manager-level event waiter of this job should still
     * be queued.
     */
    boolean allowsDoubleDispatch();
}
