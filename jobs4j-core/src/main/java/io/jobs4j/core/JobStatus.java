package io.jobs4j.core;

/**
 * Main statuses a job can be in, as reported by {@code ManagedJob#status()}.
 *
 * <p>{@link #OUTPUT_QUEUE_CLEARED} is not a job status; it is the value handed to output queue
 * waiters that did not ask to be cancelled when the queue is cleared.
 */
public enum JobStatus {
    FRESH,
    INITIALIZING,
    INITIALIZED,
    STARTING,
    RUNNING,
    IDLING,
    COMPLETING,
    BEING_KILLED,
    RESTARTING,
    STOPPING,
    OUTPUT_QUEUE_CLEARED,
    STOPPED,
    KILLED,
    COMPLETED;

    public boolean isDone() {
        return this == KILLED || this == COMPLETED;
    }
}
