package io.jobs4j.core;

/**
 * Why a job is stopping. {@link Internal} reasons are caused by the job itself (or its loop),
 * {@link External} ones by another job, the manager or the host.
 */
public interface JobStopReason {

    String name();

    enum Internal implements JobStopReason {
        UNSPECIFIC,
        ERROR,
        RESTART,
        EXECUTION_COUNT_LIMIT,
        COMPLETION,
        KILLING,
        EVENT_DISPATCH_TIMEOUT,
        EMPTY_EVENT_QUEUE
    }

    enum External implements JobStopReason {
        UNKNOWN,
        RESTART,
        KILLING
    }
}
