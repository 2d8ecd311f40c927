package io.jobs4j.mixins;

import io.jobs4j.core.JobFlags;

import java.util.concurrent.ExecutorService;

/**
 * The parts of a job its mixins may use.
 */
public interface MixinHost {

    String identifier();

    JobFlags flags();

    boolean isRunning();

    boolean isStopping();

    /**
     * Starts the job if it is registered, not running and not done.
     */
    boolean start();

    boolean stop(boolean force);

    void markIdling(boolean idling);

    /**
     * Executor for work a mixin runs alongside the job loop.
     */
    ExecutorService executor();
}
