package io.jobs4j.loop;

/**
 * Callbacks around a {@link PeriodicLoop} run.
 *
 * <p>{@link #onError(Exception)} receives the failure that ended the run and must not throw.
 */
public interface LoopHooks {

    default void beforeLoop() throws Exception {
    }

    default void afterLoop() throws Exception {
    }

    default void onError(Exception error) {
    }
}
