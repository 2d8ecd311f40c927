package io.jobs4j.mixins;

import io.jobs4j.core.JobStopReason;

/**
 * A composable behavior pack driven by its job.
 *
 * <p>A job declares its mixins as an ordered list. On every run iteration the job calls
 * {@link #mixinRoutine()} of each mixin, in that order, before its own run hook.
 */
public interface JobMixin {

    /**
     * Called while the job starts, before its own start hook.
     */
    default void onMixinStart() throws Exception {
    }

    void mixinRoutine() throws Exception;

    /**
     * Called once the job begins stopping, before its own stop hook.
     */
    default void onMixinStop() {
    }

    /**
     * Called during the job's stop cleanup, after its flags were reset.
     */
    default void onMixinStopCleanup() {
    }

    /**
     * A stopping reason this mixin caused, or {@code null}.
     */
    default JobStopReason stoppingReason() {
        return null;
    }
}
