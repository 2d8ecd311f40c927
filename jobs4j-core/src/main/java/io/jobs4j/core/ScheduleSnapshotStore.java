package io.jobs4j.core;

/**
 * Durable storage for a manager's exported schedule table.
 */
public interface ScheduleSnapshotStore {

    /**
     * Replaces whatever was stored before with {@code snapshot}.
     */
    void save(ScheduleSnapshot snapshot);

    /**
     * The last saved snapshot, or an empty one.
     */
    ScheduleSnapshot load();
}
