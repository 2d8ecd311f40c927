package io.jobs4j.core;

/**
 * Ordered trust tiers governing which cross-job operations a job may perform.
 *
 * <p>{@link #SYSTEM} is reserved for the manager's own job and can never be assigned to a job
 * registered by a host or another job.
 */
public enum JobPermissionLevel {

    LOWEST(1),
    LOW(2),
    MEDIUM(3),
    HIGH(4),
    HIGHEST(5),
    SYSTEM(6);

    public static final JobPermissionLevel DEFAULT = MEDIUM;

    private final int value;

    JobPermissionLevel(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }

    public boolean isAtLeast(JobPermissionLevel other) {
        return value >= other.value;
    }

    public boolean isBelow(JobPermissionLevel other) {
        return value < other.value;
    }

    public boolean isAbove(JobPermissionLevel other) {
        return value > other.value;
    }
}
