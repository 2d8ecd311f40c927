package io.jobs4j.core;

/**
 * Operations a job may attempt on other jobs or on its manager. Each one is checked by the
 * manager's permission gate before any state is touched.
 */
public enum JobOp {
    CREATE,
    INITIALIZE,
    REGISTER,
    SCHEDULE,
    GUARD,
    FIND,
    CUSTOM_EVENT_DISPATCH,
    EVENT_DISPATCH,
    START,
    STOP,
    RESTART,
    UNSCHEDULE,
    UNGUARD,
    KILL
}
