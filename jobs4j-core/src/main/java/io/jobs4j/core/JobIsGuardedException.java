package io.jobs4j.core;

/**
 * Raised when a guarded job is touched by a third party, or when guarding an already guarded job.
 */
public class JobIsGuardedException extends JobStateException {

    public JobIsGuardedException(String message) {
        super(message);
    }

    public JobIsGuardedException(String message, Throwable cause) {
        super(message, cause);
    }
}
