package io.jobs4j.core;

/**
 * Raised when a job is not in a state that permits the requested operation.
 */
public class JobStateException extends JobException {

    public JobStateException(String message) {
        super(message);
    }

    public JobStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
