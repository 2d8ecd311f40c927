package io.jobs4j.core;

/**
 * Raised when registering a second live instance of a singleton job class.
 */
public class JobConflictException extends JobException {

    public JobConflictException(String message) {
        super(message);
    }

    public JobConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
