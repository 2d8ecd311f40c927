package io.jobs4j.core;

/**
 * Raised when operating on a job that already completed or was killed.
 */
public class JobIsDoneException extends JobStateException {

    public JobIsDoneException(String message) {
        super(message);
    }

    public JobIsDoneException(String message, Throwable cause) {
        super(message, cause);
    }
}
