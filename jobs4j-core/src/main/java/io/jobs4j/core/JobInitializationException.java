package io.jobs4j.core;

/**
 * Raised when a job fails to initialize, or is used before initialization.
 */
public class JobInitializationException extends JobException {

    public JobInitializationException(String message) {
        super(message);
    }

    public JobInitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
