package io.jobs4j.core;

/**
 * Raised when an invoker lacks the permission level or ownership an operation requires.
 */
public class JobPermissionException extends JobException {

    public JobPermissionException(String message) {
        super(message);
    }

    public JobPermissionException(String message, Throwable cause) {
        super(message, cause);
    }
}
