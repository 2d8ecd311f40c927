package io.jobs4j.core;

public class JobNotAliveException extends JobStateException {

    public JobNotAliveException(String message) {
        super(message);
    }

    public JobNotAliveException(String message, Throwable cause) {
        super(message, cause);
    }
}
