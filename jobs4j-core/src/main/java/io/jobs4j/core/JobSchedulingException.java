package io.jobs4j.core;

public class JobSchedulingException extends JobException {

    public JobSchedulingException(String message) {
        super(message);
    }

    public JobSchedulingException(String message, Throwable cause) {
        super(message, cause);
    }
}
