package com.sailfish.jobs.exception;

/**
 * Base class for the unchecked exceptions raised by the jobs component.
 */
public class JobsException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public JobsException(String message) {
        super(message);
    }

    public JobsException(String message, Throwable cause) {
        super(message, cause);
    }
}
