package com.sailfish.jobs.exception;

/**
 * Raised when job arguments or cache values cannot be converted to or from their
 * stored JSON form.
 */
public class SerializationException extends JobsException {

    private static final long serialVersionUID = 1L;

    public SerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
