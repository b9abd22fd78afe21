package com.sailfish.jobs.exception;

/**
 * Raised while the job and schedule registries are being built, e.g. when a name is
 * registered twice. It signals a programming error and is never recovered from:
 * application startup is expected to abort.
 */
public class RegistrationException extends JobsException {

    private static final long serialVersionUID = 1L;

    public RegistrationException(String message) {
        super(message);
    }
}
