package com.sailfish.jobs.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Receives failures a background loop cannot continue after, such as the database becoming
 * unavailable. The loop has already stopped when the handler is called.
 */
@FunctionalInterface
public interface FatalErrorHandler {

    void onFatalError(String component, Throwable error);

    /**
     * Logs the failure and terminates the JVM with exit status 1. The exit runs on its own
     * thread so shutdown hooks can wait for the failing loop thread to finish.
     */
    static FatalErrorHandler exitProcess() {
        return (component, error) -> {
            Logger log = LoggerFactory.getLogger(FatalErrorHandler.class);
            log.error("FATAL: {} stopped on an unrecoverable error, exiting: {}", component, error.getMessage(), error);
            new Thread(() -> System.exit(1), "jobs-fatal-exit").start();
        };
    }
}
