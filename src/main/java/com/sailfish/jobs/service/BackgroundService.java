package com.sailfish.jobs.service;

/**
 * Lifecycle of the process-wide background loops.
 */
public interface BackgroundService {

    /**
     * Starts the scheduler loop and the worker loop.
     */
    void start();

    /**
     * Stops both loops, waiting for their current iteration to finish.
     */
    void stop();

    /**
     * Blocks until {@link #stop()} has completed.
     */
    void awaitTermination() throws InterruptedException;
}
