package com.sailfish.jobs.service;

/**
 * Result of running a single job. Only ever logged; no outcome escapes the worker loop.
 */
public enum JobOutcome {
    COMPLETED,
    /**
     * The handler threw. The job is dropped.
     */
    FAILED,
    /**
     * No handler is registered under the job name.
     */
    UNKNOWN_JOB
}
