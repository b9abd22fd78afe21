package com.sailfish.jobs.service.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/** Executor plumbing shared by the background loops. */
final class LoopExecutors {

    private static final Logger log = LoggerFactory.getLogger(LoopExecutors.class);

    private LoopExecutors() {
    }

    static ScheduledExecutorService singleThread(String threadName) {
        return Executors.newSingleThreadScheduledExecutor(r -> new Thread(r, threadName));
    }

    /**
     * Shuts the executor down and waits for the running iteration, however long it takes.
     * Running jobs are never interrupted; a warning is logged every {@code warnAfter} instead.
     */
    static void shutdownAndWait(String name, ExecutorService executor, Duration warnAfter) {
        log.info("Shutting down {}...", name);
        executor.shutdown();
        try {
            while (!executor.awaitTermination(warnAfter.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("{} is still finishing its current iteration after {}.", name, warnAfter);
            }
            log.info("{} terminated gracefully.", name);
        } catch (InterruptedException ie) {
            log.warn("{} shutdown interrupted while waiting for the current iteration.", name);
            Thread.currentThread().interrupt();
        }
    }
}
