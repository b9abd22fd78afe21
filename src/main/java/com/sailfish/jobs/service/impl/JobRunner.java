package com.sailfish.jobs.service.impl;

import com.sailfish.jobs.JobArgs;
import com.sailfish.jobs.JobContext;
import com.sailfish.jobs.JobHandler;
import com.sailfish.jobs.registry.JobRegistry;
import com.sailfish.jobs.service.JobOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs a single job by name on the calling thread and isolates its failures.
 *
 * <p>Nothing a handler throws leaves this class: the failure is logged with the job name,
 * arguments, error and stack trace, and the job is considered lost. Callers run inside
 * long-lived loops, so an unknown job name is logged and skipped in the same way.
 */
public class JobRunner {

    private static final Logger log = LoggerFactory.getLogger(JobRunner.class);

    /** Creates the context handed to a handler. */
    @FunctionalInterface
    public interface ContextFactory {
        JobContext create(String jobName, JobArgs args);
    }

    private final JobRegistry registry;
    private final ContextFactory contextFactory;

    public JobRunner(JobRegistry registry, ContextFactory contextFactory) {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        this.contextFactory = Objects.requireNonNull(contextFactory, "contextFactory cannot be null");
    }

    public boolean isRegistered(String name) {
        return registry.contains(name);
    }

    public JobOutcome run(String name, JobArgs args) {
        Optional<JobHandler> handler = registry.find(name);
        if (!handler.isPresent()) {
            log.error("No job registered for name '{}', skipping. args={}", name, args);
            return JobOutcome.UNKNOWN_JOB;
        }

        JobArgs jobArgs = args != null ? args : JobArgs.empty();
        long started = System.nanoTime();
        log.debug("Starting job '{}' args={}", name, jobArgs);
        try {
            handler.get().execute(contextFactory.create(name, jobArgs), jobArgs);
            log.info("Job '{}' completed in {} ms.", name, (System.nanoTime() - started) / 1_000_000);
            return JobOutcome.COMPLETED;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logFailure(name, jobArgs, e);
            return JobOutcome.FAILED;
        } catch (Throwable t) {
            // Errors too, e.g. StackOverflowError from a runaway handler
            logFailure(name, jobArgs, t);
            return JobOutcome.FAILED;
        }
    }

    private void logFailure(String name, JobArgs args, Throwable error) {
        log.error("Job '{}' failed and will not be retried. args={} error={}\n{}",
                name, args, error, stackTraceAsString(error));
    }

    private static String stackTraceAsString(Throwable throwable) {
        StringWriter sw = new StringWriter();
        PrintWriter pw = new PrintWriter(sw);
        throwable.printStackTrace(pw);
        pw.flush();
        return sw.toString();
    }
}
