package com.sailfish.jobs.service.impl;

import com.sailfish.jobs.JobArgs;
import com.sailfish.jobs.exception.SerializationException;
import com.sailfish.jobs.model.JobRecord;
import com.sailfish.jobs.repository.JobRepository;
import com.sailfish.jobs.service.FatalErrorHandler;
import com.sailfish.jobs.service.JobOutcome;
import com.sailfish.jobs.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Drains the job queue on a single dedicated thread.
 *
 * <p>Each iteration claims a batch of due jobs and runs them one after another. While batches
 * come back non-empty the loop claims again right away; once a claim comes back empty it
 * waits {@code idleDelay} before polling again. Throughput is scaled by running more
 * processes, not more threads.
 *
 * <p>There is no per-job timeout: a handler that never returns stalls this loop.
 */
public class WorkerLoop {

    private static final Logger log = LoggerFactory.getLogger(WorkerLoop.class);

    public static final int DEFAULT_BATCH_SIZE = 5;
    public static final Duration DEFAULT_IDLE_DELAY = Duration.ofSeconds(1);
    public static final Duration DEFAULT_SHUTDOWN_WARNING = Duration.ofSeconds(30);

    private final JobRepository jobRepository;
    private final JobRunner jobRunner;
    private final Clock clock;
    private final FatalErrorHandler fatalErrorHandler;
    private final int batchSize;
    private final Duration idleDelay;
    private final Duration shutdownWarning;

    private final ScheduledExecutorService executor;
    private ScheduledFuture<?> scheduledTask;
    private volatile boolean stopping;

    public WorkerLoop(JobRepository jobRepository, JobRunner jobRunner, Clock clock, FatalErrorHandler fatalErrorHandler) {
        this(jobRepository, jobRunner, clock, fatalErrorHandler, DEFAULT_BATCH_SIZE, DEFAULT_IDLE_DELAY, DEFAULT_SHUTDOWN_WARNING);
    }

    public WorkerLoop(JobRepository jobRepository,
                      JobRunner jobRunner,
                      Clock clock,
                      FatalErrorHandler fatalErrorHandler,
                      int batchSize,
                      Duration idleDelay,
                      Duration shutdownWarning) {
        this.jobRepository = Objects.requireNonNull(jobRepository, "jobRepository cannot be null");
        this.jobRunner = Objects.requireNonNull(jobRunner, "jobRunner cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.fatalErrorHandler = Objects.requireNonNull(fatalErrorHandler, "fatalErrorHandler cannot be null");
        this.idleDelay = Objects.requireNonNull(idleDelay, "idleDelay cannot be null");
        this.shutdownWarning = Objects.requireNonNull(shutdownWarning, "shutdownWarning cannot be null");
        if (idleDelay.isNegative() || idleDelay.isZero()) {
            throw new IllegalArgumentException("idleDelay must be positive");
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        this.batchSize = batchSize;
        this.executor = LoopExecutors.singleThread("jobs-worker");
        log.info("WorkerLoop initialized with batchSize={} and idleDelay={}", batchSize, idleDelay);
    }

    @PostConstruct
    public synchronized void start() {
        if (scheduledTask != null) {
            log.warn("WorkerLoop already started.");
            return;
        }
        // Fixed delay: the idle wait only starts once a drain has found the queue empty.
        scheduledTask = executor.scheduleWithFixedDelay(this::runIteration, 0, idleDelay.toMillis(), TimeUnit.MILLISECONDS);
        log.info("WorkerLoop started.");
    }

    @PreDestroy
    public void stop() {
        log.info("Stopping WorkerLoop...");
        stopping = true;
        synchronized (this) {
            if (scheduledTask != null) {
                scheduledTask.cancel(false); // let the running iteration complete
            }
        }
        LoopExecutors.shutdownAndWait("WorkerLoop", executor, shutdownWarning);
        log.info("WorkerLoop stopped.");
    }

    public boolean isStopped() {
        return executor.isTerminated();
    }

    private void runIteration() {
        try {
            drain();
        } catch (RuntimeException | Error e) {
            stopping = true;
            synchronized (this) {
                scheduledTask.cancel(false);
            }
            executor.shutdown();
            fatalErrorHandler.onFatalError("WorkerLoop", e);
        }
    }

    /**
     * Claims and runs batches until a claim comes back empty or a stop is requested.
     * A claimed batch always runs to the end since its rows are already gone from storage.
     *
     * @return The number of jobs taken from the queue.
     */
    int drain() {
        int processed = 0;
        while (!stopping) {
            List<JobRecord> batch = jobRepository.claimDue(LocalDateTime.now(clock), batchSize);
            if (batch.isEmpty()) {
                break;
            }
            log.debug("Claimed {} jobs.", batch.size());
            for (JobRecord record : batch) {
                runClaimed(record);
                processed++;
            }
        }
        return processed;
    }

    private JobOutcome runClaimed(JobRecord record) {
        JobArgs args;
        try {
            args = JobArgs.of(Json.readMap(record.getArgs()));
        } catch (SerializationException | IllegalArgumentException e) {
            log.error("Dropping job {} '{}': unreadable arguments {}", record.getId(), record.getName(), record.getArgs(), e);
            return JobOutcome.FAILED;
        }
        return jobRunner.run(record.getName(), args);
    }
}
