package com.sailfish.jobs.service.impl;

import com.sailfish.jobs.JobArgs;
import com.sailfish.jobs.model.JobPriority;
import com.sailfish.jobs.model.JobRecord;
import com.sailfish.jobs.repository.JobRepository;
import com.sailfish.jobs.service.JobOutcome;
import com.sailfish.jobs.service.JobQueue;
import com.sailfish.jobs.util.Ids;
import com.sailfish.jobs.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Default implementation of the JobQueue: every submitted job becomes a row in the jobs table,
 * picked up later by whichever process's {@link WorkerLoop} claims it first.
 */
public class PersistentJobQueue implements JobQueue {

    private static final Logger log = LoggerFactory.getLogger(PersistentJobQueue.class);

    private final JobRepository jobRepository;
    private final JobRunner jobRunner;
    private final Clock clock;

    public PersistentJobQueue(JobRepository jobRepository, JobRunner jobRunner, Clock clock) {
        this.jobRepository = Objects.requireNonNull(jobRepository, "jobRepository cannot be null");
        this.jobRunner = Objects.requireNonNull(jobRunner, "jobRunner cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    @Override
    public String enqueue(String name, JobArgs args) {
        return enqueue(name, args, JobPriority.LOW);
    }

    @Override
    public String enqueue(String name, JobArgs args, JobPriority priority) {
        return delay(name, args, Duration.ZERO, priority);
    }

    @Override
    public String delay(String name, JobArgs args, Duration delay) {
        return delay(name, args, delay, JobPriority.LOW);
    }

    @Override
    public String delay(String name, JobArgs args, Duration delay, JobPriority priority) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("job name cannot be blank");
        }
        Objects.requireNonNull(delay, "delay cannot be null");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay cannot be negative");
        }
        Objects.requireNonNull(priority, "priority cannot be null");
        if (!jobRunner.isRegistered(name)) {
            // Another process may know the job; the worker that claims it decides.
            log.warn("Enqueuing job '{}' which is not registered in this process.", name);
        }

        JobArgs jobArgs = args != null ? args : JobArgs.empty();
        LocalDateTime runAt = LocalDateTime.now(clock).plus(delay);
        JobRecord record = new JobRecord(Ids.newId(), name, Json.writeString(jobArgs.asMap()), priority, runAt);
        jobRepository.insert(record);
        log.debug("Job '{}' stored as {} with priority {} due at {}", name, record.getId(), priority, runAt);
        return record.getId();
    }

    @Override
    public JobOutcome runJob(String name, JobArgs args) {
        return jobRunner.run(name, args);
    }
}
