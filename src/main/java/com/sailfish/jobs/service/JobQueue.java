package com.sailfish.jobs.service;

import com.sailfish.jobs.JobArgs;
import com.sailfish.jobs.model.JobPriority;

import java.time.Duration;

/**
 * Service interface for submitting jobs for background execution.
 */
public interface JobQueue {

    /**
     * Stores a job for immediate execution at {@link JobPriority#LOW} priority.
     *
     * @param name The registered job name.
     * @param args The job arguments.
     * @return The id of the stored job.
     * @throws IllegalArgumentException if name is blank.
     * @throws jakarta.persistence.PersistenceException if the job cannot be stored.
     */
    String enqueue(String name, JobArgs args);

    String enqueue(String name, JobArgs args, JobPriority priority);

    /**
     * Stores a job that becomes eligible for execution after {@code delay}, at
     * {@link JobPriority#LOW} priority.
     *
     * @throws IllegalArgumentException if name is blank or delay is negative.
     */
    String delay(String name, JobArgs args, Duration delay);

    String delay(String name, JobArgs args, Duration delay, JobPriority priority);

    /**
     * Runs a job synchronously on the calling thread, bypassing storage. Unknown names and
     * failing handlers are logged and never thrown to the caller.
     *
     * @return How the run ended.
     */
    JobOutcome runJob(String name, JobArgs args);
}
