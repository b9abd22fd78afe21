package com.sailfish.jobs.repository;

import com.sailfish.jobs.model.JobRecord;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Storage of pending jobs.
 * Implementations must make {@link #claimDue} safe to call from any number of processes at once.
 */
public interface JobRepository {

    /**
     * Inserts a new pending job.
     *
     * @param record The job to store; its id must already be set.
     */
    void insert(JobRecord record);

    /**
     * Atomically removes and returns up to {@code limit} jobs whose run time has come.
     * Jobs are returned ordered by priority, then run time, then id. Two callers racing
     * on the same due jobs receive disjoint results.
     *
     * @param now The current time, compared against the job's run time.
     * @param limit The maximum number of jobs to claim.
     * @return The claimed jobs; they no longer exist in storage. Empty only when no due job
     *         was found, not when other callers won every candidate.
     */
    List<JobRecord> claimDue(LocalDateTime now, int limit);

    /**
     * @return The number of jobs still pending.
     */
    long count();
}
