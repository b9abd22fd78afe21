package com.sailfish.jobs;

import com.sailfish.jobs.registry.JobRegistry;
import com.sailfish.jobs.service.BackgroundService;
import com.sailfish.jobs.service.Cache;
import com.sailfish.jobs.service.JobQueue;

/** Context passed to {@link JobHandler} with access to the core services. */
public final class JobContext {
    private final String jobName;
    private final JobQueue queue;
    private final Cache cache;
    private final JobRegistry jobs;
    private final BackgroundService background;

    public JobContext(String jobName, JobQueue queue, Cache cache, JobRegistry jobs, BackgroundService background) {
        this.jobName = jobName;
        this.queue = queue;
        this.cache = cache;
        this.jobs = jobs;
        this.background = background;
    }

    public String jobName() {
        return jobName;
    }

    public JobQueue queue() {
        return queue;
    }

    public Cache cache() {
        return cache;
    }

    public JobRegistry jobs() {
        return jobs;
    }

    public BackgroundService background() {
        return background;
    }
}
