package com.sailfish.jobs;

/**
 * A named unit of background work. Implementations contain the actual business logic
 * and are registered under a job name in the {@link com.sailfish.jobs.registry.JobRegistry}.
 */
@FunctionalInterface
public interface JobHandler {

    /**
     * Executes the job logic.
     *
     * <p>A handler that throws is logged and its job is dropped; nothing is retried. A handler
     * that needs another attempt must enqueue itself again through {@link JobContext#queue()}.
     *
     * @param context access to the queue, the cache and the running application.
     * @param args the arguments the job was enqueued with.
     * @throws Exception if the job fails.
     */
    void execute(JobContext context, JobArgs args) throws Exception;
}
