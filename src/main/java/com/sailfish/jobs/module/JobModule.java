package com.sailfish.jobs.module;

import com.sailfish.jobs.registry.JobRegistry;
import com.sailfish.jobs.registry.ScheduleRegistry;

/**
 * Service Provider Interface through which application code contributes jobs and schedules.
 *
 * <p>Implementations are discovered with {@link java.util.ServiceLoader} by listing their fully
 * qualified class name in: META-INF/services/com.sailfish.jobs.module.JobModule
 */
public interface JobModule {

    /**
     * Registers jobs and schedules. Called once at startup, before any loop runs. Duplicate
     * names throw {@link com.sailfish.jobs.exception.RegistrationException} and abort startup.
     */
    void register(JobRegistry.Builder jobs, ScheduleRegistry.Builder schedules);
}
