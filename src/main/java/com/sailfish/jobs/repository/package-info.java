/**
 * Storage contracts for jobs, schedules and cache entries, such as
 * {@link com.sailfish.jobs.repository.JobRepository}, with their JPA implementations.
 * Cross-process coordination relies only on the atomicity of the statements issued here.
 */
package com.sailfish.jobs.repository;
