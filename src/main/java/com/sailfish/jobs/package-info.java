/**
 * Provides the background-processing core: a durable job queue, a periodic scheduler and a
 * database-backed cache, all coordinated across processes through the shared database.
 * {@link com.sailfish.jobs.JobsApplication} wires them together.
 */
package com.sailfish.jobs;
