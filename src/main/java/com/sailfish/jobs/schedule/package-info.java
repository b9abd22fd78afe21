/**
 * Contains the {@link com.sailfish.jobs.schedule.NextRunPolicy} used by the scheduler and its
 * default, {@link com.sailfish.jobs.schedule.IntervalAlignedNextRunPolicy}.
 */
package com.sailfish.jobs.schedule;
