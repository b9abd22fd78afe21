package com.sailfish.jobs.schedule;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Decides when a periodic schedule runs next.
 */
public interface NextRunPolicy {

    /**
     * Calculates the next run of a schedule.
     *
     * @param now The time the current occurrence is claimed (or the schedule is created).
     * @param interval The schedule's run interval.
     * @return The next run; must be after {@code now}.
     */
    LocalDateTime nextRun(LocalDateTime now, Duration interval);
}
