package com.sailfish.jobs.repository;

import com.sailfish.jobs.model.ScheduleRecord;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Storage of periodic schedule state.
 */
public interface ScheduleRepository {

    List<ScheduleRecord> findAll();

    /**
     * Finds schedules whose next run is at or before {@code now}.
     */
    List<ScheduleRecord> findDue(LocalDateTime now);

    /**
     * Inserts the schedule unless a row with the same id already exists.
     *
     * @return true if this call created the row.
     */
    boolean insertIfAbsent(ScheduleRecord record);

    /**
     * @return true if a row was deleted.
     */
    boolean deleteById(String id);

    /**
     * Conditionally moves a schedule to its next occurrence. The update only applies while the
     * stored next run is still at or before {@code now}, so among callers racing for the same
     * occurrence exactly one sees {@code true}.
     *
     * @param id The schedule name.
     * @param now The time of this occurrence, stored as last run.
     * @param nextRun The new next run.
     * @return true if this caller advanced the schedule and therefore owns the occurrence.
     */
    boolean tryAdvance(String id, LocalDateTime now, LocalDateTime nextRun);
}
