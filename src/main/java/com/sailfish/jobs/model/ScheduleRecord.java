package com.sailfish.jobs.model;

import jakarta.persistence.*;
import java.io.Serializable;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Durable state of one registered periodic schedule. The id is the schedule name, which is
 * also the name of the job it enqueues.
 */
@Entity
@Table(name = "app_schedules")
public class ScheduleRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    @Id
    @Column(length = 100)
    private String id;

    @Column(name = "last_ran", nullable = false)
    private LocalDateTime lastRan;

    @Column(name = "next_run", nullable = false)
    private LocalDateTime nextRun; // always on an interval boundary, only moves forward

    public ScheduleRecord() {
    }

    public ScheduleRecord(String id, LocalDateTime lastRan, LocalDateTime nextRun) {
        this.id = id;
        this.lastRan = lastRan;
        this.nextRun = nextRun;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public LocalDateTime getLastRan() {
        return lastRan;
    }

    public void setLastRan(LocalDateTime lastRan) {
        this.lastRan = lastRan;
    }

    public LocalDateTime getNextRun() {
        return nextRun;
    }

    public void setNextRun(LocalDateTime nextRun) {
        this.nextRun = nextRun;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ScheduleRecord that = (ScheduleRecord) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "ScheduleRecord{" +
               "id='" + id + '\'' +
               ", lastRan=" + lastRan +
               ", nextRun=" + nextRun +
               '}';
    }
}
