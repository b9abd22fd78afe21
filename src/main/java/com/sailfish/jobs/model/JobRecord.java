package com.sailfish.jobs.model;

import jakarta.persistence.*;
import java.io.Serializable;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * A pending job in the queue table.
 *
 * <p>Rows only exist while a job is waiting: a worker deletes the row when it claims the
 * job, so there is no in-progress or completed state in storage.
 */
@Entity
@Table(name = "app_jobs", indexes = {
    @Index(name = "idx_app_jobs_claim", columnList = "priority, run_at")
})
public class JobRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    @Id
    @Column(length = 20)
    private String id; // time-ordered, see Ids

    @Column(nullable = false, length = 100)
    private String name; // job name, resolved through the JobRegistry

    @Column(nullable = false, length = 65535)
    private String args; // JSON object

    @Column(nullable = false)
    private int priority;

    @Column(name = "run_at", nullable = false)
    private LocalDateTime runAt;

    public JobRecord() {
    }

    public JobRecord(String id, String name, String args, JobPriority priority, LocalDateTime runAt) {
        this.id = id;
        this.name = name;
        this.args = args;
        this.priority = priority.level();
        this.runAt = runAt;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getArgs() {
        return args;
    }

    public void setArgs(String args) {
        this.args = args;
    }

    public JobPriority getPriority() {
        return JobPriority.fromLevel(priority);
    }

    public void setPriority(JobPriority priority) {
        this.priority = priority.level();
    }

    public LocalDateTime getRunAt() {
        return runAt;
    }

    public void setRunAt(LocalDateTime runAt) {
        this.runAt = runAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        JobRecord that = (JobRecord) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "JobRecord{" +
               "id='" + id + '\'' +
               ", name='" + name + '\'' +
               ", priority=" + getPriority() +
               ", runAt=" + runAt +
               '}';
    }
}
