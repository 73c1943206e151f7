package com.cronpilot.engine.model;

import jakarta.persistence.*;
import org.hibernate.annotations.DynamicUpdate;

import java.time.Instant;

/**
 * Per-job scheduling cursor.
 *
 * nextDue is a cache: it can always be recomputed from the job's cron
 * expression, timezone and lastScheduled. lastScheduled is the due time of
 * the most recent occurrence turned into a run.
 *
 * DB table: schedules  (created by Flyway V1 migration)
 */
// Only changed columns are written, so outcome stamps and cursor moves do not overwrite each other.
@Entity
@DynamicUpdate
@Table(name = "schedules")
public class Schedule {

    @Id
    @Column(name = "job_id")
    private String jobId;

    @Column(name = "next_due", nullable = false)
    private Instant nextDue;

    @Column(name = "last_scheduled")
    private Instant lastScheduled;

    @Column(name = "last_success")
    private Instant lastSuccess;

    @Column(name = "last_attempt")
    private Instant lastAttempt;

    @Column(nullable = false)
    private String timezone;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    protected Schedule() {}   // required by JPA

    public Schedule(String jobId, Instant nextDue, String timezone) {
        this.jobId    = jobId;
        this.nextDue  = nextDue;
        this.timezone = timezone;
    }

    public String  getJobId()         { return jobId; }
    public Instant getNextDue()       { return nextDue; }
    public Instant getLastScheduled() { return lastScheduled; }
    public Instant getLastSuccess()   { return lastSuccess; }
    public Instant getLastAttempt()   { return lastAttempt; }
    public String  getTimezone()      { return timezone; }
    public Instant getUpdatedAt()     { return updatedAt; }

    public void setNextDue(Instant nextDue)             { this.nextDue = nextDue; }
    public void setLastScheduled(Instant t)             { this.lastScheduled = t; }
    public void setLastSuccess(Instant t)               { this.lastSuccess = t; }
    public void setLastAttempt(Instant t)               { this.lastAttempt = t; }
    public void setTimezone(String timezone)            { this.timezone = timezone; }
}
