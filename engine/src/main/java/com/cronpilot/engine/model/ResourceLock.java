package com.cronpilot.engine.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Storage-level mutual-exclusion token.
 *
 * The resource column is UNIQUE, so at most one row per resource can exist.
 * Resources in use:
 *   {@code <jobId>}          concurrency lock of a job (owner = run id)
 *   {@code run:<runId>}      claim of a DUE run by a worker (owner = worker id)
 *   {@code schedule:<jobId>} materialization of a schedule (owner = worker id)
 *
 * DB table: locks  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "locks")
public class ResourceLock {

    @Id
    private String id;

    @Column(nullable = false, unique = true, updatable = false)
    private String resource;

    @Column(name = "acquired_at", nullable = false, updatable = false)
    private Instant acquiredAt;

    // Null means the lock lives until it is released explicitly.
    @Column(name = "expires_at", updatable = false)
    private Instant expiresAt;

    @Column(nullable = false, updatable = false)
    private String owner;

    protected ResourceLock() {}   // required by JPA

    public ResourceLock(String resource, String owner, Instant acquiredAt, Instant expiresAt) {
        this.id         = UUID.randomUUID().toString();
        this.resource   = resource;
        this.owner      = owner;
        this.acquiredAt = acquiredAt;
        this.expiresAt  = expiresAt;
    }

    public static String claimResource(String runId) {
        return "run:" + runId;
    }

    public static String scheduleResource(String jobId) {
        return "schedule:" + jobId;
    }

    public boolean isLive(Instant now) {
        return expiresAt == null || expiresAt.isAfter(now);
    }

    public String  getId()         { return id; }
    public String  getResource()   { return resource; }
    public Instant getAcquiredAt() { return acquiredAt; }
    public Instant getExpiresAt()  { return expiresAt; }
    public String  getOwner()      { return owner; }
}
