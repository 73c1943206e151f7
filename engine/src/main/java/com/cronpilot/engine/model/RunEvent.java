package com.cronpilot.engine.model;

import com.cronpilot.engine.model.converter.JsonMapConverter;
import jakarta.persistence.*;
import org.hibernate.annotations.Generated;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Append-only audit entry of a run. Replayed in (occurredAt, seq) order to build
 * stdout.log and the `logs` command output.
 *
 * DB table: run_events  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "run_events")
public class RunEvent {

    @Id
    private String id;

    // Insertion order; breaks ties between events with the same timestamp.
    @Generated
    @Column(insertable = false, updatable = false)
    private Long seq;

    @Column(name = "run_id", nullable = false, updatable = false)
    private String runId;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private Instant occurredAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private EventLevel level;

    @Column(nullable = false, updatable = false)
    private String event;

    @Column(nullable = false, updatable = false)
    private String message;

    @Convert(converter = JsonMapConverter.class)
    @Column(updatable = false)
    private Map<String, Object> data;

    protected RunEvent() {}   // required by JPA

    public RunEvent(String runId, Instant occurredAt, EventLevel level,
                    String event, String message, Map<String, Object> data) {
        this.id         = UUID.randomUUID().toString();
        this.runId      = runId;
        this.occurredAt = occurredAt;
        this.level      = level;
        this.event      = event;
        this.message    = message;
        this.data       = data;
    }

    /** Same event with a different timestamp; used to keep per-run order monotonic. */
    public RunEvent at(Instant instant) {
        RunEvent copy = new RunEvent(runId, instant, level, event, message, data);
        copy.id = this.id;
        return copy;
    }

    public String              getId()         { return id; }
    public Long                getSeq()        { return seq; }
    public String              getRunId()      { return runId; }
    public Instant             getOccurredAt() { return occurredAt; }
    public EventLevel          getLevel()      { return level; }
    public String              getEvent()      { return event; }
    public String              getMessage()    { return message; }
    public Map<String, Object> getData()       { return data; }
}
