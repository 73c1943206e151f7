package com.cronpilot.engine.model;

import com.cronpilot.engine.model.converter.AlertConfigConverter;
import com.cronpilot.engine.model.converter.JsonMapConverter;
import com.cronpilot.engine.model.converter.ResourceLimitsConverter;
import com.cronpilot.engine.model.converter.RetryPolicyConverter;
import com.cronpilot.engine.model.converter.StringMapConverter;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A named, versioned recurring task.
 *
 * The id is chosen by the author of the job file and never changes; saving a
 * definition with an existing id replaces every other field (see
 * {@code CronStore#saveJob}). Deleting a job removes its runs, events,
 * schedule and locks.
 *
 * DB table: jobs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "jobs")
public class JobDefinition {

    public static final String DEFAULT_VERSION = "1.0.0";

    @Id
    private String id;

    @Column(nullable = false)
    private String version = DEFAULT_VERSION;

    @Column(nullable = false)
    private String name;

    private String description;

    private String owner;

    @Column(nullable = false)
    private boolean enabled = true;

    // ------------------------------------------------------------------
    // Scheduling
    // ------------------------------------------------------------------

    // Five-field cron expression, evaluated in 'timezone'.
    @Column(nullable = false)
    private String schedule;

    @Column(nullable = false)
    private String timezone;

    @Column(name = "jitter_ms", nullable = false)
    private long jitterMs = 0;

    @Column(nullable = false)
    private boolean catchup = false;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ConcurrencyPolicy concurrency = ConcurrencyPolicy.ALLOW;

    @Column(nullable = false)
    private int priority = 0;

    // Active window; either bound may be absent.
    @Column(name = "not_before")
    private Instant notBefore;

    @Column(name = "not_after")
    private Instant notAfter;

    // ------------------------------------------------------------------
    // Execution
    // ------------------------------------------------------------------

    @Column(name = "graph_id", nullable = false)
    private String graphId;

    // Opaque to the engine: passed to the executor unchanged.
    @Convert(converter = JsonMapConverter.class)
    @Column(nullable = false)
    private Map<String, Object> inputs = new LinkedHashMap<>();

    @Convert(converter = ResourceLimitsConverter.class)
    @Column(nullable = false)
    private ResourceLimits resources = ResourceLimits.defaults();

    @Convert(converter = RetryPolicyConverter.class)
    @Column(name = "retry_config", nullable = false)
    private RetryPolicy retry = RetryPolicy.defaults();

    @Convert(converter = AlertConfigConverter.class)
    @Column(name = "alerts_config", nullable = false)
    private AlertConfig alerts = AlertConfig.none();

    @Convert(converter = StringMapConverter.class)
    @Column(nullable = false)
    private Map<String, String> labels = new LinkedHashMap<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected JobDefinition() {}   // required by JPA

    public JobDefinition(String id, String name, String schedule, String timezone, String graphId) {
        this.id       = id;
        this.name     = name;
        this.schedule = schedule;
        this.timezone = timezone;
        this.graphId  = graphId;
    }

    /**
     * Overwrite every user-controlled field with the values of {@code other}.
     * The id and creation time are kept.
     */
    public void replaceWith(JobDefinition other) {
        this.version     = other.version;
        this.name        = other.name;
        this.description = other.description;
        this.owner       = other.owner;
        this.enabled     = other.enabled;
        this.schedule    = other.schedule;
        this.timezone    = other.timezone;
        this.jitterMs    = other.jitterMs;
        this.catchup     = other.catchup;
        this.concurrency = other.concurrency;
        this.priority    = other.priority;
        this.notBefore   = other.notBefore;
        this.notAfter    = other.notAfter;
        this.graphId     = other.graphId;
        this.inputs      = new LinkedHashMap<>(other.inputs);
        this.resources   = other.resources;
        this.retry       = other.retry;
        this.alerts      = other.alerts;
        this.labels      = new LinkedHashMap<>(other.labels);
        this.updatedAt   = Instant.now();
    }

    /** Job inputs with per-run overrides layered on top. */
    public Map<String, Object> effectiveInputs(Map<String, Object> overrides) {
        Map<String, Object> merged = new LinkedHashMap<>(inputs);
        if (overrides != null) {
            merged.putAll(overrides);
        }
        return merged;
    }

    /** True if {@code instant} lies inside the [notBefore, notAfter] window. */
    public boolean isWithinWindow(Instant instant) {
        if (notBefore != null && instant.isBefore(notBefore)) return false;
        return notAfter == null || !instant.isAfter(notAfter);
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public String              getId()          { return id; }
    public String              getVersion()     { return version; }
    public String              getName()        { return name; }
    public String              getDescription() { return description; }
    public String              getOwner()       { return owner; }
    public boolean             isEnabled()      { return enabled; }
    public String              getSchedule()    { return schedule; }
    public String              getTimezone()    { return timezone; }
    public long                getJitterMs()    { return jitterMs; }
    public boolean             isCatchup()      { return catchup; }
    public ConcurrencyPolicy   getConcurrency() { return concurrency; }
    public int                 getPriority()    { return priority; }
    public Instant             getNotBefore()   { return notBefore; }
    public Instant             getNotAfter()    { return notAfter; }
    public String              getGraphId()     { return graphId; }
    public Map<String, Object> getInputs()      { return inputs; }
    public ResourceLimits      getResources()   { return resources; }
    public RetryPolicy         getRetry()       { return retry; }
    public AlertConfig         getAlerts()      { return alerts; }
    public Map<String, String> getLabels()      { return labels; }
    public Instant             getCreatedAt()   { return createdAt; }
    public Instant             getUpdatedAt()   { return updatedAt; }

    public void setVersion(String version)                  { this.version = version; }
    public void setName(String name)                        { this.name = name; }
    public void setDescription(String description)          { this.description = description; }
    public void setOwner(String owner)                      { this.owner = owner; }
    public void setEnabled(boolean enabled)                 { this.enabled = enabled; }
    public void setSchedule(String schedule)                { this.schedule = schedule; }
    public void setTimezone(String timezone)                { this.timezone = timezone; }
    public void setJitterMs(long jitterMs)                  { this.jitterMs = jitterMs; }
    public void setCatchup(boolean catchup)                 { this.catchup = catchup; }
    public void setConcurrency(ConcurrencyPolicy policy)    { this.concurrency = policy; }
    public void setPriority(int priority)                   { this.priority = priority; }
    public void setNotBefore(Instant notBefore)             { this.notBefore = notBefore; }
    public void setNotAfter(Instant notAfter)               { this.notAfter = notAfter; }
    public void setGraphId(String graphId)                  { this.graphId = graphId; }
    public void setInputs(Map<String, Object> inputs)       { this.inputs = inputs == null ? new LinkedHashMap<>() : new LinkedHashMap<>(inputs); }
    public void setResources(ResourceLimits resources)      { this.resources = resources; }
    public void setRetry(RetryPolicy retry)                 { this.retry = retry; }
    public void setAlerts(AlertConfig alerts)               { this.alerts = alerts; }
    public void setLabels(Map<String, String> labels)       { this.labels = labels == null ? new LinkedHashMap<>() : new LinkedHashMap<>(labels); }
}
