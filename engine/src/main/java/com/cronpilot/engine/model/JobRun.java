package com.cronpilot.engine.model;

import com.cronpilot.engine.model.converter.JsonMapConverter;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * One execution attempt of a job.
 *
 * Created DUE by the scheduler (one per cron occurrence), by the runner (retry
 * of a failed attempt) or by a manual trigger. Once the state is terminal the
 * row is never written again; the store enforces this by checking the state
 * under a row lock before every transition.
 *
 * DB table: runs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "runs")
public class JobRun {

    @Id
    private String id;

    @Column(name = "job_id", nullable = false, updatable = false)
    private String jobId;

    @Column(name = "scheduled_at", nullable = false)
    private Instant scheduledAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private RunState state = RunState.DUE;

    // 0 for the first attempt, incremented for each retry run.
    @Column(nullable = false)
    private int attempt = 0;

    @Column(name = "dry_run", nullable = false)
    private boolean dryRun = false;

    @Column(name = "error_code")
    private String errorCode;

    @Column(name = "error_message")
    private String errorMessage;

    @Embedded
    private ResourceUsage resourceUsage = ResourceUsage.empty();

    // Inputs supplied with a manual trigger; merged over the job's inputs.
    @Convert(converter = JsonMapConverter.class)
    @Column(name = "input_overrides")
    private Map<String, Object> inputOverrides;

    // SHA-256 of the executor output, used for material-change alerts.
    @Column(name = "output_digest")
    private String outputDigest;

    @Column(name = "artifacts_dir")
    private String artifactsDir;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected JobRun() {}   // required by JPA

    public JobRun(String id, String jobId, Instant scheduledAt, int attempt) {
        this.id          = id;
        this.jobId       = jobId;
        this.scheduledAt = scheduledAt;
        this.attempt     = attempt;
    }

    /** A fresh DUE run with a generated id. */
    public static JobRun due(String jobId, Instant scheduledAt, int attempt) {
        return new JobRun(newId("run", jobId, scheduledAt), jobId, scheduledAt, attempt);
    }

    /** Run ids embed the job id and the scheduled time so they sort and grep naturally. */
    public static String newId(String prefix, String jobId, Instant scheduledAt) {
        return prefix + "_" + jobId + "_" + scheduledAt.toEpochMilli() + "_"
                + UUID.randomUUID().toString().substring(0, 8);
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public String              getId()             { return id; }
    public String              getJobId()          { return jobId; }
    public Instant             getScheduledAt()    { return scheduledAt; }
    public Instant             getStartedAt()      { return startedAt; }
    public Instant             getCompletedAt()    { return completedAt; }
    public RunState            getState()          { return state; }
    public int                 getAttempt()        { return attempt; }
    public boolean             isDryRun()          { return dryRun; }
    public String              getErrorCode()      { return errorCode; }
    public String              getErrorMessage()   { return errorMessage; }
    public ResourceUsage       getResourceUsage()  { return resourceUsage == null ? ResourceUsage.empty() : resourceUsage; }
    public Map<String, Object> getInputOverrides() { return inputOverrides; }
    public String              getOutputDigest()   { return outputDigest; }
    public String              getArtifactsDir()   { return artifactsDir; }
    public Instant             getCreatedAt()      { return createdAt; }

    public void setState(RunState state)                        { this.state = state; }
    public void setStartedAt(Instant t)                         { this.startedAt = t; }
    public void setCompletedAt(Instant t)                       { this.completedAt = t; }
    public void setDryRun(boolean dryRun)                       { this.dryRun = dryRun; }
    public void setErrorCode(String errorCode)                  { this.errorCode = errorCode; }
    public void setErrorMessage(String errorMessage)            { this.errorMessage = errorMessage; }
    public void setResourceUsage(ResourceUsage usage)           { this.resourceUsage = usage; }
    public void setInputOverrides(Map<String, Object> overrides) { this.inputOverrides = overrides; }
    public void setOutputDigest(String outputDigest)            { this.outputDigest = outputDigest; }
    public void setArtifactsDir(String artifactsDir)            { this.artifactsDir = artifactsDir; }
}
