package com.cronpilot.engine.scheduler;

import com.cronpilot.engine.config.CronProperties;
import com.cronpilot.engine.model.*;
import com.cronpilot.engine.store.CronStore;
import com.cronpilot.engine.store.RunEventLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.*;

/**
 * Decides when jobs are due and whether a due run may start.
 *
 * Schedules are a cache over each job's cron expression: {@link #scheduleJob}
 * can always rebuild one from scratch. Admission ({@link #canRunJob}) is
 * built on storage locks only, so several engine processes sharing one
 * database never admit two exclusive runs of the same job.
 */
@Service
public class CronScheduler {

    private static final Logger log = LoggerFactory.getLogger(CronScheduler.class);

    // Upper bound on how long one materialization pass may hold a schedule lock.
    private static final Duration SCHEDULE_LOCK_TTL = Duration.ofSeconds(60);

    private static final Comparator<PendingRun> PENDING_ORDER =
            Comparator.comparingInt((PendingRun p) -> p.job().getPriority()).reversed()
                      .thenComparing(p -> p.run().getScheduledAt());

    private final CronStore          store;
    private final ScheduleCalculator calculator;
    private final RunEventLog        events;
    private final CronProperties     props;
    private final Clock              clock;

    public CronScheduler(CronStore store,
                         ScheduleCalculator calculator,
                         RunEventLog events,
                         CronProperties props,
                         Clock clock) {
        this.store      = store;
        this.calculator = calculator;
        this.events     = events;
        this.props      = props;
        this.clock      = clock;
    }

    // ------------------------------------------------------------------
    // Schedules
    // ------------------------------------------------------------------

    /**
     * Compute and store the next due time of a job.
     *
     * Disabled jobs and jobs whose window has closed lose their schedule
     * row. Outcome stamps (lastSuccess, lastAttempt) and the catch-up cursor
     * (lastScheduled) of an existing row are kept.
     *
     * @return the stored schedule, or empty if the job has nothing to schedule
     */
    public Optional<Schedule> scheduleJob(JobDefinition job) {
        if (!job.isEnabled()) {
            store.deleteSchedule(job.getId());
            log.info("Job '{}' is disabled; schedule removed", job.getId());
            return Optional.empty();
        }
        Instant now = clock.instant();
        Optional<Schedule> existing = store.getSchedule(job.getId());
        Instant lastScheduled = existing.map(Schedule::getLastScheduled).orElse(null);

        Optional<Instant> occurrence = unmaterializedOccurrence(job, existing, now)
                .or(() -> calculator.nextOccurrence(job, now, lastScheduled));
        if (occurrence.isEmpty()) {
            store.deleteSchedule(job.getId());
            log.info("Job '{}' has no occurrence inside its active window; not scheduled", job.getId());
            return Optional.empty();
        }
        Instant nextDue = calculator.applyJitter(occurrence.get(), job);

        Schedule schedule = existing.orElseGet(() -> new Schedule(job.getId(), nextDue, job.getTimezone()));
        schedule.setNextDue(nextDue);
        schedule.setTimezone(job.getTimezone());
        Schedule saved = store.saveSchedule(schedule);
        log.info("Job '{}' next due at {} ({})", job.getId(), nextDue, job.getTimezone());
        return Optional.of(saved);
    }

    /**
     * With catch-up, an occurrence that fell due but was never turned into a
     * run stays the next due time when the job is rescheduled (restart,
     * upsert). Only applies before the first materialization; afterwards
     * lastScheduled is the cursor.
     */
    private Optional<Instant> unmaterializedOccurrence(JobDefinition job, Optional<Schedule> existing, Instant now) {
        if (!job.isCatchup() || existing.isEmpty() || existing.get().getLastScheduled() != null
                || existing.get().getNextDue().isAfter(now)) {
            return Optional.empty();
        }
        ZoneId zone = ZoneId.of(job.getTimezone());
        return calculator.occurrenceAtOrBefore(job.getSchedule(), zone, existing.get().getNextDue())
                .flatMap(missed -> calculator.nextOccurrenceInWindow(job, missed.minusSeconds(1)));
    }

    /**
     * Rebuild the schedule of every job. Enabled jobs are (re)scheduled,
     * disabled ones lose their schedule.
     *
     * @return number of jobs that now have a schedule
     */
    public int updateAllSchedules() {
        int scheduled = 0;
        int page = 0;
        final int pageSize = 200;
        List<JobDefinition> jobs;
        do {
            jobs = store.listJobs(page * pageSize, pageSize);
            for (JobDefinition job : jobs) {
                try {
                    if (scheduleJob(job).isPresent()) {
                        scheduled++;
                    }
                } catch (RuntimeException e) {
                    log.warn("Could not schedule job '{}': {}", job.getId(), e.getMessage());
                }
            }
            page++;
        } while (jobs.size() == pageSize);
        log.info("Schedules updated: {} job(s) scheduled", scheduled);
        return scheduled;
    }

    /**
     * Turn due schedules into DUE runs, then return every DUE run whose time
     * has come and that no worker has claimed, highest priority first.
     */
    public List<JobRun> getPendingRuns() {
        Instant now = clock.instant();
        for (Schedule schedule : store.getDueSchedules(now)) {
            try {
                materialize(schedule.getJobId(), now);
            } catch (RuntimeException e) {
                log.warn("Materializing schedule of job '{}' failed: {}", schedule.getJobId(), e.getMessage());
            }
        }

        Map<String, Optional<JobDefinition>> jobs = new HashMap<>();
        List<PendingRun> pending = new ArrayList<>();
        for (JobRun run : store.findDueRuns(now)) {
            Optional<JobDefinition> job = jobs.computeIfAbsent(run.getJobId(), store::getJob);
            if (job.isEmpty() || !job.get().isEnabled()) {
                continue;
            }
            if (store.isLocked(ResourceLock.claimResource(run.getId()))) {
                continue;
            }
            pending.add(new PendingRun(run, job.get()));
        }
        pending.sort(PENDING_ORDER);
        return pending.stream().map(PendingRun::run).toList();
    }

    /**
     * Create runs for the occurrences of one job that are due by {@code now}.
     * Without catch-up at most one run is created and the schedule jumps to
     * the next future occurrence; with catch-up every missed occurrence is
     * created, up to max-catchup-runs per call.
     *
     * @return number of runs created
     */
    int materialize(String jobId, Instant now) {
        Optional<JobDefinition> found = store.getJob(jobId);
        if (found.isEmpty()) {
            store.deleteSchedule(jobId);
            return 0;
        }
        JobDefinition job = found.get();
        if (!job.isEnabled()) {
            return 0;
        }

        String resource = ResourceLock.scheduleResource(jobId);
        if (!store.acquireLock(resource, props.workerId(), now.plus(SCHEDULE_LOCK_TTL))) {
            log.debug("Schedule of job '{}' is being materialized elsewhere", jobId);
            return 0;
        }
        try {
            Optional<Schedule> current = store.getSchedule(jobId);
            if (current.isEmpty() || current.get().getNextDue().isAfter(now)) {
                return 0;
            }
            ZoneId zone = ZoneId.of(job.getTimezone());
            Instant due = current.get().getNextDue();
            Instant occurrence = calculator.occurrenceAtOrBefore(job.getSchedule(), zone, due).orElse(due);

            List<JobRun> runs = new ArrayList<>();
            Instant lastScheduled = null;
            while (due != null && !due.isAfter(now) && runs.size() < props.maxCatchupRuns()) {
                runs.add(JobRun.due(jobId, due, 0));
                lastScheduled = occurrence;
                if (!job.isCatchup()) {
                    break;
                }
                Optional<Instant> next = calculator.nextOccurrenceInWindow(job, occurrence);
                if (next.isEmpty()) {
                    due = null;
                    break;
                }
                occurrence = next.get();
                due = calculator.applyJitter(occurrence, job);
            }

            Instant nextDue;
            if (job.isCatchup()) {
                // Either the first occurrence not yet materialized, or the cap was hit and it is still in the past.
                nextDue = due;
            } else {
                nextDue = calculator.nextOccurrenceInWindow(job, now)
                        .map(o -> calculator.applyJitter(o, job))
                        .orElse(null);
            }
            store.recordOccurrences(jobId, runs, lastScheduled, nextDue);
            if (runs.size() > 1) {
                log.info("Job '{}': {} missed occurrence(s) queued for catch-up", jobId, runs.size());
            } else {
                log.info("Job '{}' due at {}; next due {}", jobId, runs.get(0).getScheduledAt(), nextDue);
            }
            return runs.size();
        } finally {
            store.releaseLock(resource, props.workerId());
        }
    }

    // ------------------------------------------------------------------
    // Admission control
    // ------------------------------------------------------------------

    /**
     * Decide whether run {@code runId} of {@code job} may start now.
     *
     * <ul>
     *   <li>allow: always admitted, no lock.</li>
     *   <li>skip: admitted iff the job lock can be taken.</li>
     *   <li>cancel-previous: active runs are cancelled and their locks released,
     *       then the lock is taken (one retry if that races).</li>
     *   <li>queue: bounded FIFO. Admitted iff this is the oldest waiting run and
     *       the lock is free; otherwise deferred. Runs beyond max-queue-depth
     *       are rejected.</li>
     * </ul>
     */
    public AdmissionDecision canRunJob(JobDefinition job, String runId) {
        Instant expiresAt = lockExpiry(job);
        return switch (job.getConcurrency()) {
            case ALLOW -> AdmissionDecision.admitted(false);

            case SKIP -> store.acquireLock(job.getId(), runId, expiresAt)
                    ? AdmissionDecision.admitted(true)
                    : AdmissionDecision.rejected("job already running");

            case CANCEL_PREVIOUS -> {
                for (JobRun active : store.findRuns(job.getId(), RunState.ACTIVE)) {
                    if (!active.getId().equals(runId)) {
                        cancelRun(active.getId(), "superseded by run " + runId);
                    }
                }
                if (store.acquireLock(job.getId(), runId, expiresAt)
                        || store.acquireLock(job.getId(), runId, expiresAt)) {
                    yield AdmissionDecision.admitted(true);
                }
                yield AdmissionDecision.rejected("could not acquire job lock after cancelling previous run");
            }

            case QUEUE -> admitFromQueue(job, runId, expiresAt);
        };
    }

    private AdmissionDecision admitFromQueue(JobDefinition job, String runId, Instant expiresAt) {
        List<JobRun> waiting = store.findWaitingRuns(job.getId());
        int position = -1;
        for (int i = 0; i < waiting.size(); i++) {
            if (waiting.get(i).getId().equals(runId)) {
                position = i;
                break;
            }
        }
        if (position >= props.maxQueueDepth()) {
            return AdmissionDecision.rejected("queue full");
        }
        if (position > 0) {
            return AdmissionDecision.deferred("waiting behind run " + waiting.get(0).getId());
        }
        return store.acquireLock(job.getId(), runId, expiresAt)
                ? AdmissionDecision.admitted(true)
                : AdmissionDecision.deferred("job already running");
    }

    /** The job lock outlives a run's timeout by the configured grace period. */
    public Instant lockExpiry(JobDefinition job) {
        return clock.instant()
                .plusSeconds(job.getResources().maxRunSeconds())
                .plus(props.lockGrace());
    }

    // ------------------------------------------------------------------
    // Run state
    // ------------------------------------------------------------------

    /** DUE → STARTING, stamping startedAt. Empty if the run is no longer DUE. */
    public Optional<JobRun> markRunStarted(String runId) {
        Instant now = clock.instant();
        return store.transitionRun(runId, EnumSet.of(RunState.DUE), run -> {
            run.setState(RunState.STARTING);
            run.setStartedAt(now);
        });
    }

    /**
     * Cancel a run that has not finished yet and release the job lock it holds.
     * This is a logical cancellation: an executor call already in flight is
     * not interrupted, but its result is discarded.
     *
     * @return false if the run was already finished
     */
    public boolean cancelRun(String runId, String reason) {
        Instant now = clock.instant();
        Optional<JobRun> cancelled = store.transitionRun(runId, RunState.LIVE, run -> {
            run.setState(RunState.CANCELLED);
            run.setCompletedAt(now);
            run.setErrorCode("CANCELLED");
            run.setErrorMessage(reason);
        });
        if (cancelled.isEmpty()) {
            return false;
        }
        store.releaseLock(cancelled.get().getJobId(), runId);
        events.warn(runId, "run_cancelled", "Run cancelled: " + reason);
        return true;
    }

    public void releaseJobLock(JobDefinition job, String runId) {
        store.releaseLock(job.getId(), runId);
    }

    /** Stamp the outcome of a finished run on the job's schedule. */
    public void recordCompletion(String jobId, Instant at, boolean success) {
        store.updateSchedule(jobId, schedule -> {
            schedule.setLastAttempt(at);
            if (success) {
                schedule.setLastSuccess(at);
            }
        });
    }

    private record PendingRun(JobRun run, JobDefinition job) {}
}
