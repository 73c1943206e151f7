package com.cronpilot.engine.store;

import com.cronpilot.engine.model.*;
import com.cronpilot.engine.repository.*;
import jakarta.persistence.EntityManager;
import jakarta.persistence.TypedQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Durable state of the engine: jobs, runs, run events, locks and schedules.
 *
 * Nothing above this class keeps authoritative state; the scheduler and
 * runner re-read rows on every decision so the process can be restarted
 * (or run as several replicas) at any time.
 *
 * Two operations run in their own transaction
 * (REQUIRES_NEW): lock acquisition, whose unique-constraint failure must not
 * mark a caller's transaction rollback-only, and event appends, which must
 * survive whatever happens to the run afterwards.
 */
@Service
public class CronStore {

    private static final Logger log = LoggerFactory.getLogger(CronStore.class);

    private final JobRepository      jobRepo;
    private final RunRepository      runRepo;
    private final RunEventRepository eventRepo;
    private final LockRepository     lockRepo;
    private final ScheduleRepository scheduleRepo;
    private final EntityManager      em;
    private final TransactionTemplate requiresNew;
    private final Clock              clock;

    public CronStore(JobRepository jobRepo,
                     RunRepository runRepo,
                     RunEventRepository eventRepo,
                     LockRepository lockRepo,
                     ScheduleRepository scheduleRepo,
                     EntityManager em,
                     PlatformTransactionManager txManager,
                     Clock clock) {
        this.jobRepo      = jobRepo;
        this.runRepo      = runRepo;
        this.eventRepo    = eventRepo;
        this.lockRepo     = lockRepo;
        this.scheduleRepo = scheduleRepo;
        this.em           = em;
        this.clock        = clock;
        this.requiresNew  = new TransactionTemplate(txManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    // ------------------------------------------------------------------
    // Jobs
    // ------------------------------------------------------------------

    /**
     * Insert or fully replace a job definition. Saving the same id twice
     * leaves one row holding the second version; createdAt is preserved.
     */
    @Transactional
    public JobDefinition saveJob(JobDefinition job) {
        Optional<JobDefinition> existing = jobRepo.findById(job.getId());
        if (existing.isPresent()) {
            existing.get().replaceWith(job);
            log.debug("Job '{}' replaced", job.getId());
            return existing.get();
        }
        log.debug("Job '{}' created", job.getId());
        return jobRepo.save(job);
    }

    @Transactional(readOnly = true)
    public Optional<JobDefinition> getJob(String jobId) {
        return jobRepo.findById(jobId);
    }

    @Transactional(readOnly = true)
    public JobDefinition requireJob(String jobId) {
        return jobRepo.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    @Transactional(readOnly = true)
    public List<JobDefinition> listJobs(int offset, int limit) {
        return page(em.createQuery("SELECT j FROM JobDefinition j ORDER BY j.id", JobDefinition.class),
                offset, limit);
    }

    @Transactional(readOnly = true)
    public List<JobDefinition> listEnabledJobs() {
        return jobRepo.findByEnabledTrueOrderByIdAsc();
    }

    @Transactional(readOnly = true)
    public long countJobs() {
        return jobRepo.count();
    }

    @Transactional
    public JobDefinition setJobEnabled(String jobId, boolean enabled) {
        JobDefinition job = jobRepo.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        job.setEnabled(enabled);
        return job;
    }

    /**
     * Delete a job together with its run events, runs, schedule and every
     * lock that refers to it. All or nothing.
     *
     * @return false if the job did not exist
     */
    @Transactional
    public boolean deleteJob(String jobId) {
        if (!jobRepo.existsById(jobId)) {
            return false;
        }
        int events = eventRepo.deleteByJobId(jobId);
        int locks  = lockRepo.deleteByJob(jobId, ResourceLock.scheduleResource(jobId));
        int runs   = runRepo.deleteByJobIdInBulk(jobId);
        scheduleRepo.findById(jobId).ifPresent(scheduleRepo::delete);
        jobRepo.deleteById(jobId);
        log.info("Job '{}' deleted ({} runs, {} events, {} locks)", jobId, runs, events, locks);
        return true;
    }

    // ------------------------------------------------------------------
    // Runs
    // ------------------------------------------------------------------

    /**
     * Insert or replace a run. A run that is already terminal in the
     * database is returned unchanged.
     */
    @Transactional
    public JobRun saveRun(JobRun run) {
        Optional<JobRun> existing = runRepo.findForUpdate(run.getId());
        if (existing.isPresent() && existing.get().getState().isTerminal()) {
            log.debug("Run {} is {}; save ignored", run.getId(), existing.get().getState());
            return existing.get();
        }
        return runRepo.save(run);
    }

    @Transactional(readOnly = true)
    public Optional<JobRun> getRun(String runId) {
        return runRepo.findById(runId);
    }

    @Transactional(readOnly = true)
    public JobRun requireRun(String runId) {
        return runRepo.findById(runId).orElseThrow(() -> new RunNotFoundException(runId));
    }

    /** Runs newest first, optionally restricted to one job. */
    @Transactional(readOnly = true)
    public List<JobRun> listRuns(String jobId, int offset, int limit) {
        TypedQuery<JobRun> query;
        if (jobId == null) {
            query = em.createQuery(
                    "SELECT r FROM JobRun r ORDER BY r.scheduledAt DESC, r.createdAt DESC", JobRun.class);
        } else {
            query = em.createQuery(
                    "SELECT r FROM JobRun r WHERE r.jobId = :jobId ORDER BY r.scheduledAt DESC, r.createdAt DESC",
                    JobRun.class).setParameter("jobId", jobId);
        }
        return page(query, offset, limit);
    }

    @Transactional(readOnly = true)
    public long countRuns(String jobId) {
        return jobId == null ? runRepo.count() : runRepo.countByJobId(jobId);
    }

    @Transactional(readOnly = true)
    public List<JobRun> findRuns(String jobId, Set<RunState> states) {
        return runRepo.findByJobIdAndStateIn(jobId, states);
    }

    @Transactional(readOnly = true)
    public List<JobRun> findRunsInStates(Set<RunState> states) {
        return runRepo.findByStateIn(states);
    }

    /** DUE runs whose scheduled time has arrived, oldest first. */
    @Transactional(readOnly = true)
    public List<JobRun> findDueRuns(Instant now) {
        return runRepo.findByStateAndScheduledAtLessThanEqualOrderByScheduledAtAsc(RunState.DUE, now);
    }

    /** DUE runs of one job in FIFO order, whether or not their time has come. */
    @Transactional(readOnly = true)
    public List<JobRun> findWaitingRuns(String jobId) {
        return runRepo.findByJobIdAndStateOrderByScheduledAtAscCreatedAtAsc(jobId, RunState.DUE);
    }

    @Transactional(readOnly = true)
    public long countWaitingRuns(String jobId) {
        return runRepo.countByJobIdAndState(jobId, RunState.DUE);
    }

    /** Latest succeeded real run of the job; dry runs carry no output digest and are skipped. */
    @Transactional(readOnly = true)
    public Optional<JobRun> findLastSuccessfulRun(String jobId, String excludedRunId) {
        return runRepo.findFirstByJobIdAndStateAndDryRunFalseAndIdNotOrderByCompletedAtDesc(
                jobId, RunState.SUCCEEDED, excludedRunId);
    }

    /**
     * Conditionally move a run to a new state.
     *
     * The row is locked for the duration of the check and the mutation, so
     * concurrent callers serialize. The mutation is applied only if the
     * current state is in {@code from}; terminal runs are never touched.
     *
     * @return the updated run, or empty if the current state did not match
     * @throws RunNotFoundException if the run does not exist
     */
    @Transactional
    public Optional<JobRun> transitionRun(String runId, Set<RunState> from, Consumer<JobRun> mutation) {
        JobRun run = runRepo.findForUpdate(runId).orElseThrow(() -> new RunNotFoundException(runId));
        if (run.getState().isTerminal() || !from.contains(run.getState())) {
            log.debug("Run {} is {}; transition from {} skipped", runId, run.getState(), from);
            return Optional.empty();
        }
        RunState before = run.getState();
        mutation.accept(run);
        log.debug("Run {} {} -> {}", runId, before, run.getState());
        return Optional.of(run);
    }

    // ------------------------------------------------------------------
    // Run events
    // ------------------------------------------------------------------

    /**
     * Append an event in its own transaction. If the event is older than the
     * newest stored event of the same run, its timestamp is moved forward so
     * replay order matches append order.
     */
    public RunEvent appendEvent(RunEvent event) {
        return requiresNew.execute(status -> {
            RunEvent toSave = eventRepo.findFirstByRunIdOrderByOccurredAtDescSeqDesc(event.getRunId())
                    .filter(last -> event.getOccurredAt().isBefore(last.getOccurredAt()))
                    .map(last -> event.at(last.getOccurredAt()))
                    .orElse(event);
            return eventRepo.save(toSave);
        });
    }

    @Transactional(readOnly = true)
    public List<RunEvent> getRunEvents(String runId) {
        return eventRepo.findByRunIdOrderByOccurredAtAscSeqAsc(runId);
    }

    /** The most recent {@code limit} events of a run, oldest first. */
    @Transactional(readOnly = true)
    public List<RunEvent> getRunEvents(String runId, int limit) {
        List<RunEvent> newestFirst = new ArrayList<>(
                eventRepo.findByRunIdOrderByOccurredAtDescSeqDesc(runId, PageRequest.of(0, Math.max(1, limit))));
        Collections.reverse(newestFirst);
        return newestFirst;
    }

    @Transactional(readOnly = true)
    public boolean hasEvent(String runId, String event) {
        return eventRepo.countByRunIdAndEvent(runId, event) > 0;
    }

    // ------------------------------------------------------------------
    // Locks
    // ------------------------------------------------------------------

    /**
     * Try to take the lock on {@code resource}.
     *
     * An expired lock on the resource is removed first; the new lock is
     * then written with a plain INSERT. The UNIQUE(resource) constraint
     * makes the insert fail for every caller but one, so this is safe
     * across processes sharing the database.
     *
     * @param expiresAt null for a lock that lives until released
     * @return true iff this call now holds the lock
     */
    public boolean acquireLock(String resource, String owner, Instant expiresAt) {
        Instant now = clock.instant();
        try {
            requiresNew.executeWithoutResult(status -> {
                int expired = lockRepo.deleteExpired(resource, now);
                if (expired > 0) {
                    log.info("Removed expired lock on '{}'", resource);
                }
                lockRepo.saveAndFlush(new ResourceLock(resource, owner, now, expiresAt));
            });
            log.debug("Lock '{}' acquired by {}", resource, owner);
            return true;
        } catch (DataIntegrityViolationException e) {
            log.debug("Lock '{}' is held; {} not admitted", resource, owner);
            return false;
        }
    }

    /**
     * Release a lock held by {@code owner}.
     *
     * @return false (and nothing changes) if the caller does not hold it
     */
    @Transactional
    public boolean releaseLock(String resource, String owner) {
        boolean released = lockRepo.deleteByResourceAndOwner(resource, owner) > 0;
        if (released) {
            log.debug("Lock '{}' released by {}", resource, owner);
        }
        return released;
    }

    @Transactional(readOnly = true)
    public Optional<ResourceLock> getLock(String resource) {
        return lockRepo.findByResource(resource);
    }

    /** True if a lock on the resource exists and has not expired. */
    @Transactional(readOnly = true)
    public boolean isLocked(String resource) {
        Instant now = clock.instant();
        return lockRepo.findByResource(resource).map(l -> l.isLive(now)).orElse(false);
    }

    @Transactional
    public int purgeExpiredLocks(Instant now) {
        int purged = lockRepo.deleteAllExpired(now);
        if (purged > 0) {
            log.info("Purged {} expired lock(s)", purged);
        }
        return purged;
    }

    // ------------------------------------------------------------------
    // Schedules
    // ------------------------------------------------------------------

    @Transactional
    public Schedule saveSchedule(Schedule schedule) {
        return scheduleRepo.save(schedule);
    }

    @Transactional(readOnly = true)
    public Optional<Schedule> getSchedule(String jobId) {
        return scheduleRepo.findById(jobId);
    }

    /** Apply a change to an existing schedule row; no-op if the job has none. */
    @Transactional
    public Optional<Schedule> updateSchedule(String jobId, Consumer<Schedule> mutation) {
        Optional<Schedule> schedule = scheduleRepo.findById(jobId);
        schedule.ifPresent(mutation);
        return schedule;
    }

    /**
     * Persist the runs created for due occurrences and move the schedule
     * forward in one transaction, so a crash cannot create the same
     * occurrence twice.
     *
     * @param nextDue null when the job has no further occurrence; the schedule is then deleted
     */
    @Transactional
    public void recordOccurrences(String jobId, List<JobRun> runs, Instant lastScheduled, Instant nextDue) {
        runRepo.saveAll(runs);
        Optional<Schedule> schedule = scheduleRepo.findById(jobId);
        if (schedule.isEmpty()) {
            return;
        }
        if (nextDue == null) {
            scheduleRepo.delete(schedule.get());
            log.info("Schedule of job '{}' closed; no further occurrences", jobId);
            return;
        }
        if (lastScheduled != null) {
            schedule.get().setLastScheduled(lastScheduled);
        }
        schedule.get().setNextDue(nextDue);
    }

    @Transactional
    public void deleteSchedule(String jobId) {
        scheduleRepo.findById(jobId).ifPresent(scheduleRepo::delete);
    }

    /** All schedules with nextDue &lt;= now. */
    @Transactional(readOnly = true)
    public List<Schedule> getDueSchedules(Instant now) {
        return scheduleRepo.findByNextDueLessThanEqualOrderByNextDueAsc(now);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static <T> List<T> page(TypedQuery<T> query, int offset, int limit) {
        return query.setFirstResult(Math.max(0, offset))
                    .setMaxResults(Math.max(1, limit))
                    .getResultList();
    }
}
