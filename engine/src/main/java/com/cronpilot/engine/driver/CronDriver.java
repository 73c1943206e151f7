package com.cronpilot.engine.driver;

import com.cronpilot.engine.config.CronProperties;
import com.cronpilot.engine.definition.JobDefinitionLoader;
import com.cronpilot.engine.definition.JobDefinitionValidator;
import com.cronpilot.engine.definition.JobSpec;
import com.cronpilot.engine.model.*;
import com.cronpilot.engine.runner.CronRunner;
import com.cronpilot.engine.scheduler.CronScheduler;
import com.cronpilot.engine.store.CronStore;
import com.cronpilot.engine.store.JobNotFoundException;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Front door of the engine, shared by the REST API, the CLI and the
 * polling loop.
 *
 * Job operations are thin pass-throughs to the store; adding or resuming a
 * job also (re)computes its schedule. Errors surface as exceptions
 * (JobNotFoundException, RunNotFoundException, JobValidationException).
 */
@Service
public class CronDriver {

    private static final Logger log = LoggerFactory.getLogger(CronDriver.class);

    private final CronStore              store;
    private final CronScheduler          scheduler;
    private final CronRunner             runner;
    private final JobDefinitionLoader    loader;
    private final JobDefinitionValidator validator;
    private final Clock                  clock;

    // Bounded parallelism of processPendingRuns.
    private final ExecutorService workers;

    public CronDriver(CronStore store,
                      CronScheduler scheduler,
                      CronRunner runner,
                      JobDefinitionLoader loader,
                      JobDefinitionValidator validator,
                      CronProperties props,
                      Clock clock) {
        this.store     = store;
        this.scheduler = scheduler;
        this.runner    = runner;
        this.loader    = loader;
        this.validator = validator;
        this.clock     = clock;
        this.workers   = Executors.newFixedThreadPool(props.maxConcurrentRuns());
    }

    @PreDestroy
    void shutdown() {
        workers.shutdown();
    }

    // ------------------------------------------------------------------
    // Jobs
    // ------------------------------------------------------------------

    public JobDefinition addJob(JobDefinition job) {
        JobDefinition saved = store.saveJob(job);
        scheduler.scheduleJob(saved);
        log.info("Job '{}' saved (version {}, schedule '{}')", saved.getId(), saved.getVersion(), saved.getSchedule());
        return saved;
    }

    public JobDefinition addJob(JobSpec spec) {
        return addJob(validator.validate(spec));
    }

    public JobDefinition addJobFromFile(Path file) {
        return addJob(loader.load(file));
    }

    public ListResult<JobDefinition> listJobs(int offset, int limit) {
        return new ListResult<>(store.listJobs(offset, limit), store.countJobs(), offset, limit);
    }

    public JobDefinition getJob(String jobId) {
        return store.requireJob(jobId);
    }

    public Optional<Schedule> getSchedule(String jobId) {
        return store.getSchedule(jobId);
    }

    public JobDefinition pauseJob(String jobId) {
        JobDefinition job = store.setJobEnabled(jobId, false);
        scheduler.scheduleJob(job);
        log.info("Job '{}' paused", jobId);
        return job;
    }

    public JobDefinition resumeJob(String jobId) {
        JobDefinition job = store.setJobEnabled(jobId, true);
        scheduler.scheduleJob(job);
        log.info("Job '{}' resumed", jobId);
        return job;
    }

    public void deleteJob(String jobId) {
        if (!store.deleteJob(jobId)) {
            throw new JobNotFoundException(jobId);
        }
    }

    // ------------------------------------------------------------------
    // Runs
    // ------------------------------------------------------------------

    public JobRun runJobNow(String jobId, Map<String, Object> overrides) {
        return runner.runJobNow(jobId, overrides);
    }

    public JobRun dryRun(String jobId, Map<String, Object> overrides) {
        return runner.dryRun(jobId, overrides);
    }

    public ListResult<JobRun> listRuns(String jobId, int offset, int limit) {
        if (jobId != null) {
            store.requireJob(jobId);
        }
        return new ListResult<>(store.listRuns(jobId, offset, limit), store.countRuns(jobId), offset, limit);
    }

    /** Most recently scheduled run of a job, if it has any. */
    public Optional<JobRun> getLatestRun(String jobId) {
        return listRuns(jobId, 0, 1).items().stream().findFirst();
    }

    public JobRun getRun(String runId) {
        return store.requireRun(runId);
    }

    public List<RunEvent> getRunEvents(String runId, int limit) {
        store.requireRun(runId);
        return store.getRunEvents(runId, limit);
    }

    /** @return false if the run had already finished */
    public boolean cancelRun(String runId) {
        store.requireRun(runId);
        return scheduler.cancelRun(runId, "cancelled by operator");
    }

    // ------------------------------------------------------------------
    // Processing
    // ------------------------------------------------------------------

    public int updateSchedules() {
        return scheduler.updateAllSchedules();
    }

    /**
     * Execute every pending run, at most max-concurrent-runs at a time.
     * A run that throws is logged and counted; it never stops the others.
     */
    public ProcessSummary processPendingRuns() {
        List<JobRun> pending = scheduler.getPendingRuns();
        if (pending.isEmpty()) {
            return ProcessSummary.empty();
        }
        log.info("Processing {} pending run(s)", pending.size());

        List<Future<JobRun>> futures = new ArrayList<>(pending.size());
        for (JobRun run : pending) {
            futures.add(workers.submit(() -> runner.executeRun(run.getId())));
        }

        int succeeded = 0, failed = 0, deferred = 0, cancelled = 0, errors = 0;
        for (int i = 0; i < futures.size(); i++) {
            String runId = pending.get(i).getId();
            try {
                JobRun result = futures.get(i).get();
                switch (result.getState()) {
                    case SUCCEEDED                -> succeeded++;
                    case FAILED, FAILED_RETRYABLE -> failed++;
                    case CANCELLED                -> cancelled++;
                    case DUE                      -> deferred++;
                    case STARTING, RUNNING        -> errors++;
                }
            } catch (ExecutionException e) {
                errors++;
                log.error("Run {} could not be processed: {}", runId, e.getCause().getMessage(), e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for run {}", runId);
                break;
            }
        }
        ProcessSummary summary = new ProcessSummary(pending.size(), succeeded, failed, deferred, cancelled, errors);
        log.info("Processed {}", summary);
        return summary;
    }

    /** Housekeeping: drop expired locks and recover runs abandoned by dead workers. */
    public int runMaintenance() {
        store.purgeExpiredLocks(clock.instant());
        return runner.recoverAbandonedRuns();
    }
}
