package com.cronpilot.engine.runner;

import com.cronpilot.engine.config.CronProperties;
import com.cronpilot.engine.executor.ExecutorException;
import com.cronpilot.engine.executor.GraphExecutor;
import com.cronpilot.engine.executor.dto.ExecutionResult;
import com.cronpilot.engine.model.*;
import com.cronpilot.engine.runner.FailureClassifier.Failure;
import com.cronpilot.engine.scheduler.AdmissionDecision;
import com.cronpilot.engine.scheduler.CronScheduler;
import com.cronpilot.engine.store.CronStore;
import com.cronpilot.engine.store.RunEventLog;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives one run through its state machine:
 *
 * <pre>
 *   DUE ─claim─▶ admission ─▶ STARTING ─▶ RUNNING ─▶ SUCCEEDED
 *                    │                       ├──▶ FAILED_RETRYABLE (+ new DUE run, attempt+1)
 *                    └──▶ FAILED             ├──▶ FAILED
 *                                            └──▶ CANCELLED (by cancel-previous)
 * </pre>
 *
 * The executor call is the only blocking step. It runs on a separate thread
 * so maxRunSeconds can be enforced with {@link Future#get(long, TimeUnit)};
 * on timeout the call is interrupted and the run is finalized anyway.
 *
 * Every state change is conditional on the state the runner expects, so a
 * run cancelled while its executor call is in flight stays CANCELLED: its
 * result is discarded, no artifacts are written and no retry is scheduled.
 */
@Service
public class CronRunner {

    private static final Logger log = LoggerFactory.getLogger(CronRunner.class);

    private final CronStore         store;
    private final CronScheduler     scheduler;
    private final GraphExecutor     executor;
    private final ArtifactWriter    artifacts;
    private final RunEventLog       events;
    private final FailureClassifier classifier;
    private final AlertNotifier     alerts;
    private final CronProperties    props;
    private final Clock             clock;
    private final MeterRegistry     meters;

    private final ExecutorService executionPool = Executors.newCachedThreadPool(new ExecutionThreadFactory());

    public CronRunner(CronStore store,
                      CronScheduler scheduler,
                      GraphExecutor executor,
                      ArtifactWriter artifacts,
                      RunEventLog events,
                      FailureClassifier classifier,
                      AlertNotifier alerts,
                      CronProperties props,
                      Clock clock,
                      MeterRegistry meters) {
        this.store      = store;
        this.scheduler  = scheduler;
        this.executor   = executor;
        this.artifacts  = artifacts;
        this.events     = events;
        this.classifier = classifier;
        this.alerts     = alerts;
        this.props      = props;
        this.clock      = clock;
        this.meters     = meters;
    }

    @PreDestroy
    void shutdown() {
        executionPool.shutdownNow();
    }

    // ------------------------------------------------------------------
    // Entry points
    // ------------------------------------------------------------------

    /**
     * Execute a DUE run.
     *
     * Returns without doing anything if the run is no longer DUE or another
     * worker has claimed it. A run deferred by the queue policy stays DUE.
     *
     * @return the run as stored after this call
     * @throws com.cronpilot.engine.store.RunNotFoundException if the run does not exist
     * @throws com.cronpilot.engine.store.JobNotFoundException if its job does not exist
     */
    public JobRun executeRun(String runId) {
        JobRun run = store.requireRun(runId);
        JobDefinition job = store.requireJob(run.getJobId());

        MDC.put("jobId", job.getId());
        MDC.put("runId", runId);
        MDC.put("attempt", String.valueOf(run.getAttempt()));
        try {
            if (run.getState() != RunState.DUE) {
                log.info("Run {} is {}; nothing to execute", runId, run.getState());
                return run;
            }
            String claim = ResourceLock.claimResource(runId);
            if (!store.acquireLock(claim, props.workerId(), scheduler.lockExpiry(job))) {
                log.debug("Run {} is claimed by another worker", runId);
                return run;
            }
            try {
                if (run.isDryRun() || props.enableDryRun()) {
                    return simulate(job, run);
                }
                return admitAndExecute(job, run);
            } finally {
                store.releaseLock(claim, props.workerId());
            }
        } finally {
            MDC.remove("jobId");
            MDC.remove("runId");
            MDC.remove("attempt");
        }
    }

    /**
     * Trigger a job outside its schedule. Override inputs are layered over
     * the job's inputs for this run only; the job itself is not changed.
     */
    public JobRun runJobNow(String jobId, Map<String, Object> overrides) {
        JobDefinition job = store.requireJob(jobId);
        JobRun run = JobRun.due(job.getId(), clock.instant(), 0);
        if (overrides != null && !overrides.isEmpty()) {
            run.setInputOverrides(new LinkedHashMap<>(overrides));
        }
        store.saveRun(run);
        log.info("Manual run {} created for job '{}'", run.getId(), jobId);
        return executeRun(run.getId());
    }

    /**
     * Walk a job through the full run machinery without calling the
     * executor. No admission check, no lock, no resource use.
     */
    public JobRun dryRun(String jobId, Map<String, Object> overrides) {
        JobDefinition job = store.requireJob(jobId);
        Instant now = clock.instant();
        JobRun run = new JobRun(JobRun.newId("dryrun", job.getId(), now), job.getId(), now, 0);
        run.setDryRun(true);
        if (overrides != null && !overrides.isEmpty()) {
            run.setInputOverrides(new LinkedHashMap<>(overrides));
        }
        store.saveRun(run);
        return executeRun(run.getId());
    }

    /**
     * Fail runs stuck in STARTING/RUNNING past their timeout plus the lock
     * grace period whose worker no longer holds the claim. Such runs follow
     * the job's retry policy like any transient failure.
     *
     * @return number of runs recovered
     */
    public int recoverAbandonedRuns() {
        Instant now = clock.instant();
        int recovered = 0;
        for (JobRun run : store.findRunsInStates(RunState.ACTIVE)) {
            Optional<JobDefinition> job = store.getJob(run.getJobId());
            if (job.isEmpty()) {
                continue;
            }
            Instant since = run.getStartedAt() != null ? run.getStartedAt() : run.getScheduledAt();
            Instant deadline = since.plusSeconds(job.get().getResources().maxRunSeconds()).plus(props.lockGrace());
            if (now.isBefore(deadline) || store.isLocked(ResourceLock.claimResource(run.getId()))) {
                continue;
            }
            log.warn("Run {} of job '{}' abandoned in state {} since {}", run.getId(), run.getJobId(), run.getState(), since);
            Failure failure = classifier.abandoned("Run was not finished by its worker within "
                    + Duration.between(since, deadline).toSeconds() + "s");
            long durationMs = Duration.between(since, now).toMillis();
            Path dir = run.getArtifactsDir() == null ? null : Path.of(run.getArtifactsDir());
            if (fail(job.get(), run, failure, durationMs, dir, RunState.ACTIVE)) {
                store.releaseLock(run.getJobId(), run.getId());
                recovered++;
            }
        }
        return recovered;
    }

    // ------------------------------------------------------------------
    // Real execution
    // ------------------------------------------------------------------

    private JobRun admitAndExecute(JobDefinition job, JobRun run) {
        String runId = run.getId();
        AdmissionDecision decision = scheduler.canRunJob(job, runId);
        if (decision.deferred()) {
            if (!store.hasEvent(runId, "run_queued")) {
                events.info(runId, "run_queued", "Run queued: " + decision.reason());
            }
            return store.requireRun(runId);
        }
        if (!decision.canRun()) {
            reject(job, run, decision.reason());
            return store.requireRun(runId);
        }
        try {
            execute(job, run);
        } finally {
            if (decision.lockAcquired()) {
                scheduler.releaseJobLock(job, runId);
            }
        }
        return store.requireRun(runId);
    }

    private void reject(JobDefinition job, JobRun run, String reason) {
        Instant now = clock.instant();
        events.warn(run.getId(), "run_rejected", "Run not admitted (" + job.getConcurrency().wireName() + "): " + reason);
        Optional<JobRun> failed = store.transitionRun(run.getId(), EnumSet.of(RunState.DUE), r -> {
            r.setState(RunState.FAILED);
            r.setCompletedAt(now);
            r.setErrorCode("ADMISSION_REJECTED");
            r.setErrorMessage(reason);
        });
        if (failed.isPresent()) {
            count("rejected");
            scheduler.recordCompletion(job.getId(), now, false);
        }
    }

    private void execute(JobDefinition job, JobRun run) {
        String runId = run.getId();
        Optional<JobRun> started = scheduler.markRunStarted(runId);
        if (started.isEmpty()) {
            log.info("Run {} left DUE before it could start", runId);
            return;
        }
        Path dir;
        try {
            dir = artifacts.createRunDirectory(job.getId(), started.get().getStartedAt(), runId);
        } catch (UncheckedIOException e) {
            fail(job, started.get(), classifier.classify(e, job.getRetry()), 0L, null, RunState.ACTIVE);
            return;
        }
        if (store.transitionRun(runId, EnumSet.of(RunState.STARTING), r -> {
                r.setState(RunState.RUNNING);
                r.setArtifactsDir(dir.toString());
            }).isEmpty()) {
            return;
        }
        events.info(runId, "run_started",
                "Executing graph '" + job.getGraphId() + "' (attempt " + run.getAttempt() + ")");

        Map<String, Object> inputs = job.effectiveInputs(run.getInputOverrides());
        long t0 = System.nanoTime();
        try {
            ExecutionResult result = invokeWithTimeout(job, inputs, dir);
            succeed(job, runId, result, elapsedMs(t0), dir, inputs);
        } catch (RuntimeException e) {
            long durationMs = elapsedMs(t0);
            Failure failure = classifier.classify(e, job.getRetry());
            if (e instanceof RunTimeoutException) {
                count("timeout");
            }
            log.debug("Run {} failed", runId, e);
            fail(job, store.requireRun(runId), failure, durationMs, dir, EnumSet.of(RunState.RUNNING));
        }
    }

    private ExecutionResult invokeWithTimeout(JobDefinition job, Map<String, Object> inputs, Path dir) {
        ResourceLimits caps = job.getResources();
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        Future<ExecutionResult> call = executionPool.submit(() -> {
            if (mdc != null) MDC.setContextMap(mdc);
            try {
                return executor.execute(job.getGraphId(), inputs, dir, caps);
            } finally {
                MDC.clear();
            }
        });
        try {
            return call.get(caps.maxRunSeconds(), TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            throw new RunTimeoutException(caps.maxRunSeconds());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw new ExecutorException(cause.getClass().getSimpleName(), String.valueOf(cause.getMessage()), false, cause);
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw new ExecutorException(ExecutorException.INTERRUPTED, "Runner interrupted while waiting for executor", true, e);
        }
    }

    private void succeed(JobDefinition job, String runId, ExecutionResult result, long durationMs,
                         Path dir, Map<String, Object> inputs) {
        Instant now = clock.instant();
        ResourceUsage usage = new ResourceUsage(result.steps_used(), result.tokens_used(), durationMs, result.bandwidth_bytes());
        Optional<JobRun> done = store.transitionRun(runId, EnumSet.of(RunState.RUNNING), r -> {
            r.setState(RunState.SUCCEEDED);
            r.setCompletedAt(now);
            r.setResourceUsage(usage);
            r.setOutputDigest(sha256(result.output()));
        });
        if (done.isEmpty()) {
            discarded(runId);
            return;
        }
        events.info(runId, "run_completed", "Run succeeded in " + durationMs + "ms ("
                + usage.steps() + " steps, " + usage.tokens() + " tokens)");
        writeArtifacts(dir, job, done.get(), inputs, result, null);
        count("succeeded");
        timer(job).record(Duration.ofMillis(durationMs));
        scheduler.recordCompletion(job.getId(), now, true);
        alerts.runSucceeded(job, done.get());
    }

    /**
     * Finalize a failed run: FAILED_RETRYABLE plus a new DUE attempt when the
     * failure is retryable and retries are left, FAILED otherwise.
     *
     * @return false if the run had already left the expected states (cancelled)
     */
    private boolean fail(JobDefinition job, JobRun run, Failure failure, long durationMs,
                         Path dir, Set<RunState> expected) {
        String runId = run.getId();
        Instant now = clock.instant();
        RetryPolicy policy = job.getRetry();
        boolean retry = failure.retryable() && policy.hasRetriesLeft(run.getAttempt());
        RunState target = retry ? RunState.FAILED_RETRYABLE : RunState.FAILED;

        Optional<JobRun> done = store.transitionRun(runId, expected, r -> {
            r.setState(target);
            r.setCompletedAt(now);
            r.setErrorCode(failure.code());
            r.setErrorMessage(failure.message());
            r.setResourceUsage(new ResourceUsage(r.getResourceUsage().steps(), r.getResourceUsage().tokens(),
                    durationMs, r.getResourceUsage().bandwidthBytes()));
        });
        if (done.isEmpty()) {
            discarded(runId);
            return false;
        }
        events.error(runId, "run_failed", failure.code() + ": " + failure.message());

        if (retry) {
            long delay = policy.delayAfter(run.getAttempt());
            JobRun next = JobRun.due(job.getId(), now.plusMillis(delay), run.getAttempt() + 1);
            next.setInputOverrides(run.getInputOverrides());
            store.saveRun(next);
            events.warn(runId, "retry_scheduled", "Attempt " + next.getAttempt() + " of " + policy.maxRetries()
                    + " scheduled at " + next.getScheduledAt() + " (in " + delay + "ms) as run " + next.getId());
            count("retry");
        } else {
            count("failed");
        }
        if (dir != null) {
            writeArtifacts(dir, job, done.get(), job.effectiveInputs(run.getInputOverrides()), null, failure);
        }
        timer(job).record(Duration.ofMillis(durationMs));
        scheduler.recordCompletion(job.getId(), now, false);
        alerts.runFailed(job, done.get());
        return true;
    }

    private void discarded(String runId) {
        JobRun current = store.requireRun(runId);
        log.info("Run {} finished but is {}; result discarded", runId, current.getState());
        if (current.getState() == RunState.CANCELLED) {
            count("cancelled");
        }
    }

    // ------------------------------------------------------------------
    // Dry run
    // ------------------------------------------------------------------

    private JobRun simulate(JobDefinition job, JobRun run) {
        String runId = run.getId();
        Instant now = clock.instant();
        Optional<JobRun> started = store.transitionRun(runId, EnumSet.of(RunState.DUE), r -> {
            r.setState(RunState.RUNNING);
            r.setStartedAt(now);
            r.setDryRun(true);
        });
        if (started.isEmpty()) {
            return store.requireRun(runId);
        }
        Path dir = artifacts.createRunDirectory(job.getId(), now, runId);
        events.info(runId, "dry_run_started", "Starting dry run of job " + job.getName());

        Map<String, Object> inputs = job.effectiveInputs(run.getInputOverrides());
        ExecutionResult simulated = ExecutionResult.of(artifacts.dryRunOutput(job, inputs, dir), 0, 0L);
        Optional<JobRun> done = store.transitionRun(runId, EnumSet.of(RunState.RUNNING), r -> {
            r.setState(RunState.SUCCEEDED);
            r.setCompletedAt(clock.instant());
            r.setArtifactsDir(dir.toString());
            r.setResourceUsage(ResourceUsage.empty());
        });
        if (done.isEmpty()) {
            return store.requireRun(runId);
        }
        events.info(runId, "dry_run_completed", "Dry run completed successfully");
        writeArtifacts(dir, job, done.get(), inputs, simulated, null);
        return store.requireRun(runId);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void writeArtifacts(Path dir, JobDefinition job, JobRun run, Map<String, Object> inputs,
                                ExecutionResult result, Failure failure) {
        try {
            artifacts.write(dir, job, run, inputs, result, failure, store.getRunEvents(run.getId()));
            events.info(run.getId(), "artifacts_saved", "Artifacts saved to " + dir);
        } catch (RuntimeException e) {
            events.error(run.getId(), "artifacts_failed", "Could not write artifacts: " + e.getMessage());
        }
    }

    private void count(String outcome) {
        meters.counter("cronpilot.runs", "outcome", outcome).increment();
    }

    private Timer timer(JobDefinition job) {
        return meters.timer("cronpilot.run.duration", "graph", job.getGraphId());
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    static String sha256(String text) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static final class ExecutionThreadFactory implements ThreadFactory {
        private final AtomicInteger seq = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "graph-exec-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
