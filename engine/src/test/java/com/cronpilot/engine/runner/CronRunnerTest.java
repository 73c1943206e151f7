package com.cronpilot.engine.runner;

import com.cronpilot.engine.EngineTestConfig;
import com.cronpilot.engine.FakeGraphExecutor;
import com.cronpilot.engine.MutableClock;
import com.cronpilot.engine.TestJobs;
import com.cronpilot.engine.config.CronProperties;
import com.cronpilot.engine.executor.ExecutorException;
import com.cronpilot.engine.executor.dto.ExecutionResult;
import com.cronpilot.engine.model.*;
import com.cronpilot.engine.scheduler.CronScheduler;
import com.cronpilot.engine.scheduler.ScheduleCalculator;
import com.cronpilot.engine.store.CronStore;
import com.cronpilot.engine.store.RunEventLog;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end run lifecycle: admission, execution through a fake executor,
 * retries, timeouts, cancellation, artifacts and alerts.
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Import({CronStore.class, RunEventLog.class, ScheduleCalculator.class, CronScheduler.class,
         CronRunner.class, ArtifactWriter.class, FailureClassifier.class, AlertNotifier.class,
         EngineTestConfig.class})
class CronRunnerTest {

    @Autowired CronRunner        runner;
    @Autowired CronScheduler     scheduler;
    @Autowired CronStore         store;
    @Autowired FakeGraphExecutor executor;
    @Autowired MutableClock      clock;
    @Autowired MeterRegistry     meters;
    @Autowired JdbcTemplate      jdbc;
    @Autowired CronProperties    props;

    @BeforeEach
    void setUp() {
        jdbc.update("DELETE FROM locks");
        jdbc.update("DELETE FROM jobs");
        executor.reset();
        clock.set(EngineTestConfig.START);
    }

    // ------------------------------------------------------------------
    // Success
    // ------------------------------------------------------------------

    @Test
    void runJobNow_success_recordsUsageEventsAndArtifacts() throws Exception {
        JobDefinition job = store.saveJob(TestJobs.job("digest", "0 7 * * *"));
        scheduler.scheduleJob(job);
        executor.thenReturn("headline summary");
        double before = succeededCount();

        JobRun run = runner.runJobNow("digest", null);

        assertThat(run.getState()).isEqualTo(RunState.SUCCEEDED);
        assertThat(run.getStartedAt()).isEqualTo(clock.instant());
        assertThat(run.getCompletedAt()).isNotNull();
        assertThat(run.getResourceUsage().steps()).isEqualTo(2);
        assertThat(run.getResourceUsage().tokens()).isEqualTo(50L);
        assertThat(run.getOutputDigest()).isEqualTo(CronRunner.sha256("headline summary"));
        assertThat(eventNames(run)).containsSubsequence("run_started", "run_completed", "artifacts_saved");

        Path dir = Path.of(run.getArtifactsDir());
        assertThat(dir.getParent().getFileName().toString()).isEqualTo("digest");
        assertThat(dir.getFileName().toString()).endsWith("_" + run.getId());
        assertThat(dir.resolve("metadata.json")).exists();
        assertThat(dir.resolve("stdout.log")).exists();
        assertThat(dir.resolve("report.md")).exists();
        assertThat(dir.resolve("snapshots")).isDirectory();
        assertThat(Files.readString(dir.resolve("stdout.log"))).contains("run_started");

        assertThat(store.getSchedule("digest")).get()
                .extracting(Schedule::getLastSuccess).isNotNull();
        assertThat(succeededCount()).isEqualTo(before + 1);
        assertThat(executor.calls()).singleElement()
                .satisfies(call -> assertThat(call.caps()).isEqualTo(job.getResources()));
    }

    @Test
    void runJobNow_overridesAreLayeredOverJobInputs() {
        JobDefinition job = TestJobs.job("digest", "0 7 * * *");
        job.setInputs(Map.of("topic", "markets", "maxItems", 5));
        store.saveJob(job);

        runner.runJobNow("digest", Map.of("topic", "ai"));

        assertThat(executor.calls()).singleElement().satisfies(call ->
                assertThat(call.inputs()).containsEntry("topic", "ai").containsEntry("maxItems", 5));
        assertThat(store.requireJob("digest").getInputs()).containsEntry("topic", "markets");
    }

    @Test
    void executeRun_notDue_doesNothing() {
        store.saveJob(TestJobs.job("j", "0 * * * *"));
        JobRun run = store.saveRun(JobRun.due("j", clock.instant(), 0));
        store.transitionRun(run.getId(), EnumSet.of(RunState.DUE), r -> r.setState(RunState.SUCCEEDED));

        JobRun result = runner.executeRun(run.getId());

        assertThat(result.getState()).isEqualTo(RunState.SUCCEEDED);
        assertThat(executor.calls()).isEmpty();
    }

    @Test
    void executeRun_claimedByAnotherWorker_isSkipped() {
        store.saveJob(TestJobs.job("j", "0 * * * *"));
        JobRun run = store.saveRun(JobRun.due("j", clock.instant(), 0));
        store.acquireLock(ResourceLock.claimResource(run.getId()), "other-worker", clock.instant().plusSeconds(60));

        JobRun result = runner.executeRun(run.getId());

        assertThat(result.getState()).isEqualTo(RunState.DUE);
        assertThat(executor.calls()).isEmpty();
    }

    // ------------------------------------------------------------------
    // Failures and retries
    // ------------------------------------------------------------------

    @Test
    void retryableFailure_followsDelayScheduleUntilExhausted() {
        store.saveJob(TestJobs.job("flaky", "0 * * * *"));
        for (int i = 0; i < 4; i++) {
            executor.thenThrow(ExecutorException.forStatus(503, "executor down"));
        }

        JobRun run = runner.runJobNow("flaky", Map.of("topic", "ai"));
        long[] expectedDelays = {1_000L, 5_000L, 30_000L};
        for (int attempt = 0; attempt < 3; attempt++) {
            assertThat(run.getState()).isEqualTo(RunState.FAILED_RETRYABLE);
            assertThat(run.getAttempt()).isEqualTo(attempt);
            assertThat(run.getErrorCode()).isEqualTo("HTTP_503");
            assertThat(eventNames(run)).contains("run_failed", "retry_scheduled");

            JobRun next = store.findWaitingRuns("flaky").get(0);
            assertThat(next.getAttempt()).isEqualTo(attempt + 1);
            assertThat(next.getScheduledAt()).isEqualTo(run.getCompletedAt().plusMillis(expectedDelays[attempt]));
            assertThat(next.getInputOverrides()).containsEntry("topic", "ai");
            run = runner.executeRun(next.getId());
        }

        assertThat(run.getState()).isEqualTo(RunState.FAILED);
        assertThat(run.getAttempt()).isEqualTo(3);
        assertThat(store.findWaitingRuns("flaky")).isEmpty();
        assertThat(executor.calls()).hasSize(4);
    }

    @Test
    void terminalFailure_isNotRetried() {
        store.saveJob(TestJobs.job("broken", "0 * * * *"));
        executor.thenThrow(ExecutorException.forStatus(400, "unknown graph"));

        JobRun run = runner.runJobNow("broken", null);

        assertThat(run.getState()).isEqualTo(RunState.FAILED);
        assertThat(run.getErrorCode()).isEqualTo("HTTP_400");
        assertThat(run.getErrorMessage()).isEqualTo("unknown graph");
        assertThat(store.findWaitingRuns("broken")).isEmpty();
        assertThat(Path.of(run.getArtifactsDir()).resolve("metadata.json")).exists();
    }

    @Test
    void timeout_cancelsExecutorCallAndRetries() {
        JobDefinition job = TestJobs.job("slow", "0 * * * *");
        job.setResources(TestJobs.limits(1));
        store.saveJob(job);
        executor.then((graph, inputs) -> {
            Thread.sleep(5_000);
            return null;
        });

        JobRun run = runner.runJobNow("slow", null);

        assertThat(run.getState()).isEqualTo(RunState.FAILED_RETRYABLE);
        assertThat(run.getErrorCode()).isEqualTo("TIMEOUT");
        assertThat(store.findWaitingRuns("slow")).hasSize(1);
    }

    // ------------------------------------------------------------------
    // Admission
    // ------------------------------------------------------------------

    @Test
    void skip_whileRunning_failsWithAdmissionRejected() {
        store.saveJob(TestJobs.job("exclusive", "0 * * * *", ConcurrencyPolicy.SKIP));
        store.acquireLock("exclusive", "some-other-run", null);

        JobRun run = runner.runJobNow("exclusive", null);

        assertThat(run.getState()).isEqualTo(RunState.FAILED);
        assertThat(run.getErrorCode()).isEqualTo("ADMISSION_REJECTED");
        assertThat(run.getErrorMessage()).isEqualTo("job already running");
        assertThat(eventNames(run)).contains("run_rejected");
        assertThat(executor.calls()).isEmpty();
        assertThat(store.findWaitingRuns("exclusive")).isEmpty();
        assertThat(run.getArtifactsDir()).isNull();
        assertThat(props.artifactsPath().resolve("exclusive")).doesNotExist();
    }

    @Test
    void queue_whileRunning_staysDueWithOneQueuedEvent() {
        store.saveJob(TestJobs.job("serial", "0 * * * *", ConcurrencyPolicy.QUEUE));
        store.acquireLock("serial", "some-other-run", null);

        JobRun run = runner.runJobNow("serial", null);
        runner.executeRun(run.getId());

        assertThat(store.requireRun(run.getId()).getState()).isEqualTo(RunState.DUE);
        assertThat(eventNames(run)).containsOnlyOnce("run_queued");
        assertThat(executor.calls()).isEmpty();

        store.releaseLock("serial", "some-other-run");
        assertThat(runner.executeRun(run.getId()).getState()).isEqualTo(RunState.SUCCEEDED);
        assertThat(store.isLocked("serial")).isFalse();
    }

    // ------------------------------------------------------------------
    // Cancellation
    // ------------------------------------------------------------------

    @Test
    void cancelledWhileExecuting_resultIsDiscarded() throws Exception {
        store.saveJob(TestJobs.job("long", "0 * * * *"));
        JobRun run = store.saveRun(JobRun.due("long", clock.instant(), 0));
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        executor.then((graph, inputs) -> {
            entered.countDown();
            release.await(10, TimeUnit.SECONDS);
            return ExecutionResult.of("late", 1, 1L);
        });

        CompletableFuture<JobRun> execution = CompletableFuture.supplyAsync(() -> runner.executeRun(run.getId()));
        assertThat(entered.await(10, TimeUnit.SECONDS)).isTrue();
        assertThat(scheduler.cancelRun(run.getId(), "operator")).isTrue();
        release.countDown();
        JobRun result = execution.get(10, TimeUnit.SECONDS);

        assertThat(result.getState()).isEqualTo(RunState.CANCELLED);
        assertThat(result.getOutputDigest()).isNull();
        assertThat(eventNames(result)).contains("run_cancelled").doesNotContain("run_completed", "artifacts_saved");
        assertThat(store.findWaitingRuns("long")).isEmpty();
    }

    // ------------------------------------------------------------------
    // Dry run
    // ------------------------------------------------------------------

    @Test
    void dryRun_walksLifecycleWithoutExecutor() throws Exception {
        store.saveJob(TestJobs.job("digest", "0 7 * * *", ConcurrencyPolicy.SKIP));
        store.acquireLock("digest", "some-other-run", null);

        JobRun run = runner.dryRun("digest", Map.of("topic", "ai"));

        assertThat(run.getId()).startsWith("dryrun_digest_");
        assertThat(run.isDryRun()).isTrue();
        assertThat(run.getState()).isEqualTo(RunState.SUCCEEDED);
        assertThat(run.getResourceUsage()).isEqualTo(ResourceUsage.empty());
        assertThat(eventNames(run)).containsSubsequence("dry_run_started", "dry_run_completed");
        assertThat(executor.calls()).isEmpty();
        assertThat(Files.readString(Path.of(run.getArtifactsDir()).resolve("report.md")))
                .contains("Dry Run Result");
    }

    // ------------------------------------------------------------------
    // Alerts
    // ------------------------------------------------------------------

    @Test
    void alerts_successAndMaterialChange() {
        JobDefinition job = TestJobs.job("watch", "0 * * * *");
        job.setAlerts(new AlertConfig(true, false, true));
        store.saveJob(job);
        executor.thenReturn("v1").thenReturn("v1").thenReturn("v2");

        JobRun first = runner.runJobNow("watch", null);
        clock.advance(Duration.ofMinutes(1));
        JobRun same = runner.runJobNow("watch", null);
        clock.advance(Duration.ofMinutes(1));
        JobRun changed = runner.runJobNow("watch", null);

        assertThat(alertKinds(first)).containsExactly("success");
        assertThat(alertKinds(same)).containsExactly("success");
        assertThat(alertKinds(changed)).containsExactly("success", "material_change");
    }

    @Test
    void alerts_materialChange_comparesAgainstLastRealRunNotDryRun() {
        JobDefinition job = TestJobs.job("watch", "0 * * * *");
        job.setAlerts(new AlertConfig(false, false, true));
        store.saveJob(job);
        executor.thenReturn("v1").thenReturn("v2");

        runner.runJobNow("watch", null);
        clock.advance(Duration.ofMinutes(1));
        JobRun dry = runner.dryRun("watch", null);
        clock.advance(Duration.ofMinutes(1));
        JobRun changed = runner.runJobNow("watch", null);

        assertThat(dry.getState()).isEqualTo(RunState.SUCCEEDED);
        assertThat(alertKinds(changed)).containsExactly("material_change");
    }

    @Test
    void alerts_onFailure() {
        JobDefinition job = TestJobs.job("watch", "0 * * * *");
        job.setAlerts(new AlertConfig(false, true, false));
        job.setRetry(TestJobs.noRetries());
        store.saveJob(job);
        executor.thenThrow(ExecutorException.forStatus(500, "boom"));

        JobRun run = runner.runJobNow("watch", null);

        assertThat(run.getState()).isEqualTo(RunState.FAILED);
        assertThat(alertKinds(run)).containsExactly("failure");
    }

    // ------------------------------------------------------------------
    // Abandoned runs
    // ------------------------------------------------------------------

    @Test
    void recoverAbandonedRuns_failsStuckRunsAndRetries() {
        JobDefinition job = TestJobs.job("stuck", "0 * * * *");
        job.setResources(TestJobs.limits(60));
        store.saveJob(job);
        JobRun run = store.saveRun(JobRun.due("stuck", clock.instant(), 0));
        Instant startedAt = clock.instant();
        store.transitionRun(run.getId(), EnumSet.of(RunState.DUE), r -> {
            r.setState(RunState.RUNNING);
            r.setStartedAt(startedAt);
        });

        clock.advance(Duration.ofSeconds(60));
        assertThat(runner.recoverAbandonedRuns()).isZero();

        clock.advance(Duration.ofSeconds(61));
        assertThat(runner.recoverAbandonedRuns()).isEqualTo(1);

        JobRun recovered = store.requireRun(run.getId());
        assertThat(recovered.getState()).isEqualTo(RunState.FAILED_RETRYABLE);
        assertThat(recovered.getErrorCode()).isEqualTo(FailureClassifier.ABANDONED);
        assertThat(store.findWaitingRuns("stuck")).singleElement()
                .extracting(JobRun::getAttempt).isEqualTo(1);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private List<String> eventNames(JobRun run) {
        return store.getRunEvents(run.getId()).stream().map(RunEvent::getEvent).toList();
    }

    private List<Object> alertKinds(JobRun run) {
        return store.getRunEvents(run.getId()).stream()
                .filter(e -> e.getEvent().equals("alert"))
                .map(e -> e.getData().get("kind"))
                .toList();
    }

    private double succeededCount() {
        return meters.counter("cronpilot.runs", "outcome", "succeeded").count();
    }
}
