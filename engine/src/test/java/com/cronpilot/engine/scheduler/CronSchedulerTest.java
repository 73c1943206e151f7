package com.cronpilot.engine.scheduler;

import com.cronpilot.engine.EngineTestConfig;
import com.cronpilot.engine.MutableClock;
import com.cronpilot.engine.TestJobs;
import com.cronpilot.engine.model.*;
import com.cronpilot.engine.store.CronStore;
import com.cronpilot.engine.store.RunEventLog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Scheduling, materialization and admission control against the real store.
 * The clock starts at 2024-01-15T10:00:00Z; jobs run in UTC.
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Import({CronStore.class, RunEventLog.class, ScheduleCalculator.class, CronScheduler.class, EngineTestConfig.class})
class CronSchedulerTest {

    @Autowired CronScheduler scheduler;
    @Autowired CronStore     store;
    @Autowired MutableClock  clock;
    @Autowired JdbcTemplate  jdbc;

    @BeforeEach
    void setUp() {
        jdbc.update("DELETE FROM locks");
        jdbc.update("DELETE FROM jobs");
        clock.set(EngineTestConfig.START);
    }

    // ------------------------------------------------------------------
    // scheduleJob()
    // ------------------------------------------------------------------

    @Test
    void scheduleJob_storesNextOccurrence() {
        JobDefinition job = store.saveJob(TestJobs.job("hourly", "0 * * * *"));

        Schedule schedule = scheduler.scheduleJob(job).orElseThrow();

        assertThat(schedule.getNextDue()).isEqualTo(Instant.parse("2024-01-15T11:00:00Z"));
        assertThat(schedule.getTimezone()).isEqualTo("UTC");
    }

    @Test
    void scheduleJob_disabledJob_removesSchedule() {
        JobDefinition job = store.saveJob(TestJobs.job("hourly", "0 * * * *"));
        scheduler.scheduleJob(job);

        JobDefinition paused = store.setJobEnabled("hourly", false);

        assertThat(scheduler.scheduleJob(paused)).isEmpty();
        assertThat(store.getSchedule("hourly")).isEmpty();
    }

    @Test
    void scheduleJob_windowClosed_notScheduled() {
        JobDefinition job = TestJobs.job("expired", "0 * * * *");
        job.setNotAfter(Instant.parse("2024-01-15T10:30:00Z"));
        store.saveJob(job);

        assertThat(scheduler.scheduleJob(job)).isEmpty();
    }

    @Test
    void updateAllSchedules_countsScheduledJobs() {
        store.saveJob(TestJobs.job("a", "0 * * * *"));
        store.saveJob(TestJobs.job("b", "*/5 * * * *"));
        JobDefinition paused = TestJobs.job("c", "0 * * * *");
        paused.setEnabled(false);
        store.saveJob(paused);

        assertThat(scheduler.updateAllSchedules()).isEqualTo(2);
        assertThat(store.getSchedule("b")).get()
                .extracting(Schedule::getNextDue).isEqualTo(Instant.parse("2024-01-15T10:05:00Z"));
    }

    // ------------------------------------------------------------------
    // getPendingRuns()
    // ------------------------------------------------------------------

    @Test
    void getPendingRuns_nothingDue_returnsEmpty() {
        scheduler.scheduleJob(store.saveJob(TestJobs.job("hourly", "0 * * * *")));

        assertThat(scheduler.getPendingRuns()).isEmpty();
    }

    @Test
    void getPendingRuns_withoutCatchup_materializesOneRunAndSkipsMissed() {
        scheduler.scheduleJob(store.saveJob(TestJobs.job("hourly", "0 * * * *")));
        clock.set(Instant.parse("2024-01-15T15:30:00Z"));

        List<JobRun> pending = scheduler.getPendingRuns();

        assertThat(pending).singleElement().satisfies(run -> {
            assertThat(run.getScheduledAt()).isEqualTo(Instant.parse("2024-01-15T11:00:00Z"));
            assertThat(run.getState()).isEqualTo(RunState.DUE);
            assertThat(run.getAttempt()).isZero();
        });
        assertThat(store.getSchedule("hourly")).get()
                .extracting(Schedule::getNextDue).isEqualTo(Instant.parse("2024-01-15T16:00:00Z"));
    }

    @Test
    void getPendingRuns_withCatchup_materializesEveryMissedOccurrence() {
        JobDefinition job = TestJobs.job("hourly", "0 * * * *");
        job.setCatchup(true);
        scheduler.scheduleJob(store.saveJob(job));
        clock.set(Instant.parse("2024-01-15T15:30:00Z"));

        List<JobRun> pending = scheduler.getPendingRuns();

        assertThat(pending).extracting(JobRun::getScheduledAt).containsExactly(
                Instant.parse("2024-01-15T11:00:00Z"),
                Instant.parse("2024-01-15T12:00:00Z"),
                Instant.parse("2024-01-15T13:00:00Z"),
                Instant.parse("2024-01-15T14:00:00Z"),
                Instant.parse("2024-01-15T15:00:00Z"));
        Schedule schedule = store.getSchedule("hourly").orElseThrow();
        assertThat(schedule.getNextDue()).isEqualTo(Instant.parse("2024-01-15T16:00:00Z"));
        assertThat(schedule.getLastScheduled()).isEqualTo(Instant.parse("2024-01-15T15:00:00Z"));
    }

    @Test
    void updateAllSchedules_afterDowntime_withCatchup_keepsEarliestMissedOccurrence() {
        JobDefinition job = TestJobs.job("hourly", "0 * * * *");
        job.setCatchup(true);
        scheduler.scheduleJob(store.saveJob(job));
        clock.set(Instant.parse("2024-01-15T15:30:00Z"));

        scheduler.updateAllSchedules();

        assertThat(store.getSchedule("hourly")).get()
                .extracting(Schedule::getNextDue).isEqualTo(Instant.parse("2024-01-15T11:00:00Z"));
        assertThat(scheduler.getPendingRuns()).extracting(JobRun::getScheduledAt).containsExactly(
                Instant.parse("2024-01-15T11:00:00Z"),
                Instant.parse("2024-01-15T12:00:00Z"),
                Instant.parse("2024-01-15T13:00:00Z"),
                Instant.parse("2024-01-15T14:00:00Z"),
                Instant.parse("2024-01-15T15:00:00Z"));
    }

    @Test
    void updateAllSchedules_afterDowntime_withoutCatchup_skipsToNextWindow() {
        scheduler.scheduleJob(store.saveJob(TestJobs.job("hourly", "0 * * * *")));
        clock.set(Instant.parse("2024-01-15T15:30:00Z"));

        scheduler.updateAllSchedules();

        assertThat(store.getSchedule("hourly")).get()
                .extracting(Schedule::getNextDue).isEqualTo(Instant.parse("2024-01-15T16:00:00Z"));
    }

    @Test
    void getPendingRuns_calledTwice_doesNotDuplicateOccurrences() {
        scheduler.scheduleJob(store.saveJob(TestJobs.job("hourly", "0 * * * *")));
        clock.set(Instant.parse("2024-01-15T11:00:30Z"));

        scheduler.getPendingRuns();
        List<JobRun> second = scheduler.getPendingRuns();

        assertThat(second).hasSize(1);
        assertThat(store.countRuns("hourly")).isEqualTo(1);
    }

    @Test
    void materialize_scheduleLockHeldElsewhere_createsNothing() {
        scheduler.scheduleJob(store.saveJob(TestJobs.job("hourly", "0 * * * *")));
        clock.set(Instant.parse("2024-01-15T11:00:30Z"));
        store.acquireLock(ResourceLock.scheduleResource("hourly"), "other-worker", clock.instant().plusSeconds(60));

        assertThat(scheduler.materialize("hourly", clock.instant())).isZero();
        assertThat(store.countRuns("hourly")).isZero();
    }

    @Test
    void getPendingRuns_lastOccurrenceInWindow_closesSchedule() {
        JobDefinition job = TestJobs.job("once", "0 * * * *");
        job.setNotAfter(Instant.parse("2024-01-15T11:30:00Z"));
        scheduler.scheduleJob(store.saveJob(job));
        clock.set(Instant.parse("2024-01-15T11:00:10Z"));

        assertThat(scheduler.getPendingRuns()).hasSize(1);
        assertThat(store.getSchedule("once")).isEmpty();
    }

    @Test
    void getPendingRuns_ordersByPriorityThenScheduledAt() {
        JobDefinition low = TestJobs.job("low", "0 * * * *");
        JobDefinition high = TestJobs.job("high", "0 * * * *");
        high.setPriority(10);
        store.saveJob(low);
        store.saveJob(high);
        Instant now = clock.instant();
        store.saveRun(JobRun.due("low", now.minusSeconds(120), 0));
        store.saveRun(JobRun.due("high", now.minusSeconds(10), 0));
        store.saveRun(JobRun.due("low", now.minusSeconds(60), 0));

        assertThat(scheduler.getPendingRuns())
                .extracting(JobRun::getJobId, JobRun::getScheduledAt)
                .containsExactly(
                        tuple("high", now.minusSeconds(10)),
                        tuple("low", now.minusSeconds(120)),
                        tuple("low", now.minusSeconds(60)));
    }

    @Test
    void getPendingRuns_skipsClaimedRunsAndDisabledJobs() {
        store.saveJob(TestJobs.job("active", "0 * * * *"));
        JobDefinition paused = TestJobs.job("paused", "0 * * * *");
        paused.setEnabled(false);
        store.saveJob(paused);
        Instant now = clock.instant();
        JobRun claimed = store.saveRun(JobRun.due("active", now, 0));
        JobRun free = store.saveRun(JobRun.due("active", now, 0));
        store.saveRun(JobRun.due("paused", now, 0));
        store.acquireLock(ResourceLock.claimResource(claimed.getId()), "other-worker", now.plusSeconds(60));

        assertThat(scheduler.getPendingRuns()).extracting(JobRun::getId).containsExactly(free.getId());
    }

    // ------------------------------------------------------------------
    // canRunJob()
    // ------------------------------------------------------------------

    @Test
    void allow_alwaysAdmitsWithoutLock() {
        JobDefinition job = store.saveJob(TestJobs.job("j", "0 * * * *", ConcurrencyPolicy.ALLOW));

        AdmissionDecision first = scheduler.canRunJob(job, "run-1");
        AdmissionDecision second = scheduler.canRunJob(job, "run-2");

        assertThat(first.canRun()).isTrue();
        assertThat(second.canRun()).isTrue();
        assertThat(first.lockAcquired()).isFalse();
        assertThat(store.isLocked("j")).isFalse();
    }

    @Test
    void skip_rejectsWhileJobIsRunning() {
        JobDefinition job = store.saveJob(TestJobs.job("j", "0 * * * *", ConcurrencyPolicy.SKIP));

        AdmissionDecision first = scheduler.canRunJob(job, "run-1");
        AdmissionDecision second = scheduler.canRunJob(job, "run-2");

        assertThat(first.canRun()).isTrue();
        assertThat(first.lockAcquired()).isTrue();
        assertThat(second.canRun()).isFalse();
        assertThat(second.deferred()).isFalse();
        assertThat(second.reason()).isEqualTo("job already running");

        scheduler.releaseJobLock(job, "run-1");
        assertThat(scheduler.canRunJob(job, "run-3").canRun()).isTrue();
    }

    @Test
    void skip_lockExpiresAfterMaxRunSecondsPlusGrace() {
        JobDefinition job = TestJobs.job("j", "0 * * * *", ConcurrencyPolicy.SKIP);
        job.setResources(TestJobs.limits(30));
        store.saveJob(job);
        scheduler.canRunJob(job, "stuck-run");

        clock.advance(Duration.ofSeconds(30 + 60 + 1));

        assertThat(scheduler.canRunJob(job, "run-2").canRun()).isTrue();
    }

    @Test
    void queue_admitsHeadDefersOthersAndRejectsBeyondDepth() {
        JobDefinition job = store.saveJob(TestJobs.job("q", "0 * * * *", ConcurrencyPolicy.QUEUE));
        Instant now = clock.instant();
        JobRun r0 = store.saveRun(JobRun.due("q", now.minusSeconds(40), 0));
        JobRun r1 = store.saveRun(JobRun.due("q", now.minusSeconds(30), 0));
        store.saveRun(JobRun.due("q", now.minusSeconds(20), 0));
        JobRun r3 = store.saveRun(JobRun.due("q", now.minusSeconds(10), 0));

        AdmissionDecision head = scheduler.canRunJob(job, r0.getId());
        AdmissionDecision behind = scheduler.canRunJob(job, r1.getId());
        AdmissionDecision overflow = scheduler.canRunJob(job, r3.getId());

        assertThat(head.canRun()).isTrue();
        assertThat(head.lockAcquired()).isTrue();
        assertThat(behind.canRun()).isFalse();
        assertThat(behind.deferred()).isTrue();
        assertThat(overflow.canRun()).isFalse();
        assertThat(overflow.deferred()).isFalse();
        assertThat(overflow.reason()).isEqualTo("queue full");
    }

    @Test
    void queue_headDeferredWhileLockHeld() {
        JobDefinition job = store.saveJob(TestJobs.job("q", "0 * * * *", ConcurrencyPolicy.QUEUE));
        JobRun running = store.saveRun(JobRun.due("q", clock.instant().minusSeconds(60), 0));
        store.transitionRun(running.getId(), EnumSet.of(RunState.DUE), r -> r.setState(RunState.RUNNING));
        store.acquireLock("q", running.getId(), null);
        JobRun next = store.saveRun(JobRun.due("q", clock.instant(), 0));

        AdmissionDecision decision = scheduler.canRunJob(job, next.getId());

        assertThat(decision.deferred()).isTrue();
        assertThat(decision.reason()).isEqualTo("job already running");
    }

    @Test
    void cancelPrevious_cancelsActiveRunAndTakesLock() {
        JobDefinition job = store.saveJob(TestJobs.job("c", "0 * * * *", ConcurrencyPolicy.CANCEL_PREVIOUS));
        JobRun old = store.saveRun(JobRun.due("c", clock.instant().minusSeconds(60), 0));
        store.transitionRun(old.getId(), EnumSet.of(RunState.DUE), r -> r.setState(RunState.RUNNING));
        store.acquireLock("c", old.getId(), null);
        JobRun fresh = store.saveRun(JobRun.due("c", clock.instant(), 0));

        AdmissionDecision decision = scheduler.canRunJob(job, fresh.getId());

        assertThat(decision.canRun()).isTrue();
        assertThat(store.requireRun(old.getId()).getState()).isEqualTo(RunState.CANCELLED);
        assertThat(store.getLock("c")).get().extracting(ResourceLock::getOwner).isEqualTo(fresh.getId());
        assertThat(store.hasEvent(old.getId(), "run_cancelled")).isTrue();
    }

    // ------------------------------------------------------------------
    // Run state
    // ------------------------------------------------------------------

    @Test
    void markRunStarted_onlyFromDue() {
        store.saveJob(TestJobs.job("j", "0 * * * *"));
        JobRun run = store.saveRun(JobRun.due("j", clock.instant(), 0));

        assertThat(scheduler.markRunStarted(run.getId())).get()
                .satisfies(r -> {
                    assertThat(r.getState()).isEqualTo(RunState.STARTING);
                    assertThat(r.getStartedAt()).isEqualTo(clock.instant());
                });
        assertThat(scheduler.markRunStarted(run.getId())).isEmpty();
    }

    @Test
    void cancelRun_finishedRun_returnsFalse() {
        store.saveJob(TestJobs.job("j", "0 * * * *"));
        JobRun run = store.saveRun(JobRun.due("j", clock.instant(), 0));
        store.transitionRun(run.getId(), EnumSet.of(RunState.DUE), r -> r.setState(RunState.SUCCEEDED));

        assertThat(scheduler.cancelRun(run.getId(), "too late")).isFalse();
        assertThat(store.requireRun(run.getId()).getState()).isEqualTo(RunState.SUCCEEDED);
    }

    @Test
    void recordCompletion_stampsAttemptAndSuccess() {
        JobDefinition job = store.saveJob(TestJobs.job("j", "0 * * * *"));
        scheduler.scheduleJob(job);
        Instant failedAt = clock.instant();
        Instant succeededAt = failedAt.plusSeconds(60);

        scheduler.recordCompletion("j", failedAt, false);
        Schedule afterFailure = store.getSchedule("j").orElseThrow();
        scheduler.recordCompletion("j", succeededAt, true);
        Schedule afterSuccess = store.getSchedule("j").orElseThrow();

        assertThat(afterFailure.getLastAttempt()).isEqualTo(failedAt);
        assertThat(afterFailure.getLastSuccess()).isNull();
        assertThat(afterSuccess.getLastAttempt()).isEqualTo(succeededAt);
        assertThat(afterSuccess.getLastSuccess()).isEqualTo(succeededAt);
    }
}
