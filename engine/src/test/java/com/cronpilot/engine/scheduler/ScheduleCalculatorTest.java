package com.cronpilot.engine.scheduler;

import com.cronpilot.engine.TestJobs;
import com.cronpilot.engine.model.JobDefinition;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScheduleCalculatorTest {

    private static final ZoneId UTC      = ZoneId.of("UTC");
    private static final ZoneId NEW_YORK = ZoneId.of("America/New_York");

    // nextDouble() always 0.5, so jitter is half the window.
    private final ScheduleCalculator calculator = new ScheduleCalculator(new Random() {
        @Override
        public double nextDouble() {
            return 0.5;
        }
    });

    // ------------------------------------------------------------------
    // Parsing
    // ------------------------------------------------------------------

    @Test
    void parse_acceptsFiveFieldExpressions() {
        assertThat(ScheduleCalculator.isValid("0 7 * * *")).isTrue();
        assertThat(ScheduleCalculator.isValid("*/15 9-17 * * 1-5")).isTrue();
    }

    @Test
    void parse_rejectsMalformedExpressions() {
        assertThat(ScheduleCalculator.isValid("not a cron")).isFalse();
        assertThat(ScheduleCalculator.isValid("61 * * * *")).isFalse();
        assertThat(ScheduleCalculator.isValid("")).isFalse();
        assertThatThrownBy(() -> ScheduleCalculator.parse(null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // nextOccurrence(expression, zone, after)
    // ------------------------------------------------------------------

    @Test
    void nextOccurrence_isStrictlyAfterBase() {
        Instant sevenAmEst = Instant.parse("2024-01-15T12:00:00Z");

        assertThat(calculator.nextOccurrence("0 7 * * *", NEW_YORK, sevenAmEst))
                .contains(Instant.parse("2024-01-16T12:00:00Z"));
    }

    @Test
    void nextOccurrence_subSecondBase_skipsOccurrenceAtSameSecond() {
        Instant base = Instant.parse("2024-01-15T10:05:00.500Z");

        assertThat(calculator.nextOccurrence("*/5 * * * *", UTC, base))
                .contains(Instant.parse("2024-01-15T10:10:00Z"));
    }

    @Test
    void nextOccurrence_followsLocalWallClockAcrossDst() {
        // 2024-03-10: New York springs forward, 7:00 local becomes 11:00 UTC.
        Instant saturdaySevenAm = Instant.parse("2024-03-09T12:00:00Z");

        assertThat(calculator.nextOccurrence("0 7 * * *", NEW_YORK, saturdaySevenAm))
                .contains(Instant.parse("2024-03-10T11:00:00Z"));
    }

    @Test
    void occurrenceAtOrBefore_returnsLatestOccurrence() {
        assertThat(calculator.occurrenceAtOrBefore("*/5 * * * *", UTC, Instant.parse("2024-01-15T10:07:30Z")))
                .contains(Instant.parse("2024-01-15T10:05:00Z"));
        assertThat(calculator.occurrenceAtOrBefore("*/5 * * * *", UTC, Instant.parse("2024-01-15T10:05:00Z")))
                .contains(Instant.parse("2024-01-15T10:05:00Z"));
    }

    // ------------------------------------------------------------------
    // Job windows and catch-up
    // ------------------------------------------------------------------

    @Test
    void nextOccurrence_withoutCatchup_startsFromNow() {
        JobDefinition job = TestJobs.job("hourly", "0 * * * *");
        Instant lastScheduled = Instant.parse("2024-01-15T03:00:00Z");
        Instant now = Instant.parse("2024-01-15T10:30:00Z");

        assertThat(calculator.nextOccurrence(job, now, lastScheduled))
                .contains(Instant.parse("2024-01-15T11:00:00Z"));
    }

    @Test
    void nextOccurrence_withCatchup_startsFromLastScheduled() {
        JobDefinition job = TestJobs.job("hourly", "0 * * * *");
        job.setCatchup(true);
        Instant lastScheduled = Instant.parse("2024-01-15T03:00:00Z");
        Instant now = Instant.parse("2024-01-15T10:30:00Z");

        assertThat(calculator.nextOccurrence(job, now, lastScheduled))
                .contains(Instant.parse("2024-01-15T04:00:00Z"));
    }

    @Test
    void nextOccurrenceInWindow_includesOccurrenceExactlyAtNotBefore() {
        JobDefinition job = TestJobs.job("daily", "0 0 * * *");
        job.setNotBefore(Instant.parse("2024-02-01T00:00:00Z"));

        assertThat(calculator.nextOccurrenceInWindow(job, Instant.parse("2024-01-10T08:00:00Z")))
                .contains(Instant.parse("2024-02-01T00:00:00Z"));
    }

    @Test
    void nextOccurrenceInWindow_emptyAfterNotAfter() {
        JobDefinition job = TestJobs.job("daily", "0 0 * * *");
        job.setNotAfter(Instant.parse("2024-01-10T12:00:00Z"));

        assertThat(calculator.nextOccurrenceInWindow(job, Instant.parse("2024-01-10T08:00:00Z"))).isEmpty();
    }

    // ------------------------------------------------------------------
    // Jitter
    // ------------------------------------------------------------------

    @Test
    void applyJitter_staysWithinWindow() {
        Instant occurrence = Instant.parse("2024-01-15T10:00:00Z");

        assertThat(calculator.applyJitter(occurrence, 0, null)).isEqualTo(occurrence);
        assertThat(calculator.applyJitter(occurrence, 1_000, null)).isEqualTo(occurrence.plusMillis(500));
    }

    @Test
    void applyJitter_neverPassesNotAfter() {
        Instant occurrence = Instant.parse("2024-01-15T10:00:00Z");
        Instant notAfter = occurrence.plusMillis(100);

        assertThat(calculator.applyJitter(occurrence, 60_000, notAfter)).isEqualTo(notAfter);
    }

    @Test
    void applyJitter_realRandom_isBounded() {
        ScheduleCalculator random = new ScheduleCalculator();
        Instant occurrence = Instant.parse("2024-01-15T10:00:00Z");
        for (int i = 0; i < 200; i++) {
            Instant jittered = random.applyJitter(occurrence, 250, null);
            assertThat(jittered).isBetween(occurrence, occurrence.plusMillis(250));
        }
    }
}
