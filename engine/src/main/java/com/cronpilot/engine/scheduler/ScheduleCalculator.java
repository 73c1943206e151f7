package com.cronpilot.engine.scheduler;

import com.cronpilot.engine.model.JobDefinition;
import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinition;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.Random;

/**
 * Pure time arithmetic for cron schedules: next occurrence, active window
 * and jitter. Holds no state besides the jitter source.
 *
 * Expressions use the classic five-field UNIX syntax and are evaluated in
 * the job's IANA timezone, so DST transitions follow local wall-clock time.
 * Jitter is expected to be smaller than the cron period; the occurrence a
 * jittered due time belongs to is recovered as the latest occurrence at or
 * before it.
 */
@Component
public class ScheduleCalculator {

    private static final CronParser PARSER;

    static {
        CronDefinition def = CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX);
        PARSER = new CronParser(def);
    }

    private final Random random;

    public ScheduleCalculator() {
        this(new Random());
    }

    ScheduleCalculator(Random random) {
        this.random = random;
    }

    /**
     * Parse and validate a cron expression.
     *
     * @throws IllegalArgumentException if the expression is blank or malformed
     */
    public static Cron parse(String expression) {
        String expr = expression == null ? "" : expression.trim();
        if (expr.isEmpty()) {
            throw new IllegalArgumentException("cron expression is required");
        }
        Cron cron = PARSER.parse(expr);
        cron.validate();
        return cron;
    }

    public static boolean isValid(String expression) {
        try {
            parse(expression);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /** First occurrence strictly after {@code after}. */
    public Optional<Instant> nextOccurrence(String expression, ZoneId zone, Instant after) {
        ExecutionTime et = ExecutionTime.forCron(parse(expression));
        ZonedDateTime cursor = ZonedDateTime.ofInstant(after.truncatedTo(ChronoUnit.SECONDS), zone);
        for (int i = 0; i < 3; i++) {
            Optional<ZonedDateTime> next = et.nextExecution(cursor);
            if (next.isEmpty()) {
                return Optional.empty();
            }
            if (next.get().toInstant().isAfter(after)) {
                return Optional.of(next.get().toInstant());
            }
            cursor = next.get().plusSeconds(1);
        }
        return Optional.empty();
    }

    /** Latest occurrence at or before {@code instant}. */
    public Optional<Instant> occurrenceAtOrBefore(String expression, ZoneId zone, Instant instant) {
        ExecutionTime et = ExecutionTime.forCron(parse(expression));
        Instant cursor = instant.truncatedTo(ChronoUnit.SECONDS).plusSeconds(1);
        return et.lastExecution(ZonedDateTime.ofInstant(cursor, zone))
                .map(ZonedDateTime::toInstant)
                .filter(prev -> !prev.isAfter(instant));
    }

    /**
     * The occurrence a job's schedule should point at next, before jitter.
     *
     * Without catch-up the search starts at {@code now}, so missed windows
     * are skipped and the result is always in the future. With catch-up it
     * starts at the last occurrence already turned into a run, so the result
     * is the earliest missed one. A job that has never been scheduled starts
     * from {@code now} either way.
     *
     * @return empty if the job's window has closed
     */
    public Optional<Instant> nextOccurrence(JobDefinition job, Instant now, Instant lastScheduled) {
        Instant base = job.isCatchup() && lastScheduled != null ? lastScheduled : now;
        return nextOccurrenceInWindow(job, base);
    }

    /** First occurrence after {@code base} that lies inside [notBefore, notAfter]. */
    public Optional<Instant> nextOccurrenceInWindow(JobDefinition job, Instant base) {
        Instant from = base;
        if (job.getNotBefore() != null && from.isBefore(job.getNotBefore())) {
            // Step back by 1 ms so an occurrence exactly at notBefore is included.
            from = job.getNotBefore().minusMillis(1);
        }
        Optional<Instant> next = nextOccurrence(job.getSchedule(), ZoneId.of(job.getTimezone()), from);
        if (next.isPresent() && job.getNotAfter() != null && next.get().isAfter(job.getNotAfter())) {
            return Optional.empty();
        }
        return next;
    }

    /** Add a random delay in [0, jitterMs], never moving past notAfter. */
    public Instant applyJitter(Instant occurrence, long jitterMs, Instant notAfter) {
        if (jitterMs <= 0) {
            return occurrence;
        }
        long delay = (long) (random.nextDouble() * (jitterMs + 1));
        Instant jittered = occurrence.plusMillis(Math.min(delay, jitterMs));
        if (notAfter != null && jittered.isAfter(notAfter)) {
            return notAfter;
        }
        return jittered;
    }

    public Instant applyJitter(Instant occurrence, JobDefinition job) {
        return applyJitter(occurrence, job.getJitterMs(), job.getNotAfter());
    }
}
