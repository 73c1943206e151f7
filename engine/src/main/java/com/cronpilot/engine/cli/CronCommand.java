package com.cronpilot.engine.cli;

import com.cronpilot.engine.definition.JobSpec;
import com.cronpilot.engine.definition.JobValidationException;
import com.cronpilot.engine.driver.CronDriver;
import com.cronpilot.engine.driver.ListResult;
import com.cronpilot.engine.driver.ProcessSummary;
import com.cronpilot.engine.model.JobDefinition;
import com.cronpilot.engine.model.JobRun;
import com.cronpilot.engine.model.RunEvent;
import com.cronpilot.engine.model.RunState;
import com.cronpilot.engine.model.Schedule;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Command-line surface of the engine. Each subcommand maps to one
 * CronDriver operation; any failure exits with status 1.
 */
@Component
@Command(
        name = "cronpilot",
        mixinStandardHelpOptions = true,
        description = "Scheduled graph runs: manage jobs, inspect runs, drive the scheduler",
        subcommands = {
                CronCommand.AddCommand.class,
                CronCommand.ListCommand.class,
                CronCommand.ShowCommand.class,
                CronCommand.PauseCommand.class,
                CronCommand.ResumeCommand.class,
                CronCommand.DeleteCommand.class,
                CronCommand.RunNowCommand.class,
                CronCommand.DryRunCommand.class,
                CronCommand.RunsCommand.class,
                CronCommand.TailCommand.class,
                CronCommand.LogsCommand.class,
                CronCommand.ProcessCommand.class,
                CronCommand.UpdateSchedulesCommand.class
        }
)
public class CronCommand implements Runnable {

    final CronDriver   driver;
    final ObjectMapper mapper;

    @Spec
    CommandSpec spec;

    public CronCommand(CronDriver driver, ObjectMapper mapper) {
        this.driver = driver;
        this.mapper = mapper;
    }

    @Override
    public void run() {
        spec.commandLine().usage(out());
    }

    /**
     * Parses and runs {@code args}. Returns 0 on success and 1 on any failure,
     * including usage errors.
     */
    public int execute(String... args) {
        return execute(new PrintWriter(System.out, true), new PrintWriter(System.err, true), args);
    }

    public int execute(PrintWriter out, PrintWriter err, String... args) {
        CommandLine cli = new CommandLine(this)
                .setOut(out)
                .setErr(err)
                .setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
                    reportFailure(ex, commandLine.getErr());
                    return 1;
                });
        return cli.execute(args) == 0 ? 0 : 1;
    }

    PrintWriter out() {
        return spec.commandLine().getOut();
    }

    String json(Object value) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot render output", e);
        }
    }

    private static void reportFailure(Exception ex, PrintWriter err) {
        if (ex instanceof JobValidationException invalid) {
            err.println("Invalid job definition:");
            for (JobValidationException.FieldViolation v : invalid.getViolations()) {
                err.println("  " + v);
            }
        } else {
            err.println("Error: " + ex.getMessage());
        }
        err.flush();
    }

    // ------------------------------------------------------------------
    // Jobs
    // ------------------------------------------------------------------

    @Command(name = "add", description = "Add or replace a job from a JSON or YAML file")
    static final class AddCommand implements Callable<Integer> {
        @ParentCommand
        CronCommand parent;

        @Parameters(index = "0", description = "Job file (.json, .yaml, .yml)")
        Path file;

        @Override
        public Integer call() {
            JobDefinition job = parent.driver.addJobFromFile(file);
            parent.out().println("Added job " + job.getId() + " (" + job.getSchedule() + ", " + job.getTimezone() + ")");
            parent.driver.getSchedule(job.getId())
                    .ifPresent(s -> parent.out().println("Next run: " + s.getNextDue()));
            return 0;
        }
    }

    @Command(name = "list", description = "List jobs")
    static final class ListCommand implements Callable<Integer> {
        @ParentCommand
        CronCommand parent;

        @Option(names = {"--offset"}, defaultValue = "0")
        int offset;

        @Option(names = {"--limit"}, defaultValue = "50")
        int limit;

        @Override
        public Integer call() {
            ListResult<JobDefinition> page = parent.driver.listJobs(offset, limit);
            PrintWriter out = parent.out();
            if (page.items().isEmpty()) {
                out.println("No jobs.");
                return 0;
            }
            for (JobDefinition job : page.items()) {
                String next = parent.driver.getSchedule(job.getId())
                        .map(s -> String.valueOf(s.getNextDue()))
                        .orElse("-");
                out.printf("%-24s %-8s %-20s next=%s%n",
                        job.getId(), job.isEnabled() ? "enabled" : "paused", job.getSchedule(), next);
            }
            out.printf("%d of %d job(s)%n", page.items().size(), page.total());
            return 0;
        }
    }

    @Command(name = "show", description = "Show a job definition and its schedule")
    static final class ShowCommand implements Callable<Integer> {
        @ParentCommand
        CronCommand parent;

        @Parameters(index = "0", description = "Job id")
        String jobId;

        @Override
        public Integer call() {
            JobDefinition job = parent.driver.getJob(jobId);
            Map<String, Object> view = new LinkedHashMap<>();
            view.put("definition", JobSpec.from(job));
            Optional<Schedule> schedule = parent.driver.getSchedule(jobId);
            schedule.ifPresent(s -> {
                view.put("nextDue", s.getNextDue());
                view.put("lastScheduled", s.getLastScheduled());
                view.put("lastSuccess", s.getLastSuccess());
                view.put("lastAttempt", s.getLastAttempt());
            });
            parent.out().println(parent.json(view));
            return 0;
        }
    }

    @Command(name = "pause", description = "Stop scheduling a job")
    static final class PauseCommand implements Callable<Integer> {
        @ParentCommand
        CronCommand parent;

        @Parameters(index = "0", description = "Job id")
        String jobId;

        @Override
        public Integer call() {
            parent.driver.pauseJob(jobId);
            parent.out().println("Paused " + jobId);
            return 0;
        }
    }

    @Command(name = "resume", description = "Resume scheduling a job")
    static final class ResumeCommand implements Callable<Integer> {
        @ParentCommand
        CronCommand parent;

        @Parameters(index = "0", description = "Job id")
        String jobId;

        @Override
        public Integer call() {
            parent.driver.resumeJob(jobId);
            parent.out().println("Resumed " + jobId);
            return 0;
        }
    }

    @Command(name = "delete", description = "Delete a job with its runs, events and schedule")
    static final class DeleteCommand implements Callable<Integer> {
        @ParentCommand
        CronCommand parent;

        @Parameters(index = "0", description = "Job id")
        String jobId;

        @Override
        public Integer call() {
            parent.driver.deleteJob(jobId);
            parent.out().println("Deleted " + jobId);
            return 0;
        }
    }

    // ------------------------------------------------------------------
    // Runs
    // ------------------------------------------------------------------

    /** Exits 1 unless the run ends SUCCEEDED. */
    @Command(name = "run-now", description = "Run a job immediately and wait for the outcome")
    static final class RunNowCommand implements Callable<Integer> {
        @ParentCommand
        CronCommand parent;

        @Parameters(index = "0", description = "Job id")
        String jobId;

        @Option(names = {"--dry-run"}, defaultValue = "false", description = "Simulate without calling the executor")
        boolean dryRun;

        @Option(names = {"--input"}, description = "Input override, key=value (repeatable)")
        Map<String, String> inputs;

        @Override
        public Integer call() {
            Map<String, Object> overrides = inputs == null ? null : new LinkedHashMap<>(inputs);
            JobRun run = dryRun
                    ? parent.driver.dryRun(jobId, overrides)
                    : parent.driver.runJobNow(jobId, overrides);
            printOutcome(parent.out(), run);
            return run.getState() == RunState.SUCCEEDED ? 0 : 1;
        }
    }

    @Command(name = "dry-run", description = "Simulate a run of a job")
    static final class DryRunCommand implements Callable<Integer> {
        @ParentCommand
        CronCommand parent;

        @Parameters(index = "0", description = "Job id")
        String jobId;

        @Override
        public Integer call() {
            JobRun run = parent.driver.dryRun(jobId, null);
            printOutcome(parent.out(), run);
            return run.getState() == RunState.SUCCEEDED ? 0 : 1;
        }
    }

    @Command(name = "runs", description = "List runs, newest first")
    static final class RunsCommand implements Callable<Integer> {
        @ParentCommand
        CronCommand parent;

        @Option(names = {"--job"}, description = "Only runs of this job")
        String jobId;

        @Option(names = {"--offset"}, defaultValue = "0")
        int offset;

        @Option(names = {"--limit"}, defaultValue = "20")
        int limit;

        @Override
        public Integer call() {
            ListResult<JobRun> page = parent.driver.listRuns(jobId, offset, limit);
            PrintWriter out = parent.out();
            for (JobRun run : page.items()) {
                out.printf("%-60s %-16s attempt=%d scheduled=%s%s%n",
                        run.getId(), run.getState(), run.getAttempt(), run.getScheduledAt(),
                        run.getErrorCode() == null ? "" : " error=" + run.getErrorCode());
            }
            out.printf("%d of %d run(s)%n", page.items().size(), page.total());
            return 0;
        }
    }

    @Command(name = "tail", description = "Show the latest run of a job with its events")
    static final class TailCommand implements Callable<Integer> {
        @ParentCommand
        CronCommand parent;

        @Parameters(index = "0", description = "Job id")
        String jobId;

        @Option(names = {"--limit"}, defaultValue = "50")
        int limit;

        @Override
        public Integer call() {
            parent.driver.getJob(jobId);
            Optional<JobRun> latest = parent.driver.getLatestRun(jobId);
            if (latest.isEmpty()) {
                parent.out().println("No runs for " + jobId);
                return 0;
            }
            JobRun run = latest.get();
            printOutcome(parent.out(), run);
            printEvents(parent.out(), parent.driver.getRunEvents(run.getId(), limit));
            return 0;
        }
    }

    @Command(name = "logs", description = "Show the events of a run")
    static final class LogsCommand implements Callable<Integer> {
        @ParentCommand
        CronCommand parent;

        @Parameters(index = "0", description = "Run id")
        String runId;

        @Option(names = {"--limit"}, defaultValue = "100", description = "Most recent events to show")
        int limit;

        @Override
        public Integer call() {
            printEvents(parent.out(), parent.driver.getRunEvents(runId, limit));
            return 0;
        }
    }

    // ------------------------------------------------------------------
    // Processing
    // ------------------------------------------------------------------

    /** Exits 1 if any run could not be processed. */
    @Command(name = "process", description = "Execute every pending run once")
    static final class ProcessCommand implements Callable<Integer> {
        @ParentCommand
        CronCommand parent;

        @Override
        public Integer call() {
            ProcessSummary summary = parent.driver.processPendingRuns();
            parent.out().println("Processed " + summary);
            return summary.errors() > 0 ? 1 : 0;
        }
    }

    @Command(name = "update-schedules", description = "Recompute the next due time of every job")
    static final class UpdateSchedulesCommand implements Callable<Integer> {
        @ParentCommand
        CronCommand parent;

        @Override
        public Integer call() {
            parent.out().println("Updated " + parent.driver.updateSchedules() + " schedule(s)");
            return 0;
        }
    }

    // ------------------------------------------------------------------

    static void printOutcome(PrintWriter out, JobRun run) {
        out.println("Run " + run.getId() + ": " + run.getState());
        if (run.getErrorCode() != null) {
            out.println("  " + run.getErrorCode() + ": " + run.getErrorMessage());
        }
        if (run.getArtifactsDir() != null) {
            out.println("  artifacts: " + run.getArtifactsDir());
        }
    }

    static void printEvents(PrintWriter out, List<RunEvent> events) {
        for (RunEvent e : events) {
            out.printf("[%s] %-5s %s: %s%n", e.getOccurredAt(), e.getLevel(), e.getEvent(), e.getMessage());
        }
    }
}
