package com.cronpilot.engine.runner;

import com.cronpilot.engine.config.CronProperties;
import com.cronpilot.engine.executor.dto.ExecutionResult;
import com.cronpilot.engine.model.JobDefinition;
import com.cronpilot.engine.model.JobRun;
import com.cronpilot.engine.model.RunEvent;
import com.cronpilot.engine.runner.FailureClassifier.Failure;
import com.cronpilot.engine.util.Jsons;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Owns the on-disk layout of run artifacts:
 *
 * <pre>
 * artifacts/&lt;jobId&gt;/&lt;startedAt&gt;_&lt;runId&gt;/
 *     metadata.json   job, run, inputs, caps, timing, usage
 *     stdout.log      the run's events, one line each
 *     steps.json      executor step trace, when reported
 *     report.md       human-readable summary
 *     snapshots/  cleaned/  diffs/   free for the executor to fill
 * </pre>
 */
@Component
public class ArtifactWriter {

    private static final Logger log = LoggerFactory.getLogger(ArtifactWriter.class);

    static final List<String> SUBDIRECTORIES = List.of("snapshots", "cleaned", "diffs");

    private final Path         root;
    private final ObjectWriter json = Jsons.mapper().writerWithDefaultPrettyPrinter();

    public ArtifactWriter(CronProperties props) {
        this.root = props.artifactsPath();
    }

    /**
     * Create the run directory and its fixed subdirectories.
     *
     * @throws UncheckedIOException if the directories cannot be created
     */
    public Path createRunDirectory(String jobId, Instant startedAt, String runId) {
        String stamp = startedAt.toString().replace(':', '-').replace('.', '-');
        Path dir = root.resolve(jobId).resolve(stamp + "_" + runId);
        try {
            for (String sub : SUBDIRECTORIES) {
                Files.createDirectories(dir.resolve(sub));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create artifact directory " + dir, e);
        }
        log.debug("Artifact directory {} created", dir);
        return dir;
    }

    /**
     * Write the artifact files of a finished run. {@code result} is null for
     * a failed run, {@code failure} is null for a successful one.
     */
    public void write(Path dir, JobDefinition job, JobRun run, Map<String, Object> inputs,
                      ExecutionResult result, Failure failure, List<RunEvent> events) {
        try {
            Files.createDirectories(dir);
            json.writeValue(dir.resolve("metadata.json").toFile(), metadata(job, run, inputs, failure));
            Files.writeString(dir.resolve("stdout.log"), stdoutLog(events));
            if (result != null && result.hasSteps()) {
                json.writeValue(dir.resolve("steps.json").toFile(), result.steps());
            }
            Files.writeString(dir.resolve("report.md"), report(job, run, result, failure));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write artifacts to " + dir, e);
        }
    }

    /** Output of a dry run: what would have been executed, and nothing else. */
    public String dryRunOutput(JobDefinition job, Map<String, Object> inputs, Path dir) {
        return """
                # Dry Run Result

                This is a simulated execution of job **%s**.

                ## Configuration
                - Job ID: %s
                - Graph: %s
                - Schedule: %s
                - Timezone: %s

                ## Simulated Execution
                - Would execute graph with inputs: %s
                - Would respect resource limits: %s
                - Would generate artifacts in: %s

                *This is a dry run. No executor call was made.*
                """.formatted(job.getName(), job.getId(), job.getGraphId(), job.getSchedule(),
                job.getTimezone(), toJson(inputs), toJson(job.getResources()), dir);
    }

    // ------------------------------------------------------------------
    // File bodies
    // ------------------------------------------------------------------

    private static Map<String, Object> metadata(JobDefinition job, JobRun run,
                                                Map<String, Object> inputs, Failure failure) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("jobId",         job.getId());
        m.put("runId",         run.getId());
        m.put("graphId",       job.getGraphId());
        m.put("attempt",       run.getAttempt());
        m.put("state",         run.getState());
        m.put("dryRun",        run.isDryRun());
        m.put("scheduledAt",   run.getScheduledAt());
        m.put("startedAt",     run.getStartedAt());
        m.put("completedAt",   run.getCompletedAt());
        m.put("inputs",        inputs);
        m.put("resourceCaps",  job.getResources());
        m.put("resourceUsage", run.getResourceUsage());
        if (failure != null) {
            m.put("error", Map.of("code", failure.code(), "message", failure.message()));
        }
        return m;
    }

    static String stdoutLog(List<RunEvent> events) {
        return events.stream()
                .map(e -> "[" + e.getOccurredAt() + "] "
                        + e.getLevel().name() + " " + e.getEvent() + ": " + e.getMessage())
                .collect(Collectors.joining("\n", "", events.isEmpty() ? "" : "\n"));
    }

    private static String report(JobDefinition job, JobRun run, ExecutionResult result, Failure failure) {
        StringBuilder sb = new StringBuilder();
        sb.append("# Job Execution Report\n\n");
        sb.append("## Job Information\n");
        sb.append("- **Job ID**: ").append(job.getId()).append('\n');
        sb.append("- **Name**: ").append(job.getName()).append('\n');
        sb.append("- **Graph**: ").append(job.getGraphId()).append('\n');
        sb.append("- **Run ID**: ").append(run.getId()).append('\n');
        sb.append("- **Attempt**: ").append(run.getAttempt()).append('\n');
        sb.append("- **Scheduled At**: ").append(run.getScheduledAt()).append("\n\n");

        sb.append("## Execution Details\n");
        sb.append("- **State**: ").append(run.getState()).append('\n');
        sb.append("- **Started**: ").append(orUnknown(run.getStartedAt())).append('\n');
        sb.append("- **Completed**: ").append(orUnknown(run.getCompletedAt())).append('\n');
        sb.append("- **Duration**: ").append(run.getResourceUsage().durationMs()).append("ms\n\n");

        if (failure != null) {
            sb.append("## Error\n");
            sb.append("- **Code**: ").append(failure.code()).append('\n');
            sb.append("- **Retryable**: ").append(failure.retryable() ? "yes" : "no").append('\n');
            sb.append("- **Message**: ").append(failure.message()).append("\n\n");
        }
        if (result != null) {
            sb.append("## Result\n").append(result.output().strip()).append("\n\n");
        }

        sb.append("## Resource Usage\n");
        sb.append("- Steps: ").append(run.getResourceUsage().steps())
          .append(" / ").append(job.getResources().maxSteps()).append('\n');
        sb.append("- Tokens: ").append(run.getResourceUsage().tokens())
          .append(" / ").append(job.getResources().maxModelTokens()).append('\n');
        sb.append("- Bandwidth: ").append(run.getResourceUsage().bandwidthBytes()).append(" bytes\n");
        sb.append("- Execution Time: ").append(run.getResourceUsage().durationMs())
          .append("ms (limit ").append(job.getResources().maxRunSeconds()).append("s)\n");
        return sb.toString();
    }

    private static String orUnknown(Instant instant) {
        return instant == null ? "Unknown" : instant.toString();
    }

    private String toJson(Object value) {
        try {
            return json.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot render " + value.getClass().getSimpleName() + " as JSON", e);
        }
    }
}
