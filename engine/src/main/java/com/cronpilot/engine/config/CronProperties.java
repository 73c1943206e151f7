package com.cronpilot.engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import java.util.UUID;

/**
 * Engine settings bound from the {@code cronpilot.*} keys of application.yml.
 *
 * @param artifactsPath     root of the per-run artifact directories
 * @param logsPath          directory created at startup for file logs
 * @param maxConcurrentRuns bounded parallelism of one processPendingRuns call
 * @param defaultTimezone   timezone given to jobs that omit one
 * @param enableDryRun      execute every run as a dry run
 * @param pollIntervalMs    fixed delay of the driver loop
 * @param maxCatchupRuns    missed occurrences materialized per schedule per poll
 * @param maxQueueDepth     waiting DUE runs allowed per job under the queue policy
 * @param lockGraceSeconds  added to a job's maxRunSeconds to get the lock expiry
 * @param workerId          owner id of this process's claim locks
 * @param executor          HTTP executor endpoint settings
 */
@ConfigurationProperties(prefix = "cronpilot")
public record CronProperties(
        @DefaultValue("./artifacts")       Path     artifactsPath,
        @DefaultValue("./logs")            Path     logsPath,
        @DefaultValue("5")                 int      maxConcurrentRuns,
        @DefaultValue("America/New_York")  String   defaultTimezone,
        @DefaultValue("false")             boolean  enableDryRun,
        @DefaultValue("15000")             long     pollIntervalMs,
        @DefaultValue("50")                int      maxCatchupRuns,
        @DefaultValue("10")                int      maxQueueDepth,
        @DefaultValue("60")                int      lockGraceSeconds,
                                           String   workerId,
        @DefaultValue                      Executor executor
) {
    public CronProperties {
        if (maxConcurrentRuns < 1) maxConcurrentRuns = 1;
        if (maxCatchupRuns < 1)    maxCatchupRuns = 1;
        if (maxQueueDepth < 1)     maxQueueDepth = 1;
        if (workerId == null || workerId.isBlank()) {
            workerId = "worker-" + UUID.randomUUID().toString().substring(0, 8);
        }
        // Fail at startup rather than on the first job load.
        ZoneId.of(defaultTimezone);
    }

    public Duration lockGrace() {
        return Duration.ofSeconds(lockGraceSeconds);
    }

    /**
     * @param baseUrl               executor root URL, without trailing slash
     * @param connectTimeoutSeconds TCP connect timeout of the HTTP client
     */
    public record Executor(
            @DefaultValue("http://localhost:8090") String baseUrl,
            @DefaultValue("10")                    int    connectTimeoutSeconds
    ) {}
}
