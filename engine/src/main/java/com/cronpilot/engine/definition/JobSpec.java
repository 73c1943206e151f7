package com.cronpilot.engine.definition;

import com.cronpilot.engine.model.JobDefinition;
import com.cronpilot.engine.model.ResourceLimits;
import com.cronpilot.engine.model.RetryPolicy;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

/**
 * The job file / request body shape, before validation.
 *
 * Every field is nullable: null means "not given" and the validator fills
 * in the default. Enum-valued fields are kept as strings so an unknown
 * value becomes a field error instead of a parse failure. Timestamps
 * (notBefore, notAfter) are epoch milliseconds.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobSpec(
        String              id,
        String              version,
        String              name,
        String              description,
        String              owner,
        Boolean             enabled,
        String              schedule,
        String              timezone,
        Long                jitterMs,
        Boolean             catchup,
        String              concurrency,
        Integer             priority,
        Long                notBefore,
        Long                notAfter,
        String              graphId,
        Map<String, Object> inputs,
        Resources           resources,
        Retry               retry,
        Alerts              alerts,
        Map<String, String> labels
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Resources(
            String               networkScope,
            List<String>         allowlist,
            Map<String, Integer> rateLimits,
            Long                 maxBandwidth,
            Integer              maxSteps,
            Integer              maxRunSeconds,
            Integer              maxModelTokens
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Retry(
            Integer      maxRetries,
            String       strategy,
            List<Long>   delays,
            List<String> retryableCodes
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Alerts(Boolean onSuccess, Boolean onFailure, Boolean onMaterialChange) {}

    /** The stored definition in file shape, with every default spelled out. */
    public static JobSpec from(JobDefinition job) {
        ResourceLimits r = job.getResources();
        RetryPolicy retry = job.getRetry();
        return new JobSpec(
                job.getId(), job.getVersion(), job.getName(), job.getDescription(), job.getOwner(),
                job.isEnabled(), job.getSchedule(), job.getTimezone(), job.getJitterMs(), job.isCatchup(),
                job.getConcurrency().wireName(), job.getPriority(),
                job.getNotBefore() == null ? null : job.getNotBefore().toEpochMilli(),
                job.getNotAfter()  == null ? null : job.getNotAfter().toEpochMilli(),
                job.getGraphId(), job.getInputs(),
                new Resources(r.networkScope().wireName(), r.allowlist(), r.rateLimits(), r.maxBandwidth(),
                        r.maxSteps(), r.maxRunSeconds(), r.maxModelTokens()),
                new Retry(retry.maxRetries(), retry.strategy().wireName(), retry.delays(), retry.retryableCodes()),
                new Alerts(job.getAlerts().onSuccess(), job.getAlerts().onFailure(), job.getAlerts().onMaterialChange()),
                job.getLabels());
    }
}
