package com.cronpilot.engine.definition;

import com.cronpilot.engine.config.CronProperties;
import com.cronpilot.engine.definition.JobValidationException.FieldViolation;
import com.cronpilot.engine.model.*;
import com.cronpilot.engine.scheduler.ScheduleCalculator;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Validate-then-normalize step between a raw {@link JobSpec} and a
 * {@link JobDefinition}.
 *
 * All checks run before anything is built, and every failure is reported
 * together with its field path (e.g. {@code retry.delays[1]}).
 */
@Component
public class JobDefinitionValidator {

    public static final long MAX_JITTER_MS = 300_000L;

    private static final Pattern ID_PATTERN = Pattern.compile("[A-Za-z0-9_.-]+");

    private final String defaultTimezone;

    public JobDefinitionValidator(CronProperties props) {
        this.defaultTimezone = props.defaultTimezone();
    }

    /**
     * @throws JobValidationException with every violation found
     */
    public JobDefinition validate(JobSpec spec) {
        if (spec == null) {
            throw new JobValidationException("$", "job definition is empty");
        }
        List<FieldViolation> errors = new ArrayList<>();

        if (isBlank(spec.id())) {
            errors.add(new FieldViolation("id", "is required"));
        } else if (!ID_PATTERN.matcher(spec.id()).matches()) {
            errors.add(new FieldViolation("id", "may only contain letters, digits, '.', '_' and '-'"));
        }
        if (isBlank(spec.name())) {
            errors.add(new FieldViolation("name", "is required"));
        }
        if (isBlank(spec.graphId())) {
            errors.add(new FieldViolation("graphId", "is required"));
        }
        if (isBlank(spec.schedule())) {
            errors.add(new FieldViolation("schedule", "is required"));
        } else {
            try {
                ScheduleCalculator.parse(spec.schedule());
            } catch (IllegalArgumentException e) {
                errors.add(new FieldViolation("schedule", "invalid cron expression: " + e.getMessage()));
            }
        }

        String timezone = isBlank(spec.timezone()) ? defaultTimezone : spec.timezone().trim();
        try {
            ZoneId.of(timezone);
        } catch (DateTimeException e) {
            errors.add(new FieldViolation("timezone", "unknown timezone '" + timezone + "'"));
        }

        long jitterMs = orDefault(spec.jitterMs(), 0L);
        if (jitterMs < 0 || jitterMs > MAX_JITTER_MS) {
            errors.add(new FieldViolation("jitterMs", "must be between 0 and " + MAX_JITTER_MS));
        }

        Optional<ConcurrencyPolicy> concurrency = spec.concurrency() == null
                ? Optional.of(ConcurrencyPolicy.ALLOW)
                : ConcurrencyPolicy.fromWire(spec.concurrency());
        if (concurrency.isEmpty()) {
            errors.add(new FieldViolation("concurrency",
                    "must be one of allow, skip, queue, cancel-previous"));
        }

        if (spec.notBefore() != null && spec.notAfter() != null && spec.notBefore() > spec.notAfter()) {
            errors.add(new FieldViolation("notAfter", "must not be before notBefore"));
        }

        ResourceLimits resources = resources(spec.resources(), errors);
        RetryPolicy retry = retry(spec.retry(), errors);

        if (!errors.isEmpty()) {
            throw new JobValidationException(errors);
        }

        JobDefinition job = new JobDefinition(spec.id().trim(), spec.name().trim(),
                spec.schedule().trim(), timezone, spec.graphId().trim());
        job.setVersion(isBlank(spec.version()) ? JobDefinition.DEFAULT_VERSION : spec.version());
        job.setDescription(spec.description());
        job.setOwner(spec.owner());
        job.setEnabled(orDefault(spec.enabled(), true));
        job.setJitterMs(jitterMs);
        job.setCatchup(orDefault(spec.catchup(), false));
        job.setConcurrency(concurrency.get());
        job.setPriority(orDefault(spec.priority(), 0));
        job.setNotBefore(spec.notBefore() == null ? null : Instant.ofEpochMilli(spec.notBefore()));
        job.setNotAfter(spec.notAfter() == null ? null : Instant.ofEpochMilli(spec.notAfter()));
        job.setInputs(spec.inputs());
        job.setResources(resources);
        job.setRetry(retry);
        job.setAlerts(alerts(spec.alerts()));
        job.setLabels(spec.labels());
        return job;
    }

    // ------------------------------------------------------------------
    // Nested sections
    // ------------------------------------------------------------------

    private ResourceLimits resources(JobSpec.Resources r, List<FieldViolation> errors) {
        if (r == null) {
            return ResourceLimits.defaults();
        }
        NetworkScope scope = NetworkScope.ALL;
        if (r.networkScope() != null) {
            Optional<NetworkScope> parsed = NetworkScope.fromWire(r.networkScope());
            if (parsed.isEmpty()) {
                errors.add(new FieldViolation("resources.networkScope",
                        "must be one of none, localhost, allowlist, all"));
            } else {
                scope = parsed.get();
            }
        }
        int maxSteps       = positive("resources.maxSteps", r.maxSteps(), ResourceLimits.DEFAULT_MAX_STEPS, errors);
        int maxRunSeconds  = positive("resources.maxRunSeconds", r.maxRunSeconds(), ResourceLimits.DEFAULT_MAX_RUN_SECONDS, errors);
        int maxModelTokens = positive("resources.maxModelTokens", r.maxModelTokens(), ResourceLimits.DEFAULT_MAX_MODEL_TOKENS, errors);
        if (r.maxBandwidth() != null && r.maxBandwidth() <= 0) {
            errors.add(new FieldViolation("resources.maxBandwidth", "must be positive"));
        }
        nonBlankElements("resources.allowlist", r.allowlist(), errors);
        if (r.rateLimits() != null) {
            for (Map.Entry<String, Integer> e : r.rateLimits().entrySet()) {
                if (e.getValue() == null || e.getValue() <= 0) {
                    errors.add(new FieldViolation("resources.rateLimits." + e.getKey(), "must be positive"));
                }
            }
        }
        if (!errors.isEmpty()) {
            return ResourceLimits.defaults();
        }
        return new ResourceLimits(scope, r.allowlist(), r.rateLimits(), r.maxBandwidth(),
                maxSteps, maxRunSeconds, maxModelTokens);
    }

    private RetryPolicy retry(JobSpec.Retry r, List<FieldViolation> errors) {
        if (r == null) {
            return RetryPolicy.defaults();
        }
        int maxRetries = orDefault(r.maxRetries(), RetryPolicy.defaults().maxRetries());
        if (maxRetries < 0) {
            errors.add(new FieldViolation("retry.maxRetries", "must not be negative"));
        }
        RetryStrategy strategy = RetryStrategy.EXPONENTIAL;
        if (r.strategy() != null) {
            Optional<RetryStrategy> parsed = RetryStrategy.fromWire(r.strategy());
            if (parsed.isEmpty()) {
                errors.add(new FieldViolation("retry.strategy", "must be one of immediate, exponential, linear"));
            } else {
                strategy = parsed.get();
            }
        }
        List<Long> delays = r.delays() == null ? RetryPolicy.DEFAULT_DELAYS : r.delays();
        for (int i = 0; i < delays.size(); i++) {
            if (delays.get(i) == null || delays.get(i) < 0) {
                errors.add(new FieldViolation("retry.delays[" + i + "]", "must not be negative"));
            }
        }
        nonBlankElements("retry.retryableCodes", r.retryableCodes(), errors);
        if (!errors.isEmpty()) {
            return RetryPolicy.defaults();
        }
        return new RetryPolicy(maxRetries, strategy, delays, r.retryableCodes());
    }

    private static AlertConfig alerts(JobSpec.Alerts a) {
        if (a == null) {
            return AlertConfig.none();
        }
        return new AlertConfig(orDefault(a.onSuccess(), false),
                               orDefault(a.onFailure(), false),
                               orDefault(a.onMaterialChange(), false));
    }

    private static void nonBlankElements(String field, List<String> values, List<FieldViolation> errors) {
        if (values == null) {
            return;
        }
        for (int i = 0; i < values.size(); i++) {
            if (values.get(i) == null || values.get(i).isBlank()) {
                errors.add(new FieldViolation(field + "[" + i + "]", "must not be blank"));
            }
        }
    }

    private static int positive(String field, Integer value, int defaultValue, List<FieldViolation> errors) {
        if (value == null) {
            return defaultValue;
        }
        if (value <= 0) {
            errors.add(new FieldViolation(field, "must be positive"));
        }
        return value;
    }

    private static <T> T orDefault(T value, T defaultValue) {
        return value == null ? defaultValue : value;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
