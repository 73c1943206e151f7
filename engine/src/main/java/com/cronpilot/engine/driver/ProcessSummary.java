package com.cronpilot.engine.driver;

/**
 * Result of one processPendingRuns pass.
 *
 * @param pending   runs handed to the runner
 * @param succeeded runs that ended SUCCEEDED
 * @param failed    runs that ended FAILED or FAILED_RETRYABLE (including admission rejections)
 * @param deferred  runs still DUE afterwards (queued, or claimed by another worker)
 * @param cancelled runs that ended CANCELLED
 * @param errors    runs whose execution threw; their state is reconciled on a later pass
 */
public record ProcessSummary(int pending, int succeeded, int failed, int deferred, int cancelled, int errors) {

    public static ProcessSummary empty() {
        return new ProcessSummary(0, 0, 0, 0, 0, 0);
    }

    @Override
    public String toString() {
        return pending + " pending: " + succeeded + " succeeded, " + failed + " failed, "
                + deferred + " deferred, " + cancelled + " cancelled, " + errors + " errors";
    }
}
