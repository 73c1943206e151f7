package com.cronpilot.engine.model;

import java.util.List;

/**
 * How failed runs are retried.
 *
 * @param maxRetries     number of additional attempts after the first one
 * @param strategy       IMMEDIATE ignores delays; LINEAR and EXPONENTIAL read them
 * @param delays         per-attempt delays in ms; the last one repeats once exhausted
 * @param retryableCodes error codes that are always retried, regardless of shape
 */
public record RetryPolicy(
        int           maxRetries,
        RetryStrategy strategy,
        List<Long>    delays,
        List<String>  retryableCodes
) {
    public static final List<Long> DEFAULT_DELAYS = List.of(1_000L, 5_000L, 30_000L);

    // Used only when a LINEAR or EXPONENTIAL policy declares no delays at all.
    private static final long BASE_DELAY_MS = 1_000L;

    public RetryPolicy {
        if (strategy == null) strategy = RetryStrategy.EXPONENTIAL;
        delays         = delays == null ? DEFAULT_DELAYS : List.copyOf(delays);
        retryableCodes = retryableCodes == null ? List.of() : List.copyOf(retryableCodes);
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, RetryStrategy.EXPONENTIAL, DEFAULT_DELAYS, List.of());
    }

    /** True if a run with the given 0-based attempt number may be followed by another. */
    public boolean hasRetriesLeft(int attempt) {
        return attempt < maxRetries;
    }

    /**
     * Delay before the attempt that follows {@code attempt}.
     * The delay list is indexed by the failed attempt and clamped to its last element.
     */
    public long delayAfter(int attempt) {
        if (strategy == RetryStrategy.IMMEDIATE) {
            return 0L;
        }
        int index = Math.max(0, attempt);
        if (!delays.isEmpty()) {
            return delays.get(Math.min(index, delays.size() - 1));
        }
        return switch (strategy) {
            case EXPONENTIAL -> BASE_DELAY_MS << Math.min(index, 20);
            case LINEAR      -> BASE_DELAY_MS * (index + 1);
            case IMMEDIATE   -> 0L;
        };
    }

    public boolean isRetryableCode(String code) {
        return code != null && retryableCodes.contains(code);
    }
}
