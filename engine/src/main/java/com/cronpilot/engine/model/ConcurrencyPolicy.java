package com.cronpilot.engine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * What happens when a job becomes due while a previous run of it is still active.
 *
 *   ALLOW           runs overlap freely, no lock is taken
 *   SKIP            the new run is rejected and recorded as FAILED
 *   QUEUE           the new run waits (stays DUE) until the running one releases the lock
 *   CANCEL_PREVIOUS the active run is cancelled and the new one takes over
 */
public enum ConcurrencyPolicy {
    ALLOW("allow"),
    SKIP("skip"),
    QUEUE("queue"),
    CANCEL_PREVIOUS("cancel-previous");

    private final String wireName;

    ConcurrencyPolicy(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /** True when admission has to go through the job lock. */
    public boolean requiresLock() {
        return this != ALLOW;
    }

    public static Optional<ConcurrencyPolicy> fromWire(String value) {
        if (value == null) return Optional.empty();
        String v = value.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(p -> p.wireName.equals(v) || p.name().equalsIgnoreCase(v))
                .findFirst();
    }

    @JsonCreator
    static ConcurrencyPolicy parse(String value) {
        return fromWire(value).orElseThrow(() ->
                new IllegalArgumentException("Unknown concurrency policy: " + value));
    }
}
