package com.cronpilot.engine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/** Network reach granted to the executor for a run. Enforced by the executor. */
public enum NetworkScope {
    NONE,
    LOCALHOST,
    ALLOWLIST,
    ALL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    public static Optional<NetworkScope> fromWire(String value) {
        if (value == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(s -> s.name().equalsIgnoreCase(value.trim()))
                .findFirst();
    }

    @JsonCreator
    static NetworkScope parse(String value) {
        return fromWire(value).orElseThrow(() ->
                new IllegalArgumentException("Unknown network scope: " + value));
    }
}
