package com.cronpilot.engine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum RetryStrategy {
    IMMEDIATE,
    EXPONENTIAL,
    LINEAR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    public static Optional<RetryStrategy> fromWire(String value) {
        if (value == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(s -> s.name().equalsIgnoreCase(value.trim()))
                .findFirst();
    }

    @JsonCreator
    static RetryStrategy parse(String value) {
        return fromWire(value).orElseThrow(() ->
                new IllegalArgumentException("Unknown retry strategy: " + value));
    }
}
