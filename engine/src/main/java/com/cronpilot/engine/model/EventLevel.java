package com.cronpilot.engine.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EventLevel {
    DEBUG,
    INFO,
    WARN,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
