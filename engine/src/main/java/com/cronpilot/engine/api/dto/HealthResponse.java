package com.cronpilot.engine.api.dto;

import java.time.Instant;

public record HealthResponse(String status, long jobs, String workerId, Instant timestamp) {}
