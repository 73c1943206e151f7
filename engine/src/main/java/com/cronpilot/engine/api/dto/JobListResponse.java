package com.cronpilot.engine.api.dto;

import java.util.List;

public record JobListResponse(List<JobResponse> jobs, long total, int offset, int limit) {}
