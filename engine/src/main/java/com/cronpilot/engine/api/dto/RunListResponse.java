package com.cronpilot.engine.api.dto;

import java.util.List;

public record RunListResponse(List<RunResponse> runs, long total, int offset, int limit) {}
