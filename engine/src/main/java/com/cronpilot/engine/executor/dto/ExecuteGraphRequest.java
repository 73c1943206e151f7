package com.cronpilot.engine.executor.dto;

import com.cronpilot.engine.model.ResourceLimits;

import java.util.Map;

/**
 * Request body for POST /graphs/{graphId}/execute on the executor service.
 */
public record ExecuteGraphRequest(
        String              graph_id,
        Map<String, Object> inputs,
        String              artifacts_dir,
        ResourceLimits      caps
) {}
