package com.cronpilot.engine.api.dto;

import java.util.Map;

/**
 * Optional body of POST /jobs/{id}/run. {@code inputs} are layered over the
 * job's inputs for this run only.
 */
public record RunJobRequest(Map<String, Object> inputs) {}
