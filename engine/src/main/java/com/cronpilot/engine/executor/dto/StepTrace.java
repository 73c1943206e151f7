package com.cronpilot.engine.executor.dto;

import java.util.Map;

/** One entry of the executor's step trace, written verbatim to steps.json. */
public record StepTrace(
        int                 index,
        String              name,
        String              status,
        long                duration_ms,
        Map<String, Object> detail
) {}
