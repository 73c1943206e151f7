package com.cronpilot.engine.api.dto;

import com.cronpilot.engine.model.EventLevel;
import com.cronpilot.engine.model.RunEvent;

import java.time.Instant;
import java.util.Map;

public record RunEventResponse(
        String              id,
        String              runId,
        Instant             timestamp,
        EventLevel          level,
        String              event,
        String              message,
        Map<String, Object> data
) {
    public static RunEventResponse from(RunEvent e) {
        return new RunEventResponse(e.getId(), e.getRunId(), e.getOccurredAt(), e.getLevel(),
                e.getEvent(), e.getMessage(), e.getData());
    }
}
