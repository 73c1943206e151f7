package com.cronpilot.engine.api.dto;

import com.cronpilot.engine.model.JobRun;
import com.cronpilot.engine.model.ResourceUsage;
import com.cronpilot.engine.model.RunState;

import java.time.Instant;
import java.util.Map;

/**
 * Read-only view of a run returned by the run endpoints and by
 * POST /jobs/{id}/run.
 */
public record RunResponse(
        String              id,
        String              jobId,
        RunState            state,
        int                 attempt,
        boolean             dryRun,
        Instant             scheduledAt,
        Instant             startedAt,
        Instant             completedAt,
        String              errorCode,
        String              errorMessage,
        ResourceUsage       resourceUsage,
        Map<String, Object> inputOverrides,
        String              artifactsDir
) {
    public static RunResponse from(JobRun r) {
        return new RunResponse(
                r.getId(),
                r.getJobId(),
                r.getState(),
                r.getAttempt(),
                r.isDryRun(),
                r.getScheduledAt(),
                r.getStartedAt(),
                r.getCompletedAt(),
                r.getErrorCode(),
                r.getErrorMessage(),
                r.getResourceUsage(),
                r.getInputOverrides(),
                r.getArtifactsDir()
        );
    }
}
