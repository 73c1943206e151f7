package com.cronpilot.engine.api.dto;

import com.cronpilot.engine.definition.JobSpec;
import com.cronpilot.engine.model.JobDefinition;
import com.cronpilot.engine.model.Schedule;

import java.time.Instant;
import java.util.Optional;

/**
 * Response body for job endpoints: the definition in file shape (every
 * default spelled out) plus the job's schedule state, if it has one.
 */
public record JobResponse(
        JobSpec definition,
        Instant nextDue,
        Instant lastScheduled,
        Instant lastSuccess,
        Instant lastAttempt,
        Instant createdAt,
        Instant updatedAt
) {
    public static JobResponse from(JobDefinition job, Optional<Schedule> schedule) {
        return new JobResponse(
                JobSpec.from(job),
                schedule.map(Schedule::getNextDue).orElse(null),
                schedule.map(Schedule::getLastScheduled).orElse(null),
                schedule.map(Schedule::getLastSuccess).orElse(null),
                schedule.map(Schedule::getLastAttempt).orElse(null),
                job.getCreatedAt(),
                job.getUpdatedAt()
        );
    }
}
