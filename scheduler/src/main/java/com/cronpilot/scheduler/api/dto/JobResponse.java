package com.cronpilot.scheduler.api.dto;

import com.cronpilot.scheduler.model.Job;

import java.time.Instant;
import java.util.Map;

/**
 * Response body for the /api/jobs endpoints.
 */
public record JobResponse(
        Long    id,
        String  name,
        String  description,
        String  scriptPath,
        String  cronExpression,
        boolean enabled,
        Instant createdAt,
        Instant updatedAt,
        Instant lastRunAt,
        Instant nextRunAt,
        Map<String, Object> config
) {
    public static JobResponse from(Job job) {
        return new JobResponse(
                job.getId(),
                job.getName(),
                job.getDescription(),
                job.getScriptPath(),
                job.getCronExpression(),
                job.isEnabled(),
                job.getCreatedAt(),
                job.getUpdatedAt(),
                job.getLastRunAt(),
                job.getNextRunAt(),
                job.getConfig()
        );
    }
}
