package com.cronpilot.scheduler.api.dto;

import com.cronpilot.scheduler.model.JobRun;

import java.time.Instant;

/**
 * Read-only view of one run returned by GET /api/jobs/{id}/runs.
 * status uses the stored lowercase values (pending, running, success, failed).
 */
public record JobRunResponse(
        Long    id,
        Long    jobId,
        String  status,
        Instant startedAt,
        Instant completedAt,
        Integer durationSeconds,
        String  output,
        String  errorMessage
) {
    public static JobRunResponse from(JobRun r) {
        return new JobRunResponse(
                r.getId(),
                r.getJobId(),
                r.getStatus().dbValue(),
                r.getStartedAt(),
                r.getCompletedAt(),
                r.getDurationSeconds(),
                r.getOutput(),
                r.getErrorMessage()
        );
    }
}
