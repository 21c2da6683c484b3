package com.cronpilot.scheduler.api.dto;

/** Response body for GET /api/status. */
public record StatusResponse(
        long    totalJobs,
        long    enabledJobs,
        long    runningJobs,
        String  schedulerState,
        boolean schedulerRunning,
        int     runsInFlight
) {}
