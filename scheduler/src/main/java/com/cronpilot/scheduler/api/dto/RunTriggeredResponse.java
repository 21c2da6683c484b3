package com.cronpilot.scheduler.api.dto;

/** Response body for POST /api/jobs/{id}/run. */
public record RunTriggeredResponse(Long jobId, Long runId, String message) {}
