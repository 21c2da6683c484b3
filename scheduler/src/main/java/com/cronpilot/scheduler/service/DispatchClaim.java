package com.cronpilot.scheduler.service;

import java.time.Instant;

/** Proof that this caller won the claim on one occurrence of a job. */
public record DispatchClaim(Long jobId, Instant dispatchedAt, Instant nextRunAt) {}
