package com.cronpilot.scheduler.service;

/**
 * The job was disabled between being selected as due and being claimed.
 * The scheduler logs it and moves on; it is not retried in the same cycle.
 */
public class JobDisabledException extends RuntimeException {

    public JobDisabledException(Long jobId) {
        super("Job is disabled: " + jobId);
    }
}
