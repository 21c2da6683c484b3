package com.cronpilot.scheduler.service;

public class RunNotFoundException extends RuntimeException {

    public RunNotFoundException(Long runId) {
        super("Run not found: " + runId);
    }
}
