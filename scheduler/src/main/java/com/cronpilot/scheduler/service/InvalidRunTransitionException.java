package com.cronpilot.scheduler.service;

import com.cronpilot.scheduler.model.RunStatus;

/**
 * Attempt to complete a run that is already SUCCESS or FAILED.
 *
 * Usually means two parties raced to finish the same run (the worker and the
 * timeout watchdog). The run row is left exactly as the first one wrote it.
 */
public class InvalidRunTransitionException extends RuntimeException {

    private final RunStatus currentStatus;

    public InvalidRunTransitionException(Long runId, RunStatus currentStatus, RunStatus requested) {
        super("Run " + runId + " is already " + currentStatus.dbValue()
                + "; cannot move it to " + requested.dbValue());
        this.currentStatus = currentStatus;
    }

    public RunStatus getCurrentStatus() { return currentStatus; }
}
