package com.cronpilot.scheduler.model;

/**
 * Status of a single job run, stored lowercase in job_runs.status.
 *
 * Transitions:
 *   PENDING → RUNNING → SUCCESS
 *   PENDING → RUNNING → FAILED
 *   PENDING | RUNNING → FAILED  (timeout, interrupted by a crash)
 *
 * SUCCESS and FAILED are terminal.
 */
public enum RunStatus {
    PENDING("pending"),
    RUNNING("running"),
    SUCCESS("success"),
    FAILED("failed");

    private final String dbValue;

    RunStatus(String dbValue) {
        this.dbValue = dbValue;
    }

    public String dbValue() {
        return dbValue;
    }

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED;
    }

    public static RunStatus fromDbValue(String value) {
        for (RunStatus s : values()) {
            if (s.dbValue.equalsIgnoreCase(value)) return s;
        }
        throw new IllegalArgumentException("Unknown run status: " + value);
    }
}
