package com.cronpilot.scheduler.executor.dto;

/**
 * Outcome of a script that ran to completion.
 */
public record ScriptResult(
        int    exitCode,
        String stdout,
        String stderr
) {
    /** True if the script exited 0. */
    public boolean success() {
        return exitCode == 0;
    }

    /**
     * Text stored in job_runs.error_message for a failed run:
     * stderr if there is any, otherwise the exit code.
     */
    public String errorText() {
        if (stderr != null && !stderr.isBlank()) {
            return stderr.stripTrailing();
        }
        return "Script exited with code " + exitCode;
    }
}
