package com.cronpilot.scheduler.executor;

/**
 * Thrown when a job script cannot be run at all (missing file, spawn
 * failure, interrupted). A script that runs and exits non-zero is not an
 * exception; it comes back as a ScriptResult.
 */
public class ScriptExecutionException extends RuntimeException {

    public ScriptExecutionException(String message) {
        super(message);
    }

    public ScriptExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
