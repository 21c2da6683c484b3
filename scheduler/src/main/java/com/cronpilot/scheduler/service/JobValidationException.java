package com.cronpilot.scheduler.service;

/**
 * A job definition was rejected before it reached the database
 * (missing required field, bad cron expression, value too long).
 */
public class JobValidationException extends RuntimeException {

    public JobValidationException(String message) {
        super(message);
    }

    public JobValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
