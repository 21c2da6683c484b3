package com.cronpilot.scheduler.schedule;

/**
 * Thrown when a schedule descriptor cannot be parsed or has no future occurrence.
 */
public class InvalidScheduleException extends RuntimeException {

    public InvalidScheduleException(String message) {
        super(message);
    }

    public InvalidScheduleException(String message, Throwable cause) {
        super(message, cause);
    }
}
