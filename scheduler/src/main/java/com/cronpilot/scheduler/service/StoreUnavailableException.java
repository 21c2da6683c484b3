package com.cronpilot.scheduler.service;

/**
 * The job store stayed unreachable for the whole retry budget.
 * Fatal for the polling loop.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
