package com.cronpilot.scheduler.service;

/** Another job already uses the requested name. */
public class JobConflictException extends RuntimeException {

    public JobConflictException(String name) {
        super("A job named '" + name + "' already exists");
    }

    public JobConflictException(String name, Throwable cause) {
        super("A job named '" + name + "' already exists", cause);
    }
}
