package com.cronpilot.scheduler.model;

/**
 * Where the polling loop is within a cycle.
 *
 *   IDLE → POLLING → DISPATCHING → IDLE
 *
 * HALTED is entered once the store stays unreachable after the retry budget
 * is spent; the loop does not leave it without a restart.
 */
public enum SchedulerState {
    IDLE,
    POLLING,
    DISPATCHING,
    HALTED
}
