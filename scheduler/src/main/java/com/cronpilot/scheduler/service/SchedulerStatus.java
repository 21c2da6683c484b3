package com.cronpilot.scheduler.service;

import com.cronpilot.scheduler.model.SchedulerState;

/**
 * Snapshot of this scheduler instance.
 *
 * @param state      where the polling loop is right now
 * @param recovered  whether startup recovery (orphaned runs, schedules) has completed
 * @param runsInFlight runs started by this instance that have not finished yet
 */
public record SchedulerStatus(SchedulerState state, boolean recovered, int runsInFlight) {}
