package com.cronpilot.scheduler.schedule;

import java.time.ZoneId;

/** The time zone cron expressions are evaluated in. */
public record ScheduleZone(ZoneId zoneId) {

    public static ScheduleZone utc() {
        return new ScheduleZone(ZoneId.of("UTC"));
    }
}
