package com.cronpilot.scheduler.schedule;

import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * ScheduleCalculator backed by Spring's CronExpression.
 *
 * Accepts:
 *   - classic 5-field UNIX cron ("0 2 * * *"): a "0" seconds field is prepended
 *   - 6-field Spring cron with seconds ("0 0 2 * * *")
 *   - macros ("@daily", "@hourly", ...)
 *
 * Occurrences are computed in a fixed zone (UTC unless configured), so a
 * daily job at 02:00 fires at 02:00 in that zone regardless of the host.
 */
@Component
public class SpringCronScheduleCalculator implements ScheduleCalculator {

    private final ZoneId zone;

    public SpringCronScheduleCalculator(ScheduleZone zone) {
        this.zone = zone.zoneId();
    }

    @Override
    public Instant nextOccurrence(String expression, Instant after) {
        CronExpression cron = parse(expression);
        ZonedDateTime next = cron.next(after.atZone(zone));
        if (next == null) {
            throw new InvalidScheduleException("Cron expression never fires after " + after + ": " + expression);
        }
        return next.toInstant();
    }

    @Override
    public void validate(String expression) {
        parse(expression);
    }

    private static CronExpression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidScheduleException("Cron expression is required");
        }
        String normalized = expression.trim();
        if (!normalized.startsWith("@") && normalized.split("\\s+").length == 5) {
            normalized = "0 " + normalized;
        }
        try {
            return CronExpression.parse(normalized);
        } catch (IllegalArgumentException e) {
            throw new InvalidScheduleException("Invalid cron expression '" + expression + "': " + e.getMessage(), e);
        }
    }
}
