package com.cronpilot.scheduler.schedule;

import java.time.Instant;

/**
 * Evaluates schedule descriptors (cron expressions).
 *
 * Everything that needs "when does this job run next" goes through here,
 * so the scheduler never parses cron text itself.
 */
public interface ScheduleCalculator {

    /**
     * The first occurrence of {@code expression} strictly after {@code after}.
     *
     * @throws InvalidScheduleException if the expression cannot be parsed or never fires
     */
    Instant nextOccurrence(String expression, Instant after);

    /**
     * Reject an expression that {@link #nextOccurrence} could not evaluate.
     *
     * @throws InvalidScheduleException with a message suitable for API callers
     */
    void validate(String expression);
}
