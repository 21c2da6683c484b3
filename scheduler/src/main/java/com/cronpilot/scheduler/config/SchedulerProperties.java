package com.cronpilot.scheduler.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings under cronpilot.scheduler.*
 *
 * The poll interval itself is read directly by @Scheduled
 * (cronpilot.scheduler.poll-interval-ms) and is only listed here for binding.
 */
@ConfigurationProperties(prefix = "cronpilot.scheduler")
public record SchedulerProperties(
        Long pollIntervalMs,
        Integer workerCount,
        Duration jobTimeout,
        Duration staleRunThreshold,
        String zone,
        StoreRetry storeRetry
) {

    // Compact constructor: fill in defaults for anything left out of the config.
    public SchedulerProperties {
        if (pollIntervalMs == null || pollIntervalMs <= 0)   pollIntervalMs = 10_000L;
        if (workerCount == null || workerCount <= 0)         workerCount = 4;
        if (jobTimeout == null)                              jobTimeout = Duration.ofHours(1);
        if (staleRunThreshold == null)                       staleRunThreshold = Duration.ofHours(2);
        if (zone == null || zone.isBlank())                  zone = "UTC";
        if (storeRetry == null)                              storeRetry = new StoreRetry(null, null, null, null);
    }

    /**
     * Retry policy for store (database) failures in the polling loop.
     * Once maxAttempts consecutive attempts fail, the loop halts.
     */
    public record StoreRetry(Integer maxAttempts, Duration initialBackoff, Duration maxBackoff, Double multiplier) {
        public StoreRetry {
            if (maxAttempts == null || maxAttempts <= 0) maxAttempts = 5;
            if (initialBackoff == null)                  initialBackoff = Duration.ofSeconds(1);
            if (maxBackoff == null)                      maxBackoff = Duration.ofSeconds(30);
            if (multiplier == null || multiplier < 1.0)  multiplier = 2.0;
        }
    }
}
