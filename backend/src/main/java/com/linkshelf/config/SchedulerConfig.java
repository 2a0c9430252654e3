package com.linkshelf.config;

import java.time.Duration;

/**
 * Validated scheduler settings, fixed for the lifetime of the process.
 */
public record SchedulerConfig(
    Duration interval,
    int batchSize,
    int jitterPercent,
    int maxConcurrency,
    int failureThreshold,
    Duration requestTimeout,
    boolean retryRepoUnavailable,
    Duration shutdownTimeout
) {
    public SchedulerConfig {
        requirePositive("interval", interval);
        requirePositive("requestTimeout", requestTimeout);
        requirePositive("shutdownTimeout", shutdownTimeout);
        requirePositive("batchSize", batchSize);
        requirePositive("maxConcurrency", maxConcurrency);
        requirePositive("failureThreshold", failureThreshold);
        if (jitterPercent < 0 || jitterPercent > 100) {
            throw new SchedulerConfigException("jitterPercent must be between 0 and 100, got " + jitterPercent);
        }
    }

    public static SchedulerConfig from(RefreshProperties properties) {
        RefreshProperties.Scheduler scheduler = properties.getScheduler();
        return new SchedulerConfig(
            scheduler.getInterval(),
            scheduler.getBatchSize(),
            scheduler.getJitterPercent(),
            scheduler.getMaxConcurrency(),
            scheduler.getFailureThreshold(),
            Duration.ofSeconds(properties.getRequestTimeoutSeconds()),
            scheduler.isRetryRepoUnavailable(),
            scheduler.getShutdownTimeout()
        );
    }

    private static void requirePositive(String name, int value) {
        if (value <= 0) {
            throw new SchedulerConfigException(name + " must be positive, got " + value);
        }
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new SchedulerConfigException(name + " must be a positive duration, got " + value);
        }
    }
}
