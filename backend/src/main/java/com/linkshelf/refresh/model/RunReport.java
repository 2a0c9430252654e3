package com.linkshelf.refresh.model;

import java.time.Duration;
import java.time.Instant;

public record RunReport(
    Instant startedAt,
    Duration duration,
    int linksSelected,
    int linksAttempted,
    int linksSucceeded,
    int linksFailed,
    int linksTransitionedToInaccessible,
    int linksTransitionedToRepoUnavailable,
    int linksRecovered,
    int writeErrors,
    boolean cancelled,
    String error
) {
    public static RunReport failed(Instant startedAt, Duration duration, String error) {
        return new RunReport(startedAt, duration, 0, 0, 0, 0, 0, 0, 0, 0, false, error);
    }

    public boolean isFailed() {
        return error != null;
    }

    public int linksSkipped() {
        return Math.max(0, linksSelected - linksAttempted);
    }
}
