package com.linkshelf.refresh.model;

import java.time.Instant;

public record SchedulerStatusResponse(
    SchedulerState state,
    boolean running,
    Instant nextRunAt,
    RunReport lastReport,
    long cyclesCompleted,
    long cyclesFailed
) {
}
