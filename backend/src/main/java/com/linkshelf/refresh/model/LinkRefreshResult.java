package com.linkshelf.refresh.model;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record LinkRefreshResult(
    UUID linkId,
    RefreshOutcome.Kind outcome,
    FailureSource failureSource,
    String reason,
    LinkStatus status,
    int consecutiveFailures,
    Instant lastChecked,
    List<String> changedFields,
    boolean written
) {
}
