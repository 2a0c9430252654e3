package com.linkshelf.refresh.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Everything a single refresh writes back for one link. Applied as one statement.
 */
public record LinkStateWrite(
    UUID linkId,
    LinkStatus previousStatus,
    LinkStatus status,
    int consecutiveFailures,
    Instant lastChecked,
    Instant refreshedAt,
    MetadataDelta delta
) {
    public boolean statusChanged() {
        return previousStatus != status;
    }

    public boolean becameInaccessible() {
        return statusChanged() && status == LinkStatus.INACCESSIBLE;
    }

    public boolean becameRepoUnavailable() {
        return statusChanged() && status == LinkStatus.REPO_UNAVAILABLE;
    }

    public boolean recovered() {
        return statusChanged() && previousStatus.isUnreachable() && status == LinkStatus.ACTIVE;
    }
}
