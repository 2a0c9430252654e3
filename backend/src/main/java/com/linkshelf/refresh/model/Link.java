package com.linkshelf.refresh.model;

import java.time.Instant;
import java.util.UUID;

public record Link(
    UUID id,
    String url,
    String domain,
    String path,
    boolean githubRepo,
    LinkStatus status,
    String title,
    String description,
    String logo,
    Integer githubStars,
    Boolean githubArchived,
    Instant githubLastCommit,
    Instant lastChecked,
    Instant refreshedAt,
    int consecutiveFailures
) {
}
