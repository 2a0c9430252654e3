package com.linkshelf.refresh.model;

import java.time.Instant;

public record RepoMetadata(
    int stars,
    String description,
    boolean archived,
    Instant lastCommit
) {
}
