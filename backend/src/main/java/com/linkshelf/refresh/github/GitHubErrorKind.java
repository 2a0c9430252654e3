package com.linkshelf.refresh.github;

public enum GitHubErrorKind {
    RATE_LIMITED,
    NOT_FOUND,
    TIMEOUT,
    OTHER
}
