package com.linkshelf.refresh.github;

public class GitHubException extends Exception {
    private final GitHubErrorKind kind;
    private final int statusCode;

    public GitHubException(GitHubErrorKind kind, int statusCode, String message) {
        this(kind, statusCode, message, null);
    }

    public GitHubException(GitHubErrorKind kind, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = statusCode;
    }

    public GitHubErrorKind getKind() {
        return kind;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
