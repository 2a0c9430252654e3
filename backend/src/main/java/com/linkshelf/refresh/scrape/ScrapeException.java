package com.linkshelf.refresh.scrape;

public class ScrapeException extends Exception {
    private final ScrapeErrorKind kind;
    private final int statusCode;

    public ScrapeException(ScrapeErrorKind kind, String message) {
        this(kind, 0, message, null);
    }

    public ScrapeException(ScrapeErrorKind kind, int statusCode, String message) {
        this(kind, statusCode, message, null);
    }

    public ScrapeException(ScrapeErrorKind kind, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = statusCode;
    }

    public ScrapeErrorKind getKind() {
        return kind;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
