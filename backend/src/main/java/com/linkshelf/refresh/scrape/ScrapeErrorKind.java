package com.linkshelf.refresh.scrape;

public enum ScrapeErrorKind {
    TIMEOUT,
    NOT_FOUND,
    SERVER_ERROR,
    OTHER
}
