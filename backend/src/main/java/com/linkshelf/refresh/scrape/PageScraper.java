package com.linkshelf.refresh.scrape;

import com.linkshelf.refresh.model.PageMetadata;

import java.time.Duration;

public interface PageScraper {
    PageMetadata fetchPage(String url, Duration timeout) throws ScrapeException;
}
