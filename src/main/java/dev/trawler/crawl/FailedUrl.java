package dev.trawler.crawl;

/** A URL that was processed without producing a page. */
public record FailedUrl(String url, CrawlErrorKind kind, String message) {}
