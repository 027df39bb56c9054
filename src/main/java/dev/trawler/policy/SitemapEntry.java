package dev.trawler.policy;

import java.time.Instant;
import org.jspecify.annotations.Nullable;

/** A URL listed in a sitemap. Used only as a crawl seed candidate. */
public record SitemapEntry(String url, @Nullable Instant lastModified, @Nullable Double priority) {}
