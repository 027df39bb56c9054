package dev.trawler.crawl;

import org.jspecify.annotations.Nullable;

/**
 * @param url normalized URL
 * @param path artifact path relative to the output directory; null when nothing was written
 * @param status outcome of processing the URL
 */
public record ManifestEntry(String url, @Nullable String path, ManifestStatus status) {}
