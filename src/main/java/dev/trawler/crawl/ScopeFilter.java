package dev.trawler.crawl;

import dev.trawler.url.UrlNormalizer;
import dev.trawler.url.UrlPatternMatcher;

/**
 * Decides whether a discovered, normalized link belongs to a crawl's scope.
 *
 * <p>Filtering order:
 *
 * <ol>
 *   <li>Reject anything but http and https
 *   <li>Reject links to another origin unless external links are allowed
 *   <li>Reject links matching any exclude pattern (exclude takes priority)
 *   <li>If include patterns exist, accept only links matching at least one
 * </ol>
 */
final class ScopeFilter {

  private final String rootUrl;
  private final boolean allowExternalLinks;
  private final UrlPatternMatcher includes;
  private final UrlPatternMatcher excludes;

  ScopeFilter(CrawlJob job) {
    this.rootUrl = job.rootUrl();
    this.allowExternalLinks = job.allowExternalLinks();
    this.includes = new UrlPatternMatcher(job.includePatterns());
    this.excludes = new UrlPatternMatcher(job.excludePatterns());
  }

  boolean accepts(String normalizedUrl) {
    if (!normalizedUrl.startsWith("http://") && !normalizedUrl.startsWith("https://")) {
      return false;
    }
    if (!allowExternalLinks && !UrlNormalizer.isSameOrigin(rootUrl, normalizedUrl)) {
      return false;
    }
    if (!excludes.isEmpty() && excludes.matches(normalizedUrl)) {
      return false;
    }
    return includes.matches(normalizedUrl);
  }
}
