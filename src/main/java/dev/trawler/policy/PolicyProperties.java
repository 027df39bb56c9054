package dev.trawler.policy;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings for robots.txt and sitemap retrieval. Invalid values fail application startup.
 *
 * @param userAgent user agent sent with every request and matched against robots.txt groups
 * @param connectTimeoutMs TCP connection timeout for robots.txt and sitemap fetches
 * @param readTimeoutMs response read timeout for robots.txt and sitemap fetches
 * @param maxFileSizeBytes files larger than this are ignored
 * @param sitemapMaxDepth maximum nesting of sitemap indexes
 * @param sitemapMaxUrls maximum number of URLs collected from sitemaps per origin
 */
@ConfigurationProperties(prefix = "trawler.policy")
public record PolicyProperties(
    String userAgent,
    int connectTimeoutMs,
    int readTimeoutMs,
    long maxFileSizeBytes,
    int sitemapMaxDepth,
    int sitemapMaxUrls) {

  public PolicyProperties {
    if (userAgent == null || userAgent.isBlank()) {
      throw new IllegalArgumentException("trawler.policy.user-agent must not be blank");
    }
    requirePositive("connect-timeout-ms", connectTimeoutMs);
    requirePositive("read-timeout-ms", readTimeoutMs);
    requirePositive("max-file-size-bytes", maxFileSizeBytes);
    if (sitemapMaxDepth < 0) {
      throw new IllegalArgumentException(
          "trawler.policy.sitemap-max-depth must not be negative, got " + sitemapMaxDepth);
    }
    requirePositive("sitemap-max-urls", sitemapMaxUrls);
  }

  private static void requirePositive(String name, long value) {
    if (value <= 0) {
      throw new IllegalArgumentException(
          "trawler.policy." + name + " must be positive, got " + value);
    }
  }
}
