package dev.trawler.crawl;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Engine-wide crawl settings and the defaults used when a caller leaves a job setting unset.
 * Invalid values fail application startup.
 *
 * @param maxCrawlDelay upper bound applied to robots.txt crawl delays
 * @param eventBufferSize capacity of the event buffer between a crawl and its consumer
 */
@ConfigurationProperties(prefix = "trawler.crawl")
public record CrawlProperties(
    Duration maxCrawlDelay,
    int eventBufferSize,
    int defaultMaxPages,
    int defaultMaxDepth,
    int defaultConcurrency,
    Duration defaultCacheTtl,
    Duration defaultRenderTimeout) {

  public CrawlProperties {
    requireNonNegative("max-crawl-delay", maxCrawlDelay);
    requirePositive("event-buffer-size", eventBufferSize);
    requirePositive("default-max-pages", defaultMaxPages);
    if (defaultMaxDepth < 0) {
      throw new IllegalArgumentException(
          "trawler.crawl.default-max-depth must not be negative, got " + defaultMaxDepth);
    }
    requirePositive("default-concurrency", defaultConcurrency);
    requirePositive("default-cache-ttl", defaultCacheTtl);
    requirePositive("default-render-timeout", defaultRenderTimeout);
  }

  private static void requirePositive(String name, int value) {
    if (value <= 0) {
      throw new IllegalArgumentException(
          "trawler.crawl." + name + " must be positive, got " + value);
    }
  }

  private static void requirePositive(String name, Duration value) {
    if (value == null || value.isZero() || value.isNegative()) {
      throw new IllegalArgumentException(
          "trawler.crawl." + name + " must be positive, got " + value);
    }
  }

  private static void requireNonNegative(String name, Duration value) {
    if (value == null || value.isNegative()) {
      throw new IllegalArgumentException(
          "trawler.crawl." + name + " must not be negative, got " + value);
    }
  }
}
