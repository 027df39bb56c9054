package dev.trawler.render;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "trawler.crawl4ai")
public record Crawl4AiProperties(
    String baseUrl, int connectTimeoutMs, int readTimeoutMs, boolean headless, Retry retry) {

  public record Retry(int maxAttempts, long delayMs, double multiplier) {}
}
