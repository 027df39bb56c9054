package dev.trawler.render;

import dev.trawler.url.UrlNormalizer;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * {@link PageRenderer} backed by a Crawl4AI sidecar running headless Chromium. Transient
 * {@link RestClientException}s are retried with exponential backoff; once retries are exhausted
 * the exception is mapped to a {@link RenderFailure}.
 */
@Service
public class Crawl4AiRenderer implements PageRenderer {

  private static final Logger log = LoggerFactory.getLogger(Crawl4AiRenderer.class);

  private final RestClient restClient;
  private final boolean headless;

  public Crawl4AiRenderer(
      @Qualifier("crawl4AiRestClient") RestClient restClient, Crawl4AiProperties props) {
    this.restClient = restClient;
    this.headless = props.headless();
  }

  @Override
  @Retryable(
      retryFor = RestClientException.class,
      maxAttemptsExpression = "${trawler.crawl4ai.retry.max-attempts}",
      backoff =
          @Backoff(
              delayExpression = "${trawler.crawl4ai.retry.delay-ms}",
              multiplierExpression = "${trawler.crawl4ai.retry.multiplier}"))
  public RenderResult render(String url, Duration timeout) {
    if (UrlNormalizer.tryNormalize(url).isEmpty()) {
      return RenderResult.failure(url, RenderFailure.Kind.INVALID_URL, "Invalid URL: " + url);
    }

    Crawl4AiResponse response =
        restClient
            .post()
            .uri("/crawl")
            .body(buildRequest(url, timeout))
            .retrieve()
            .body(Crawl4AiResponse.class);

    if (response == null || !response.success() || response.results().isEmpty()) {
      return RenderResult.failure(
          url, RenderFailure.Kind.UNKNOWN, "Crawl4AI returned no results for " + url);
    }

    Crawl4AiPageResult page = response.results().get(0);
    String rendered = page.renderedHtml();
    if (!page.success() || rendered == null) {
      String message = page.errorMessage() != null ? page.errorMessage() : "Render failed";
      return RenderResult.failure(url, classify(message), message);
    }
    return RenderResult.success(url, rendered, page.html());
  }

  @Recover
  RenderResult recoverRender(RestClientException e, String url, Duration timeout) {
    log.warn("Crawl4AI request failed after retries for {}: {}", url, e.getMessage());
    return RenderResult.failure(url, classify(e), String.valueOf(e.getMessage()));
  }

  static RenderFailure.Kind classify(RestClientException e) {
    if (e instanceof ResourceAccessException) {
      return e.getCause() instanceof SocketTimeoutException
          ? RenderFailure.Kind.TIMEOUT
          : RenderFailure.Kind.NETWORK;
    }
    return RenderFailure.Kind.UNKNOWN;
  }

  /** Page-level errors come back as browser messages, e.g. {@code net::ERR_NAME_NOT_RESOLVED}. */
  static RenderFailure.Kind classify(@Nullable String message) {
    if (message == null) {
      return RenderFailure.Kind.UNKNOWN;
    }
    String lower = message.toLowerCase(Locale.ROOT);
    if (lower.contains("timeout") || lower.contains("timed out")) {
      return RenderFailure.Kind.TIMEOUT;
    }
    if (lower.contains("net::") || lower.contains("connection")) {
      return RenderFailure.Kind.NETWORK;
    }
    return RenderFailure.Kind.UNKNOWN;
  }

  private Crawl4AiRequest buildRequest(String url, Duration timeout) {
    return new Crawl4AiRequest(
        List.of(url),
        Map.of("type", "BrowserConfig", "params", Map.of("headless", headless)),
        Map.of(
            "type",
            "CrawlerRunConfig",
            "params",
            Map.of(
                "cache_mode", "bypass",
                "page_timeout", timeout.toMillis(),
                "excluded_tags", List.of("script", "style", "noscript"))));
  }
}
