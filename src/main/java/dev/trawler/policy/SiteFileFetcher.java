package dev.trawler.policy;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Fetches small site-level files (robots.txt, sitemaps) directly over HTTP. Every failure,
 * non-2xx status, empty body or oversized body is reported as an empty result.
 */
@Component
public class SiteFileFetcher {

  private static final Logger log = LoggerFactory.getLogger(SiteFileFetcher.class);

  private final RestClient httpClient;
  private final long maxFileSizeBytes;

  public SiteFileFetcher(RestClient.Builder restClientBuilder, PolicyProperties props) {
    var requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(Duration.ofMillis(props.connectTimeoutMs()));
    requestFactory.setReadTimeout(Duration.ofMillis(props.readTimeoutMs()));
    this.httpClient =
        restClientBuilder
            .requestFactory(requestFactory)
            .defaultHeader(HttpHeaders.USER_AGENT, props.userAgent())
            .defaultHeader(HttpHeaders.ACCEPT, "*/*")
            .build();
    this.maxFileSizeBytes = props.maxFileSizeBytes();
  }

  public Optional<byte[]> fetch(String url) {
    byte[] content;
    try {
      content = httpClient.get().uri(url).retrieve().body(byte[].class);
    } catch (RestClientException | IllegalArgumentException e) {
      log.debug("Could not fetch {}: {}", url, e.getMessage());
      return Optional.empty();
    }
    if (content == null || content.length == 0) {
      return Optional.empty();
    }
    if (content.length > maxFileSizeBytes) {
      log.warn(
          "File at {} exceeds size limit ({} bytes > {} bytes), skipping",
          url,
          content.length,
          maxFileSizeBytes);
      return Optional.empty();
    }
    return Optional.of(content);
  }

  public Optional<String> fetchText(String url) {
    return fetch(url).map(bytes -> new String(bytes, StandardCharsets.UTF_8));
  }
}
