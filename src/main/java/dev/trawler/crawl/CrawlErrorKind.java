package dev.trawler.crawl;

import dev.trawler.render.RenderFailure;

/** Per-URL failure categories reported in {@link CrawlEvent.PageError}. */
public enum CrawlErrorKind {
  INVALID_URL,
  ROBOTS_DISALLOWED,
  FETCH_FAILED,
  TIMEOUT,
  NETWORK;

  static CrawlErrorKind from(RenderFailure.Kind kind) {
    return switch (kind) {
      case TIMEOUT -> TIMEOUT;
      case NETWORK -> NETWORK;
      case INVALID_URL -> INVALID_URL;
      case UNKNOWN -> FETCH_FAILED;
    };
  }
}
