package dev.trawler.crawl;

/** Lifecycle of a crawl job. Transitions only move forward. */
public enum CrawlState {
  SEEDED,
  RUNNING,
  DRAINING,
  COMPLETE
}
