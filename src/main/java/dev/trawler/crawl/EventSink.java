package dev.trawler.crawl;

/** Receives crawl events; may block to apply back-pressure. */
@FunctionalInterface
interface EventSink {

  void publish(CrawlEvent event) throws InterruptedException;
}
