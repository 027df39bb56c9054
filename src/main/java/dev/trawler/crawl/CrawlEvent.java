package dev.trawler.crawl;

import dev.trawler.render.PageMetadata;
import java.util.List;

/**
 * Events emitted by a crawl, in real time. Every stream ends with exactly one {@link Complete}.
 */
public sealed interface CrawlEvent
    permits CrawlEvent.Progress, CrawlEvent.Page, CrawlEvent.PageError, CrawlEvent.Complete {

  enum Type {
    PROGRESS,
    PAGE,
    ERROR,
    COMPLETE
  }

  Type type();

  /**
   * @param processed entries processed so far
   * @param totalEstimate advisory upper bound: the lesser of max pages and URLs admitted so far
   */
  record Progress(int processed, int totalEstimate) implements CrawlEvent {
    @Override
    public Type type() {
      return Type.PROGRESS;
    }
  }

  record Page(
      String url,
      String markdown,
      PageMetadata metadata,
      List<String> outlinks,
      int depth,
      boolean fromCache)
      implements CrawlEvent {
    public Page {
      outlinks = outlinks == null ? List.of() : List.copyOf(outlinks);
    }

    @Override
    public Type type() {
      return Type.PAGE;
    }
  }

  record PageError(String url, CrawlErrorKind kind, String message) implements CrawlEvent {
    @Override
    public Type type() {
      return Type.ERROR;
    }
  }

  /**
   * @param scrapedUrls URLs that produced a page (fetched or from cache), in completion order
   * @param failed URLs that did not, with the reason
   */
  record Complete(List<String> scrapedUrls, List<FailedUrl> failed) implements CrawlEvent {
    public Complete {
      scrapedUrls = List.copyOf(scrapedUrls);
      failed = List.copyOf(failed);
    }

    @Override
    public Type type() {
      return Type.COMPLETE;
    }
  }
}
