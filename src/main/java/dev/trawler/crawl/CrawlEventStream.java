package dev.trawler.crawl;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.jspecify.annotations.Nullable;

/**
 * Lazy, finite, single-use view of a running crawl's events. Producers block when the bounded
 * buffer is full. Iteration ends after the {@link CrawlEvent.Complete} event. Closing the stream
 * stops the crawl and discards any further events.
 */
public final class CrawlEventStream implements Iterator<CrawlEvent>, AutoCloseable {

  private static final long PUBLISH_POLL_MILLIS = 100;

  private final BlockingQueue<CrawlEvent> buffer;
  private final Runnable onClose;

  private volatile boolean closed;
  private boolean finished;
  private @Nullable CrawlEvent next;

  CrawlEventStream(int capacity, Runnable onClose) {
    this.buffer = new ArrayBlockingQueue<>(capacity);
    this.onClose = onClose;
  }

  /**
   * Hand an event to the consumer, waiting while the buffer is full.
   *
   * @return false if the stream was closed and the event discarded
   */
  boolean publish(CrawlEvent event) throws InterruptedException {
    while (!closed) {
      if (buffer.offer(event, PUBLISH_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public boolean hasNext() {
    if (next != null) {
      return true;
    }
    if (finished || closed) {
      return false;
    }
    try {
      next = buffer.take();
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      close();
      return false;
    }
  }

  @Override
  public CrawlEvent next() {
    if (!hasNext()) {
      throw new NoSuchElementException("Crawl event stream is exhausted");
    }
    CrawlEvent event = next;
    next = null;
    if (event instanceof CrawlEvent.Complete) {
      finished = true;
    }
    return event;
  }

  /** Sequential stream over the remaining events; closing it closes this stream. */
  public Stream<CrawlEvent> stream() {
    return StreamSupport.stream(
            Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL),
            false)
        .onClose(this::close);
  }

  public boolean isClosed() {
    return closed;
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    buffer.clear();
    onClose.run();
  }
}
