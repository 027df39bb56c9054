package dev.trawler.crawl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.trawler.cache.ContentCache;
import dev.trawler.policy.RobotsPolicy;
import dev.trawler.render.ContentTransformer;
import dev.trawler.render.PageRenderer;
import dev.trawler.render.RenderResult;
import dev.trawler.render.TransformedPage;
import dev.trawler.url.UrlNormalizer;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one crawl job's frontier to exhaustion with {@code concurrencyLimit} worker threads.
 *
 * <p>Per entry: robots check, cache lookup, render and transform on a miss, cache write, artifact
 * write, manifest append, event, then admission of in-scope outlinks one level deeper. A failure is
 * confined to its entry and reported as a {@link CrawlEvent.PageError}.
 */
final class CrawlScheduler {

  private static final Logger log = LoggerFactory.getLogger(CrawlScheduler.class);

  private static final Duration WORKER_EXIT_WAIT = Duration.ofSeconds(10);

  private final CrawlJob job;
  private final Frontier frontier;
  private final ScopeFilter scope;
  private final Function<String, RobotsPolicy> robots;
  private final ContentCache cache;
  private final PageRenderer renderer;
  private final ContentTransformer transformer;
  private final PageArtifactWriter artifacts;
  private final Manifest manifest;
  private final EventSink events;
  private final ObjectMapper objectMapper;
  private final Duration maxCrawlDelay;

  private final PolitenessGate politeness = new PolitenessGate();
  private final Set<String> processed = ConcurrentHashMap.newKeySet();
  private final List<String> scrapedUrls = Collections.synchronizedList(new ArrayList<>());
  private final List<FailedUrl> failedUrls = Collections.synchronizedList(new ArrayList<>());
  private final AtomicReference<CrawlState> state = new AtomicReference<>(CrawlState.SEEDED);

  CrawlScheduler(
      CrawlJob job,
      Frontier frontier,
      ScopeFilter scope,
      Function<String, RobotsPolicy> robots,
      ContentCache cache,
      PageRenderer renderer,
      ContentTransformer transformer,
      PageArtifactWriter artifacts,
      Manifest manifest,
      EventSink events,
      ObjectMapper objectMapper,
      Duration maxCrawlDelay) {
    this.job = job;
    this.frontier = frontier;
    this.scope = scope;
    this.robots = robots;
    this.cache = cache;
    this.renderer = renderer;
    this.transformer = transformer;
    this.artifacts = artifacts;
    this.manifest = manifest;
    this.events = events;
    this.objectMapper = objectMapper;
    this.maxCrawlDelay = maxCrawlDelay;
  }

  /**
   * Process the frontier until it is exhausted or drained. Blocks until all workers finish, also
   * when interrupted.
   */
  void run() throws InterruptedException {
    if (!state.compareAndSet(CrawlState.SEEDED, CrawlState.RUNNING)) {
      throw new IllegalStateException("Scheduler already ran, state " + state.get());
    }
    ExecutorService workers =
        Executors.newFixedThreadPool(
            job.concurrencyLimit(), new NamedThreadFactory("trawler-worker"));
    try {
      List<Future<?>> running = new ArrayList<>();
      for (int i = 0; i < job.concurrencyLimit(); i++) {
        running.add(workers.submit(this::workLoop));
      }
      for (Future<?> worker : running) {
        try {
          worker.get();
        } catch (ExecutionException e) {
          log.error("Crawl worker for {} died", job.rootUrl(), e.getCause());
        }
      }
    } catch (InterruptedException e) {
      stop();
      throw e;
    } finally {
      workers.shutdownNow();
      awaitWorkers(workers);
      advance(CrawlState.DRAINING);
    }
  }

  /**
   * Wait for every worker to exit, even when this thread is interrupted, so that nothing is
   * published once {@link #run()} has returned. The interrupt status is restored afterwards.
   */
  private void awaitWorkers(ExecutorService workers) {
    boolean interrupted = false;
    try {
      while (true) {
        try {
          if (workers.awaitTermination(WORKER_EXIT_WAIT.toMillis(), TimeUnit.MILLISECONDS)) {
            return;
          }
          log.warn("Still waiting for crawl workers of {} to finish", job.rootUrl());
        } catch (InterruptedException e) {
          interrupted = true;
        }
      }
    } finally {
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /**
   * Take over the pages an earlier run to the same output directory scraped. Each keeps its
   * manifest entry and counts as processed without being fetched again. Failed and disallowed
   * entries are left out so that this run retries them.
   *
   * @return number of pages carried over
   */
  int carryOver(List<ManifestEntry> previous) {
    if (state.get() != CrawlState.SEEDED) {
      throw new IllegalStateException("Cannot carry over pages once the crawl is " + state.get());
    }
    int carried = 0;
    for (ManifestEntry entry : previous) {
      if (entry.status() != ManifestStatus.SCRAPED && entry.status() != ManifestStatus.CACHED) {
        continue;
      }
      Optional<String> url = UrlNormalizer.tryNormalize(entry.url());
      if (url.isEmpty() || !frontier.recordCompleted(url.get())) {
        continue;
      }
      processed.add(url.get());
      if (entry.path() != null) {
        artifacts.reserve(entry.path());
      }
      manifest.append(url.get(), entry.path(), entry.status());
      scrapedUrls.add(url.get());
      carried++;
    }
    return carried;
  }

  /** No new entries start; entries already in flight run to completion. */
  void stop() {
    frontier.drain();
    advance(CrawlState.DRAINING);
  }

  void markComplete() {
    state.set(CrawlState.COMPLETE);
  }

  CrawlState state() {
    return state.get();
  }

  List<String> scrapedUrls() {
    synchronized (scrapedUrls) {
      return List.copyOf(scrapedUrls);
    }
  }

  List<FailedUrl> failedUrls() {
    synchronized (failedUrls) {
      return List.copyOf(failedUrls);
    }
  }

  private void advance(CrawlState target) {
    state.getAndUpdate(current -> current.compareTo(target) < 0 ? target : current);
  }

  private void workLoop() {
    try {
      while (true) {
        Optional<FrontierEntry> next = frontier.take();
        if (next.isEmpty()) {
          return;
        }
        FrontierEntry entry = next.get();
        try {
          process(entry);
        } catch (RuntimeException e) {
          log.error("Unexpected error crawling {}", entry.url(), e);
          fail(entry, CrawlErrorKind.FETCH_FAILED, describe(e), ManifestStatus.FAILED);
        } finally {
          int done = frontier.complete(entry);
          if (done >= job.maxPages()) {
            stop();
          }
        }
        events.publish(
            new CrawlEvent.Progress(
                frontier.processedCount(), Math.min(job.maxPages(), frontier.visitedCount())));
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private void process(FrontierEntry entry) throws InterruptedException {
    String url = entry.url();
    if (!processed.add(url)) {
      log.debug("Already processed {}", url);
      return;
    }

    String origin = UrlNormalizer.origin(url);
    RobotsPolicy policy = null;
    if (job.respectRobots()) {
      policy = robots.apply(origin);
      if (!policy.isAllowed(url)) {
        log.debug("Disallowed by robots.txt: {}", url);
        fail(
            entry,
            CrawlErrorKind.ROBOTS_DISALLOWED,
            "Disallowed by robots.txt",
            ManifestStatus.ROBOTS_DISALLOWED);
        return;
      }
    }

    if (job.useCache()) {
      Optional<CachedPage> cached = readCache(url);
      if (cached.isPresent()) {
        succeed(entry, cached.get(), true);
        return;
      }
    }

    if (policy != null) {
      politeness.await(origin, policy.effectiveCrawlDelay(maxCrawlDelay));
    }
    log.info("Crawling [{}/{}]: {}", frontier.processedCount() + 1, job.maxPages(), url);
    RenderResult result = renderer.render(url, job.renderTimeout());
    if (!result.isSuccess() || result.html() == null) {
      CrawlErrorKind kind =
          result.failure() == null
              ? CrawlErrorKind.FETCH_FAILED
              : CrawlErrorKind.from(result.failure().kind());
      String message = result.failure() == null ? "Empty render" : result.failure().message();
      log.warn("Failed to crawl {}: {}", url, message);
      fail(entry, kind, message, ManifestStatus.FAILED);
      return;
    }

    TransformedPage transformed = transformer.toMarkdown(result.html(), url);
    CachedPage page =
        new CachedPage(
            transformed.markdown(),
            result.html(),
            result.rawHtml(),
            transformed.metadata(),
            transformed.outlinks());
    if (job.useCache()) {
      writeCache(url, page);
    }
    succeed(entry, page, false);
  }

  private void succeed(FrontierEntry entry, CachedPage page, boolean fromCache)
      throws InterruptedException {
    String path = artifacts.write(entry.url(), page);
    manifest.append(entry.url(), path, fromCache ? ManifestStatus.CACHED : ManifestStatus.SCRAPED);
    scrapedUrls.add(entry.url());
    admitOutlinks(entry, page.outlinks());
    events.publish(
        new CrawlEvent.Page(
            entry.url(),
            page.markdown(),
            page.metadata(),
            page.outlinks(),
            entry.depth(),
            fromCache));
  }

  private void fail(
      FrontierEntry entry, CrawlErrorKind kind, String message, ManifestStatus status) {
    manifest.append(entry.url(), null, status);
    failedUrls.add(new FailedUrl(entry.url(), kind, message));
    try {
      events.publish(new CrawlEvent.PageError(entry.url(), kind, message));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private void admitOutlinks(FrontierEntry entry, List<String> outlinks) {
    int childDepth = entry.depth() + 1;
    if (childDepth > job.maxDepth()) {
      return;
    }
    int admitted = 0;
    for (String link : outlinks) {
      Optional<String> normalized = UrlNormalizer.tryNormalize(link);
      if (normalized.isEmpty() || !scope.accepts(normalized.get())) {
        continue;
      }
      if (frontier.offer(new FrontierEntry(normalized.get(), childDepth, entry.url()))) {
        admitted++;
      }
    }
    if (admitted > 0) {
      log.debug("Admitted {} links from {}", admitted, entry.url());
    }
  }

  private Optional<CachedPage> readCache(String url) {
    return cache
        .get(url)
        .flatMap(
            entry -> {
              try {
                return Optional.of(objectMapper.readValue(entry.payload(), CachedPage.class));
              } catch (IOException e) {
                log.warn("Ignoring unreadable cached page for {}: {}", url, e.getMessage());
                return Optional.empty();
              }
            });
  }

  private void writeCache(String url, CachedPage page) {
    try {
      if (!cache.put(url, objectMapper.writeValueAsBytes(page), job.cacheTtl())) {
        log.debug("Page {} was not cached", url);
      }
    } catch (JsonProcessingException e) {
      log.warn("Could not serialize page {} for caching: {}", url, e.getMessage());
    }
  }

  private static String describe(RuntimeException e) {
    return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
  }
}
