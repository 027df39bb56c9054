package dev.trawler.crawl;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.trawler.cache.ContentCache;
import dev.trawler.policy.PolicyResolver;
import dev.trawler.policy.RobotsPolicy;
import dev.trawler.policy.SitemapEntry;
import dev.trawler.render.ContentTransformer;
import dev.trawler.render.PageRenderer;
import dev.trawler.url.UrlNormalizer;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for crawling a site. Each call to {@link #crawl(CrawlJob)} starts an independent job
 * on its own coordinator thread and returns the job's event stream immediately.
 *
 * <p>The coordinator resolves the root origin's robots.txt, takes over the pages of a previous
 * run when resuming, seeds the frontier with the root URL (and sitemap URLs when enabled), runs
 * the worker pool, writes the manifest and finally publishes {@link CrawlEvent.Complete}. Complete
 * is always the last event, also after a failure or after the consumer closed the stream.
 */
@Service
public class CrawlOrchestrator {

  private static final Logger log = LoggerFactory.getLogger(CrawlOrchestrator.class);

  private final PolicyResolver policyResolver;
  private final ContentCache cache;
  private final PageRenderer renderer;
  private final ContentTransformer transformer;
  private final ManifestWriter manifestWriter;
  private final ObjectMapper objectMapper;
  private final CrawlProperties props;
  private final NamedThreadFactory coordinatorThreads = new NamedThreadFactory("trawler-crawl");

  public CrawlOrchestrator(
      PolicyResolver policyResolver,
      ContentCache cache,
      PageRenderer renderer,
      ContentTransformer transformer,
      ManifestWriter manifestWriter,
      ObjectMapper objectMapper,
      CrawlProperties props) {
    this.policyResolver = policyResolver;
    this.cache = cache;
    this.renderer = renderer;
    this.transformer = transformer;
    this.manifestWriter = manifestWriter;
    this.objectMapper = objectMapper;
    this.props = props;
  }

  /**
   * Start a crawl.
   *
   * @throws IllegalArgumentException if the output directory exists and is not a directory
   */
  public CrawlEventStream crawl(CrawlJob job) {
    Path outputDir = job.outputDir();
    if (outputDir != null && Files.exists(outputDir) && !Files.isDirectory(outputDir)) {
      throw new IllegalArgumentException("Output path is not a directory: " + outputDir);
    }
    Frontier frontier = new Frontier(job.maxPages(), job.urlIdentity());
    CrawlEventStream events = new CrawlEventStream(props.eventBufferSize(), frontier::drain);
    coordinatorThreads.newThread(() -> coordinate(job, frontier, events)).start();
    return events;
  }

  /** Run a crawl on the calling thread and return its final event. */
  public CrawlEvent.Complete crawlAndWait(CrawlJob job) {
    try (CrawlEventStream events = crawl(job)) {
      CrawlEvent.Complete complete = null;
      while (events.hasNext()) {
        if (events.next() instanceof CrawlEvent.Complete c) {
          complete = c;
        }
      }
      if (complete == null) {
        throw new IllegalStateException("Crawl of " + job.rootUrl() + " ended without completing");
      }
      return complete;
    }
  }

  private void coordinate(CrawlJob job, Frontier frontier, CrawlEventStream events) {
    Manifest manifest = new Manifest();
    CrawlScheduler scheduler = null;
    log.info(
        "Starting crawl of {} (maxPages={}, maxDepth={}, concurrency={})",
        job.rootUrl(),
        job.maxPages(),
        job.maxDepth(),
        job.concurrencyLimit());
    try {
      Map<String, RobotsPolicy> policies = new ConcurrentHashMap<>();
      Function<String, RobotsPolicy> robots =
          origin -> policies.computeIfAbsent(origin, policyResolver::fetchRobots);
      RobotsPolicy rootPolicy =
          job.respectRobots()
              ? robots.apply(job.rootOrigin())
              : RobotsPolicy.permissive(policyResolver.userAgent());

      ScopeFilter scope = new ScopeFilter(job);
      scheduler =
          new CrawlScheduler(
              job,
              frontier,
              scope,
              robots,
              cache,
              renderer,
              transformer,
              new PageArtifactWriter(job, objectMapper),
              manifest,
              events::publish,
              objectMapper,
              props.maxCrawlDelay());
      Path outputDir = job.outputDir();
      if (job.resume() && outputDir != null) {
        int carried = scheduler.carryOver(manifestWriter.read(outputDir));
        log.info("Resuming crawl of {} with {} pages already scraped", job.rootUrl(), carried);
      }
      seed(job, frontier, scope, rootPolicy);
      scheduler.run();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      frontier.drain();
      log.warn("Crawl of {} interrupted", job.rootUrl());
    } catch (RuntimeException e) {
      frontier.drain();
      log.error("Crawl of {} aborted", job.rootUrl(), e);
    } finally {
      List<String> scraped = scheduler == null ? List.of() : scheduler.scrapedUrls();
      List<FailedUrl> failed = scheduler == null ? List.of() : scheduler.failedUrls();
      writeManifest(job, manifest);
      if (scheduler != null) {
        scheduler.markComplete();
      }
      log.info(
          "Crawl of {} complete: {} scraped, {} failed", job.rootUrl(), scraped.size(), failed.size());
      try {
        events.publish(new CrawlEvent.Complete(scraped, failed));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  private void seed(CrawlJob job, Frontier frontier, ScopeFilter scope, RobotsPolicy rootPolicy) {
    frontier.offer(FrontierEntry.seed(job.rootUrl()));
    if (!job.useSitemap()) {
      return;
    }
    List<SitemapEntry> entries = policyResolver.discoverSitemaps(job.rootOrigin(), rootPolicy);
    int seeded = 0;
    for (SitemapEntry entry : entries) {
      Optional<String> normalized = UrlNormalizer.tryNormalize(entry.url());
      if (normalized.isPresent()
          && scope.accepts(normalized.get())
          && frontier.offer(FrontierEntry.seed(normalized.get()))) {
        seeded++;
      }
    }
    log.info("Seeded {} of {} sitemap URLs for {}", seeded, entries.size(), job.rootUrl());
  }

  private void writeManifest(CrawlJob job, Manifest manifest) {
    Path outputDir = job.outputDir();
    if (outputDir == null) {
      return;
    }
    try {
      manifestWriter.write(outputDir, manifest);
    } catch (IOException e) {
      log.error("Could not write manifest to {}: {}", outputDir, e.getMessage());
    }
  }
}
