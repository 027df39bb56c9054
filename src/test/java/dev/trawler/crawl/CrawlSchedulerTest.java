package dev.trawler.crawl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.trawler.cache.ContentCache;
import dev.trawler.fixture.FakeSite;
import dev.trawler.fixture.MutableClock;
import dev.trawler.policy.RobotsPolicy;
import dev.trawler.render.JsoupMarkdownTransformer;
import dev.trawler.render.PageRenderer;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

@Timeout(30)
class CrawlSchedulerTest {

  private static final String ROOT = "https://example.com/";

  @TempDir Path tempDir;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final List<CrawlEvent> events = new CopyOnWriteArrayList<>();
  private final Manifest manifest = new Manifest();
  private final MutableClock clock = MutableClock.startingAt("2025-01-01T00:00:00Z");

  private CrawlScheduler scheduler(CrawlJob job, Frontier frontier, PageRenderer site) {
    return new CrawlScheduler(
        job,
        frontier,
        new ScopeFilter(job),
        origin -> RobotsPolicy.permissive("TrawlerBot/1.0"),
        new ContentCache(tempDir.resolve("cache"), objectMapper, clock),
        site,
        new JsoupMarkdownTransformer(),
        new PageArtifactWriter(job, objectMapper),
        manifest,
        events::add,
        objectMapper,
        Duration.ofSeconds(1));
  }

  @Test
  void state_moves_from_seeded_through_draining() throws InterruptedException {
    CrawlJob job = CrawlJob.builder(ROOT).build();
    Frontier frontier = new Frontier(job.maxPages());
    frontier.offer(FrontierEntry.seed(job.rootUrl()));
    CrawlScheduler scheduler = scheduler(job, frontier, new FakeSite().page(ROOT, "Home"));

    assertThat(scheduler.state()).isEqualTo(CrawlState.SEEDED);
    scheduler.run();
    assertThat(scheduler.state()).isEqualTo(CrawlState.DRAINING);
    scheduler.markComplete();
    assertThat(scheduler.state()).isEqualTo(CrawlState.COMPLETE);
  }

  @Test
  void a_scheduler_runs_only_once() throws InterruptedException {
    CrawlJob job = CrawlJob.builder(ROOT).build();
    CrawlScheduler scheduler = scheduler(job, new Frontier(job.maxPages()), new FakeSite());
    scheduler.run();

    assertThatThrownBy(scheduler::run).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void reaching_max_pages_drains_the_frontier() throws InterruptedException {
    FakeSite site =
        new FakeSite()
            .page(ROOT, "Home", "/a", "/b", "/c")
            .page("https://example.com/a", "A")
            .page("https://example.com/b", "B")
            .page("https://example.com/c", "C");
    CrawlJob job = CrawlJob.builder(ROOT).maxPages(2).concurrencyLimit(1).useCache(false).build();
    Frontier frontier = new Frontier(job.maxPages());
    frontier.offer(FrontierEntry.seed(job.rootUrl()));

    scheduler(job, frontier, site).run();

    assertThat(frontier.processedCount()).isEqualTo(2);
    assertThat(frontier.isDraining()).isTrue();
    assertThat(manifest.size()).isEqualTo(2);
    assertThat(site.totalRenderCount()).isEqualTo(2);
  }

  @Test
  void outlinks_are_admitted_one_level_deeper() throws InterruptedException {
    FakeSite site =
        new FakeSite()
            .page(ROOT, "Home", "/a")
            .page("https://example.com/a", "A", "/a/b")
            .page("https://example.com/a/b", "B");
    CrawlJob job = CrawlJob.builder(ROOT).maxDepth(2).useCache(false).build();
    Frontier frontier = new Frontier(job.maxPages());
    frontier.offer(FrontierEntry.seed(job.rootUrl()));

    scheduler(job, frontier, site).run();

    assertThat(events)
        .filteredOn(CrawlEvent.Page.class::isInstance)
        .map(e -> (CrawlEvent.Page) e)
        .extracting(CrawlEvent.Page::url, CrawlEvent.Page::depth)
        .containsExactly(
            tuple(ROOT, 0),
            tuple("https://example.com/a", 1),
            tuple("https://example.com/a/b", 2));
  }

  @Test
  void interrupted_run_returns_only_after_in_flight_workers_finish() throws InterruptedException {
    FakeSite site = new FakeSite().page(ROOT, "Home");
    CountDownLatch rendering = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    PageRenderer slowSite =
        (url, timeout) -> {
          rendering.countDown();
          awaitIgnoringInterrupts(release);
          return site.render(url, timeout);
        };
    CrawlJob job = CrawlJob.builder(ROOT).concurrencyLimit(1).useCache(false).build();
    Frontier frontier = new Frontier(job.maxPages());
    frontier.offer(FrontierEntry.seed(job.rootUrl()));
    CrawlScheduler scheduler = scheduler(job, frontier, slowSite);

    AtomicBoolean interrupted = new AtomicBoolean();
    AtomicInteger eventsAtReturn = new AtomicInteger(-1);
    Thread runner =
        new Thread(
            () -> {
              try {
                scheduler.run();
              } catch (InterruptedException e) {
                interrupted.set(true);
              }
              eventsAtReturn.set(events.size());
            });
    runner.start();
    assertThat(rendering.await(5, TimeUnit.SECONDS)).isTrue();

    runner.interrupt();
    runner.join(300);
    assertThat(runner.isAlive()).isTrue();

    release.countDown();
    runner.join(5_000);

    assertThat(runner.isAlive()).isFalse();
    assertThat(interrupted).isTrue();
    assertThat(events).hasAtLeastOneElementOfType(CrawlEvent.Page.class);
    assertThat(eventsAtReturn.get()).isEqualTo(events.size());
    assertThat(scheduler.state()).isEqualTo(CrawlState.DRAINING);
  }

  private static void awaitIgnoringInterrupts(CountDownLatch latch) {
    boolean interrupted = false;
    while (true) {
      try {
        latch.await();
        break;
      } catch (InterruptedException e) {
        interrupted = true;
      }
    }
    if (interrupted) {
      Thread.currentThread().interrupt();
    }
  }
}
