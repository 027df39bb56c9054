package dev.trawler.crawl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

@Timeout(10)
class FrontierTest {

  private static FrontierEntry entry(String path, int depth) {
    return new FrontierEntry("https://example.com" + path, depth, null);
  }

  @Test
  void entries_are_handed_out_in_fifo_order() throws InterruptedException {
    Frontier frontier = new Frontier(10);
    frontier.offer(entry("/a", 0));
    frontier.offer(entry("/b", 1));

    assertThat(frontier.take()).contains(entry("/a", 0));
    assertThat(frontier.take()).contains(entry("/b", 1));
  }

  @Test
  void a_url_is_admitted_only_once() {
    Frontier frontier = new Frontier(10);

    assertThat(frontier.offer(entry("/a", 0))).isTrue();
    assertThat(frontier.offer(entry("/a", 2))).isFalse();
    assertThat(frontier.queuedCount()).isEqualTo(1);
  }

  @Test
  void admission_stops_at_the_cap() {
    Frontier frontier = new Frontier(2);

    frontier.offer(entry("/a", 0));
    frontier.offer(entry("/b", 0));

    assertThat(frontier.offer(entry("/c", 0))).isFalse();
    assertThat(frontier.visitedCount()).isEqualTo(2);
  }

  @Test
  void completed_urls_from_an_earlier_run_take_a_slot_and_are_never_queued() {
    Frontier frontier = new Frontier(2);

    assertThat(frontier.recordCompleted("https://example.com/a")).isTrue();
    assertThat(frontier.recordCompleted("https://example.com/a")).isFalse();

    assertThat(frontier.processedCount()).isEqualTo(1);
    assertThat(frontier.offer(entry("/a", 0))).isFalse();
    assertThat(frontier.offer(entry("/b", 0))).isTrue();
    assertThat(frontier.recordCompleted("https://example.com/c")).isFalse();
    assertThat(frontier.queuedCount()).isEqualTo(1);
  }

  @Test
  void identity_function_decides_which_urls_count_as_seen() {
    Frontier frontier = new Frontier(10, url -> url.replaceAll("\\?.*$", ""));

    assertThat(frontier.offer(entry("/a?utm_source=x", 0))).isTrue();
    assertThat(frontier.offer(entry("/a", 1))).isFalse();
    assertThat(frontier.visitedCount()).isEqualTo(1);
  }

  @Test
  void take_returns_empty_when_nothing_is_queued_or_in_flight() throws InterruptedException {
    assertThat(new Frontier(5).take()).isEmpty();
  }

  @Test
  void take_waits_for_in_flight_work_to_add_entries() throws Exception {
    Frontier frontier = new Frontier(5);
    frontier.offer(entry("/a", 0));
    FrontierEntry first = frontier.take().orElseThrow();

    ExecutorService pool = Executors.newSingleThreadExecutor();
    try {
      Future<Optional<FrontierEntry>> waiting = pool.submit(frontier::take);
      Thread.sleep(50);
      assertThat(waiting.isDone()).isFalse();

      frontier.offer(entry("/b", 1));
      frontier.complete(first);

      assertThat(waiting.get(5, TimeUnit.SECONDS)).contains(entry("/b", 1));
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void waiting_workers_are_released_when_the_last_entry_completes() throws Exception {
    Frontier frontier = new Frontier(5);
    frontier.offer(entry("/a", 0));
    FrontierEntry first = frontier.take().orElseThrow();

    ExecutorService pool = Executors.newFixedThreadPool(2);
    try {
      Future<Optional<FrontierEntry>> w1 = pool.submit(frontier::take);
      Future<Optional<FrontierEntry>> w2 = pool.submit(frontier::take);

      assertThat(frontier.complete(first)).isEqualTo(1);

      assertThat(w1.get(5, TimeUnit.SECONDS)).isEmpty();
      assertThat(w2.get(5, TimeUnit.SECONDS)).isEmpty();
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void drain_discards_queued_entries_and_rejects_new_ones() throws InterruptedException {
    Frontier frontier = new Frontier(5);
    frontier.offer(entry("/a", 0));
    frontier.offer(entry("/b", 0));

    frontier.drain();

    assertThat(frontier.isDraining()).isTrue();
    assertThat(frontier.queuedCount()).isZero();
    assertThat(frontier.offer(entry("/c", 0))).isFalse();
    assertThat(frontier.take()).isEmpty();
  }

  @Test
  void concurrent_offers_of_the_same_url_admit_exactly_one() throws Exception {
    Frontier frontier = new Frontier(1000);
    int threads = 8;
    CountDownLatch start = new CountDownLatch(1);
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    try {
      List<Future<Integer>> results = new ArrayList<>();
      for (int t = 0; t < threads; t++) {
        results.add(
            pool.submit(
                () -> {
                  start.await();
                  int admitted = 0;
                  for (int i = 0; i < 100; i++) {
                    if (frontier.offer(entry("/p" + i, 1))) {
                      admitted++;
                    }
                  }
                  return admitted;
                }));
      }
      start.countDown();

      int total = 0;
      for (Future<Integer> result : results) {
        total += result.get(5, TimeUnit.SECONDS);
      }
      assertThat(total).isEqualTo(100);
      assertThat(frontier.visitedCount()).isEqualTo(100);
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void cap_must_be_positive() {
    assertThatThrownBy(() -> new Frontier(0)).isInstanceOf(IllegalArgumentException.class);
  }
}
