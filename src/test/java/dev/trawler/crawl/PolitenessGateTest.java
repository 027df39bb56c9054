package dev.trawler.crawl;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class PolitenessGateTest {

  @Test
  void consecutive_requests_to_one_origin_are_spaced() throws InterruptedException {
    PolitenessGate gate = new PolitenessGate();
    long start = System.nanoTime();

    gate.await("https://example.com", Duration.ofMillis(150));
    gate.await("https://example.com", Duration.ofMillis(150));
    gate.await("https://example.com", Duration.ofMillis(150));

    assertThat(Duration.ofNanos(System.nanoTime() - start))
        .isGreaterThanOrEqualTo(Duration.ofMillis(300));
  }

  @Test
  void different_origins_do_not_wait_on_each_other() throws InterruptedException {
    PolitenessGate gate = new PolitenessGate();
    long start = System.nanoTime();

    gate.await("https://a.example.com", Duration.ofSeconds(5));
    gate.await("https://b.example.com", Duration.ofSeconds(5));

    assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(2));
  }

  @Test
  void zero_delay_never_sleeps() throws InterruptedException {
    PolitenessGate gate = new PolitenessGate();
    long start = System.nanoTime();

    for (int i = 0; i < 100; i++) {
      gate.await("https://example.com", Duration.ZERO);
    }

    assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(1));
  }
}
