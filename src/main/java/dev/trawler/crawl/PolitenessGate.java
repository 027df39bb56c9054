package dev.trawler.crawl;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Spaces request starts per origin. Each caller reserves the next free slot for its origin under
 * the lock and sleeps outside it, so workers fetching different origins never wait on each other.
 */
final class PolitenessGate {

  private final Map<String, Long> nextSlotNanos = new HashMap<>();

  void await(String origin, Duration delay) throws InterruptedException {
    if (delay.isZero() || delay.isNegative()) {
      return;
    }
    long waitNanos;
    synchronized (this) {
      long now = System.nanoTime();
      long slot = Math.max(now, nextSlotNanos.getOrDefault(origin, now));
      nextSlotNanos.put(origin, slot + delay.toNanos());
      waitNanos = slot - now;
    }
    if (waitNanos > 0) {
      Thread.sleep(waitNanos / 1_000_000, (int) (waitNanos % 1_000_000));
    }
  }
}
