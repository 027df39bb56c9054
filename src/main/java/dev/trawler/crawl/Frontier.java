package dev.trawler.crawl;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * FIFO work queue of one crawl job together with its visited set and in-flight count, all guarded
 * by a single lock.
 *
 * <p>A URL is marked visited in the same critical section that enqueues it, and admission stops
 * once {@code maxAdmissions} URLs have been admitted, so no URL is ever processed twice and the
 * queue stays bounded. {@link #take()} returns empty once the frontier is exhausted (nothing queued
 * and nothing in flight) or draining.
 *
 * <p>The visited set holds the identity of each URL as computed by the {@code identity} function,
 * which lets a job treat URLs that differ only in tracking parameters as one.
 */
public final class Frontier {

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition changed = lock.newCondition();

  private final Deque<FrontierEntry> queue = new ArrayDeque<>();
  private final Set<String> visited = new HashSet<>();
  private final int maxAdmissions;
  private final Function<String, String> identity;

  private int inFlight;
  private int processed;
  private boolean draining;

  public Frontier(int maxAdmissions) {
    this(maxAdmissions, Function.identity());
  }

  public Frontier(int maxAdmissions, Function<String, String> identity) {
    if (maxAdmissions <= 0) {
      throw new IllegalArgumentException("maxAdmissions must be positive, got " + maxAdmissions);
    }
    this.maxAdmissions = maxAdmissions;
    this.identity = identity;
  }

  /**
   * Atomically check and admit an entry.
   *
   * @return false if the URL was seen before, the admission cap is reached, or the frontier is
   *     draining
   */
  public boolean offer(FrontierEntry entry) {
    String id = identity.apply(entry.url());
    lock.lock();
    try {
      if (draining || visited.contains(id) || visited.size() >= maxAdmissions) {
        return false;
      }
      visited.add(id);
      queue.addLast(entry);
      changed.signal();
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Record a URL finished by an earlier run: it is marked visited and counted as processed, so it
   * is never queued and takes one slot of the admission cap.
   *
   * @return false if the URL was already known or the admission cap is reached
   */
  public boolean recordCompleted(String url) {
    String id = identity.apply(url);
    lock.lock();
    try {
      if (visited.contains(id) || visited.size() >= maxAdmissions) {
        return false;
      }
      visited.add(id);
      processed++;
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Block until an entry is available and mark it in flight. Callers must pass every returned
   * entry to {@link #complete}.
   *
   * @return empty when no more work will arrive
   */
  public Optional<FrontierEntry> take() throws InterruptedException {
    lock.lock();
    try {
      while (true) {
        if (draining) {
          return Optional.empty();
        }
        FrontierEntry next = queue.pollFirst();
        if (next != null) {
          inFlight++;
          return Optional.of(next);
        }
        if (inFlight == 0) {
          changed.signalAll();
          return Optional.empty();
        }
        changed.await();
      }
    } finally {
      lock.unlock();
    }
  }

  /** Mark an entry taken with {@link #take()} as finished. Returns the processed count. */
  public int complete(FrontierEntry entry) {
    lock.lock();
    try {
      inFlight--;
      processed++;
      changed.signalAll();
      return processed;
    } finally {
      lock.unlock();
    }
  }

  /** Stop handing out work. Queued entries are discarded; in-flight entries may still complete. */
  public void drain() {
    lock.lock();
    try {
      draining = true;
      queue.clear();
      changed.signalAll();
    } finally {
      lock.unlock();
    }
  }

  public boolean isDraining() {
    lock.lock();
    try {
      return draining;
    } finally {
      lock.unlock();
    }
  }

  public int visitedCount() {
    lock.lock();
    try {
      return visited.size();
    } finally {
      lock.unlock();
    }
  }

  public int processedCount() {
    lock.lock();
    try {
      return processed;
    } finally {
      lock.unlock();
    }
  }

  public int queuedCount() {
    lock.lock();
    try {
      return queue.size();
    } finally {
      lock.unlock();
    }
  }
}
