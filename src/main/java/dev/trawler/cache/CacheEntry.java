package dev.trawler.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * A cached payload for one normalized URL.
 *
 * @param key hex prefix of the SHA-256 of the normalized URL, also the file name
 * @param url the normalized URL
 * @param payload opaque stored bytes
 * @param storedAt when the entry was written
 * @param ttl how long the entry stays valid after {@code storedAt}
 * @param sizeBytes size of the entry on disk
 */
public record CacheEntry(
    String key, String url, byte[] payload, Instant storedAt, Duration ttl, long sizeBytes) {

  public Instant expiresAt() {
    return storedAt.plus(ttl);
  }

  public boolean isExpired(Instant now) {
    return now.isAfter(expiresAt());
  }
}
