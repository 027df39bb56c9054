package dev.trawler.cache;

/**
 * Snapshot of the cache directory, computed at call time.
 *
 * @param entries number of entry files
 * @param valid entries not yet expired
 * @param expired expired or unreadable entries
 * @param sizeBytes total size of all entry files
 * @param sizeHuman {@code sizeBytes} formatted with a binary unit, e.g. {@code 1.5 KB}
 * @param cacheDir absolute cache directory
 */
public record CacheStats(
    int entries, int valid, int expired, long sizeBytes, String sizeHuman, String cacheDir) {}
