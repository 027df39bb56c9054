package dev.trawler.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.trawler.url.UrlNormalizer;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * File-system cache of fetched page payloads keyed by normalized URL. Tracking query parameters
 * (utm_*, click ids, ref/source) do not take part in the key, so a page linked with and without
 * them is fetched once.
 *
 * <p>Layout: {@code <cacheDir>/pages/<key>.json}. Writes go to a temporary file that is then moved
 * into place, so readers in this or another process never see a partial entry. Within the process
 * every mutation of a key holds that key's stripe lock. I/O failures degrade to cache misses and
 * are never propagated to callers.
 */
@Service
public class ContentCache {

  private static final Logger log = LoggerFactory.getLogger(ContentCache.class);

  static final String CACHE_DIR_ENV = "TRAWLER_CACHE_DIR";

  private static final int LOCK_STRIPES = 64;
  private static final String ENTRY_SUFFIX = ".json";
  private static final String TOMBSTONE_SUFFIX = ".pruning";

  private final Path cacheDir;
  private final Path pagesDir;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final ReentrantLock[] locks = new ReentrantLock[LOCK_STRIPES];

  @Autowired
  public ContentCache(
      @Value("${trawler.cache.dir:}") String configuredDir, ObjectMapper objectMapper, Clock clock) {
    this(resolveCacheDir(configuredDir, System.getenv(CACHE_DIR_ENV)), objectMapper, clock);
  }

  public ContentCache(Path cacheDir, ObjectMapper objectMapper, Clock clock) {
    this.cacheDir = cacheDir.toAbsolutePath();
    this.pagesDir = this.cacheDir.resolve("pages");
    this.objectMapper = objectMapper;
    this.clock = clock;
    for (int i = 0; i < LOCK_STRIPES; i++) {
      locks[i] = new ReentrantLock();
    }
    try {
      Files.createDirectories(pagesDir);
    } catch (IOException e) {
      log.warn("Could not create cache directory {}: {}", pagesDir, e.getMessage());
    }
    log.debug("Content cache at {}", this.cacheDir);
  }

  /** Explicit setting, then environment variable, then {@code ~/.trawler/cache}. */
  static Path resolveCacheDir(@Nullable String configuredDir, @Nullable String envDir) {
    if (configuredDir != null && !configuredDir.isBlank()) {
      return Path.of(configuredDir);
    }
    if (envDir != null && !envDir.isBlank()) {
      return Path.of(envDir);
    }
    return Path.of(System.getProperty("user.home"), ".trawler", "cache");
  }

  public Path cacheDir() {
    return cacheDir;
  }

  /** Returns the entry for {@code url} if present and not expired. Expired entries stay on disk. */
  public Optional<CacheEntry> get(String url) {
    Optional<String> normalized = cacheIdentity(url);
    if (normalized.isEmpty()) {
      return Optional.empty();
    }
    String key = ContentHasher.cacheKey(normalized.get());
    Optional<CacheEntry> entry = read(key);
    if (entry.isEmpty()) {
      log.debug("Cache miss (not found): {}", url);
      return Optional.empty();
    }
    if (!entry.get().url().equals(normalized.get())) {
      log.debug("Cache miss (key collision): {}", url);
      return Optional.empty();
    }
    if (entry.get().isExpired(clock.instant())) {
      log.debug("Cache miss (expired): {}", url);
      return Optional.empty();
    }
    log.debug("Cache hit: {}", url);
    return entry;
  }

  /**
   * Insert or replace the entry for {@code url}.
   *
   * @return false if the URL is invalid, the TTL is not positive, or the write failed
   */
  public boolean put(String url, byte[] payload, Duration ttl) {
    if (ttl.isZero() || ttl.isNegative()) {
      return false;
    }
    Optional<String> normalized = cacheIdentity(url);
    if (normalized.isEmpty()) {
      return false;
    }
    String key = ContentHasher.cacheKey(normalized.get());
    Instant now = clock.instant();
    StoredEntry stored =
        new StoredEntry(normalized.get(), now.toString(), now.plus(ttl).toString(), payload);

    ReentrantLock lock = lockFor(key);
    lock.lock();
    Path tmp = null;
    try {
      tmp = Files.createTempFile(pagesDir, key, ".tmp");
      objectMapper.writeValue(tmp.toFile(), stored);
      moveIntoPlace(tmp, entryPath(key));
      log.debug("Cached: {} (expires: {})", url, stored.expiresAt());
      return true;
    } catch (IOException e) {
      log.warn("Failed to cache {}: {}", url, e.getMessage());
      deleteQuietly(tmp);
      return false;
    } finally {
      lock.unlock();
    }
  }

  public CacheStats stats() {
    Instant now = clock.instant();
    int entries = 0;
    int expired = 0;
    long totalSize = 0;
    for (Path file : entryFiles()) {
      Optional<CacheEntry> entry = read(keyOf(file));
      if (entry.isEmpty() && Files.notExists(file)) {
        continue;
      }
      entries++;
      totalSize += entry.map(CacheEntry::sizeBytes).orElseGet(() -> sizeOf(file));
      if (entry.isEmpty() || entry.get().isExpired(now)) {
        expired++;
      }
    }
    return new CacheStats(
        entries, entries - expired, expired, totalSize, formatSize(totalSize), cacheDir.toString());
  }

  /**
   * Remove the entry for {@code url}, or every entry when {@code url} is null.
   *
   * @return number of entries removed
   */
  public int clear(@Nullable String url) {
    if (url == null) {
      int cleared = 0;
      for (Path file : entryFiles()) {
        if (deleteLocked(keyOf(file))) {
          cleared++;
        }
      }
      log.debug("Cleared all cache ({} entries)", cleared);
      return cleared;
    }
    Optional<String> normalized = cacheIdentity(url);
    if (normalized.isEmpty()) {
      return 0;
    }
    boolean removed = deleteLocked(ContentHasher.cacheKey(normalized.get()));
    if (removed) {
      log.debug("Cleared cache for: {}", url);
    }
    return removed ? 1 : 0;
  }

  /**
   * Delete expired and unreadable entries.
   *
   * <p>Another process may refresh an entry at any moment, and the stripe locks only cover this
   * instance. A candidate is therefore first renamed to a private tombstone, which takes it out of
   * the entry namespace atomically. The tombstone is then re-read: if it turned out to be fresh it
   * is moved back unless a newer entry has been written in the meantime, otherwise it is deleted.
   *
   * @return number of entries removed
   */
  public int prune() {
    int pruned = 0;
    for (Path file : entryFiles()) {
      String key = keyOf(file);
      ReentrantLock lock = lockFor(key);
      lock.lock();
      try {
        if (isFresh(read(key, file))) {
          continue;
        }
        if (pruneCandidate(key, file)) {
          pruned++;
        }
      } catch (IOException e) {
        log.warn("Could not prune cache entry {}: {}", file, e.getMessage());
      } finally {
        lock.unlock();
      }
    }
    log.debug("Pruned {} cache entries", pruned);
    return pruned;
  }

  private boolean pruneCandidate(String key, Path file) throws IOException {
    Path tombstone = pagesDir.resolve(key + "." + UUID.randomUUID() + TOMBSTONE_SUFFIX);
    try {
      Files.move(file, tombstone, StandardCopyOption.ATOMIC_MOVE);
    } catch (NoSuchFileException e) {
      return false;
    } catch (AtomicMoveNotSupportedException e) {
      log.debug("Atomic rename unsupported in {}, skipping prune of {}", pagesDir, key);
      return false;
    }
    if (!isFresh(read(key, tombstone))) {
      Files.deleteIfExists(tombstone);
      return true;
    }
    try {
      // Plain move: refuses to overwrite an entry written after the rename.
      Files.move(tombstone, file);
      log.debug("Kept cache entry {} refreshed during prune", key);
    } catch (FileAlreadyExistsException e) {
      Files.deleteIfExists(tombstone);
    }
    return false;
  }

  private boolean isFresh(Optional<CacheEntry> entry) {
    return entry.isPresent() && !entry.get().isExpired(clock.instant());
  }

  /** Normalized URL without tracking parameters; the stored URL and the key derive from it. */
  private static Optional<String> cacheIdentity(String url) {
    return UrlNormalizer.tryNormalize(url).map(UrlNormalizer::stripTrackingParams);
  }

  private Optional<CacheEntry> read(String key) {
    return read(key, entryPath(key));
  }

  private Optional<CacheEntry> read(String key, Path file) {
    try {
      byte[] bytes = Files.readAllBytes(file);
      StoredEntry stored = objectMapper.readValue(bytes, StoredEntry.class);
      Instant cachedAt = Instant.parse(stored.cachedAt());
      Instant expiresAt = Instant.parse(stored.expiresAt());
      byte[] payload = stored.payload() == null ? new byte[0] : stored.payload();
      return Optional.of(
          new CacheEntry(
              key,
              stored.url(),
              payload,
              cachedAt,
              Duration.between(cachedAt, expiresAt),
              bytes.length));
    } catch (NoSuchFileException e) {
      return Optional.empty();
    } catch (IOException | RuntimeException e) {
      log.warn("Failed to read cache entry {}: {}", file, e.getMessage());
      return Optional.empty();
    }
  }

  private boolean deleteLocked(String key) {
    ReentrantLock lock = lockFor(key);
    lock.lock();
    try {
      return Files.deleteIfExists(entryPath(key));
    } catch (IOException e) {
      log.warn("Could not delete cache entry {}: {}", key, e.getMessage());
      return false;
    } finally {
      lock.unlock();
    }
  }

  private List<Path> entryFiles() {
    List<Path> files = new ArrayList<>();
    try (DirectoryStream<Path> stream = Files.newDirectoryStream(pagesDir, "*" + ENTRY_SUFFIX)) {
      stream.forEach(files::add);
    } catch (NoSuchFileException e) {
      return List.of();
    } catch (IOException e) {
      log.warn("Could not list cache directory {}: {}", pagesDir, e.getMessage());
    }
    return files;
  }

  private static void moveIntoPlace(Path source, Path target) throws IOException {
    try {
      Files.move(
          source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private static void deleteQuietly(@Nullable Path file) {
    if (file == null) {
      return;
    }
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      log.debug("Could not remove temporary file {}: {}", file, e.getMessage());
    }
  }

  private static long sizeOf(Path file) {
    try {
      return Files.size(file);
    } catch (IOException e) {
      return 0;
    }
  }

  private Path entryPath(String key) {
    return pagesDir.resolve(key + ENTRY_SUFFIX);
  }

  private static String keyOf(Path file) {
    String name = file.getFileName().toString();
    return name.substring(0, name.length() - ENTRY_SUFFIX.length());
  }

  private ReentrantLock lockFor(String key) {
    return locks[Math.floorMod(key.hashCode(), LOCK_STRIPES)];
  }

  static String formatSize(long sizeBytes) {
    double size = sizeBytes;
    for (String unit : List.of("B", "KB", "MB", "GB")) {
      if (size < 1024) {
        return String.format(Locale.ROOT, "%.1f %s", size, unit);
      }
      size /= 1024;
    }
    return String.format(Locale.ROOT, "%.1f TB", size);
  }
}
