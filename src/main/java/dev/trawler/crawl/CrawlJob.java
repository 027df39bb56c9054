package dev.trawler.crawl;

import dev.trawler.url.UrlNormalizer;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.Function;
import org.jspecify.annotations.Nullable;

/**
 * Immutable configuration of one crawl. Construction validates every limit and normalizes the
 * root URL, so an invalid job never starts.
 *
 * @param rootUrl normalized root URL
 * @param maxPages upper bound on processed URLs (scraped plus failed)
 * @param maxDepth maximum link distance from the root
 * @param concurrencyLimit number of worker threads
 * @param includePatterns glob patterns a discovered link must match (empty = any)
 * @param excludePatterns glob patterns that reject a discovered link; checked before includes
 * @param allowExternalLinks follow links to other origins
 * @param outputDir directory for page artifacts and the manifest; null to write nothing
 * @param useSitemap seed the frontier with sitemap URLs
 * @param respectRobots honour robots.txt rules and crawl delays
 * @param useCache read and write the content cache
 * @param cacheTtl lifetime of entries written by this job
 * @param renderTimeout per-page timeout handed to the renderer
 * @param formats artifact formats to write per page
 * @param saveFiles write page artifacts; the manifest is written regardless when outputDir is set
 * @param resume skip URLs the manifest in outputDir already records as scraped or cached
 * @param deduplicateSimilarUrls treat URLs differing only in tracking parameters or parameter order
 *     as the same page
 */
public record CrawlJob(
    String rootUrl,
    int maxPages,
    int maxDepth,
    int concurrencyLimit,
    Set<String> includePatterns,
    Set<String> excludePatterns,
    boolean allowExternalLinks,
    @Nullable Path outputDir,
    boolean useSitemap,
    boolean respectRobots,
    boolean useCache,
    Duration cacheTtl,
    Duration renderTimeout,
    Set<OutputFormat> formats,
    boolean saveFiles,
    boolean resume,
    boolean deduplicateSimilarUrls) {

  public CrawlJob {
    rootUrl = UrlNormalizer.normalize(rootUrl);
    if (maxPages <= 0) {
      throw new IllegalArgumentException("maxPages must be positive, got " + maxPages);
    }
    if (maxDepth < 0) {
      throw new IllegalArgumentException("maxDepth must not be negative, got " + maxDepth);
    }
    if (concurrencyLimit <= 0) {
      throw new IllegalArgumentException(
          "concurrencyLimit must be positive, got " + concurrencyLimit);
    }
    requirePositive(cacheTtl, "cacheTtl");
    requirePositive(renderTimeout, "renderTimeout");
    if (formats == null || formats.isEmpty()) {
      throw new IllegalArgumentException("At least one output format is required");
    }
    if (resume && outputDir == null) {
      throw new IllegalArgumentException("Resuming a crawl requires an output directory");
    }
    includePatterns = includePatterns == null ? Set.of() : Set.copyOf(includePatterns);
    excludePatterns = excludePatterns == null ? Set.of() : Set.copyOf(excludePatterns);
    formats = Set.copyOf(EnumSet.copyOf(formats));
  }

  private static void requirePositive(@Nullable Duration value, String name) {
    if (value == null || value.isZero() || value.isNegative()) {
      throw new IllegalArgumentException(name + " must be positive, got " + value);
    }
  }

  public static Builder builder(String rootUrl) {
    return new Builder(rootUrl);
  }

  public String rootOrigin() {
    return UrlNormalizer.origin(rootUrl);
  }

  /** The key under which the frontier tells URLs of this job apart. */
  public Function<String, String> urlIdentity() {
    return deduplicateSimilarUrls ? UrlNormalizer::dedupeKey : Function.identity();
  }

  public static final class Builder {
    private final String rootUrl;
    private int maxPages = 100;
    private int maxDepth = 3;
    private int concurrencyLimit = 5;
    private final Set<String> includePatterns = new LinkedHashSet<>();
    private final Set<String> excludePatterns = new LinkedHashSet<>();
    private boolean allowExternalLinks;
    private @Nullable Path outputDir;
    private boolean useSitemap;
    private boolean respectRobots = true;
    private boolean useCache = true;
    private Duration cacheTtl = Duration.ofDays(1);
    private Duration renderTimeout = Duration.ofSeconds(30);
    private Set<OutputFormat> formats = EnumSet.of(OutputFormat.MARKDOWN);
    private boolean saveFiles = true;
    private boolean resume;
    private boolean deduplicateSimilarUrls;

    private Builder(String rootUrl) {
      this.rootUrl = rootUrl;
    }

    public Builder maxPages(int maxPages) {
      this.maxPages = maxPages;
      return this;
    }

    public Builder maxDepth(int maxDepth) {
      this.maxDepth = maxDepth;
      return this;
    }

    public Builder concurrencyLimit(int concurrencyLimit) {
      this.concurrencyLimit = concurrencyLimit;
      return this;
    }

    public Builder includePatterns(Collection<String> patterns) {
      includePatterns.addAll(patterns);
      return this;
    }

    public Builder excludePatterns(Collection<String> patterns) {
      excludePatterns.addAll(patterns);
      return this;
    }

    public Builder allowExternalLinks(boolean allowExternalLinks) {
      this.allowExternalLinks = allowExternalLinks;
      return this;
    }

    public Builder outputDir(@Nullable Path outputDir) {
      this.outputDir = outputDir;
      return this;
    }

    public Builder useSitemap(boolean useSitemap) {
      this.useSitemap = useSitemap;
      return this;
    }

    public Builder respectRobots(boolean respectRobots) {
      this.respectRobots = respectRobots;
      return this;
    }

    public Builder useCache(boolean useCache) {
      this.useCache = useCache;
      return this;
    }

    public Builder cacheTtl(Duration cacheTtl) {
      this.cacheTtl = cacheTtl;
      return this;
    }

    public Builder renderTimeout(Duration renderTimeout) {
      this.renderTimeout = renderTimeout;
      return this;
    }

    public Builder formats(Set<OutputFormat> formats) {
      this.formats = formats;
      return this;
    }

    public Builder saveFiles(boolean saveFiles) {
      this.saveFiles = saveFiles;
      return this;
    }

    public Builder resume(boolean resume) {
      this.resume = resume;
      return this;
    }

    public Builder deduplicateSimilarUrls(boolean deduplicateSimilarUrls) {
      this.deduplicateSimilarUrls = deduplicateSimilarUrls;
      return this;
    }

    public CrawlJob build() {
      return new CrawlJob(
          rootUrl,
          maxPages,
          maxDepth,
          concurrencyLimit,
          includePatterns,
          excludePatterns,
          allowExternalLinks,
          outputDir,
          useSitemap,
          respectRobots,
          useCache,
          cacheTtl,
          renderTimeout,
          formats,
          saveFiles,
          resume,
          deduplicateSimilarUrls);
    }
  }
}
