package dev.trawler.mcp;

import dev.trawler.cache.CacheStats;
import dev.trawler.cache.ContentCache;
import dev.trawler.crawl.CrawlEvent;
import dev.trawler.crawl.CrawlJob;
import dev.trawler.crawl.CrawlOrchestrator;
import dev.trawler.crawl.CrawlProperties;
import dev.trawler.crawl.FailedUrl;
import dev.trawler.crawl.OutputFormat;
import dev.trawler.url.InvalidUrlException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;

/**
 * MCP adapter exposing the crawler and its cache as tool methods.
 *
 * <p>Each method is annotated with {@code @Tool} and registered via {@link McpToolConfig} as an MCP
 * tool callable through the stdio or SSE transport. Tool methods follow the structured error
 * pattern: all exceptions are caught and returned as descriptive error strings, never thrown.
 *
 * <p>Functional tools: {@code crawl_site}, {@code cache_stats}, {@code cache_clear}, {@code
 * cache_prune}.
 *
 * @see McpToolConfig
 */
@Service
public class McpToolService {

  private static final Logger log = LoggerFactory.getLogger(McpToolService.class);

  static final int MAX_LISTED_FAILURES = 20;

  private final CrawlOrchestrator orchestrator;
  private final ContentCache cache;
  private final CrawlProperties crawlProperties;

  public McpToolService(
      CrawlOrchestrator orchestrator, ContentCache cache, CrawlProperties crawlProperties) {
    this.orchestrator = orchestrator;
    this.cache = cache;
    this.crawlProperties = crawlProperties;
  }

  /**
   * Crawls a site synchronously and reports what was scraped. Pages are written to {@code
   * outputDir} when given; otherwise the crawl only warms the cache.
   */
  @Tool(
      name = "crawl_site",
      description =
          "Crawl a website starting from a root URL, following links within scope. "
              + "Respects robots.txt, caches fetched pages, and writes Markdown files plus a manifest.json "
              + "to the output directory when one is given.")
  public String crawlSite(
      @ToolParam(description = "Root URL to start crawling from") @Nullable String url,
      @ToolParam(description = "Maximum number of pages to process (default 100)", required = false)
          @Nullable Integer maxPages,
      @ToolParam(description = "Maximum link depth from the root URL (default 3)", required = false)
          @Nullable Integer maxDepth,
      @ToolParam(description = "Number of pages fetched in parallel (default 5)", required = false)
          @Nullable Integer concurrency,
      @ToolParam(
              description =
                  "Comma-separated glob patterns a link path must match, e.g. '/docs/*'. Empty = all.",
              required = false)
          @Nullable String includePatterns,
      @ToolParam(
              description =
                  "Comma-separated glob patterns that exclude a link path, e.g. '*/archive/*'.",
              required = false)
          @Nullable String excludePatterns,
      @ToolParam(description = "Follow links to other sites (default false)", required = false)
          @Nullable Boolean allowExternalLinks,
      @ToolParam(description = "Seed the crawl from the site's sitemaps", required = false)
          @Nullable Boolean useSitemap,
      @ToolParam(description = "Honour robots.txt (default true)", required = false)
          @Nullable Boolean respectRobots,
      @ToolParam(description = "Read and write the page cache (default true)", required = false)
          @Nullable Boolean useCache,
      @ToolParam(
              description = "Directory for Markdown files and manifest.json",
              required = false)
          @Nullable String outputDir,
      @ToolParam(
              description = "Comma-separated output formats: markdown, html, json (default markdown)",
              required = false)
          @Nullable String formats,
      @ToolParam(
              description =
                  "Continue an earlier crawl into the same outputDir, skipping pages its "
                      + "manifest.json lists as scraped (default false)",
              required = false)
          @Nullable Boolean resume,
      @ToolParam(
              description =
                  "Treat URLs that differ only in tracking parameters (utm_*, fbclid, ref...) or "
                      + "parameter order as one page (default false)",
              required = false)
          @Nullable Boolean deduplicateSimilarUrls) {
    try {
      if (url == null || url.isBlank()) {
        return "Error: URL must not be empty. Provide the root URL of the site to crawl.";
      }
      CrawlJob.Builder builder =
          CrawlJob.builder(url)
              .maxPages(maxPages != null ? maxPages : crawlProperties.defaultMaxPages())
              .maxDepth(maxDepth != null ? maxDepth : crawlProperties.defaultMaxDepth())
              .concurrencyLimit(
                  concurrency != null ? concurrency : crawlProperties.defaultConcurrency())
              .includePatterns(splitPatterns(includePatterns))
              .excludePatterns(splitPatterns(excludePatterns))
              .allowExternalLinks(Boolean.TRUE.equals(allowExternalLinks))
              .useSitemap(Boolean.TRUE.equals(useSitemap))
              .respectRobots(!Boolean.FALSE.equals(respectRobots))
              .useCache(!Boolean.FALSE.equals(useCache))
              .cacheTtl(crawlProperties.defaultCacheTtl())
              .renderTimeout(crawlProperties.defaultRenderTimeout())
              .formats(parseFormats(formats))
              .resume(Boolean.TRUE.equals(resume))
              .deduplicateSimilarUrls(Boolean.TRUE.equals(deduplicateSimilarUrls));
      if (outputDir != null && !outputDir.isBlank()) {
        builder.outputDir(Path.of(outputDir.trim()));
      }
      CrawlJob job = builder.build();

      CrawlEvent.Complete result = orchestrator.crawlAndWait(job);
      return formatCrawlSummary(job, result);
    } catch (InvalidUrlException e) {
      return "Error: Invalid URL. " + e.getMessage();
    } catch (IllegalArgumentException e) {
      return "Error: " + e.getMessage();
    } catch (Exception e) {
      log.error("crawl_site failed for {}", url, e);
      return "Error crawling site: " + e.getMessage();
    }
  }

  /** Reports cache size and how many entries are still valid. */
  @Tool(
      name = "cache_stats",
      description = "Show page cache statistics: entry count, valid and expired entries, size.")
  public String cacheStats() {
    try {
      CacheStats stats = cache.stats();
      return """
          Cache Statistics:
          - Directory: %s
          - Entries: %,d (%,d valid, %,d expired)
          - Size: %s"""
          .formatted(
              stats.cacheDir(), stats.entries(), stats.valid(), stats.expired(), stats.sizeHuman());
    } catch (Exception e) {
      return "Error reading cache statistics: " + e.getMessage();
    }
  }

  /** Clears one URL's cache entry, or the whole cache when no URL is given. */
  @Tool(
      name = "cache_clear",
      description = "Remove a cached page by URL, or clear the entire cache when no URL is given.")
  public String cacheClear(
      @ToolParam(description = "URL to remove; omit to clear everything", required = false)
          @Nullable String url) {
    try {
      if (url == null || url.isBlank()) {
        int cleared = cache.clear(null);
        return "Cleared %,d cache entries.".formatted(cleared);
      }
      int cleared = cache.clear(url.trim());
      return cleared == 0
          ? "No cache entry for %s.".formatted(url.trim())
          : "Cleared cache entry for %s.".formatted(url.trim());
    } catch (Exception e) {
      return "Error clearing cache: " + e.getMessage();
    }
  }

  /** Deletes expired entries; valid entries are kept. */
  @Tool(name = "cache_prune", description = "Delete expired entries from the page cache.")
  public String cachePrune() {
    try {
      int pruned = cache.prune();
      return "Pruned %,d expired cache entries.".formatted(pruned);
    } catch (Exception e) {
      return "Error pruning cache: " + e.getMessage();
    }
  }

  static List<String> splitPatterns(@Nullable String patterns) {
    if (patterns == null || patterns.isBlank()) {
      return List.of();
    }
    return Arrays.stream(patterns.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();
  }

  static Set<OutputFormat> parseFormats(@Nullable String formats) {
    List<String> names = splitPatterns(formats);
    if (names.isEmpty()) {
      return EnumSet.of(OutputFormat.MARKDOWN);
    }
    EnumSet<OutputFormat> parsed = EnumSet.noneOf(OutputFormat.class);
    for (String name : names) {
      parsed.add(OutputFormat.fromString(name));
    }
    return parsed;
  }

  private String formatCrawlSummary(CrawlJob job, CrawlEvent.Complete result) {
    StringBuilder sb = new StringBuilder();
    sb.append(
        "Crawl of %s complete: %,d pages scraped, %,d failed.%n"
            .formatted(job.rootUrl(), result.scrapedUrls().size(), result.failed().size()));
    if (job.outputDir() != null) {
      sb.append("Output: %s (manifest.json)%n".formatted(job.outputDir().toAbsolutePath()));
    }
    if (!result.failed().isEmpty()) {
      sb.append("Failures:%n".formatted());
      List<FailedUrl> failed = result.failed();
      for (FailedUrl failure : failed.subList(0, Math.min(failed.size(), MAX_LISTED_FAILURES))) {
        sb.append(
            "- %s [%s]: %s%n".formatted(failure.url(), failure.kind(), failure.message()));
      }
      if (failed.size() > MAX_LISTED_FAILURES) {
        sb.append("... and %,d more%n".formatted(failed.size() - MAX_LISTED_FAILURES));
      }
    }
    return sb.toString();
  }
}
