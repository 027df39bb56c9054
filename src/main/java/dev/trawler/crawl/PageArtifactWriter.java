package dev.trawler.crawl;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.trawler.cache.ContentHasher;
import dev.trawler.render.PageMetadata;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the files of one crawl job's pages into its output directory.
 *
 * <p>File names derive from the URL path ({@code /docs/intro} becomes {@code docs_intro}, the root
 * becomes {@code index}). When two URLs of the same job map to the same name, the later one gets a
 * {@code _<8 hex chars of sha256(url)>} suffix. Files left by earlier runs are overwritten.
 */
final class PageArtifactWriter {

  private static final Logger log = LoggerFactory.getLogger(PageArtifactWriter.class);

  private final @Nullable Path outputDir;
  private final Set<OutputFormat> formats;
  private final boolean saveFiles;
  private final ObjectMapper objectMapper;
  private final Set<String> claimedNames = new HashSet<>();

  PageArtifactWriter(CrawlJob job, ObjectMapper objectMapper) {
    this.outputDir = job.outputDir();
    this.formats = job.formats();
    this.saveFiles = job.saveFiles();
    this.objectMapper = objectMapper;
  }

  /**
   * Write the artifacts of one page.
   *
   * @return path of the primary artifact relative to the output directory, or null when nothing
   *     was written
   */
  @Nullable String write(String url, CachedPage page) {
    if (outputDir == null || !saveFiles) {
      return null;
    }
    String baseName = claimName(url);
    String primary = null;
    try {
      Files.createDirectories(outputDir);
      for (OutputFormat format : OutputFormat.values()) {
        if (!formats.contains(format)) {
          continue;
        }
        String fileName = baseName + "." + format.extension();
        String content = render(format, url, page);
        if (content == null) {
          continue;
        }
        Files.writeString(outputDir.resolve(fileName), content, StandardCharsets.UTF_8);
        if (primary == null) {
          primary = fileName;
        }
      }
    } catch (IOException e) {
      log.warn("Could not write artifacts for {}: {}", url, e.getMessage());
    }
    return primary;
  }

  private @Nullable String render(OutputFormat format, String url, CachedPage page)
      throws IOException {
    return switch (format) {
      case MARKDOWN -> frontMatter(url, page.metadata()) + page.markdown();
      case HTML -> page.html();
      case JSON -> {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("title", page.metadata().title());
        metadata.put("description", page.metadata().description());
        metadata.put("source_url", page.metadata().sourceUrl());
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("url", url);
        json.put("markdown", page.markdown());
        json.put("html", page.html());
        json.put("metadata", metadata);
        yield objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(json);
      }
    };
  }

  private String frontMatter(String url, PageMetadata metadata) throws IOException {
    StringBuilder sb = new StringBuilder("---\n");
    sb.append("source_url: ").append(url).append('\n');
    if (metadata.title() != null && !metadata.title().isBlank()) {
      sb.append("title: ").append(yamlScalar(metadata.title())).append('\n');
    }
    return sb.append("---\n\n").toString();
  }

  /** Plain scalars stay as-is; anything YAML would misread is emitted as a quoted JSON string. */
  private String yamlScalar(String value) throws IOException {
    String singleLine = value.replaceAll("\\s+", " ").trim();
    boolean needsQuoting =
        singleLine.contains(": ")
            || singleLine.contains(" #")
            || singleLine.matches("^[\\[\\]{}>|*&!%@`'\",?:#-].*");
    return needsQuoting ? objectMapper.writeValueAsString(singleLine) : singleLine;
  }

  /** Keep a file name written by an earlier run of a resumed job from being reused. */
  synchronized void reserve(String relativePath) {
    int dot = relativePath.lastIndexOf('.');
    claimedNames.add(dot > 0 ? relativePath.substring(0, dot) : relativePath);
  }

  private synchronized String claimName(String url) {
    String base = baseName(url);
    if (claimedNames.add(base)) {
      return base;
    }
    String suffixed = base + "_" + ContentHasher.shortHash(url, 8);
    claimedNames.add(suffixed);
    return suffixed;
  }

  static String baseName(String url) {
    String path;
    try {
      path = URI.create(url).getPath();
    } catch (IllegalArgumentException e) {
      path = null;
    }
    if (path == null) {
      return "index";
    }
    String stripped = path.replaceAll("^/+|/+$", "");
    if (stripped.isEmpty()) {
      return "index";
    }
    return stripped.replace('/', '_').replaceAll("[^A-Za-z0-9._-]", "_");
  }
}
