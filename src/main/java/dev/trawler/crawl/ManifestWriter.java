package dev.trawler.crawl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Persists a {@link Manifest} as {@code <outputDir>/manifest.json}, replacing any manifest from an
 * earlier run. The file is written to a temporary sibling first and moved into place. Resumed crawls
 * read the previous manifest back with {@link #read(Path)}.
 */
@Component
public class ManifestWriter {

  private static final Logger log = LoggerFactory.getLogger(ManifestWriter.class);

  static final String FILE_NAME = "manifest.json";

  private final ObjectMapper objectMapper;

  public ManifestWriter(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public Path write(Path outputDir, Manifest manifest) throws IOException {
    Files.createDirectories(outputDir);
    Path target = outputDir.resolve(FILE_NAME);
    Path tmp = Files.createTempFile(outputDir, "manifest", ".tmp");
    try {
      objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), manifest);
      try {
        Files.move(
            tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
      }
    } finally {
      Files.deleteIfExists(tmp);
    }
    log.info("Wrote manifest with {} entries to {}", manifest.size(), target);
    return target;
  }

  /**
   * Entries of the manifest an earlier run left in {@code outputDir}. Plain URL strings are read as
   * scraped pages without a path. A missing or unreadable manifest yields no entries.
   */
  public List<ManifestEntry> read(Path outputDir) {
    Path file = outputDir.resolve(FILE_NAME);
    if (!Files.isRegularFile(file)) {
      return List.of();
    }
    try {
      List<ManifestEntry> entries = new ArrayList<>();
      for (JsonNode node : objectMapper.readTree(file.toFile()).path("scraped_urls")) {
        if (node.isTextual()) {
          entries.add(new ManifestEntry(node.asText(), null, ManifestStatus.SCRAPED));
        } else if (node.hasNonNull("url")) {
          entries.add(objectMapper.treeToValue(node, ManifestEntry.class));
        }
      }
      log.debug("Read {} entries from {}", entries.size(), file);
      return entries;
    } catch (IOException e) {
      log.warn("Ignoring unreadable manifest {}: {}", file, e.getMessage());
      return List.of();
    }
  }
}
