package dev.trawler.crawl;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ManifestWriterTest {

  @TempDir Path out;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final ManifestWriter writer = new ManifestWriter(objectMapper);

  @Test
  void manifest_is_written_as_scraped_urls_array() throws IOException {
    Manifest manifest = new Manifest();
    manifest.append("https://example.com/", "index.md", ManifestStatus.SCRAPED);
    manifest.append("https://example.com/a", "a.md", ManifestStatus.CACHED);
    manifest.append("https://example.com/b", null, ManifestStatus.FAILED);
    manifest.append("https://example.com/private", null, ManifestStatus.ROBOTS_DISALLOWED);

    Path written = writer.write(out.resolve("nested"), manifest);

    assertThat(written).isEqualTo(out.resolve("nested").resolve("manifest.json"));
    JsonNode entries = objectMapper.readTree(written.toFile()).get("scraped_urls");
    assertThat(entries).hasSize(4);
    assertThat(entries.get(0).get("url").asText()).isEqualTo("https://example.com/");
    assertThat(entries.get(0).get("path").asText()).isEqualTo("index.md");
    assertThat(entries.get(1).get("status").asText()).isEqualTo("cached");
    assertThat(entries.get(2).get("path").isNull()).isTrue();
    assertThat(entries.get(3).get("status").asText()).isEqualTo("robots_disallowed");
  }

  @Test
  void repeat_runs_replace_the_manifest() throws IOException {
    Manifest first = new Manifest();
    first.append("https://example.com/old", "old.md", ManifestStatus.SCRAPED);
    writer.write(out, first);
    Manifest second = new Manifest();
    second.append("https://example.com/new", "new.md", ManifestStatus.SCRAPED);

    writer.write(out, second);

    String json = Files.readString(out.resolve("manifest.json"));
    assertThat(json).contains("/new").doesNotContain("/old");
    try (var files = Files.list(out)) {
      assertThat(files).hasSize(1);
    }
  }

  @Test
  void written_manifest_reads_back_with_statuses() throws IOException {
    Manifest manifest = new Manifest();
    manifest.append("https://example.com/", "index.md", ManifestStatus.SCRAPED);
    manifest.append("https://example.com/b", null, ManifestStatus.ROBOTS_DISALLOWED);
    writer.write(out, manifest);

    assertThat(writer.read(out))
        .containsExactly(
            new ManifestEntry("https://example.com/", "index.md", ManifestStatus.SCRAPED),
            new ManifestEntry("https://example.com/b", null, ManifestStatus.ROBOTS_DISALLOWED));
  }

  @Test
  void plain_url_strings_read_as_scraped_pages() throws IOException {
    Files.writeString(
        out.resolve("manifest.json"), "{\"scraped_urls\": [\"https://example.com/a\"]}");

    assertThat(writer.read(out))
        .containsExactly(new ManifestEntry("https://example.com/a", null, ManifestStatus.SCRAPED));
  }

  @Test
  void missing_or_corrupt_manifest_reads_as_empty() throws IOException {
    assertThat(writer.read(out)).isEmpty();

    Files.writeString(out.resolve("manifest.json"), "{ not json");

    assertThat(writer.read(out)).isEmpty();
  }
}
