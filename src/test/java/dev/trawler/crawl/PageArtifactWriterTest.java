package dev.trawler.crawl;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.trawler.cache.ContentHasher;
import dev.trawler.render.PageMetadata;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PageArtifactWriterTest {

  private static final String URL = "https://docs.example.com/docs/intro";

  @TempDir Path out;

  private final ObjectMapper objectMapper = new ObjectMapper();

  private static CachedPage page(String title) {
    return new CachedPage(
        "# Intro\n\nHello.\n",
        "<h1>Intro</h1>",
        "<html><h1>Intro</h1></html>",
        new PageMetadata(title, "About things", URL),
        List.of());
  }

  private PageArtifactWriter writer(CrawlJob.Builder builder) {
    return new PageArtifactWriter(builder.outputDir(out).build(), objectMapper);
  }

  @Test
  void base_name_is_derived_from_the_path() {
    assertThat(PageArtifactWriter.baseName("https://example.com/")).isEqualTo("index");
    assertThat(PageArtifactWriter.baseName("https://example.com/docs/intro"))
        .isEqualTo("docs_intro");
    assertThat(PageArtifactWriter.baseName("https://example.com/a%20b/c")).isEqualTo("a_b_c");
    assertThat(PageArtifactWriter.baseName("https://example.com/v1.2/notes"))
        .isEqualTo("v1.2_notes");
  }

  @Test
  void markdown_gets_front_matter() throws IOException {
    String path = writer(CrawlJob.builder(URL)).write(URL, page("Intro"));

    assertThat(path).isEqualTo("docs_intro.md");
    assertThat(Files.readString(out.resolve(path)))
        .isEqualTo("---\nsource_url: " + URL + "\ntitle: Intro\n---\n\n# Intro\n\nHello.\n");
  }

  @Test
  void titles_yaml_would_misread_are_quoted() throws IOException {
    String path = writer(CrawlJob.builder(URL)).write(URL, page("Guide: part \"one\""));

    assertThat(Files.readString(out.resolve(path)))
        .contains("title: \"Guide: part \\\"one\\\"\"\n");
  }

  @Test
  void colliding_names_get_a_hash_suffix() {
    PageArtifactWriter writer = writer(CrawlJob.builder(URL));
    String other = "https://docs.example.com/docs/intro?lang=fr";

    String first = writer.write(URL, page("Intro"));
    String second = writer.write(other, page("Intro FR"));

    assertThat(first).isEqualTo("docs_intro.md");
    assertThat(second).isEqualTo("docs_intro_" + ContentHasher.shortHash(other, 8) + ".md");
    assertThat(out.resolve(second)).exists();
  }

  @Test
  void files_from_an_earlier_run_are_overwritten() throws IOException {
    Files.writeString(out.resolve("docs_intro.md"), "stale");

    String path = writer(CrawlJob.builder(URL)).write(URL, page("Intro"));

    assertThat(path).isEqualTo("docs_intro.md");
    assertThat(Files.readString(out.resolve(path))).doesNotContain("stale");
  }

  @Test
  void html_and_json_siblings_follow_the_format_set() throws IOException {
    PageArtifactWriter writer =
        writer(
            CrawlJob.builder(URL)
                .formats(EnumSet.of(OutputFormat.MARKDOWN, OutputFormat.HTML, OutputFormat.JSON)));

    writer.write(URL, page("Intro"));

    assertThat(Files.readString(out.resolve("docs_intro.html"))).isEqualTo("<h1>Intro</h1>");
    JsonNode json = objectMapper.readTree(out.resolve("docs_intro.json").toFile());
    assertThat(json.get("url").asText()).isEqualTo(URL);
    assertThat(json.get("metadata").get("title").asText()).isEqualTo("Intro");
    assertThat(json.get("metadata").get("source_url").asText()).isEqualTo(URL);
  }

  @Test
  void json_only_job_reports_the_json_file() {
    String path =
        writer(CrawlJob.builder(URL).formats(EnumSet.of(OutputFormat.JSON))).write(URL, page("x"));

    assertThat(path).isEqualTo("docs_intro.json");
  }

  @Test
  void nothing_is_written_when_saving_is_disabled() throws IOException {
    String path = writer(CrawlJob.builder(URL).saveFiles(false)).write(URL, page("Intro"));

    assertThat(path).isNull();
    try (var files = Files.list(out)) {
      assertThat(files).isEmpty();
    }
  }
}
