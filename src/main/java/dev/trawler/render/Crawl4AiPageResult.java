package dev.trawler.render;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import org.jspecify.annotations.Nullable;

/**
 * Per-page result within a {@link Crawl4AiResponse}. {@code html} is the document as served,
 * {@code cleanedHtml} the rendered document after script and boilerplate removal.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Crawl4AiPageResult(
    String url,
    boolean success,
    @Nullable Integer statusCode,
    @Nullable String html,
    @Nullable String cleanedHtml,
    @Nullable String errorMessage) {

  /** Rendered HTML, falling back to the served HTML when the cleaned variant is missing. */
  public @Nullable String renderedHtml() {
    if (cleanedHtml != null && !cleanedHtml.isBlank()) {
      return cleanedHtml;
    }
    return html;
  }
}
