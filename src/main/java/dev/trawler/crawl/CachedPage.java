package dev.trawler.crawl;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import dev.trawler.render.PageMetadata;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** What the crawl stores in the content cache for a fetched page, serialized as JSON. */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CachedPage(
    String markdown,
    @Nullable String html,
    @Nullable String rawHtml,
    PageMetadata metadata,
    List<String> outlinks) {
  public CachedPage {
    outlinks = outlinks == null ? List.of() : List.copyOf(outlinks);
  }
}
