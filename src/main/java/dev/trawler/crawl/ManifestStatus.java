package dev.trawler.crawl;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum ManifestStatus {
  SCRAPED,
  CACHED,
  FAILED,
  ROBOTS_DISALLOWED;

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
