package dev.trawler.crawl;

import java.util.Locale;

/** Artifact formats written per scraped page. */
public enum OutputFormat {
  MARKDOWN("md"),
  HTML("html"),
  JSON("json");

  private final String extension;

  OutputFormat(String extension) {
    this.extension = extension;
  }

  public String extension() {
    return extension;
  }

  /** Parses {@code markdown}, {@code html} or {@code json}, case-insensitively. */
  public static OutputFormat fromString(String value) {
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(
          "Unknown format '" + value + "', expected markdown, html or json", e);
    }
  }
}
