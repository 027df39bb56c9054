package dev.trawler.crawl;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** Append-only, thread-safe record of every URL a crawl processed. */
public final class Manifest {

  private final List<ManifestEntry> entries = new ArrayList<>();

  public synchronized void append(String url, @Nullable String path, ManifestStatus status) {
    entries.add(new ManifestEntry(url, path, status));
  }

  @JsonProperty("scraped_urls")
  public synchronized List<ManifestEntry> entries() {
    return List.copyOf(entries);
  }

  public synchronized int size() {
    return entries.size();
  }
}
