package dev.trawler.crawl;

import org.jspecify.annotations.Nullable;

/**
 * A URL admitted to the frontier.
 *
 * @param url normalized URL
 * @param depth link distance from a seed
 * @param discoveredFrom page the link was found on; null for seeds
 */
public record FrontierEntry(String url, int depth, @Nullable String discoveredFrom) {

  public static FrontierEntry seed(String url) {
    return new FrontierEntry(url, 0, null);
  }
}
