package dev.trawler.render;

import java.util.List;

/**
 * @param markdown page body as Markdown
 * @param metadata title and description extracted from the document head
 * @param outlinks absolute http(s) link targets in document order, without duplicates
 */
public record TransformedPage(String markdown, PageMetadata metadata, List<String> outlinks) {
  public TransformedPage {
    outlinks = outlinks == null ? List.of() : List.copyOf(outlinks);
  }
}
