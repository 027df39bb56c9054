package dev.trawler.render;

/** Converts rendered HTML into Markdown plus page metadata and outgoing links. */
public interface ContentTransformer {

  /**
   * @param html rendered HTML of the page
   * @param baseUrl URL the page was fetched from; relative links are resolved against it
   */
  TransformedPage toMarkdown(String html, String baseUrl);
}
