package dev.trawler.policy;

import crawlercommons.sitemaps.AbstractSiteMap;
import crawlercommons.sitemaps.SiteMap;
import crawlercommons.sitemaps.SiteMapIndex;
import crawlercommons.sitemaps.SiteMapURL;
import crawlercommons.sitemaps.UnknownFormatException;
import java.io.IOException;
import java.net.URI;
import java.net.URL;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Collects page URLs from an origin's sitemaps using crawler-commons. Handles plain, gzipped and
 * index sitemaps; indexes are followed recursively up to the configured depth.
 */
@Component
public class SitemapParser {

  private static final Logger log = LoggerFactory.getLogger(SitemapParser.class);

  private final SiteFileFetcher fetcher;
  private final int maxDepth;
  private final int maxUrls;

  public SitemapParser(SiteFileFetcher fetcher, PolicyProperties props) {
    this.fetcher = fetcher;
    this.maxDepth = props.sitemapMaxDepth();
    this.maxUrls = props.sitemapMaxUrls();
  }

  /**
   * Sitemaps declared in robots.txt are read first; the conventional {@code /sitemap.xml} and
   * {@code /sitemap_index.xml} locations are only tried when those yield nothing.
   */
  public List<SitemapEntry> discover(String origin, List<String> declaredSitemaps) {
    Set<String> visited = new HashSet<>();
    List<SitemapEntry> entries = new ArrayList<>();

    for (String sitemapUrl : declaredSitemaps) {
      parseRecursive(sitemapUrl, 0, visited, entries);
    }
    if (entries.isEmpty()) {
      for (String sitemapUrl : List.of(origin + "/sitemap.xml", origin + "/sitemap_index.xml")) {
        parseRecursive(sitemapUrl, 0, visited, entries);
        if (!entries.isEmpty()) {
          break;
        }
      }
    }
    log.debug("Discovered {} sitemap URLs for {}", entries.size(), origin);
    return List.copyOf(entries);
  }

  private void parseRecursive(
      String sitemapUrl, int depth, Set<String> visited, List<SitemapEntry> entries) {
    if (depth >= maxDepth) {
      log.warn("Sitemap nesting too deep at {}, skipping", sitemapUrl);
      return;
    }
    if (entries.size() >= maxUrls || !visited.add(sitemapUrl)) {
      return;
    }
    Optional<byte[]> content = fetcher.fetch(sitemapUrl);
    if (content.isEmpty()) {
      return;
    }

    AbstractSiteMap result;
    try {
      var parser = new crawlercommons.sitemaps.SiteMapParser(false);
      result = parser.parseSiteMap(content.get(), URI.create(sitemapUrl).toURL());
    } catch (UnknownFormatException | IOException | IllegalArgumentException e) {
      log.debug("Could not parse sitemap {}: {}", sitemapUrl, e.getMessage());
      return;
    }

    if (result instanceof SiteMapIndex index) {
      for (AbstractSiteMap child : index.getSitemaps()) {
        parseRecursive(child.getUrl().toString(), depth + 1, visited, entries);
      }
    } else if (result instanceof SiteMap siteMap) {
      for (SiteMapURL siteMapUrl : siteMap.getSiteMapUrls()) {
        if (entries.size() >= maxUrls) {
          log.warn("Sitemap URL limit of {} reached at {}", maxUrls, sitemapUrl);
          return;
        }
        entries.add(toEntry(siteMapUrl));
      }
    }
  }

  private static SitemapEntry toEntry(SiteMapURL siteMapUrl) {
    URL url = siteMapUrl.getUrl();
    return new SitemapEntry(
        url.toString(),
        siteMapUrl.getLastModified() == null ? null : siteMapUrl.getLastModified().toInstant(),
        siteMapUrl.getPriority());
  }
}
