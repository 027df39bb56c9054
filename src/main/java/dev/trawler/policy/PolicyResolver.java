package dev.trawler.policy;

import dev.trawler.url.UrlNormalizer;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Resolves what the crawler may fetch from an origin: robots.txt rules and sitemap seeds. Missing
 * or unreadable files never fail a crawl; they degrade to a permissive policy or no seeds.
 */
@Service
public class PolicyResolver {

  private static final Logger log = LoggerFactory.getLogger(PolicyResolver.class);

  private final SiteFileFetcher fetcher;
  private final SitemapParser sitemapParser;
  private final String userAgent;

  public PolicyResolver(
      SiteFileFetcher fetcher, SitemapParser sitemapParser, PolicyProperties props) {
    this.fetcher = fetcher;
    this.sitemapParser = sitemapParser;
    this.userAgent = props.userAgent();
  }

  public String userAgent() {
    return userAgent;
  }

  /** Fetch and parse {@code <origin>/robots.txt}. */
  public RobotsPolicy fetchRobots(String origin) {
    String base = UrlNormalizer.origin(origin);
    return fetcher
        .fetchText(base + "/robots.txt")
        .map(text -> RobotsTxtParser.parse(text, userAgent))
        .orElseGet(
            () -> {
              log.debug("No robots.txt for {}, allowing everything", base);
              return RobotsPolicy.permissive(userAgent);
            });
  }

  public boolean isAllowed(RobotsPolicy policy, String url, String agent) {
    return policy.isAllowed(url, agent);
  }

  public List<SitemapEntry> discoverSitemaps(String origin) {
    return discoverSitemaps(origin, fetchRobots(origin));
  }

  /** Discover sitemap URLs using an already-resolved robots policy for its Sitemap directives. */
  public List<SitemapEntry> discoverSitemaps(String origin, RobotsPolicy policy) {
    return sitemapParser.discover(UrlNormalizer.origin(origin), policy.sitemaps());
  }
}
