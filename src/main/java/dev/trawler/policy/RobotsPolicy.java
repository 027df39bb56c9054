package dev.trawler.policy;

import dev.trawler.url.InvalidUrlException;
import dev.trawler.url.UrlNormalizer;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/**
 * Immutable robots.txt policy for one origin, resolved for a crawler user agent.
 *
 * <p>Group selection: the group whose agent name equals the user agent's product token (the part
 * before the first {@code /} or space, compared case-insensitively), otherwise the {@code *} group,
 * otherwise no restrictions. Within the group the longest matching rule wins; on a tie {@code
 * Allow} wins; no match means allowed.
 */
public final class RobotsPolicy {

  private final List<RobotsGroup> groups;
  private final List<String> sitemaps;
  private final String userAgent;
  private final @Nullable RobotsGroup group;

  public RobotsPolicy(List<RobotsGroup> groups, List<String> sitemaps, String userAgent) {
    this.groups = List.copyOf(groups);
    this.sitemaps = List.copyOf(sitemaps);
    this.userAgent = userAgent;
    this.group = selectGroup(this.groups, userAgent);
  }

  /** Policy used when robots.txt is absent or unreadable: everything is allowed. */
  public static RobotsPolicy permissive(String userAgent) {
    return new RobotsPolicy(List.of(), List.of(), userAgent);
  }

  public String userAgent() {
    return userAgent;
  }

  /** {@code Sitemap:} directives; these apply to every user agent. */
  public List<String> sitemaps() {
    return sitemaps;
  }

  public List<String> allowRules() {
    return rulePaths(true);
  }

  public List<String> disallowRules() {
    return rulePaths(false);
  }

  public Optional<Double> crawlDelaySeconds() {
    return group == null ? Optional.empty() : Optional.ofNullable(group.crawlDelaySeconds());
  }

  public Optional<Double> requestRate() {
    return group == null ? Optional.empty() : Optional.ofNullable(group.requestRate());
  }

  /**
   * Minimum spacing between two fetches to this origin: {@code Crawl-delay}, else the inverse of
   * {@code Request-rate}, capped at {@code max}.
   */
  public Duration effectiveCrawlDelay(Duration max) {
    double seconds =
        crawlDelaySeconds()
            .or(() -> requestRate().filter(rate -> rate > 0).map(rate -> 1.0 / rate))
            .orElse(0.0);
    if (seconds <= 0) {
      return Duration.ZERO;
    }
    Duration delay = Duration.ofMillis(Math.round(seconds * 1000));
    return delay.compareTo(max) > 0 ? max : delay;
  }

  public boolean isPermissive() {
    return group == null || group.rules().isEmpty();
  }

  /** Evaluate the URL for the user agent this policy was resolved for. */
  public boolean isAllowed(String url) {
    return evaluate(group, url);
  }

  /** Evaluate the URL for an arbitrary user agent, selecting that agent's group. */
  public boolean isAllowed(String url, String agent) {
    RobotsGroup selected =
        agent.equalsIgnoreCase(userAgent) ? group : selectGroup(groups, agent);
    return evaluate(selected, url);
  }

  private static boolean evaluate(@Nullable RobotsGroup selected, String url) {
    if (selected == null || selected.rules().isEmpty()) {
      return true;
    }
    String subject;
    try {
      subject = UrlNormalizer.pathAndQuery(url);
    } catch (InvalidUrlException e) {
      return true;
    }
    if ("/robots.txt".equals(subject)) {
      return true;
    }

    RobotsRule bestMatch = null;
    for (RobotsRule rule : selected.rules()) {
      if (!rule.matches(subject)) {
        continue;
      }
      if (bestMatch == null
          || rule.specificity() > bestMatch.specificity()
          || (rule.specificity() == bestMatch.specificity() && rule.allow() && !bestMatch.allow())) {
        bestMatch = rule;
      }
    }
    return bestMatch == null || bestMatch.allow();
  }

  private static @Nullable RobotsGroup selectGroup(List<RobotsGroup> groups, String agent) {
    String product = productToken(agent);
    RobotsGroup wildcard = null;
    for (RobotsGroup candidate : groups) {
      if (!product.isEmpty() && !"*".equals(product) && candidate.agents().contains(product)) {
        return candidate;
      }
      if (candidate.isWildcard() && wildcard == null) {
        wildcard = candidate;
      }
    }
    return wildcard;
  }

  private static String productToken(String agent) {
    String token = agent.trim().toLowerCase(Locale.ROOT);
    int end = token.length();
    int slash = token.indexOf('/');
    int space = token.indexOf(' ');
    if (slash >= 0) {
      end = Math.min(end, slash);
    }
    if (space >= 0) {
      end = Math.min(end, space);
    }
    return token.substring(0, end);
  }

  private List<String> rulePaths(boolean allow) {
    if (group == null) {
      return List.of();
    }
    return group.rules().stream().filter(r -> r.allow() == allow).map(RobotsRule::path).toList();
  }
}
