package dev.trawler.policy;

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Rules that robots.txt addresses to one or more user agents.
 *
 * @param agents lower-cased user-agent names of the group ({@code *} for the wildcard group)
 * @param rules allow/disallow rules in file order
 * @param crawlDelaySeconds {@code Crawl-delay} value, if any
 * @param requestRate requests per second derived from {@code Request-rate: n/s}, if any
 */
public record RobotsGroup(
    List<String> agents,
    List<RobotsRule> rules,
    @Nullable Double crawlDelaySeconds,
    @Nullable Double requestRate) {

  public RobotsGroup {
    agents = agents == null ? List.of() : List.copyOf(agents);
    rules = rules == null ? List.of() : List.copyOf(rules);
  }

  boolean isWildcard() {
    return agents.contains("*");
  }
}
