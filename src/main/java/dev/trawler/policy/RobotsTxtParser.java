package dev.trawler.policy;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lenient robots.txt parser. Consecutive {@code User-agent} lines open one group; the group ends
 * at the next {@code User-agent} line that follows a rule. Every group naming an agent contributes
 * its rules to that agent, so the resulting policy holds one group per agent name. {@code Sitemap}
 * lines are global. Unknown directives and malformed lines are skipped.
 */
public final class RobotsTxtParser {

  private static final Logger log = LoggerFactory.getLogger(RobotsTxtParser.class);

  private RobotsTxtParser() {
    // utility class
  }

  public static RobotsPolicy parse(@Nullable String robotsText, String userAgent) {
    if (robotsText == null || robotsText.isBlank()) {
      return RobotsPolicy.permissive(userAgent);
    }

    List<String> sitemaps = new ArrayList<>();
    List<GroupBuilder> blocks = new ArrayList<>();

    GroupBuilder current = null;
    boolean lastDirectiveWasUserAgent = false;

    for (String rawLine : robotsText.split("\\R")) {
      String line = stripComment(rawLine).trim();
      int colonIdx = line.indexOf(':');
      if (line.isEmpty() || colonIdx <= 0) {
        continue;
      }

      String key = line.substring(0, colonIdx).trim().toLowerCase(Locale.ROOT);
      String value = line.substring(colonIdx + 1).trim();

      if ("user-agent".equals(key)) {
        if (!lastDirectiveWasUserAgent || current == null) {
          current = new GroupBuilder();
          blocks.add(current);
        }
        String agent = value.toLowerCase(Locale.ROOT);
        if (!current.agents.contains(agent)) {
          current.agents.add(agent);
        }
        lastDirectiveWasUserAgent = true;
        continue;
      }

      lastDirectiveWasUserAgent = false;

      switch (key) {
        case "sitemap" -> {
          if (!value.isBlank() && !sitemaps.contains(value)) {
            sitemaps.add(value);
          }
        }
        case "allow", "disallow" -> {
          if (current != null && !value.isBlank()) {
            current.rules.add(new RobotsRule(value, "allow".equals(key)));
          }
        }
        case "crawl-delay" -> {
          if (current != null) {
            current.crawlDelay = parseDouble(value);
          }
        }
        case "request-rate" -> {
          if (current != null) {
            current.requestRate = parseRequestRate(value);
          }
        }
        default -> log.trace("Ignoring robots directive {}", key);
      }
    }
    return new RobotsPolicy(groupsPerAgent(blocks), sitemaps, userAgent);
  }

  /** Fold the parsed blocks into one group per agent name, keeping first-seen order. */
  private static List<RobotsGroup> groupsPerAgent(List<GroupBuilder> blocks) {
    Map<String, GroupBuilder> byAgent = new LinkedHashMap<>();
    for (GroupBuilder block : blocks) {
      for (String agent : block.agents) {
        GroupBuilder merged = byAgent.computeIfAbsent(agent, GroupBuilder::forAgent);
        merged.rules.addAll(block.rules);
        if (merged.crawlDelay == null) {
          merged.crawlDelay = block.crawlDelay;
        }
        if (merged.requestRate == null) {
          merged.requestRate = block.requestRate;
        }
      }
    }
    return byAgent.values().stream().map(GroupBuilder::build).toList();
  }

  private static String stripComment(String line) {
    int idx = line.indexOf('#');
    return idx >= 0 ? line.substring(0, idx) : line;
  }

  private static @Nullable Double parseDouble(String value) {
    try {
      double parsed = Double.parseDouble(value);
      return parsed >= 0 ? parsed : null;
    } catch (NumberFormatException e) {
      return null;
    }
  }

  /** {@code Request-rate: 1/10} (optionally {@code 1/10s}) means one request per ten seconds. */
  private static @Nullable Double parseRequestRate(String value) {
    int slash = value.indexOf('/');
    if (slash <= 0) {
      return null;
    }
    Double requests = parseDouble(value.substring(0, slash).trim());
    Double seconds = parseDouble(value.substring(slash + 1).replaceAll("[^0-9.]", ""));
    if (requests == null || seconds == null || seconds == 0) {
      return null;
    }
    return requests / seconds;
  }

  private static final class GroupBuilder {
    private final List<String> agents = new ArrayList<>();
    private final List<RobotsRule> rules = new ArrayList<>();
    private @Nullable Double crawlDelay;
    private @Nullable Double requestRate;

    static GroupBuilder forAgent(String agent) {
      GroupBuilder builder = new GroupBuilder();
      builder.agents.add(agent);
      return builder;
    }

    RobotsGroup build() {
      return new RobotsGroup(agents, rules, crawlDelay, requestRate);
    }
  }
}
