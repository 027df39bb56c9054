package dev.trawler.policy;

import java.util.regex.Pattern;

/**
 * A single {@code Allow} or {@code Disallow} line. Plain values are path prefixes; {@code *} matches
 * any sequence and a trailing {@code $} anchors the end of the path.
 *
 * @param path the rule value as written in robots.txt
 * @param allow true for {@code Allow}, false for {@code Disallow}
 */
public record RobotsRule(String path, boolean allow) {

  public boolean matches(String pathAndQuery) {
    String normalizedPath = path.startsWith("/") || path.startsWith("*") ? path : "/" + path;
    if (!normalizedPath.contains("*") && !normalizedPath.endsWith("$")) {
      return pathAndQuery.startsWith(normalizedPath);
    }
    StringBuilder regex = new StringBuilder("^");
    for (int i = 0; i < normalizedPath.length(); i++) {
      char c = normalizedPath.charAt(i);
      if (c == '*') {
        regex.append(".*");
      } else if (c == '$' && i == normalizedPath.length() - 1) {
        regex.append("$");
      } else {
        regex.append(Pattern.quote(Character.toString(c)));
      }
    }
    return Pattern.compile(regex.toString()).matcher(pathAndQuery).find();
  }

  /** Specificity used for longest-match resolution. */
  int specificity() {
    return path.length();
  }
}
