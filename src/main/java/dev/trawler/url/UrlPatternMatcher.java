package dev.trawler.url;

import java.util.Collection;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Glob matcher for crawl include/exclude patterns.
 *
 * <p>{@code *} matches any substring (slashes included); every other character is literal. A
 * pattern must match the whole path+query of the URL. An empty pattern set matches everything.
 */
public final class UrlPatternMatcher {

  private final List<Pattern> compiled;

  public UrlPatternMatcher(Collection<String> patterns) {
    this.compiled = patterns.stream().map(UrlPatternMatcher::compile).toList();
  }

  /**
   * Convenience one-shot variant of {@link #matches(String)}.
   *
   * @param url absolute URL to test
   * @param patterns glob patterns
   * @return true if the set is empty or at least one pattern matches
   */
  public static boolean matchesPatterns(String url, Collection<String> patterns) {
    return new UrlPatternMatcher(patterns).matches(url);
  }

  /** Whether this matcher was built from an empty pattern set. */
  public boolean isEmpty() {
    return compiled.isEmpty();
  }

  /**
   * @param url absolute URL to test
   * @return true if there are no patterns or at least one matches the URL's path+query
   * @throws InvalidUrlException if the URL is not absolute
   */
  public boolean matches(String url) {
    if (compiled.isEmpty()) {
      return true;
    }
    String subject = UrlNormalizer.pathAndQuery(url);
    for (Pattern pattern : compiled) {
      if (pattern.matcher(subject).matches()) {
        return true;
      }
    }
    return false;
  }

  private static Pattern compile(String glob) {
    StringBuilder regex = new StringBuilder();
    int literalStart = 0;
    for (int i = 0; i < glob.length(); i++) {
      if (glob.charAt(i) == '*') {
        if (i > literalStart) {
          regex.append(Pattern.quote(glob.substring(literalStart, i)));
        }
        regex.append(".*");
        literalStart = i + 1;
      }
    }
    if (literalStart < glob.length()) {
      regex.append(Pattern.quote(glob.substring(literalStart)));
    }
    return Pattern.compile(regex.toString(), Pattern.DOTALL);
  }
}
