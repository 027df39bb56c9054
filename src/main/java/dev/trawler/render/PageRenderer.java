package dev.trawler.render;

import java.time.Duration;

/**
 * Turns a URL into rendered HTML. Implementations own the browser or HTTP lifecycle and report
 * every failure as a {@link RenderFailure} instead of throwing.
 */
public interface PageRenderer {

  RenderResult render(String url, Duration timeout);
}
