package dev.trawler.render;

import org.jspecify.annotations.Nullable;

/**
 * Outcome of {@link PageRenderer#render}. On success {@code html} holds the rendered document and
 * {@code rawHtml} the document as served; on failure only {@code failure} is set.
 */
public record RenderResult(
    String url, @Nullable String html, @Nullable String rawHtml, @Nullable RenderFailure failure) {

  public static RenderResult success(String url, String html, @Nullable String rawHtml) {
    return new RenderResult(url, html, rawHtml, null);
  }

  public static RenderResult failure(String url, RenderFailure.Kind kind, String message) {
    return new RenderResult(url, null, null, new RenderFailure(kind, message));
  }

  public boolean isSuccess() {
    return failure == null;
  }
}
