package dev.trawler.render;

/** Why a page could not be rendered. */
public record RenderFailure(Kind kind, String message) {

  public enum Kind {
    TIMEOUT,
    NETWORK,
    INVALID_URL,
    UNKNOWN
  }
}
