package dev.trawler.url;

/** Thrown when a string cannot be parsed as an absolute URL with a scheme and a host. */
public class InvalidUrlException extends IllegalArgumentException {

  private final String url;

  public InvalidUrlException(String url, String reason) {
    super("Invalid URL '" + url + "': " + reason);
    this.url = url;
  }

  public String getUrl() {
    return url;
  }
}
