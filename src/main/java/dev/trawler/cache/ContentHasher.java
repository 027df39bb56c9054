package dev.trawler.cache;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/** SHA-256 helpers for cache keys and artifact file-name disambiguation. */
public final class ContentHasher {

  private static final int CACHE_KEY_LENGTH = 16;

  private ContentHasher() {
    // utility class
  }

  /** Lowercase hex SHA-256 of the UTF-8 bytes of {@code content}. */
  public static String sha256(String content) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(content.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 algorithm not available", e);
    }
  }

  /** First {@code length} hex characters of the SHA-256 of {@code content}. */
  public static String shortHash(String content, int length) {
    return sha256(content).substring(0, length);
  }

  /** Cache key for an already normalized URL. */
  public static String cacheKey(String normalizedUrl) {
    return shortHash(normalizedUrl, CACHE_KEY_LENGTH);
  }
}
