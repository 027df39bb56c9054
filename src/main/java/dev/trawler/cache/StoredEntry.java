package dev.trawler.cache;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** On-disk JSON layout of a cache entry. Timestamps are ISO-8601; the payload is base64. */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
record StoredEntry(String url, String cachedAt, String expiresAt, byte[] payload) {}
