package dev.trawler.url;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Utility class that canonicalizes URLs for deduplication during crawling.
 * Removes fragments, normalizes trailing slashes, default ports and scheme/host casing.
 * Query strings are kept verbatim: two URLs differing only in parameter order stay distinct.
 * {@link #dedupeKey(String)} is the looser identity used when similar URLs are collapsed.
 */
public final class UrlNormalizer {

    private static final Logger log = LoggerFactory.getLogger(UrlNormalizer.class);

    private static final Set<String> TRACKING_PARAMS = Set.of(
            "_ga", "_gl", "fbclid", "gclid", "dclid", "msclkid", "igshid",
            "mc_cid", "mc_eid", "ref", "ref_src", "source", "share"
    );

    private UrlNormalizer() {
        // utility class
    }

    /**
     * Normalize a URL for deduplication:
     * - Remove fragments (#section)
     * - Lowercase scheme and host (path and query are case-sensitive)
     * - Omit the default port (80 for HTTP, 443 for HTTPS)
     * - Empty path becomes "/", trailing slash removed from any other path
     *
     * @param url the URL to normalize
     * @return canonical URL string
     * @throws InvalidUrlException if the input is blank, malformed or not absolute
     */
    public static String normalize(@Nullable String url) {
        URI uri = parseAbsolute(url);

        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        int port = uri.getPort();
        String path = uri.getRawPath();
        String query = uri.getRawQuery();

        if (path == null || path.isEmpty()) {
            path = "/";
        }
        while (path.length() > 1 && path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }

        StringBuilder sb = new StringBuilder();
        sb.append(scheme).append("://").append(host);
        if (port != -1 && !isDefaultPort(scheme, port)) {
            sb.append(':').append(port);
        }
        sb.append(path);
        if (query != null) {
            sb.append('?').append(query);
        }
        return sb.toString();
    }

    /**
     * Non-throwing variant of {@link #normalize(String)} for links scraped from page content.
     *
     * @param url the candidate URL
     * @return the normalized URL, or empty if the input is not a valid absolute URL
     */
    public static Optional<String> tryNormalize(@Nullable String url) {
        try {
            return Optional.of(normalize(url));
        } catch (InvalidUrlException e) {
            log.debug("Dropping unparseable URL {}: {}", url, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Remove tracking query parameters (utm_*, click ids, ref/source) from a normalized URL.
     * The remaining parameters keep their order; an empty query is dropped entirely.
     *
     * @param normalizedUrl output of {@link #normalize(String)}
     * @return the URL without tracking parameters
     */
    public static String stripTrackingParams(String normalizedUrl) {
        return filterQuery(normalizedUrl, false);
    }

    /**
     * Identity under which similar URLs collapse: the normalized URL without tracking
     * parameters and with the remaining parameters sorted.
     *
     * @throws InvalidUrlException if the input is not a valid absolute URL
     */
    public static String dedupeKey(@Nullable String url) {
        return filterQuery(normalize(url), true);
    }

    private static String filterQuery(String normalizedUrl, boolean sort) {
        int q = normalizedUrl.indexOf('?');
        if (q < 0) {
            return normalizedUrl;
        }
        Stream<String> params = queryParams(normalizedUrl.substring(q + 1));
        String kept = (sort ? params.sorted() : params).collect(Collectors.joining("&"));
        String base = normalizedUrl.substring(0, q);
        return kept.isEmpty() ? base : base + "?" + kept;
    }

    private static Stream<String> queryParams(String query) {
        return Arrays.stream(query.split("&"))
                .filter(param -> !param.isEmpty())
                .filter(param -> {
                    String key = param.contains("=") ? param.substring(0, param.indexOf('=')) : param;
                    return !isTrackingParam(key.toLowerCase(Locale.ROOT));
                });
    }

    private static boolean isTrackingParam(String key) {
        return key.startsWith("utm_") || TRACKING_PARAMS.contains(key);
    }

    /**
     * Extract the origin (scheme://host[:port]) from a full URL.
     * Non-default ports are preserved; default ports are omitted.
     *
     * @param url the URL to extract the origin from
     * @return the origin, without trailing slash
     * @throws InvalidUrlException if the input is not a valid absolute URL
     */
    public static String origin(@Nullable String url) {
        URI uri = parseAbsolute(url);
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        int port = uri.getPort();
        if (port == -1 || isDefaultPort(scheme, port)) {
            return scheme + "://" + host;
        }
        return scheme + "://" + host + ":" + port;
    }

    /**
     * Check whether two URLs share scheme, host and effective port.
     *
     * @return true if both are valid and have the same origin, false otherwise
     */
    public static boolean isSameOrigin(@Nullable String a, @Nullable String b) {
        try {
            return origin(a).equals(origin(b));
        } catch (InvalidUrlException e) {
            return false;
        }
    }

    /**
     * Return the raw path plus query of a URL, as matched by robots rules and crawl patterns.
     *
     * @param url an absolute URL
     * @return path (at least "/") followed by "?query" when present
     */
    public static String pathAndQuery(@Nullable String url) {
        URI uri = parseAbsolute(url);
        String path = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();
        return uri.getRawQuery() == null ? path : path + "?" + uri.getRawQuery();
    }

    private static URI parseAbsolute(@Nullable String url) {
        if (url == null || url.isBlank()) {
            throw new InvalidUrlException(String.valueOf(url), "empty");
        }
        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            throw new InvalidUrlException(url, e.getReason());
        }
        if (uri.getScheme() == null || uri.getHost() == null) {
            throw new InvalidUrlException(url, "missing scheme or host");
        }
        return uri;
    }

    private static boolean isDefaultPort(String scheme, int port) {
        return ("http".equals(scheme) && port == 80)
                || ("https".equals(scheme) && port == 443);
    }
}
