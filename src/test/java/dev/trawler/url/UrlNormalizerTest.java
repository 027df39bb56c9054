package dev.trawler.url;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class UrlNormalizerTest {

    @Nested
    class Normalize {

        @Test
        void removes_fragment() {
            String result = UrlNormalizer.normalize("https://docs.example.com/guide#section");
            assertThat(result).isEqualTo("https://docs.example.com/guide");
        }

        @Test
        void removes_trailing_slash() {
            String result = UrlNormalizer.normalize("https://docs.example.com/guide/");
            assertThat(result).isEqualTo("https://docs.example.com/guide");
        }

        @Test
        void empty_path_becomes_root_slash() {
            assertThat(UrlNormalizer.normalize("https://docs.example.com"))
                    .isEqualTo("https://docs.example.com/");
        }

        @Test
        void collapses_slash_only_path_to_root() {
            assertThat(UrlNormalizer.normalize("https://docs.example.com//"))
                    .isEqualTo("https://docs.example.com/");
        }

        @Test
        void lowercases_scheme_and_host_but_not_path() {
            String result = UrlNormalizer.normalize("HTTPS://Docs.Example.COM/Guide");
            assertThat(result).isEqualTo("https://docs.example.com/Guide");
        }

        @Test
        void keeps_query_string_verbatim() {
            String result = UrlNormalizer.normalize("https://example.com/search?z=1&a=2&utm_source=x");
            assertThat(result).isEqualTo("https://example.com/search?z=1&a=2&utm_source=x");
        }

        @Test
        void query_parameter_order_is_significant() {
            assertThat(UrlNormalizer.normalize("https://example.com/s?a=1&b=2"))
                    .isNotEqualTo(UrlNormalizer.normalize("https://example.com/s?b=2&a=1"));
        }

        @Test
        void omits_default_port_443_for_https() {
            String result = UrlNormalizer.normalize("https://example.com:443/path");
            assertThat(result).isEqualTo("https://example.com/path");
        }

        @Test
        void keeps_non_default_port() {
            String result = UrlNormalizer.normalize("http://localhost:8080/docs/");
            assertThat(result).isEqualTo("http://localhost:8080/docs");
        }

        @Test
        void rejects_relative_url() {
            assertThatThrownBy(() -> UrlNormalizer.normalize("/docs/intro"))
                    .isInstanceOf(InvalidUrlException.class)
                    .hasMessageContaining("/docs/intro");
        }

        @Test
        void rejects_malformed_url() {
            assertThatThrownBy(() -> UrlNormalizer.normalize("https://exa mple.com/"))
                    .isInstanceOf(InvalidUrlException.class);
        }

        @Test
        void rejects_null_and_blank() {
            assertThatThrownBy(() -> UrlNormalizer.normalize(null))
                    .isInstanceOf(InvalidUrlException.class);
            assertThatThrownBy(() -> UrlNormalizer.normalize("  "))
                    .isInstanceOf(InvalidUrlException.class);
        }

        @Test
        void rejects_mailto_links() {
            assertThat(UrlNormalizer.tryNormalize("mailto:team@example.com")).isEmpty();
        }
    }

    @Nested
    class TrackingParameters {

        @Test
        void strips_utm_and_click_ids_keeping_order_of_the_rest() {
            String result = UrlNormalizer.stripTrackingParams(
                    "https://example.com/page?z=3&utm_source=feed&fbclid=abc&a=1&gclid=x");
            assertThat(result).isEqualTo("https://example.com/page?z=3&a=1");
        }

        @Test
        void parameter_names_match_case_insensitively() {
            assertThat(UrlNormalizer.stripTrackingParams("https://example.com/p?UTM_Medium=mail&Ref=x"))
                    .isEqualTo("https://example.com/p");
        }

        @Test
        void url_without_query_is_unchanged() {
            assertThat(UrlNormalizer.stripTrackingParams("https://example.com/page"))
                    .isEqualTo("https://example.com/page");
        }

        @Test
        void meaningful_parameters_survive() {
            assertThat(UrlNormalizer.stripTrackingParams("https://example.com/articles?page=1&sourcecode=y"))
                    .isEqualTo("https://example.com/articles?page=1&sourcecode=y");
        }

        @Test
        void dedupe_key_also_sorts_remaining_parameters() {
            assertThat(UrlNormalizer.dedupeKey("https://Example.com/page/?utm_source=test&z=3&a=1#top"))
                    .isEqualTo("https://example.com/page?a=1&z=3");
            assertThat(UrlNormalizer.dedupeKey("https://example.com/page?b=2&a=1"))
                    .isEqualTo(UrlNormalizer.dedupeKey("https://example.com/page?a=1&b=2"));
        }

        @Test
        void dedupe_key_keeps_different_meaningful_values_apart() {
            assertThat(UrlNormalizer.dedupeKey("https://example.com/product?id=123"))
                    .isNotEqualTo(UrlNormalizer.dedupeKey("https://example.com/product?id=456"));
        }
    }

    @Nested
    class Origin {

        @Test
        void extracts_scheme_and_host() {
            assertThat(UrlNormalizer.origin("https://docs.spring.io/boot/reference/"))
                    .isEqualTo("https://docs.spring.io");
        }

        @Test
        void preserves_non_default_port() {
            assertThat(UrlNormalizer.origin("http://localhost:8080/docs"))
                    .isEqualTo("http://localhost:8080");
        }

        @Test
        void same_origin_ignores_path_and_host_case() {
            assertThat(UrlNormalizer.isSameOrigin(
                    "https://Example.com/a", "https://example.com:443/b?x=1")).isTrue();
        }

        @Test
        void different_scheme_is_different_origin() {
            assertThat(UrlNormalizer.isSameOrigin("https://example.com/", "http://example.com/"))
                    .isFalse();
        }

        @Test
        void different_port_is_different_origin() {
            assertThat(UrlNormalizer.isSameOrigin("http://example.com/", "http://example.com:8080/"))
                    .isFalse();
        }

        @Test
        void invalid_input_is_never_same_origin() {
            assertThat(UrlNormalizer.isSameOrigin("not-a-url", "not-a-url")).isFalse();
        }
    }

    @Test
    void path_and_query_includes_query() {
        assertThat(UrlNormalizer.pathAndQuery("https://example.com/api/v1?page=2"))
                .isEqualTo("/api/v1?page=2");
        assertThat(UrlNormalizer.pathAndQuery("https://example.com")).isEqualTo("/");
    }
}
