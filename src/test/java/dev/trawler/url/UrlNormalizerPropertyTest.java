package dev.trawler.url;

import static org.assertj.core.api.Assertions.assertThat;

import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Combinators;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

class UrlNormalizerPropertyTest {

  @Property
  void normalizeIsIdempotent(@ForAll("urls") String url) {
    String once = UrlNormalizer.normalize(url);

    assertThat(UrlNormalizer.normalize(once)).isEqualTo(once);
  }

  @Property
  void normalizedUrlKeepsOrigin(@ForAll("urls") String url) {
    assertThat(UrlNormalizer.isSameOrigin(url, UrlNormalizer.normalize(url))).isTrue();
  }

  @Property
  void normalizedUrlNeverHasFragment(@ForAll("urls") String url) {
    assertThat(UrlNormalizer.normalize(url)).doesNotContain("#");
  }

  @Provide
  Arbitrary<String> urls() {
    Arbitrary<String> scheme = Arbitraries.of("http", "https", "HTTP", "Https");
    Arbitrary<String> host = Arbitraries.of("example.com", "Docs.Example.org", "localhost:8080");
    Arbitrary<String> segments =
        Arbitraries.strings()
            .withCharRange('a', 'z')
            .ofMinLength(1)
            .ofMaxLength(6)
            .list()
            .ofMaxSize(4)
            .map(parts -> "/" + String.join("/", parts));
    Arbitrary<String> trailing = Arbitraries.of("", "/", "?q=1&b=2", "#frag", "/?x=y#top");
    return Combinators.combine(scheme, host, segments, trailing)
        .as((s, h, p, t) -> s + "://" + h + p + t);
  }
}
