package dev.trawler.render;

import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Configures the {@link RestClient} used to talk to the Crawl4AI rendering service.
 *
 * <p>The read timeout must exceed the largest page timeout a crawl job forwards, otherwise slow
 * pages surface as network errors instead of timeouts.
 */
@Configuration
public class Crawl4AiConfig {

  @Bean
  public RestClient crawl4AiRestClient(RestClient.Builder builder, Crawl4AiProperties props) {
    var requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(Duration.ofMillis(props.connectTimeoutMs()));
    requestFactory.setReadTimeout(Duration.ofMillis(props.readTimeoutMs()));

    return builder
        .baseUrl(props.baseUrl())
        .requestFactory(requestFactory)
        .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
        .build();
  }
}
