package dev.trawler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.retry.annotation.EnableRetry;

/**
 * Entry point for the Trawler crawl server.
 *
 * <p>Supports two Spring profiles: {@code web} (MCP over SSE on port 8080) and {@code stdio} (MCP
 * stdio transport, no web server).
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableRetry
public class TrawlerApplication {
  public static void main(String[] args) {
    SpringApplication.run(TrawlerApplication.class, args);
  }
}
