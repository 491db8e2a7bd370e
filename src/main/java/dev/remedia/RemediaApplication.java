package dev.remedia;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the Remedia hybrid retrieval service.
 *
 * <p>Runs headless and exposes the search engine as an MCP tool over the stdio transport.
 */
@SpringBootApplication
public class RemediaApplication {
  public static void main(String[] args) {
    SpringApplication.run(RemediaApplication.class, args);
  }
}
