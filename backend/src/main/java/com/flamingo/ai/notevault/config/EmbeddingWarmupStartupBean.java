package com.flamingo.ai.notevault.config;

import com.flamingo.ai.notevault.service.embedding.EmbeddingProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * Loads the embedding model once the application has started.
 *
 * <p>A failure leaves the provider uninitialised: queued jobs then fail and are retried, and
 * search falls back to lexical matching. Startup itself never fails here.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EmbeddingWarmupStartupBean implements CommandLineRunner {

  private final EmbeddingProvider embeddingProvider;

  @Override
  public void run(String... args) {
    try {
      log.info("Initializing embedding provider...");
      embeddingProvider.initialize();
      log.info("Embedding provider ready: {}", embeddingProvider.getStatus());
    } catch (Exception e) {
      log.error("Embedding provider initialization failed: {}", e.getMessage(), e);
    }
  }
}
