package com.flamingo.ai.notevault.config;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;

/**
 * Configuration for the LangChain4j embedding model.
 *
 * <p>The model is lazy: it is only built when the embedding provider is initialised, so a missing
 * API key leaves search on its lexical fallback instead of failing application startup.
 */
@Configuration
public class LangChain4jConfig {

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Value("${langchain4j.openai.base-url:https://api.openai.com/v1}")
  private String baseUrl;

  @Bean
  @Lazy
  public EmbeddingModel embeddingModel(VaultConfig vaultConfig) {
    validateApiKey();

    VaultConfig.Embedding embedding = vaultConfig.getEmbedding();
    return OpenAiEmbeddingModel.builder()
        .apiKey(openAiApiKey)
        .baseUrl(baseUrl)
        .modelName(embedding.getModelName())
        .dimensions(embedding.getDimensions())
        .timeout(Duration.ofSeconds(embedding.getTimeoutSeconds()))
        .build();
  }

  private void validateApiKey() {
    if (openAiApiKey == null || openAiApiKey.isBlank()) {
      throw new IllegalStateException(
          "OpenAI API key is required. Set OPENAI_API_KEY environment variable.");
    }
  }
}
