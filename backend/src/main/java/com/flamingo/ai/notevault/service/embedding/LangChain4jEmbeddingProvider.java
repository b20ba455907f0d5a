package com.flamingo.ai.notevault.service.embedding;

import com.flamingo.ai.notevault.exception.EmbeddingDimensionMismatchException;
import com.flamingo.ai.notevault.exception.EmbeddingGenerationException;
import com.flamingo.ai.notevault.exception.EmbeddingNotInitializedException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/** {@link EmbeddingProvider} backed by a LangChain4j {@link EmbeddingModel}. */
@Slf4j
public class LangChain4jEmbeddingProvider implements EmbeddingProvider {

  private final Supplier<EmbeddingModel> modelFactory;
  private final String modelId;
  private final int dimensions;
  private final MeterRegistry meterRegistry;

  private volatile EmbeddingModel model;

  public LangChain4jEmbeddingProvider(
      Supplier<EmbeddingModel> modelFactory,
      String modelId,
      int dimensions,
      MeterRegistry meterRegistry) {
    this.modelFactory = modelFactory;
    this.modelId = modelId;
    this.dimensions = dimensions;
    this.meterRegistry = meterRegistry;
  }

  @Override
  public synchronized void initialize() {
    if (model != null) {
      return;
    }
    log.info("Initializing embedding model {} ({} dimensions)...", modelId, dimensions);
    try {
      EmbeddingModel created = modelFactory.get();
      if (created == null) {
        throw new EmbeddingNotInitializedException("Embedding model factory returned no model");
      }
      model = created;
      log.info("Embedding model {} loaded successfully", modelId);
    } catch (EmbeddingNotInitializedException e) {
      throw e;
    } catch (RuntimeException e) {
      log.error("Failed to load embedding model {}: {}", modelId, e.getMessage());
      throw new EmbeddingNotInitializedException(
          "Failed to initialize embedding model " + modelId, e);
    }
  }

  @Override
  @Timed(value = "embedding.generate", description = "Time to generate one embedding")
  @CircuitBreaker(name = "embedding-model")
  public float[] generateEmbedding(String text) {
    EmbeddingModel current = model;
    if (current == null) {
      throw new EmbeddingNotInitializedException("Embedding service not initialized");
    }

    log.debug("Generating embedding, input length: {} chars", text.length());
    float[] vector;
    try {
      Response<Embedding> response = current.embed(text);
      vector = response.content().vector();
    } catch (RuntimeException e) {
      meterRegistry.counter("embedding.requests.failure").increment();
      throw new EmbeddingGenerationException("Failed to generate embedding: " + e.getMessage(), e);
    }

    if (vector == null || vector.length != dimensions) {
      meterRegistry.counter("embedding.requests.failure").increment();
      throw new EmbeddingDimensionMismatchException(dimensions, vector == null ? 0 : vector.length);
    }

    meterRegistry.counter("embedding.requests.success").increment();
    log.debug("Embedding generated successfully, vector dimension: {}", vector.length);
    return vector;
  }

  @Override
  public EmbeddingProviderStatus getStatus() {
    return new EmbeddingProviderStatus(model != null, modelId, dimensions);
  }
}
