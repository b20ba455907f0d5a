package com.flamingo.ai.notevault.service.embedding;

/**
 * Turns text into a fixed-length embedding vector.
 *
 * <p>Implementations are shared, expensive to construct and stateful: {@link #initialize()} must
 * complete before {@link #generateEmbedding(String)} is called.
 */
public interface EmbeddingProvider {

  /**
   * Loads the underlying model. Calling it again after a successful initialisation is a no-op.
   *
   * @throws com.flamingo.ai.notevault.exception.EmbeddingNotInitializedException if the model
   *     cannot be loaded
   */
  void initialize();

  /**
   * Generates the embedding for a piece of text.
   *
   * @param text the text to embed
   * @return a vector of exactly {@link EmbeddingProviderStatus#dimensions()} values
   * @throws com.flamingo.ai.notevault.exception.EmbeddingNotInitializedException if called before
   *     {@link #initialize()}
   * @throws com.flamingo.ai.notevault.exception.EmbeddingGenerationException on any model fault
   * @throws com.flamingo.ai.notevault.exception.EmbeddingDimensionMismatchException if the model
   *     returns a vector of the wrong length
   */
  float[] generateEmbedding(String text);

  EmbeddingProviderStatus getStatus();
}
