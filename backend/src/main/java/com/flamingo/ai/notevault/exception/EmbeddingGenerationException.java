package com.flamingo.ai.notevault.exception;

/** Exception thrown when the embedding model fails to produce a vector. */
public class EmbeddingGenerationException extends EmbeddingException {

  public EmbeddingGenerationException(String message) {
    super(message);
  }

  public EmbeddingGenerationException(String message, Throwable cause) {
    super(message, cause);
  }
}
