package com.flamingo.ai.notevault.exception;

/** Exception thrown when the embedding provider is used before it has been initialised. */
public class EmbeddingNotInitializedException extends EmbeddingException {

  public EmbeddingNotInitializedException(String message) {
    super(message);
  }

  public EmbeddingNotInitializedException(String message, Throwable cause) {
    super(message, cause);
  }
}
