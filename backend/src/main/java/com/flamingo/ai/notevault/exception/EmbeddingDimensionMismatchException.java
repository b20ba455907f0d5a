package com.flamingo.ai.notevault.exception;

/** Exception thrown when a vector does not have the configured number of dimensions. */
public class EmbeddingDimensionMismatchException extends EmbeddingException {

  private final int expected;
  private final int actual;

  public EmbeddingDimensionMismatchException(int expected, int actual) {
    super(
        String.format(
            "Invalid embedding dimensions: expected %d, got %d", expected, actual));
    this.expected = expected;
    this.actual = actual;
  }

  public int getExpected() {
    return expected;
  }

  public int getActual() {
    return actual;
  }
}
