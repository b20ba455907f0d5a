package com.flamingo.ai.notevault.service.search;

import com.flamingo.ai.notevault.exception.EmbeddingDimensionMismatchException;

/** Vector helpers for similarity ranking. */
public final class VectorMath {

  private VectorMath() {}

  /**
   * Cosine similarity of two vectors, i.e. {@code 1 - cosineDistance}.
   *
   * @return a value in {@code [-1, 1]}, or {@code NaN} if either vector has zero norm
   * @throws EmbeddingDimensionMismatchException if the lengths differ
   */
  public static double cosineSimilarity(float[] a, float[] b) {
    if (a.length != b.length) {
      throw new EmbeddingDimensionMismatchException(a.length, b.length);
    }
    double dot = 0.0;
    double normA = 0.0;
    double normB = 0.0;
    for (int i = 0; i < a.length; i++) {
      dot += (double) a[i] * b[i];
      normA += (double) a[i] * a[i];
      normB += (double) b[i] * b[i];
    }
    if (normA == 0.0 || normB == 0.0) {
      return Double.NaN;
    }
    return dot / (Math.sqrt(normA) * Math.sqrt(normB));
  }
}
