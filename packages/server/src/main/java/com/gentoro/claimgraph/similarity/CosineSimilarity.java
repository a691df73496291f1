package com.gentoro.claimgraph.similarity;

import com.gentoro.claimgraph.exception.StructuralException;

/** Cosine similarity of embedding vectors, clamped to [0,1]. */
public final class CosineSimilarity {
  private CosineSimilarity() {}

  /**
   * Cosine of the angle between {@code a} and {@code b}. Negative values clamp to 0; a zero
   * vector on either side yields 0.
   *
   * @throws StructuralException if the vectors have different lengths
   */
  public static double between(float[] a, float[] b) {
    if (a.length != b.length) {
      throw new StructuralException(
          "Embedding vectors must be of same length (%d != %d)".formatted(a.length, b.length));
    }
    double dot = 0.0;
    double na = 0.0;
    double nb = 0.0;
    for (int i = 0; i < a.length; i++) {
      dot += (double) a[i] * b[i];
      na += (double) a[i] * a[i];
      nb += (double) b[i] * b[i];
    }
    if (na == 0.0 || nb == 0.0) {
      return 0.0;
    }
    double cosine = dot / (Math.sqrt(na) * Math.sqrt(nb));
    return Math.max(0.0, Math.min(1.0, cosine));
  }
}
