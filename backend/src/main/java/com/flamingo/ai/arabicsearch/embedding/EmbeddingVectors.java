package com.flamingo.ai.arabicsearch.embedding;

import java.util.ArrayList;
import java.util.List;

/** Helpers for embedding vectors. */
public final class EmbeddingVectors {

  private EmbeddingVectors() {}

  public static List<Float> toFloatList(float[] vector) {
    List<Float> result = new ArrayList<>(vector.length);
    for (float f : vector) {
      result.add(f);
    }
    return result;
  }

  /**
   * Cosine similarity of two vectors of equal length.
   *
   * @return a value in [-1, 1], or 0 when either vector has zero norm
   * @throws IllegalArgumentException if the lengths differ
   */
  public static double cosineSimilarity(List<Float> a, List<Float> b) {
    if (a.size() != b.size()) {
      throw new IllegalArgumentException(
          "Vector dimensions differ: " + a.size() + " vs " + b.size());
    }
    double dot = 0;
    double normA = 0;
    double normB = 0;
    for (int i = 0; i < a.size(); i++) {
      double x = a.get(i);
      double y = b.get(i);
      dot += x * y;
      normA += x * x;
      normB += y * y;
    }
    if (normA == 0 || normB == 0) {
      return 0;
    }
    return dot / (Math.sqrt(normA) * Math.sqrt(normB));
  }
}
