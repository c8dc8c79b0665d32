package com.flamingo.ai.arabicsearch.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class EmbeddingVectorsTest {

  @Test
  @DisplayName("should convert primitive vectors to lists")
  void shouldConvertToList() {
    assertThat(EmbeddingVectors.toFloatList(new float[] {0.25f, -1f})).containsExactly(0.25f, -1f);
  }

  @Test
  @DisplayName("should compute cosine similarity")
  void shouldComputeCosineSimilarity() {
    assertThat(EmbeddingVectors.cosineSimilarity(List.of(1f, 0f), List.of(1f, 0f)))
        .isCloseTo(1.0, within(1e-6));
    assertThat(EmbeddingVectors.cosineSimilarity(List.of(1f, 0f), List.of(0f, 1f)))
        .isCloseTo(0.0, within(1e-6));
    assertThat(EmbeddingVectors.cosineSimilarity(List.of(0f, 0f), List.of(1f, 1f))).isZero();
  }

  @Test
  @DisplayName("should reject vectors of different length")
  void shouldRejectDifferentLengths() {
    assertThatThrownBy(() -> EmbeddingVectors.cosineSimilarity(List.of(1f), List.of(1f, 0f)))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
