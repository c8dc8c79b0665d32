package com.flamingo.ai.arabicsearch.embedding;

/**
 * Load state of the embedding model.
 *
 * @param available whether embeddings can be produced
 * @param modelId identifier stored alongside every indexed embedding
 * @param dimensions vector length, 0 when unavailable
 * @param failureReason why the model is unavailable, null when available
 */
public record EmbeddingProviderState(
    boolean available, String modelId, int dimensions, String failureReason) {

  public static EmbeddingProviderState available(String modelId, int dimensions) {
    return new EmbeddingProviderState(true, modelId, dimensions, null);
  }

  public static EmbeddingProviderState unavailable(String modelId, String failureReason) {
    return new EmbeddingProviderState(false, modelId, 0, failureReason);
  }

  public static EmbeddingProviderState notInitialized(String modelId) {
    return unavailable(modelId, "not initialized");
  }
}
