package com.flamingo.ai.arabicsearch.embedding;

import com.flamingo.ai.arabicsearch.exception.ModelUnavailableException;
import java.util.List;

/**
 * Turns normalized Arabic text into dense vectors.
 *
 * <p>The model is loaded once by {@link #initialize()}. A failed load leaves the provider
 * unavailable until an explicit {@link #reload()}; it is never retried per request.
 */
public interface EmbeddingProvider {

  /** Loads the model and probes its dimensionality. Failures are captured in the state. */
  EmbeddingProviderState initialize();

  /** Re-initializes the model. */
  EmbeddingProviderState reload();

  EmbeddingProviderState state();

  default boolean isAvailable() {
    return state().available();
  }

  /**
   * Embeds one query text.
   *
   * @throws ModelUnavailableException if the model is not loaded or the call fails
   */
  List<Float> embed(String text);

  /**
   * Embeds texts in fixed-size chunks, preserving input order.
   *
   * @throws ModelUnavailableException if the model is not loaded or a chunk fails
   */
  List<List<Float>> embedBatch(List<String> texts);
}
