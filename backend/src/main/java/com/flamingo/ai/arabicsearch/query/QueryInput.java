package com.flamingo.ai.arabicsearch.query;

import java.util.List;
import lombok.Builder;

/**
 * Everything the query builder needs for one request, already computed by the caller.
 *
 * @param rawQuery the query as typed by the user
 * @param normalizedQuery the normalized query
 * @param expandedTerms normalized terms plus their synonyms, empty for basic and semantic
 * @param queryEmbedding embedding of the normalized query, null unless semantic
 * @param embeddingModel id of the model that produced {@code queryEmbedding}
 * @param size number of hits to request
 */
@Builder
public record QueryInput(
    String rawQuery,
    String normalizedQuery,
    List<String> expandedTerms,
    List<Float> queryEmbedding,
    String embeddingModel,
    int size) {

  public QueryInput {
    expandedTerms = expandedTerms == null ? List.of() : List.copyOf(expandedTerms);
  }
}
