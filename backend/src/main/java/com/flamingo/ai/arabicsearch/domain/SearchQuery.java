package com.flamingo.ai.arabicsearch.domain;

import com.flamingo.ai.arabicsearch.exception.SearchValidationException;

/**
 * A validated search request.
 *
 * @param query raw user query, may be blank
 * @param size number of hits requested, always positive
 * @param mode retrieval strategy
 */
public record SearchQuery(String query, int size, SearchMode mode) {

  public SearchQuery {
    if (size <= 0) {
      throw new SearchValidationException("size", "size must be greater than 0, got " + size);
    }
    if (mode == null) {
      throw new SearchValidationException("mode", "mode is required");
    }
  }

  /** Builds a query from consumer input, parsing the mode name. */
  public static SearchQuery of(String query, int size, String mode) {
    return new SearchQuery(query, size, SearchMode.parse(mode));
  }

  public boolean isBlank() {
    return query == null || query.isBlank();
  }
}
