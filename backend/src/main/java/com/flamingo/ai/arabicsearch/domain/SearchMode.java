package com.flamingo.ai.arabicsearch.domain;

import com.flamingo.ai.arabicsearch.exception.SearchValidationException;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/** Retrieval strategy applied to a query. */
public enum SearchMode {
  /** Lexical match of the raw query against the original text. */
  BASIC("basic"),
  /** Normalized, synonym-expanded lexical query with phrase and fuzzy clauses. */
  ENHANCED("enhanced"),
  /** Dense-vector nearest neighbour search over segment embeddings. */
  SEMANTIC("semantic");

  private final String value;

  SearchMode(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  /**
   * Parses a mode name, ignoring case and surrounding whitespace.
   *
   * @throws SearchValidationException if the name is missing or unknown
   */
  public static SearchMode parse(String name) {
    if (name == null || name.isBlank()) {
      throw new SearchValidationException("mode", "mode is required");
    }
    String candidate = name.trim().toLowerCase(Locale.ROOT);
    for (SearchMode mode : values()) {
      if (mode.value.equals(candidate)) {
        return mode;
      }
    }
    throw new SearchValidationException(
        "mode",
        "Unknown search mode '"
            + name
            + "', expected one of "
            + Arrays.stream(values()).map(SearchMode::value).collect(Collectors.joining(", ")));
  }
}
