package com.flamingo.ai.arabicsearch.domain;

import java.util.List;

/**
 * Outcome of a search.
 *
 * <p>{@code modeUsed} differs from {@code requestedMode} exactly when the engine downgraded the
 * request, in which case {@code fallbackReason} says why.
 */
public record SearchResult(
    SearchMode requestedMode,
    SearchMode modeUsed,
    List<RankedSegment> hits,
    long totalHits,
    String fallbackReason) {

  public SearchResult {
    hits = List.copyOf(hits);
  }

  public static SearchResult empty(SearchMode mode) {
    return new SearchResult(mode, mode, List.of(), 0, null);
  }

  public boolean isDegraded() {
    return requestedMode != modeUsed;
  }
}
