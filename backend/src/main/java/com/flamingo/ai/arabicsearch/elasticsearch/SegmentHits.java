package com.flamingo.ai.arabicsearch.elasticsearch;

import java.util.List;

/** Hits of one search call in backend order, with the total number of matching documents. */
public record SegmentHits(List<SegmentHit> hits, long totalHits) {

  public SegmentHits {
    hits = List.copyOf(hits);
  }
}
