package com.flamingo.ai.arabicsearch.elasticsearch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One page of a sorted scan over an index.
 *
 * @param segments the segments of this page, in sort order
 * @param nextCursor sort values of the last segment, to pass as {@code search_after} for the next
 *     page; empty when the page is empty
 * @param endsOnTie whether the last two segments share their sort values; documents tied with the
 *     last one that did not fit in this page are not returned after {@code nextCursor}
 */
public record SegmentPage(
    List<TranscriptSegment> segments, List<Object> nextCursor, boolean endsOnTie) {

  public SegmentPage {
    segments = List.copyOf(segments);
    // sort values may contain nulls for documents missing a sort field
    nextCursor = Collections.unmodifiableList(new ArrayList<>(nextCursor));
  }

  public SegmentPage(List<TranscriptSegment> segments, List<Object> nextCursor) {
    this(segments, nextCursor, false);
  }

  public boolean isEmpty() {
    return segments.isEmpty();
  }
}
