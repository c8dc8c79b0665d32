package com.flamingo.ai.arabicsearch.service.indexing;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Progress of an indexing run after its last completed page.
 *
 * @param sourceIndex index read from
 * @param targetIndex index written to
 * @param embeddingModel model id used by the run, a resumed run must use the same one
 * @param cursor sort values of the last document of the last completed page
 * @param pagesCompleted pages completed so far
 * @param documentsProcessed documents written so far
 * @param documentsFailed documents failed so far
 * @param failures the first failures of the run, capped when the checkpoint advances
 * @param updatedAt when the checkpoint was written
 */
public record IndexingCheckpoint(
    String sourceIndex,
    String targetIndex,
    String embeddingModel,
    List<Object> cursor,
    int pagesCompleted,
    long documentsProcessed,
    long documentsFailed,
    List<IndexingFailure> failures,
    Instant updatedAt) {

  public IndexingCheckpoint {
    // sort values may be null
    cursor = cursor == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(cursor));
    failures = failures == null ? List.of() : List.copyOf(failures);
  }

  public static IndexingCheckpoint start(
      String sourceIndex, String targetIndex, String embeddingModel) {
    return new IndexingCheckpoint(
        sourceIndex, targetIndex, embeddingModel, List.of(), 0, 0, 0, List.of(), Instant.now());
  }

  /**
   * Returns the checkpoint after one more completed page.
   *
   * @param maxReportedFailures how many failure entries are kept; the failed count is always exact
   */
  public IndexingCheckpoint advance(
      List<Object> nextCursor,
      long processedInPage,
      List<IndexingFailure> failedInPage,
      int maxReportedFailures) {
    List<IndexingFailure> kept = failures;
    int room = maxReportedFailures - failures.size();
    if (room > 0 && !failedInPage.isEmpty()) {
      kept = new ArrayList<>(failures);
      kept.addAll(failedInPage.subList(0, Math.min(room, failedInPage.size())));
    }
    return new IndexingCheckpoint(
        sourceIndex,
        targetIndex,
        embeddingModel,
        nextCursor,
        pagesCompleted + 1,
        documentsProcessed + processedInPage,
        documentsFailed + failedInPage.size(),
        kept,
        Instant.now());
  }
}
