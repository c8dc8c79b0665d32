package com.flamingo.ai.arabicsearch.service.indexing;

import java.time.Duration;
import java.util.List;
import lombok.Builder;

/**
 * Summary of an indexing run. Counts are cumulative across resumed runs of the same
 * source/target pair.
 *
 * @param sourceIndex index read from
 * @param targetIndex index written to
 * @param documentsProcessed documents written with an embedding
 * @param documentsFailed documents that could not be written
 * @param pagesProcessed pages completed
 * @param duration wall time of this invocation
 * @param failures the first failed documents, capped by configuration
 * @param resumed whether this invocation continued from a checkpoint
 * @param completed whether the whole source was consumed
 */
@Builder
public record IndexingReport(
    String sourceIndex,
    String targetIndex,
    long documentsProcessed,
    long documentsFailed,
    int pagesProcessed,
    Duration duration,
    List<IndexingFailure> failures,
    boolean resumed,
    boolean completed) {

  public IndexingReport {
    failures = failures == null ? List.of() : List.copyOf(failures);
  }
}
