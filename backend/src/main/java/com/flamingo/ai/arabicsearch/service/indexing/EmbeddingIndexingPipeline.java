package com.flamingo.ai.arabicsearch.service.indexing;

import com.flamingo.ai.arabicsearch.config.ResilienceConfig;
import com.flamingo.ai.arabicsearch.config.SearchProperties;
import com.flamingo.ai.arabicsearch.elasticsearch.BulkIndexResult;
import com.flamingo.ai.arabicsearch.elasticsearch.SegmentPage;
import com.flamingo.ai.arabicsearch.elasticsearch.TranscriptIndexService;
import com.flamingo.ai.arabicsearch.elasticsearch.TranscriptSegment;
import com.flamingo.ai.arabicsearch.embedding.EmbeddingProvider;
import com.flamingo.ai.arabicsearch.embedding.EmbeddingProviderState;
import com.flamingo.ai.arabicsearch.exception.BackendUnavailableException;
import com.flamingo.ai.arabicsearch.exception.ModelUnavailableException;
import com.flamingo.ai.arabicsearch.text.ArabicTextNormalizer;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Copies transcript segments from a source index into a vector index, adding the normalized text
 * and its embedding to every document.
 *
 * <p>The source is scanned with {@code search_after} over the configured cursor fields. After each
 * page a checkpoint is written, so a run that stops midway resumes after the last completed page.
 * Failures of single documents or whole pages are recorded in the report and do not stop the run;
 * a source read that fails twice does, leaving the checkpoint in place.
 */
@Service
@Slf4j
public class EmbeddingIndexingPipeline {

  private final TranscriptIndexService transcriptIndexService;
  private final ArabicTextNormalizer normalizer;
  private final EmbeddingProvider embeddingProvider;
  private final IndexingCheckpointStore checkpointStore;
  private final SearchProperties properties;
  private final Retry backendRetry;
  private final Retry embeddingRetry;
  private final MeterRegistry meterRegistry;

  public EmbeddingIndexingPipeline(
      TranscriptIndexService transcriptIndexService,
      ArabicTextNormalizer normalizer,
      EmbeddingProvider embeddingProvider,
      IndexingCheckpointStore checkpointStore,
      SearchProperties properties,
      @Qualifier(ResilienceConfig.ELASTICSEARCH_RETRY) Retry backendRetry,
      @Qualifier(ResilienceConfig.EMBEDDING_BATCH_RETRY) Retry embeddingRetry,
      MeterRegistry meterRegistry) {
    this.transcriptIndexService = transcriptIndexService;
    this.normalizer = normalizer;
    this.embeddingProvider = embeddingProvider;
    this.checkpointStore = checkpointStore;
    this.properties = properties;
    this.backendRetry = backendRetry;
    this.embeddingRetry = embeddingRetry;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Indexes every document of {@code sourceIndex} into {@code targetIndex}.
   *
   * @param batchSize documents per page, must be positive
   * @return the cumulative report of this source/target pair
   * @throws ModelUnavailableException if the embedding model is not loaded
   * @throws BackendUnavailableException if the source cannot be read; the run can be resumed
   * @throws IllegalStateException if the target mapping is incompatible or a checkpoint was written
   *     with a different embedding model
   */
  @Timed(value = "indexing.run", description = "Time of an embedding indexing run")
  public IndexingReport run(String sourceIndex, String targetIndex, int batchSize) {
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be greater than 0, got " + batchSize);
    }
    EmbeddingProviderState state = embeddingProvider.state();
    if (!state.available()) {
      throw new ModelUnavailableException(state.failureReason());
    }
    Instant started = Instant.now();
    List<String> cursorFields = properties.getIndexing().getCursorFields();
    int maxReportedFailures = properties.getIndexing().getMaxReportedFailures();

    IndexingCheckpoint checkpoint =
        checkpointStore
            .load(sourceIndex, targetIndex)
            .orElseGet(() -> IndexingCheckpoint.start(sourceIndex, targetIndex, state.modelId()));
    boolean resumed = checkpoint.pagesCompleted() > 0;
    if (resumed && !state.modelId().equals(checkpoint.embeddingModel())) {
      throw new IllegalStateException(
          "Checkpoint for "
              + sourceIndex
              + " -> "
              + targetIndex
              + " was written with model '"
              + checkpoint.embeddingModel()
              + "', current model is '"
              + state.modelId()
              + "'. Clear the checkpoint or use a new target index.");
    }
    backendRetry.executeRunnable(
        () -> transcriptIndexService.ensureVectorIndex(targetIndex, state.dimensions()));

    log.info(
        "Indexing {} -> {} with model '{}' (batchSize={}, resumed={}, pagesDone={})",
        sourceIndex,
        targetIndex,
        state.modelId(),
        batchSize,
        resumed,
        checkpoint.pagesCompleted());

    boolean completed = false;
    while (!Thread.currentThread().isInterrupted()) {
      List<Object> after = checkpoint.cursor();
      SegmentPage page =
          backendRetry.executeSupplier(
              () -> transcriptIndexService.readPage(sourceIndex, cursorFields, after, batchSize));
      if (page.isEmpty()) {
        completed = true;
        break;
      }
      if (page.endsOnTie() && page.segments().size() == batchSize) {
        meterRegistry.counter("indexing.cursor.ties").increment();
        log.warn(
            "Page {} ends on documents sharing sort values {} over {}; tied documents beyond"
                + " this page are skipped, add a unique cursor field",
            checkpoint.pagesCompleted() + 1,
            page.nextCursor(),
            cursorFields);
      }
      PageOutcome outcome = indexPage(targetIndex, page.segments(), state.modelId());
      checkpoint =
          checkpoint.advance(
              page.nextCursor(), outcome.processed(), outcome.failures(), maxReportedFailures);
      checkpointStore.save(checkpoint);
      log.info(
          "Page {} done: processed={} failed={} (total processed={}, failed={})",
          checkpoint.pagesCompleted(),
          outcome.processed(),
          outcome.failures().size(),
          checkpoint.documentsProcessed(),
          checkpoint.documentsFailed());
      if (page.segments().size() < batchSize) {
        completed = true;
        break;
      }
    }

    if (completed) {
      backendRetry.executeRunnable(() -> transcriptIndexService.refresh(targetIndex));
      checkpointStore.clear(sourceIndex, targetIndex);
      log.info(
          "Indexing {} -> {} complete: processed={} failed={} pages={}",
          sourceIndex,
          targetIndex,
          checkpoint.documentsProcessed(),
          checkpoint.documentsFailed(),
          checkpoint.pagesCompleted());
    } else {
      log.warn(
          "Indexing {} -> {} interrupted after page {}, checkpoint kept",
          sourceIndex,
          targetIndex,
          checkpoint.pagesCompleted());
    }

    return IndexingReport.builder()
        .sourceIndex(sourceIndex)
        .targetIndex(targetIndex)
        .documentsProcessed(checkpoint.documentsProcessed())
        .documentsFailed(checkpoint.documentsFailed())
        .pagesProcessed(checkpoint.pagesCompleted())
        .duration(Duration.between(started, Instant.now()))
        .failures(checkpoint.failures())
        .resumed(resumed)
        .completed(completed)
        .build();
  }

  private PageOutcome indexPage(
      String targetIndex, List<TranscriptSegment> segments, String model) {
    List<IndexingFailure> failures = new ArrayList<>();
    List<TranscriptSegment> candidates = new ArrayList<>();
    List<String> normalizedTexts = new ArrayList<>();
    for (TranscriptSegment segment : segments) {
      String normalized = normalizer.normalize(segment.getText());
      if (normalized.isEmpty()) {
        failures.add(new IndexingFailure(segment.getId(), IndexingFailure.EMPTY_TEXT));
        continue;
      }
      candidates.add(segment);
      normalizedTexts.add(normalized);
    }
    if (candidates.isEmpty()) {
      return record(0, failures);
    }

    List<List<Float>> embeddings;
    try {
      embeddings =
          embeddingRetry.executeSupplier(() -> embeddingProvider.embedBatch(normalizedTexts));
    } catch (RuntimeException e) {
      log.error(
          "Embedding failed for a page of {} documents: {}", candidates.size(), e.getMessage());
      failAll(candidates, IndexingFailure.EMBEDDING_FAILED, failures);
      return record(0, failures);
    }

    List<TranscriptSegment> documents = new ArrayList<>(candidates.size());
    for (int i = 0; i < candidates.size(); i++) {
      documents.add(
          candidates.get(i).toBuilder()
              .processedText(normalizedTexts.get(i))
              .embedding(embeddings.get(i))
              .embeddingModel(model)
              .build());
    }

    BulkIndexResult result;
    try {
      result =
          backendRetry.executeSupplier(
              () -> transcriptIndexService.bulkIndex(targetIndex, documents));
    } catch (RuntimeException e) {
      log.error("Bulk write of {} documents failed: {}", documents.size(), e.getMessage());
      failAll(candidates, IndexingFailure.BULK_FAILED, failures);
      return record(0, failures);
    }
    for (Map.Entry<String, String> failure : result.failures().entrySet()) {
      failures.add(
          new IndexingFailure(
              failure.getKey(), IndexingFailure.BULK_FAILED + ": " + failure.getValue()));
    }
    return record(result.indexed(), failures);
  }

  private static void failAll(
      List<TranscriptSegment> segments, String reason, List<IndexingFailure> failures) {
    for (TranscriptSegment segment : segments) {
      failures.add(new IndexingFailure(segment.getId(), reason));
    }
  }

  private PageOutcome record(int processed, List<IndexingFailure> failures) {
    meterRegistry.counter("indexing.documents.processed").increment(processed);
    meterRegistry.counter("indexing.documents.failed").increment(failures.size());
    return new PageOutcome(processed, failures);
  }

  private record PageOutcome(int processed, List<IndexingFailure> failures) {}
}
