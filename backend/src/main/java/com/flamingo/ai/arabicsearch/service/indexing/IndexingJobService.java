package com.flamingo.ai.arabicsearch.service.indexing;

import com.flamingo.ai.arabicsearch.config.AsyncConfig;
import com.flamingo.ai.arabicsearch.config.SearchProperties;
import com.flamingo.ai.arabicsearch.exception.IndexingAlreadyRunningException;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/** Runs the indexing pipeline, at most one run at a time. */
@Service
@Slf4j
public class IndexingJobService {

  private final EmbeddingIndexingPipeline pipeline;
  private final SearchProperties properties;
  private final Executor indexingExecutor;
  private final AtomicBoolean running = new AtomicBoolean(false);

  private volatile IndexingReport lastReport;
  private volatile String lastError;

  public IndexingJobService(
      EmbeddingIndexingPipeline pipeline,
      SearchProperties properties,
      @Qualifier(AsyncConfig.INDEXING_EXECUTOR) Executor indexingExecutor) {
    this.pipeline = pipeline;
    this.properties = properties;
    this.indexingExecutor = indexingExecutor;
  }

  /**
   * Starts a run in the background. Null arguments fall back to the configured defaults.
   *
   * @throws IndexingAlreadyRunningException if a run is in progress
   */
  public CompletableFuture<IndexingReport> submit(
      String sourceIndex, String targetIndex, Integer batchSize) {
    IndexingParameters parameters = resolve(sourceIndex, targetIndex, batchSize);
    acquire();
    try {
      return CompletableFuture.supplyAsync(() -> execute(parameters), indexingExecutor);
    } catch (RejectedExecutionException e) {
      running.set(false);
      throw e;
    }
  }

  /**
   * Runs in the calling thread.
   *
   * @throws IndexingAlreadyRunningException if a run is in progress
   */
  public IndexingReport runNow(String sourceIndex, String targetIndex, Integer batchSize) {
    IndexingParameters parameters = resolve(sourceIndex, targetIndex, batchSize);
    acquire();
    return execute(parameters);
  }

  public boolean isRunning() {
    return running.get();
  }

  public Optional<IndexingReport> lastReport() {
    return Optional.ofNullable(lastReport);
  }

  public Optional<String> lastError() {
    return Optional.ofNullable(lastError);
  }

  private void acquire() {
    if (!running.compareAndSet(false, true)) {
      throw new IndexingAlreadyRunningException();
    }
  }

  private IndexingReport execute(IndexingParameters parameters) {
    try {
      IndexingReport report =
          pipeline.run(parameters.sourceIndex(), parameters.targetIndex(), parameters.batchSize());
      lastReport = report;
      lastError = null;
      return report;
    } catch (RuntimeException e) {
      lastError = e.getMessage();
      log.error(
          "Indexing {} -> {} failed: {}",
          parameters.sourceIndex(),
          parameters.targetIndex(),
          e.getMessage(),
          e);
      throw e;
    } finally {
      running.set(false);
    }
  }

  private IndexingParameters resolve(String sourceIndex, String targetIndex, Integer batchSize) {
    SearchProperties.Indexing defaults = properties.getIndexing();
    return new IndexingParameters(
        sourceIndex != null && !sourceIndex.isBlank() ? sourceIndex : defaults.getSourceIndex(),
        targetIndex != null && !targetIndex.isBlank() ? targetIndex : defaults.getTargetIndex(),
        batchSize != null ? batchSize : defaults.getBatchSize());
  }

  private record IndexingParameters(String sourceIndex, String targetIndex, int batchSize) {}
}
