package com.flamingo.ai.arabicsearch.embedding;

import com.flamingo.ai.arabicsearch.config.SearchProperties;
import com.flamingo.ai.arabicsearch.exception.ModelUnavailableException;
import com.google.common.collect.Lists;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

/**
 * Embedding provider backed by a langchain4j {@link EmbeddingModel}.
 *
 * <p>The model bean is resolved lazily so that a missing API key or an unreachable model server
 * leaves the provider unavailable instead of failing application startup.
 */
@Service
@Slf4j
public class LangChain4jEmbeddingProvider implements EmbeddingProvider {

  private final ObjectProvider<EmbeddingModel> embeddingModelProvider;
  private final QueryEmbeddingCache queryEmbeddingCache;
  private final MeterRegistry meterRegistry;
  private final String modelId;
  private final int chunkSize;
  private final String probeText;

  private volatile LoadedModel loaded;

  public LangChain4jEmbeddingProvider(
      ObjectProvider<EmbeddingModel> embeddingModelProvider,
      QueryEmbeddingCache queryEmbeddingCache,
      SearchProperties properties,
      MeterRegistry meterRegistry) {
    this.embeddingModelProvider = embeddingModelProvider;
    this.queryEmbeddingCache = queryEmbeddingCache;
    this.meterRegistry = meterRegistry;
    this.modelId = properties.getEmbedding().getModelId();
    this.chunkSize = properties.getEmbedding().getChunkSize();
    this.probeText = properties.getEmbedding().getProbeText();
    this.loaded = new LoadedModel(null, EmbeddingProviderState.notInitialized(modelId));
  }

  @PostConstruct
  void loadOnStartup() {
    initialize();
  }

  @Override
  public synchronized EmbeddingProviderState initialize() {
    log.info("Loading embedding model '{}'", modelId);
    try {
      EmbeddingModel model = embeddingModelProvider.getObject();
      Response<Embedding> probe = model.embed(probeText);
      int dimensions = probe.content().vector().length;
      if (dimensions == 0) {
        throw new IllegalStateException("probe returned an empty vector");
      }
      loaded = new LoadedModel(model, EmbeddingProviderState.available(modelId, dimensions));
      queryEmbeddingCache.invalidateAll();
      meterRegistry.counter("embedding.initializations", "outcome", "success").increment();
      log.info("Embedding model '{}' loaded, dimensions={}", modelId, dimensions);
    } catch (RuntimeException e) {
      String reason = e.getClass().getSimpleName() + ": " + e.getMessage();
      loaded = new LoadedModel(null, EmbeddingProviderState.unavailable(modelId, reason));
      meterRegistry.counter("embedding.initializations", "outcome", "failure").increment();
      log.error(
          "Embedding model '{}' unavailable, semantic search disabled: {}", modelId, reason, e);
    }
    return loaded.state();
  }

  @Override
  public EmbeddingProviderState reload() {
    log.info("Reloading embedding model '{}'", modelId);
    return initialize();
  }

  @Override
  public EmbeddingProviderState state() {
    return loaded.state();
  }

  @Override
  public List<Float> embed(String text) {
    LoadedModel current = requireLoaded();
    return queryEmbeddingCache.get(modelId, text, t -> embedOne(current, t));
  }

  private List<Float> embedOne(LoadedModel current, String text) {
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      float[] vector = current.model().embed(text).content().vector();
      checkDimensions(current, vector.length);
      meterRegistry.counter("embedding.requests.success").increment();
      return EmbeddingVectors.toFloatList(vector);
    } catch (RuntimeException e) {
      meterRegistry.counter("embedding.requests.failure").increment();
      log.warn("Query embedding failed: {}", e.getMessage());
      throw new ModelUnavailableException("embedding request failed: " + e.getMessage(), e);
    } finally {
      sample.stop(meterRegistry.timer("embedding.duration"));
    }
  }

  @Override
  public List<List<Float>> embedBatch(List<String> texts) {
    LoadedModel current = requireLoaded();
    List<List<Float>> vectors = new ArrayList<>(texts.size());
    for (List<String> chunk : Lists.partition(texts, chunkSize)) {
      List<TextSegment> segments = chunk.stream().map(TextSegment::from).toList();
      List<Embedding> embeddings;
      Timer.Sample sample = Timer.start(meterRegistry);
      try {
        embeddings = current.model().embedAll(segments).content();
      } catch (RuntimeException e) {
        meterRegistry.counter("embedding.batch.failure").increment();
        throw new ModelUnavailableException("batch embedding failed: " + e.getMessage(), e);
      } finally {
        sample.stop(meterRegistry.timer("embedding.batch.duration"));
      }
      if (embeddings.size() != chunk.size()) {
        throw new IllegalStateException(
            "Model returned " + embeddings.size() + " embeddings for " + chunk.size() + " texts");
      }
      for (Embedding embedding : embeddings) {
        checkDimensions(current, embedding.vector().length);
        vectors.add(EmbeddingVectors.toFloatList(embedding.vector()));
      }
      meterRegistry.counter("embedding.batch.texts").increment(chunk.size());
    }
    log.debug("Embedded {} texts in chunks of {}", texts.size(), chunkSize);
    return vectors;
  }

  private LoadedModel requireLoaded() {
    LoadedModel current = loaded;
    if (!current.state().available()) {
      throw new ModelUnavailableException(current.state().failureReason());
    }
    return current;
  }

  private static void checkDimensions(LoadedModel current, int actual) {
    int expected = current.state().dimensions();
    if (actual != expected) {
      throw new IllegalStateException(
          "Embedding dimension mismatch: model loaded with " + expected + ", got " + actual);
    }
  }

  private record LoadedModel(EmbeddingModel model, EmbeddingProviderState state) {}
}
