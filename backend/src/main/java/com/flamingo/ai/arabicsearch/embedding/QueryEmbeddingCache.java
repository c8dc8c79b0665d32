package com.flamingo.ai.arabicsearch.embedding;

import com.flamingo.ai.arabicsearch.config.SearchProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.util.List;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Bounded cache of query embeddings keyed by model id and normalized text. */
@Component
@Slf4j
public class QueryEmbeddingCache {

  private final boolean enabled;
  private final Cache<String, List<Float>> cache;

  public QueryEmbeddingCache(SearchProperties properties) {
    SearchProperties.Embedding.Cache config = properties.getEmbedding().getCache();
    this.enabled = config.isEnabled();
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(config.getMaxEntries())
            .expireAfterWrite(config.getTtl())
            .build();
    log.info(
        "Query embedding cache: enabled={}, maxEntries={}, ttl={}",
        enabled,
        config.getMaxEntries(),
        config.getTtl());
  }

  /** Returns the cached vector or computes, stores and returns it. */
  public List<Float> get(String modelId, String text, Function<String, List<Float>> loader) {
    if (!enabled) {
      return loader.apply(text);
    }
    return cache.get(modelId + '\u0000' + text, key -> List.copyOf(loader.apply(text)));
  }

  public void invalidateAll() {
    cache.invalidateAll();
  }

  public long size() {
    cache.cleanUp();
    return cache.estimatedSize();
  }
}
