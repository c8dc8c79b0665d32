package com.flamingo.ai.arabicsearch.service.search;

import co.elastic.clients.elasticsearch.core.SearchRequest;
import com.flamingo.ai.arabicsearch.config.ResilienceConfig;
import com.flamingo.ai.arabicsearch.config.SearchProperties;
import com.flamingo.ai.arabicsearch.domain.RankedSegment;
import com.flamingo.ai.arabicsearch.domain.SearchMode;
import com.flamingo.ai.arabicsearch.domain.SearchQuery;
import com.flamingo.ai.arabicsearch.domain.SearchResult;
import com.flamingo.ai.arabicsearch.elasticsearch.SegmentHit;
import com.flamingo.ai.arabicsearch.elasticsearch.SegmentHits;
import com.flamingo.ai.arabicsearch.elasticsearch.TranscriptIndexService;
import com.flamingo.ai.arabicsearch.embedding.EmbeddingProvider;
import com.flamingo.ai.arabicsearch.embedding.EmbeddingProviderState;
import com.flamingo.ai.arabicsearch.exception.BackendUnavailableException;
import com.flamingo.ai.arabicsearch.exception.ModeUnavailableException;
import com.flamingo.ai.arabicsearch.exception.ModelUnavailableException;
import com.flamingo.ai.arabicsearch.query.QueryInput;
import com.flamingo.ai.arabicsearch.query.TranscriptQueryBuilder;
import com.flamingo.ai.arabicsearch.text.ArabicTextNormalizer;
import com.flamingo.ai.arabicsearch.text.SynonymExpander;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Executes Arabic transcript searches in basic, enhanced or semantic mode.
 *
 * <p>Pipeline: validate, normalize, expand or embed depending on the mode, build the request and
 * execute it with a single retry on transient backend failures. A semantic request whose embedding
 * cannot be produced is downgraded to enhanced mode and the downgrade is reported in the result.
 */
@Service
@Slf4j
public class HybridSearchService {

  private final TranscriptIndexService transcriptIndexService;
  private final ArabicTextNormalizer normalizer;
  private final SynonymExpander synonymExpander;
  private final EmbeddingProvider embeddingProvider;
  private final TranscriptQueryBuilder queryBuilder;
  private final SearchProperties properties;
  private final Retry backendRetry;
  private final MeterRegistry meterRegistry;

  public HybridSearchService(
      TranscriptIndexService transcriptIndexService,
      ArabicTextNormalizer normalizer,
      SynonymExpander synonymExpander,
      EmbeddingProvider embeddingProvider,
      TranscriptQueryBuilder queryBuilder,
      SearchProperties properties,
      @Qualifier(ResilienceConfig.ELASTICSEARCH_RETRY) Retry backendRetry,
      MeterRegistry meterRegistry) {
    this.transcriptIndexService = transcriptIndexService;
    this.normalizer = normalizer;
    this.synonymExpander = synonymExpander;
    this.embeddingProvider = embeddingProvider;
    this.queryBuilder = queryBuilder;
    this.properties = properties;
    this.backendRetry = backendRetry;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Searches with consumer-supplied parameters.
   *
   * @param query raw Arabic query
   * @param size number of hits requested, must be positive
   * @param mode {@code basic}, {@code enhanced} or {@code semantic}, case-insensitive
   * @throws com.flamingo.ai.arabicsearch.exception.SearchValidationException on invalid size or
   *     mode
   */
  public SearchResult search(String query, int size, String mode) {
    return search(SearchQuery.of(query, size, mode));
  }

  /**
   * Searches the transcript index.
   *
   * @throws BackendUnavailableException if the backend stays unreachable after one retry
   * @throws ModeUnavailableException if semantic mode cannot be served and fallback is disabled
   */
  public SearchResult search(SearchQuery query) {
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      return runSearch(query);
    } finally {
      sample.stop(meterRegistry.timer("search.hybrid"));
    }
  }

  private SearchResult runSearch(SearchQuery query) {
    SearchMode requested = query.mode();
    if (query.isBlank()) {
      log.debug("Blank query, returning no results");
      return SearchResult.empty(requested);
    }
    int size = Math.min(query.size(), properties.getMaxSize());
    if (size < query.size()) {
      log.debug("Requested size {} clamped to {}", query.size(), size);
    }
    String normalized = normalizer.normalize(query.query());
    if (normalized.isEmpty()) {
      log.debug("Query normalized to nothing, returning no results");
      return SearchResult.empty(requested);
    }

    SearchResult result =
        switch (requested) {
          case BASIC -> execute(requested, SearchMode.BASIC, basicInput(query, normalized, size));
          case ENHANCED ->
              execute(requested, SearchMode.ENHANCED, enhancedInput(query, normalized, size));
          case SEMANTIC -> semantic(query, normalized, size);
        };

    meterRegistry
        .counter(
            "search.requests",
            "mode",
            tag(result.requestedMode()),
            "mode_used",
            tag(result.modeUsed()))
        .increment();
    log.info(
        "Search mode={} modeUsed={} size={} totalHits={} returned={}",
        tag(result.requestedMode()),
        tag(result.modeUsed()),
        size,
        result.totalHits(),
        result.hits().size());
    return result;
  }

  private SearchResult semantic(SearchQuery query, String normalized, int size) {
    EmbeddingProviderState state = embeddingProvider.state();
    if (!state.available()) {
      return fallback(query, normalized, size, state.failureReason());
    }
    List<Float> embedding;
    try {
      embedding = embeddingProvider.embed(normalized);
    } catch (ModelUnavailableException e) {
      return fallback(query, normalized, size, e.getReason());
    }
    QueryInput input =
        QueryInput.builder()
            .rawQuery(query.query())
            .normalizedQuery(normalized)
            .queryEmbedding(embedding)
            .embeddingModel(state.modelId())
            .size(size)
            .build();
    return execute(SearchMode.SEMANTIC, SearchMode.SEMANTIC, input);
  }

  private SearchResult fallback(SearchQuery query, String normalized, int size, String reason) {
    if (!properties.isSemanticFallbackEnabled()) {
      throw new ModeUnavailableException(SearchMode.SEMANTIC, reason);
    }
    log.warn("Semantic search unavailable ({}), falling back to enhanced", reason);
    meterRegistry.counter("search.fallback", "from", "semantic", "to", "enhanced").increment();
    SearchResult enhanced =
        execute(SearchMode.SEMANTIC, SearchMode.ENHANCED, enhancedInput(query, normalized, size));
    return new SearchResult(
        SearchMode.SEMANTIC,
        SearchMode.ENHANCED,
        enhanced.hits(),
        enhanced.totalHits(),
        "embedding model unavailable: " + reason);
  }

  private QueryInput basicInput(SearchQuery query, String normalized, int size) {
    return QueryInput.builder()
        .rawQuery(query.query())
        .normalizedQuery(normalized)
        .size(size)
        .build();
  }

  private QueryInput enhancedInput(SearchQuery query, String normalized, int size) {
    List<String> expanded = synonymExpander.expand(normalizer.tokenize(normalized));
    return QueryInput.builder()
        .rawQuery(query.query())
        .normalizedQuery(normalized)
        .expandedTerms(expanded)
        .size(size)
        .build();
  }

  private SearchResult execute(SearchMode requested, SearchMode modeUsed, QueryInput input) {
    SearchRequest request = queryBuilder.build(modeUsed, input);
    SegmentHits hits = backendRetry.executeSupplier(() -> transcriptIndexService.search(request));
    List<RankedSegment> ranked =
        hits.hits().stream().map(hit -> toRankedSegment(hit, modeUsed)).toList();
    return new SearchResult(requested, modeUsed, ranked, hits.totalHits(), null);
  }

  private static RankedSegment toRankedSegment(SegmentHit hit, SearchMode modeUsed) {
    return new RankedSegment(hit.id(), hit.score(), modeUsed, hit.segment());
  }

  private static String tag(SearchMode mode) {
    return mode.name().toLowerCase(Locale.ROOT);
  }
}
