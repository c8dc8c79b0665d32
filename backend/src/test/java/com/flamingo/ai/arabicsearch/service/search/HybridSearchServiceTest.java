package com.flamingo.ai.arabicsearch.service.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import co.elastic.clients.elasticsearch.core.SearchRequest;
import com.flamingo.ai.arabicsearch.config.ResilienceConfig;
import com.flamingo.ai.arabicsearch.config.SearchProperties;
import com.flamingo.ai.arabicsearch.domain.RankedSegment;
import com.flamingo.ai.arabicsearch.domain.SearchMode;
import com.flamingo.ai.arabicsearch.domain.SearchResult;
import com.flamingo.ai.arabicsearch.elasticsearch.SegmentHit;
import com.flamingo.ai.arabicsearch.elasticsearch.SegmentHits;
import com.flamingo.ai.arabicsearch.elasticsearch.TranscriptIndexService;
import com.flamingo.ai.arabicsearch.elasticsearch.TranscriptSegment;
import com.flamingo.ai.arabicsearch.embedding.EmbeddingProvider;
import com.flamingo.ai.arabicsearch.embedding.EmbeddingProviderState;
import com.flamingo.ai.arabicsearch.exception.BackendUnavailableException;
import com.flamingo.ai.arabicsearch.exception.ModeUnavailableException;
import com.flamingo.ai.arabicsearch.exception.ModelUnavailableException;
import com.flamingo.ai.arabicsearch.exception.SearchException;
import com.flamingo.ai.arabicsearch.exception.SearchValidationException;
import com.flamingo.ai.arabicsearch.query.TranscriptQueryBuilder;
import com.flamingo.ai.arabicsearch.text.ArabicTextNormalizer;
import com.flamingo.ai.arabicsearch.text.SynonymDictionary;
import com.flamingo.ai.arabicsearch.text.SynonymExpander;
import com.flamingo.ai.arabicsearch.text.TehMarbutaPolicy;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class HybridSearchServiceTest {

  private static final EmbeddingProviderState AVAILABLE =
      EmbeddingProviderState.available("test-model", 3);

  @Mock private TranscriptIndexService transcriptIndexService;
  @Mock private EmbeddingProvider embeddingProvider;

  private SearchProperties properties;
  private SimpleMeterRegistry meterRegistry;
  private HybridSearchService searchService;

  @BeforeEach
  void setUp() {
    properties = new SearchProperties();
    meterRegistry = new SimpleMeterRegistry();
    ArabicTextNormalizer normalizer = new ArabicTextNormalizer(TehMarbutaPolicy.KEEP, false);
    SynonymExpander expander =
        new SynonymExpander(
            SynonymDictionary.of(Map.of("صلاة", List.of("صلوات", "الصلاة")), normalizer));
    searchService =
        new HybridSearchService(
            transcriptIndexService,
            normalizer,
            expander,
            embeddingProvider,
            new TranscriptQueryBuilder(properties),
            properties,
            ResilienceConfig.retryOnce(
                RetryRegistry.ofDefaults(),
                "elasticsearch",
                BackendUnavailableException.class,
                Duration.ofMillis(1),
                meterRegistry),
            meterRegistry);
  }

  private static SegmentHits hits(String... ids) {
    List<SegmentHit> hits =
        Arrays.stream(ids)
            .map(
                id ->
                    new SegmentHit(
                        id,
                        2.0,
                        TranscriptSegment.builder()
                            .id(id)
                            .text("صلاة الفجر")
                            .start(12.0)
                            .end(15.5)
                            .videoLink("https://www.youtube.com/watch?v=abc123")
                            .build()))
            .toList();
    return new SegmentHits(hits, ids.length);
  }

  private SearchRequest capturedRequest() {
    ArgumentCaptor<SearchRequest> captor = ArgumentCaptor.forClass(SearchRequest.class);
    verify(transcriptIndexService).search(captor.capture());
    return captor.getValue();
  }

  @Nested
  @DisplayName("basic mode")
  class BasicMode {

    @Test
    @DisplayName("should query the raw text and pass hits through in order")
    void shouldPassHitsThrough() {
      when(transcriptIndexService.search(any(SearchRequest.class))).thenReturn(hits("d1", "d2"));

      SearchResult result = searchService.search("صلاة", 10, "basic");

      assertThat(result.requestedMode()).isEqualTo(SearchMode.BASIC);
      assertThat(result.modeUsed()).isEqualTo(SearchMode.BASIC);
      assertThat(result.isDegraded()).isFalse();
      assertThat(result.totalHits()).isEqualTo(2);
      assertThat(result.hits()).extracting(RankedSegment::documentId).containsExactly("d1", "d2");
      assertThat(result.hits()).extracting(RankedSegment::score).containsOnly(2.0);
      assertThat(capturedRequest().query().match().field()).isEqualTo("text");
    }

    @Test
    @DisplayName("should accept mode names in any case")
    void shouldAcceptModeInAnyCase() {
      when(transcriptIndexService.search(any(SearchRequest.class))).thenReturn(hits());

      assertThat(searchService.search("صلاة", 10, " BASIC ").modeUsed())
          .isEqualTo(SearchMode.BASIC);
    }

    @Test
    @DisplayName("should return an empty result when nothing matches")
    void shouldReturnEmptyResult() {
      when(transcriptIndexService.search(any(SearchRequest.class))).thenReturn(hits());

      SearchResult result = searchService.search("كلمة نادرة", 10, "basic");

      assertThat(result.hits()).isEmpty();
      assertThat(result.totalHits()).isZero();
    }
  }

  @Nested
  @DisplayName("enhanced mode")
  class EnhancedMode {

    @Test
    @DisplayName("should search the normalized query with its synonyms")
    void shouldExpandSynonyms() {
      when(transcriptIndexService.search(any(SearchRequest.class))).thenReturn(hits("d1"));

      SearchResult result = searchService.search("صـــلاة", 10, "enhanced");

      assertThat(result.modeUsed()).isEqualTo(SearchMode.ENHANCED);
      SearchRequest request = capturedRequest();
      assertThat(request.query().bool().should())
          .filteredOn(q -> q.isMatch() && q.match().fuzziness() == null)
          .extracting(q -> q.match().query().stringValue())
          .containsExactly("صلاة", "صلوات", "الصلاة");
      assertThat(request.query().bool().should().get(3).matchPhrase().query()).isEqualTo("صلاة");
    }
  }

  @Nested
  @DisplayName("semantic mode")
  class SemanticMode {

    @Test
    @DisplayName("should embed the normalized query and run a knn search")
    void shouldRunKnnSearch() {
      when(embeddingProvider.state()).thenReturn(AVAILABLE);
      when(embeddingProvider.embed("الصلاة")).thenReturn(List.of(0.1f, 0.2f, 0.3f));
      when(transcriptIndexService.search(any(SearchRequest.class))).thenReturn(hits("d3"));

      SearchResult result = searchService.search("الصَّلاة", 5, "semantic");

      assertThat(result.modeUsed()).isEqualTo(SearchMode.SEMANTIC);
      assertThat(result.fallbackReason()).isNull();
      SearchRequest request = capturedRequest();
      assertThat(request.knn()).hasSize(1);
      assertThat(request.knn().get(0).filter().get(0).term().value().stringValue())
          .isEqualTo("test-model");
    }

    @Test
    @DisplayName("should fall back to enhanced when the model is not loaded")
    void shouldFallBackWhenModelNotLoaded() {
      when(embeddingProvider.state())
          .thenReturn(EmbeddingProviderState.unavailable("test-model", "API key missing"));
      when(transcriptIndexService.search(any(SearchRequest.class))).thenReturn(hits("d1"));

      SearchResult result = searchService.search("صلاة", 10, "semantic");

      assertThat(result.requestedMode()).isEqualTo(SearchMode.SEMANTIC);
      assertThat(result.modeUsed()).isEqualTo(SearchMode.ENHANCED);
      assertThat(result.isDegraded()).isTrue();
      assertThat(result.fallbackReason()).contains("API key missing");
      assertThat(result.hits())
          .extracting(RankedSegment::modeUsed)
          .containsOnly(SearchMode.ENHANCED);
      assertThat(capturedRequest().query().isBool()).isTrue();
      verify(embeddingProvider, never()).embed(anyString());
      assertThat(
              meterRegistry
                  .counter("search.fallback", "from", "semantic", "to", "enhanced")
                  .count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("should fall back to enhanced when the embedding call fails")
    void shouldFallBackWhenEmbeddingFails() {
      when(embeddingProvider.state()).thenReturn(AVAILABLE);
      when(embeddingProvider.embed("صلاة"))
          .thenThrow(new ModelUnavailableException("embedding request failed: timeout"));
      when(transcriptIndexService.search(any(SearchRequest.class))).thenReturn(hits());

      SearchResult result = searchService.search("صلاة", 10, "semantic");

      assertThat(result.modeUsed()).isEqualTo(SearchMode.ENHANCED);
      assertThat(result.fallbackReason()).contains("timeout");
    }

    @Test
    @DisplayName("should report the mode unavailable when fallback is disabled")
    void shouldFailWhenFallbackDisabled() {
      properties.setSemanticFallbackEnabled(false);
      when(embeddingProvider.state())
          .thenReturn(EmbeddingProviderState.unavailable("test-model", "not initialized"));

      assertThatThrownBy(() -> searchService.search("صلاة", 10, "semantic"))
          .isInstanceOf(ModeUnavailableException.class);
      verifyNoInteractions(transcriptIndexService);
    }
  }

  @Nested
  @DisplayName("validation")
  class Validation {

    @Test
    @DisplayName("should reject unknown modes before touching the backend")
    void shouldRejectUnknownMode() {
      assertThatThrownBy(() -> searchService.search("صلاة", 10, "bogus"))
          .isInstanceOf(SearchValidationException.class)
          .hasMessageContaining("bogus");
      verifyNoInteractions(transcriptIndexService, embeddingProvider);
    }

    @Test
    @DisplayName("should reject non-positive sizes")
    void shouldRejectNonPositiveSize() {
      assertThatThrownBy(() -> searchService.search("صلاة", 0, "basic"))
          .isInstanceOf(SearchValidationException.class);
      verifyNoInteractions(transcriptIndexService);
    }

    @Test
    @DisplayName("should return no results for blank queries")
    void shouldReturnNothingForBlankQuery() {
      SearchResult result = searchService.search("   ", 10, "enhanced");

      assertThat(result.hits()).isEmpty();
      assertThat(result.modeUsed()).isEqualTo(SearchMode.ENHANCED);
      verifyNoInteractions(transcriptIndexService);
    }

    @Test
    @DisplayName("should return no results for queries that normalize to nothing")
    void shouldReturnNothingForDiacriticsOnlyQuery() {
      SearchResult result = searchService.search("ــَـ", 10, "basic");

      assertThat(result.hits()).isEmpty();
      verifyNoInteractions(transcriptIndexService);
    }

    @Test
    @DisplayName("should clamp sizes to the configured maximum")
    void shouldClampSize() {
      when(transcriptIndexService.search(any(SearchRequest.class))).thenReturn(hits());

      searchService.search("صلاة", 5000, "basic");

      assertThat(capturedRequest().size()).isEqualTo(1000);
    }
  }

  @Nested
  @DisplayName("backend failures")
  class BackendFailures {

    @Test
    @DisplayName("should retry once on a transient failure")
    void shouldRetryOnce() {
      when(transcriptIndexService.search(any(SearchRequest.class)))
          .thenThrow(new BackendUnavailableException("timeout", new IOException("timeout")))
          .thenReturn(hits("d1"));

      SearchResult result = searchService.search("صلاة", 10, "basic");

      assertThat(result.hits()).hasSize(1);
      verify(transcriptIndexService, times(2)).search(any(SearchRequest.class));
      assertThat(meterRegistry.counter("resilience.retries", "name", "elasticsearch").count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("should give up after the retry")
    void shouldGiveUpAfterRetry() {
      when(transcriptIndexService.search(any(SearchRequest.class)))
          .thenThrow(new BackendUnavailableException("down", new IOException("refused")));

      assertThatThrownBy(() -> searchService.search("صلاة", 10, "basic"))
          .isInstanceOf(BackendUnavailableException.class);
      verify(transcriptIndexService, times(2)).search(any(SearchRequest.class));
    }

    @Test
    @DisplayName("should not retry rejected requests")
    void shouldNotRetryRejectedRequests() {
      when(transcriptIndexService.search(any(SearchRequest.class)))
          .thenThrow(new SearchException("search failed on index"));

      assertThatThrownBy(() -> searchService.search("صلاة", 10, "basic"))
          .isInstanceOf(SearchException.class);
      verify(transcriptIndexService, times(1)).search(any(SearchRequest.class));
    }
  }

  @Nested
  @DisplayName("metrics")
  class Metrics {

    @Test
    @DisplayName("should time searches made with request parameters")
    void shouldTimeParameterSearch() {
      when(transcriptIndexService.search(any(SearchRequest.class))).thenReturn(hits("d1"));

      searchService.search("صلاة", 10, "basic");
      searchService.search("صلاة", 10, "enhanced");

      assertThat(meterRegistry.timer("search.hybrid").count()).isEqualTo(2);
      assertThat(
              meterRegistry
                  .counter("search.requests", "mode", "basic", "mode_used", "basic")
                  .count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("should time searches that fail")
    void shouldTimeFailedSearch() {
      when(transcriptIndexService.search(any(SearchRequest.class)))
          .thenThrow(new SearchException("search failed on index"));

      assertThatThrownBy(() -> searchService.search("صلاة", 10, "basic"))
          .isInstanceOf(SearchException.class);
      assertThat(meterRegistry.timer("search.hybrid").count()).isEqualTo(1);
    }
  }
}
