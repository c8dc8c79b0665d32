package com.flamingo.ai.arabicsearch.query;

import static com.flamingo.ai.arabicsearch.elasticsearch.TranscriptIndexService.FIELD_EMBEDDING;
import static com.flamingo.ai.arabicsearch.elasticsearch.TranscriptIndexService.FIELD_EMBEDDING_MODEL;
import static com.flamingo.ai.arabicsearch.elasticsearch.TranscriptIndexService.FIELD_PROCESSED_TEXT;
import static com.flamingo.ai.arabicsearch.elasticsearch.TranscriptIndexService.FIELD_TEXT;

import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import com.flamingo.ai.arabicsearch.config.SearchProperties;
import com.flamingo.ai.arabicsearch.domain.SearchMode;
import com.flamingo.ai.arabicsearch.exception.ModeUnavailableException;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Builds the Elasticsearch request for each search mode. Pure: performs no I/O.
 *
 * <ul>
 *   <li>basic: {@code match} of the raw query on {@code text}
 *   <li>enhanced: {@code bool.should} on {@code processed_text} with one {@code match} per expanded
 *       term, a boosted {@code match_phrase} of the normalized query and a fuzzy {@code match} of
 *       the normalized query
 *   <li>semantic: {@code knn} on {@code text_embedding} restricted to the current embedding model
 * </ul>
 */
@Component
@RequiredArgsConstructor
public class TranscriptQueryBuilder {

  static final int MAX_NUM_CANDIDATES = 10_000;

  private final SearchProperties properties;

  /**
   * Builds the request for a mode.
   *
   * @throws ModeUnavailableException if {@code mode} is semantic and no embedding is supplied
   */
  public SearchRequest build(SearchMode mode, QueryInput input) {
    return switch (mode) {
      case BASIC -> basic(input);
      case ENHANCED -> enhanced(input);
      case SEMANTIC -> semantic(input);
    };
  }

  private SearchRequest basic(QueryInput input) {
    return SearchRequest.of(
        s ->
            s.index(properties.getIndex())
                .size(input.size())
                .trackTotalHits(t -> t.enabled(true))
                .query(q -> q.match(m -> m.field(FIELD_TEXT).query(input.rawQuery()))));
  }

  private SearchRequest enhanced(QueryInput input) {
    SearchProperties.Enhanced config = properties.getEnhanced();
    List<Query> should = new ArrayList<>();
    for (String term : input.expandedTerms()) {
      should.add(
          Query.of(
              q ->
                  q.match(
                      m ->
                          m.field(FIELD_PROCESSED_TEXT)
                              .query(term)
                              .boost(config.getTermBoost()))));
    }
    should.add(
        Query.of(
            q ->
                q.matchPhrase(
                    p ->
                        p.field(FIELD_PROCESSED_TEXT)
                            .query(input.normalizedQuery())
                            .boost(config.getPhraseBoost()))));
    should.add(
        Query.of(
            q ->
                q.match(
                    m ->
                        m.field(FIELD_PROCESSED_TEXT)
                            .query(input.normalizedQuery())
                            .fuzziness(config.getFuzziness())
                            .boost(config.getFuzzyBoost()))));

    return SearchRequest.of(
        s ->
            s.index(properties.getIndex())
                .size(input.size())
                .trackTotalHits(t -> t.enabled(true))
                .query(q -> q.bool(b -> b.should(should).minimumShouldMatch("1"))));
  }

  private SearchRequest semantic(QueryInput input) {
    List<Float> embedding = input.queryEmbedding();
    if (embedding == null || embedding.isEmpty()) {
      throw new ModeUnavailableException(SearchMode.SEMANTIC, "no query embedding available");
    }
    int numCandidates = numCandidates(input.size());
    return SearchRequest.of(
        s ->
            s.index(properties.getIndex())
                .size(input.size())
                .trackTotalHits(t -> t.enabled(true))
                .knn(
                    k ->
                        k.field(FIELD_EMBEDDING)
                            .queryVector(embedding)
                            .k(input.size())
                            .numCandidates(numCandidates)
                            .filter(
                                f ->
                                    f.term(
                                        t ->
                                            t.field(FIELD_EMBEDDING_MODEL)
                                                .value(input.embeddingModel())))));
  }

  int numCandidates(int size) {
    int candidates = Math.max(size * 2, properties.getSemantic().getMinCandidates());
    return Math.min(candidates, MAX_NUM_CANDIDATES);
  }
}
