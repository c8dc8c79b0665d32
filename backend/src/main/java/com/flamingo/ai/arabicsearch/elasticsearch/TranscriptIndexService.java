package com.flamingo.ai.arabicsearch.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.SortOptions;
import co.elastic.clients.elasticsearch._types.SortOrder;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.mapping.TextProperty;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.bulk.BulkResponseItem;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import co.elastic.clients.elasticsearch.indices.PutMappingRequest;
import com.flamingo.ai.arabicsearch.exception.BackendUnavailableException;
import com.flamingo.ai.arabicsearch.exception.SearchException;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Elasticsearch adapter for transcript segment indices.
 *
 * <p>Executes prepared search requests, scans source indices page by page, maintains the vector
 * index mapping and bulk-writes embedded segments. Transport failures and transient HTTP statuses
 * surface as {@link BackendUnavailableException}; any other backend error surfaces as {@link
 * SearchException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TranscriptIndexService {

  public static final String FIELD_TEXT = "text";
  public static final String FIELD_PROCESSED_TEXT = "processed_text";
  public static final String FIELD_EMBEDDING = "text_embedding";
  public static final String FIELD_EMBEDDING_MODEL = "embedding_model";
  public static final String FIELD_START = "start";
  public static final String FIELD_END = "end";
  public static final String FIELD_VIDEO_LINK = "video_link";

  private static final String TEXT_ANALYZER = "arabic";
  private static final Set<Integer> TRANSIENT_STATUSES = Set.of(408, 429, 502, 503, 504);
  private static final List<String> SOURCE_FIELDS =
      List.of(FIELD_TEXT, FIELD_START, FIELD_END, FIELD_VIDEO_LINK);

  private final ElasticsearchClient elasticsearchClient;
  private final MeterRegistry meterRegistry;

  /**
   * Executes a prepared search request.
   *
   * @param request request built by the query builder
   * @return hits in backend order with the total hit count
   */
  @Timed(value = "elasticsearch.search", description = "Time to execute a transcript search")
  public SegmentHits search(SearchRequest request) {
    try {
      SearchResponse<Map> response = elasticsearchClient.search(request, Map.class);
      List<Hit<Map>> hits = response.hits().hits();
      long totalHits =
          response.hits().total() != null ? response.hits().total().value() : hits.size();
      List<SegmentHit> results = new ArrayList<>(hits.size());
      for (Hit<Map> hit : hits) {
        results.add(new SegmentHit(hit.id(), hit.score(), toSegment(hit)));
      }
      log.debug(
          "[search] index={} totalHits={} returned={}", request.index(), totalHits, hits.size());
      return new SegmentHits(results, totalHits);
    } catch (IOException | ElasticsearchException e) {
      throw translate("search", request.index().toString(), e);
    }
  }

  /**
   * Reads one page of an index in a stable sort order.
   *
   * @param index index to scan
   * @param sortFields fields that order the index uniquely
   * @param searchAfter sort values of the last document of the previous page, empty for the first
   *     page
   * @param pageSize maximum number of documents to return
   */
  public SegmentPage readPage(
      String index, List<String> sortFields, List<Object> searchAfter, int pageSize) {
    List<SortOptions> sort =
        sortFields.stream()
            .map(
                field ->
                    SortOptions.of(o -> o.field(f -> f.field(field).order(SortOrder.Asc))))
            .toList();
    SearchRequest request =
        SearchRequest.of(
            s -> {
              s.index(index)
                  .size(pageSize)
                  .query(q -> q.matchAll(m -> m))
                  .sort(sort)
                  .source(src -> src.filter(f -> f.includes(SOURCE_FIELDS)));
              if (searchAfter != null && !searchAfter.isEmpty()) {
                s.searchAfter(
                    searchAfter.stream().map(TranscriptIndexService::toFieldValue).toList());
              }
              return s;
            });
    try {
      SearchResponse<Map> response = elasticsearchClient.search(request, Map.class);
      List<Hit<Map>> hits = response.hits().hits();
      List<TranscriptSegment> segments = new ArrayList<>(hits.size());
      for (Hit<Map> hit : hits) {
        segments.add(toSegment(hit));
      }
      List<Object> nextCursor = hits.isEmpty() ? List.of() : sortValues(hits.get(hits.size() - 1));
      boolean endsOnTie =
          hits.size() > 1 && nextCursor.equals(sortValues(hits.get(hits.size() - 2)));
      log.debug("[readPage] index={} after={} returned={}", index, searchAfter, hits.size());
      return new SegmentPage(segments, nextCursor, endsOnTie);
    } catch (IOException | ElasticsearchException e) {
      throw translate("readPage", index, e);
    }
  }

  /**
   * Creates the vector index if missing, otherwise adds missing fields and verifies that existing
   * fields have the expected types and vector dimensions.
   *
   * @throws IllegalStateException if the existing mapping is incompatible
   */
  public void ensureVectorIndex(String index, int dimensions) {
    Map<String, Property> expected = vectorIndexProperties(dimensions);
    try {
      boolean exists = elasticsearchClient.indices().exists(e -> e.index(index)).value();
      if (!exists) {
        CreateIndexRequest request =
            CreateIndexRequest.of(
                c ->
                    c.index(index)
                        .mappings(m -> m.dynamic(DynamicMapping.False).properties(expected)));
        elasticsearchClient.indices().create(request);
        log.info("Created Elasticsearch index '{}' with {}-dim vectors", index, dimensions);
      } else {
        updateAndValidateMappings(index, expected, dimensions);
      }
    } catch (IOException | ElasticsearchException e) {
      throw translate("ensureVectorIndex", index, e);
    }
  }

  private void updateAndValidateMappings(
      String index, Map<String, Property> expected, int dimensions) throws IOException {
    var response = elasticsearchClient.indices().getMapping(g -> g.index(index));
    var indexMapping = response.get(index);
    if (indexMapping == null) {
      return;
    }
    Map<String, Property> actual = indexMapping.mappings().properties();

    List<String> mismatches = new ArrayList<>();
    for (Map.Entry<String, Property> entry : expected.entrySet()) {
      String field = entry.getKey();
      Property actualProperty = actual.get(field);
      if (actualProperty == null) {
        continue;
      }
      if (entry.getValue()._kind() != actualProperty._kind()) {
        mismatches.add(
            String.format(
                "field '%s' expected type '%s' but found '%s'",
                field, entry.getValue()._kind(), actualProperty._kind()));
      } else if (actualProperty.isDenseVector()
          && actualProperty.denseVector().dims() != null
          && actualProperty.denseVector().dims() != dimensions) {
        mismatches.add(
            String.format(
                "field '%s' expected %d dimensions but found %d",
                field, dimensions, actualProperty.denseVector().dims()));
      }
    }
    if (!mismatches.isEmpty()) {
      String message =
          "Index '"
              + index
              + "' has an incompatible mapping: "
              + String.join("; ", mismatches)
              + ". Delete the index or choose another target index.";
      log.error(message);
      throw new IllegalStateException(message);
    }

    Map<String, Property> missingFields = new HashMap<>();
    for (Map.Entry<String, Property> entry : expected.entrySet()) {
      if (!actual.containsKey(entry.getKey())) {
        missingFields.put(entry.getKey(), entry.getValue());
      }
    }
    if (!missingFields.isEmpty()) {
      elasticsearchClient
          .indices()
          .putMapping(PutMappingRequest.of(p -> p.index(index).properties(missingFields)));
      log.info(
          "Added {} new field(s) to index '{}': {}",
          missingFields.size(),
          index,
          missingFields.keySet());
    } else {
      log.debug("Index '{}' mapping verified correctly.", index);
    }
  }

  /**
   * Writes segments under their ids. Per-document rejections are reported in the result, never
   * thrown.
   */
  @Timed(value = "elasticsearch.bulk", description = "Time to bulk index transcript segments")
  public BulkIndexResult bulkIndex(String index, List<TranscriptSegment> segments) {
    if (segments.isEmpty()) {
      return new BulkIndexResult(0, Map.of());
    }
    BulkRequest.Builder bulkBuilder = new BulkRequest.Builder();
    for (TranscriptSegment segment : segments) {
      Map<String, Object> document = toDocument(segment);
      bulkBuilder.operations(
          op -> op.index(idx -> idx.index(index).id(segment.getId()).document(document)));
    }
    try {
      BulkResponse response = elasticsearchClient.bulk(bulkBuilder.build());
      Map<String, String> failures = new LinkedHashMap<>();
      if (response.errors()) {
        for (BulkResponseItem item : response.items()) {
          if (item.error() != null) {
            failures.put(item.id(), item.error().type() + ": " + item.error().reason());
          }
        }
        log.warn(
            "{} of {} documents failed to index in {}", failures.size(), segments.size(), index);
        meterRegistry.counter("transcript.index.errors").increment(failures.size());
      }
      int indexed = segments.size() - failures.size();
      meterRegistry.counter("transcript.indexed").increment(indexed);
      return new BulkIndexResult(indexed, failures);
    } catch (IOException | ElasticsearchException e) {
      throw translate("bulkIndex", index, e);
    }
  }

  public void refresh(String index) {
    try {
      elasticsearchClient.indices().refresh(r -> r.index(index));
      log.debug("Refreshed index: {}", index);
    } catch (IOException | ElasticsearchException e) {
      throw translate("refresh", index, e);
    }
  }

  public long count(String index) {
    try {
      return elasticsearchClient.count(c -> c.index(index)).count();
    } catch (IOException | ElasticsearchException e) {
      throw translate("count", index, e);
    }
  }

  /** Mapping of the vector index written by the indexing pipeline. */
  @VisibleForTesting
  static Map<String, Property> vectorIndexProperties(int dimensions) {
    Map<String, Property> properties = new HashMap<>();
    properties.put(
        FIELD_TEXT, Property.of(p -> p.text(TextProperty.of(t -> t.analyzer(TEXT_ANALYZER)))));
    properties.put(
        FIELD_PROCESSED_TEXT,
        Property.of(p -> p.text(TextProperty.of(t -> t.analyzer(TEXT_ANALYZER)))));
    properties.put(
        FIELD_EMBEDDING,
        Property.of(
            p ->
                p.denseVector(
                    DenseVectorProperty.of(
                        d ->
                            d.dims(dimensions)
                                .index(true)
                                .similarity(DenseVectorSimilarity.Cosine)))));
    properties.put(FIELD_EMBEDDING_MODEL, Property.of(p -> p.keyword(k -> k)));
    properties.put(FIELD_START, Property.of(p -> p.float_(f -> f)));
    properties.put(FIELD_END, Property.of(p -> p.float_(f -> f)));
    properties.put(FIELD_VIDEO_LINK, Property.of(p -> p.keyword(k -> k)));
    return properties;
  }

  @VisibleForTesting
  static Map<String, Object> toDocument(TranscriptSegment segment) {
    Map<String, Object> document = new HashMap<>();
    document.put(FIELD_TEXT, segment.getText());
    document.put(FIELD_PROCESSED_TEXT, segment.getProcessedText());
    document.put(FIELD_EMBEDDING, segment.getEmbedding());
    document.put(FIELD_EMBEDDING_MODEL, segment.getEmbeddingModel());
    if (segment.getStart() != null) {
      document.put(FIELD_START, segment.getStart());
    }
    if (segment.getEnd() != null) {
      document.put(FIELD_END, segment.getEnd());
    }
    if (segment.getVideoLink() != null) {
      document.put(FIELD_VIDEO_LINK, segment.getVideoLink());
    }
    return document;
  }

  private static List<Object> sortValues(Hit<Map> hit) {
    List<Object> values = new ArrayList<>(hit.sort().size());
    for (FieldValue value : hit.sort()) {
      values.add(fromFieldValue(value));
    }
    return values;
  }

  private static TranscriptSegment toSegment(Hit<Map> hit) {
    Map<String, Object> source = hit.source() != null ? hit.source() : Map.of();
    return TranscriptSegment.builder()
        .id(hit.id())
        .text((String) source.get(FIELD_TEXT))
        .processedText((String) source.get(FIELD_PROCESSED_TEXT))
        .embeddingModel((String) source.get(FIELD_EMBEDDING_MODEL))
        .start(toDouble(source.get(FIELD_START)))
        .end(toDouble(source.get(FIELD_END)))
        .videoLink((String) source.get(FIELD_VIDEO_LINK))
        .build();
  }

  private static Double toDouble(Object value) {
    if (value instanceof Number number) {
      return number.doubleValue();
    }
    if (value instanceof String text && !text.isBlank()) {
      return Double.valueOf(text);
    }
    return null;
  }

  @VisibleForTesting
  static FieldValue toFieldValue(Object value) {
    if (value == null) {
      return FieldValue.NULL;
    }
    if (value instanceof String text) {
      return FieldValue.of(text);
    }
    if (value instanceof Integer || value instanceof Long) {
      return FieldValue.of(((Number) value).longValue());
    }
    if (value instanceof Number number) {
      return FieldValue.of(number.doubleValue());
    }
    if (value instanceof Boolean bool) {
      return FieldValue.of(bool);
    }
    throw new IllegalArgumentException("Unsupported cursor value: " + value.getClass());
  }

  @VisibleForTesting
  static Object fromFieldValue(FieldValue value) {
    if (value.isString()) {
      return value.stringValue();
    }
    if (value.isLong()) {
      return value.longValue();
    }
    if (value.isDouble()) {
      return value.doubleValue();
    }
    if (value.isBoolean()) {
      return value.booleanValue();
    }
    return null;
  }

  private RuntimeException translate(String operation, String index, Exception e) {
    if (e instanceof ElasticsearchException ese && !TRANSIENT_STATUSES.contains(ese.status())) {
      log.error("[{}] index={} rejected by Elasticsearch: {}", operation, index, e.getMessage());
      meterRegistry.counter("elasticsearch.errors", "operation", operation).increment();
      return new SearchException(operation + " failed on index '" + index + "'", e);
    }
    log.warn("[{}] index={} backend unavailable: {}", operation, index, e.getMessage());
    meterRegistry.counter("elasticsearch.unavailable", "operation", operation).increment();
    return new BackendUnavailableException(
        operation + " failed on index '" + index + "': backend unavailable", e);
  }
}
