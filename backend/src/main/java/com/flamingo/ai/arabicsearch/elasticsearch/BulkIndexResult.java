package com.flamingo.ai.arabicsearch.elasticsearch;

import java.util.Map;

/**
 * Outcome of a bulk write.
 *
 * @param indexed number of documents written
 * @param failures reason per document id that the backend rejected
 */
public record BulkIndexResult(int indexed, Map<String, String> failures) {

  public BulkIndexResult {
    failures = Map.copyOf(failures);
  }

  public boolean hasFailures() {
    return !failures.isEmpty();
  }
}
