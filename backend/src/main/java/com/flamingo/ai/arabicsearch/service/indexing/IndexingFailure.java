package com.flamingo.ai.arabicsearch.service.indexing;

/**
 * A source document that could not be indexed.
 *
 * @param documentId source document id
 * @param reason short machine-readable cause, e.g. {@code empty_text}
 */
public record IndexingFailure(String documentId, String reason) {

  public static final String EMPTY_TEXT = "empty_text";
  public static final String EMBEDDING_FAILED = "embedding_failed";
  public static final String BULK_FAILED = "bulk_failed";
}
