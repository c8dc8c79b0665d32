package com.flamingo.ai.arabicsearch.exception;

/** Exception thrown when a search request is malformed (unknown mode, non-positive size). */
public class SearchValidationException extends RuntimeException {

  private final String field;

  public SearchValidationException(String field, String message) {
    super(message);
    this.field = field;
  }

  public String getField() {
    return field;
  }
}
