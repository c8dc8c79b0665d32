package com.flamingo.ai.arabicsearch.exception;

/** Exception thrown when an embedding is requested but the embedding model cannot produce one. */
public class ModelUnavailableException extends RuntimeException {

  private final String reason;

  public ModelUnavailableException(String reason) {
    super("Embedding model unavailable: " + reason);
    this.reason = reason;
  }

  public ModelUnavailableException(String reason, Throwable cause) {
    super("Embedding model unavailable: " + reason, cause);
    this.reason = reason;
  }

  public String getReason() {
    return reason;
  }
}
