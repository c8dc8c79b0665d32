package com.flamingo.ai.arabicsearch.exception;

/**
 * Exception thrown when the search backend cannot be reached or answers with a transient error
 * (timeout, 429, 502, 503, 504). Retried once before it reaches the caller.
 */
public class BackendUnavailableException extends RuntimeException {

  private final String userMessage;

  public BackendUnavailableException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "Search is temporarily unavailable. Please try again.";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
