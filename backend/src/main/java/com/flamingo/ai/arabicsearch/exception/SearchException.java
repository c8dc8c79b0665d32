package com.flamingo.ai.arabicsearch.exception;

/** Exception thrown when the search backend rejects a request for a non-transient reason. */
public class SearchException extends RuntimeException {

  private final String userMessage;

  public SearchException(String message) {
    super(message);
    this.userMessage = "Search failed. Please try again.";
  }

  public SearchException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "Search failed. Please try again.";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
