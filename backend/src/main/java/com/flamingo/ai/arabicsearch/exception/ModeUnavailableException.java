package com.flamingo.ai.arabicsearch.exception;

import com.flamingo.ai.arabicsearch.domain.SearchMode;

/** Exception thrown when a search mode cannot be served and no fallback is allowed. */
public class ModeUnavailableException extends RuntimeException {

  private final SearchMode mode;

  public ModeUnavailableException(SearchMode mode, String reason) {
    super("Search mode " + mode.value() + " unavailable: " + reason);
    this.mode = mode;
  }

  public SearchMode getMode() {
    return mode;
  }
}
