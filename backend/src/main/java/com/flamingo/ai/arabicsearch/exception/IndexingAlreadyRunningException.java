package com.flamingo.ai.arabicsearch.exception;

/** Exception thrown when an indexing run is requested while another one is in progress. */
public class IndexingAlreadyRunningException extends RuntimeException {

  public IndexingAlreadyRunningException() {
    super("An embedding indexing run is already in progress");
  }
}
