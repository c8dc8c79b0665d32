package com.flamingo.ai.arabicsearch.service.indexing;

import java.util.Optional;

/** Persists indexing progress so an interrupted run can resume. */
public interface IndexingCheckpointStore {

  Optional<IndexingCheckpoint> load(String sourceIndex, String targetIndex);

  void save(IndexingCheckpoint checkpoint);

  void clear(String sourceIndex, String targetIndex);
}
