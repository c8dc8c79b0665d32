package com.flamingo.ai.arabicsearch.service.indexing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.arabicsearch.config.SearchProperties;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Stores one JSON checkpoint file per source/target pair in the configured checkpoint directory.
 * Writes go to a temporary file that is then moved over the previous checkpoint.
 */
@Component
@Slf4j
public class FileIndexingCheckpointStore implements IndexingCheckpointStore {

  private final Path directory;
  private final ObjectMapper objectMapper;

  @Autowired
  public FileIndexingCheckpointStore(SearchProperties properties, ObjectMapper objectMapper) {
    this(Paths.get(properties.getIndexing().getCheckpointDir()), objectMapper);
  }

  public FileIndexingCheckpointStore(Path directory, ObjectMapper objectMapper) {
    this.directory = directory;
    this.objectMapper = objectMapper;
  }

  @Override
  public Optional<IndexingCheckpoint> load(String sourceIndex, String targetIndex) {
    Path file = fileFor(sourceIndex, targetIndex);
    if (!Files.exists(file)) {
      return Optional.empty();
    }
    try {
      IndexingCheckpoint checkpoint =
          objectMapper.readValue(file.toFile(), IndexingCheckpoint.class);
      log.info(
          "Loaded checkpoint {}: pages={} processed={} failed={}",
          file,
          checkpoint.pagesCompleted(),
          checkpoint.documentsProcessed(),
          checkpoint.documentsFailed());
      return Optional.of(checkpoint);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read indexing checkpoint " + file, e);
    }
  }

  @Override
  public void save(IndexingCheckpoint checkpoint) {
    Path file = fileFor(checkpoint.sourceIndex(), checkpoint.targetIndex());
    try {
      Files.createDirectories(directory);
      Path temp = Files.createTempFile(directory, file.getFileName().toString(), ".tmp");
      objectMapper.writeValue(temp.toFile(), checkpoint);
      Files.move(
          temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      log.debug("Saved checkpoint {} after page {}", file, checkpoint.pagesCompleted());
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write indexing checkpoint " + file, e);
    }
  }

  @Override
  public void clear(String sourceIndex, String targetIndex) {
    Path file = fileFor(sourceIndex, targetIndex);
    try {
      if (Files.deleteIfExists(file)) {
        log.info("Cleared checkpoint {}", file);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to delete indexing checkpoint " + file, e);
    }
  }

  Path fileFor(String sourceIndex, String targetIndex) {
    return directory.resolve(sanitize(sourceIndex) + "__" + sanitize(targetIndex) + ".json");
  }

  private static String sanitize(String indexName) {
    return indexName.replaceAll("[^A-Za-z0-9._-]", "_");
  }
}
