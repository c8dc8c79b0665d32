package com.flamingo.ai.arabicsearch.api.rest;

import com.flamingo.ai.arabicsearch.api.dto.request.IndexingRunRequest;
import com.flamingo.ai.arabicsearch.api.dto.response.IndexingStatusResponse;
import com.flamingo.ai.arabicsearch.service.indexing.IndexingJobService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for embedding indexing runs. */
@RestController
@RequestMapping("/api/indexing")
@RequiredArgsConstructor
public class IndexingController {

  private final IndexingJobService indexingJobService;

  /** Starts an indexing run in the background. */
  @PostMapping("/runs")
  public ResponseEntity<IndexingStatusResponse> startRun(
      @Valid @RequestBody(required = false) IndexingRunRequest request) {
    IndexingRunRequest run = request != null ? request : new IndexingRunRequest();
    indexingJobService.submit(run.getSourceIndex(), run.getTargetIndex(), run.getBatchSize());
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(status());
  }

  /** Returns whether a run is in progress and the outcome of the last one. */
  @GetMapping("/runs/latest")
  public ResponseEntity<IndexingStatusResponse> latestRun() {
    return ResponseEntity.ok(status());
  }

  private IndexingStatusResponse status() {
    return IndexingStatusResponse.builder()
        .running(indexingJobService.isRunning())
        .lastReport(indexingJobService.lastReport().orElse(null))
        .lastError(indexingJobService.lastError().orElse(null))
        .build();
  }
}
