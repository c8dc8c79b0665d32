package com.flamingo.ai.arabicsearch.api.rest;

import com.flamingo.ai.arabicsearch.embedding.EmbeddingProvider;
import com.flamingo.ai.arabicsearch.embedding.EmbeddingProviderState;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for health checks and the embedding model state. */
@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

  private final EmbeddingProvider embeddingProvider;

  /** Returns a simple health check response. Semantic search availability is reported apart. */
  @GetMapping
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, Object> health = new HashMap<>();
    health.put("status", "UP");
    health.put("timestamp", LocalDateTime.now());
    health.put("service", "arabic-transcript-search");
    health.put("embedding", embeddingProvider.state());
    return ResponseEntity.ok(health);
  }

  /** Reloads the embedding model and returns its new state. */
  @PostMapping("/embedding/reload")
  public ResponseEntity<EmbeddingProviderState> reloadEmbedding() {
    return ResponseEntity.ok(embeddingProvider.reload());
  }
}
