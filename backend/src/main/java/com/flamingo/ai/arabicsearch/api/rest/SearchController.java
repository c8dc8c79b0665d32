package com.flamingo.ai.arabicsearch.api.rest;

import com.flamingo.ai.arabicsearch.api.dto.request.SearchRequestBody;
import com.flamingo.ai.arabicsearch.api.dto.response.SearchResponse;
import com.flamingo.ai.arabicsearch.domain.SearchMode;
import com.flamingo.ai.arabicsearch.domain.SearchResult;
import com.flamingo.ai.arabicsearch.service.search.HybridSearchService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for transcript search. */
@RestController
@RequestMapping("/api/search")
@RequiredArgsConstructor
public class SearchController {

  static final int DEFAULT_SIZE = 50;

  private final HybridSearchService hybridSearchService;

  /** Searches with a JSON body. */
  @PostMapping
  public ResponseEntity<SearchResponse> search(@Valid @RequestBody SearchRequestBody body) {
    SearchResult result =
        hybridSearchService.search(
            body.getQuery(),
            body.getSize() != null ? body.getSize() : DEFAULT_SIZE,
            body.getMode() != null ? body.getMode() : SearchMode.BASIC.value());
    return ResponseEntity.ok(SearchResponse.from(result));
  }

  /** Searches with query parameters. */
  @GetMapping
  public ResponseEntity<SearchResponse> search(
      @RequestParam(name = "q", required = false) String query,
      @RequestParam(defaultValue = "" + DEFAULT_SIZE) int size,
      @RequestParam(defaultValue = "basic") String mode) {
    return ResponseEntity.ok(SearchResponse.from(hybridSearchService.search(query, size, mode)));
  }
}
