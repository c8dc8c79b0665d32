package com.flamingo.ai.arabicsearch.api.dto.response;

import com.flamingo.ai.arabicsearch.domain.SearchResult;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a search: the returned page plus the total number of matches. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchResponse {

  private List<SearchHitResponse> results;
  private long total;
  private int returned;
  private String requestedMode;
  private String modeUsed;
  private String fallbackReason;

  public static SearchResponse from(SearchResult result) {
    List<SearchHitResponse> hits = result.hits().stream().map(SearchHitResponse::from).toList();
    return SearchResponse.builder()
        .results(hits)
        .total(result.totalHits())
        .returned(hits.size())
        .requestedMode(result.requestedMode().value())
        .modeUsed(result.modeUsed().value())
        .fallbackReason(result.fallbackReason())
        .build();
  }
}
