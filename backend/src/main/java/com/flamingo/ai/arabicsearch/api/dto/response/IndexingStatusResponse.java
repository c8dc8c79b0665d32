package com.flamingo.ai.arabicsearch.api.dto.response;

import com.flamingo.ai.arabicsearch.service.indexing.IndexingReport;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for the indexing job state. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexingStatusResponse {

  private boolean running;
  private IndexingReport lastReport;
  private String lastError;
}
