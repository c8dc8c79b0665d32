package com.flamingo.ai.arabicsearch.api.dto.request;

import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO to start an indexing run. Omitted fields use the configured defaults. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class IndexingRunRequest {

  private String sourceIndex;
  private String targetIndex;

  @Positive private Integer batchSize;
}
