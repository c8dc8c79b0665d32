package com.flamingo.ai.arabicsearch.api.dto.request;

import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for a transcript search. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SearchRequestBody {

  private String query;

  @Positive private Integer size;

  /** {@code basic}, {@code enhanced} or {@code semantic}; basic when omitted. */
  private String mode;
}
