package com.flamingo.ai.arabicsearch.api.dto.response;

import com.flamingo.ai.arabicsearch.domain.RankedSegment;
import com.flamingo.ai.arabicsearch.elasticsearch.TranscriptSegment;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for one search hit. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchHitResponse {

  private String documentId;
  private Double score;
  private String modeUsed;
  private String text;
  private Double start;
  private Double end;
  private String videoLink;
  private String timestampedLink;

  public static SearchHitResponse from(RankedSegment hit) {
    TranscriptSegment segment = hit.segment();
    return SearchHitResponse.builder()
        .documentId(hit.documentId())
        .score(hit.score())
        .modeUsed(hit.modeUsed().value())
        .text(segment.getText())
        .start(segment.getStart())
        .end(segment.getEnd())
        .videoLink(segment.getVideoLink())
        .timestampedLink(segment.timestampedLink())
        .build();
  }
}
