package com.flamingo.ai.arabicsearch.elasticsearch;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A transcribed lecture segment as stored in Elasticsearch.
 *
 * <p>Source documents carry {@code text}, {@code start}, {@code end} and {@code videoLink}; the
 * indexing pipeline adds {@code processedText}, {@code embedding} and {@code embeddingModel}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TranscriptSegment {

  private static final String WATCH_MARKER = "watch?v=";
  private static final String SHORT_MARKER = "youtu.be/";

  private String id;
  private String text;
  private String processedText;
  private List<Float> embedding;
  private String embeddingModel;

  /** Segment start, in seconds from the beginning of the video. */
  private Double start;

  /** Segment end, in seconds from the beginning of the video. */
  private Double end;

  private String videoLink;

  /**
   * Returns a YouTube link that starts playback at this segment.
   *
   * <p>Links in {@code watch?v=} and {@code youtu.be/} form are rewritten to the canonical watch
   * URL with a {@code t} parameter. Other links are returned unchanged.
   */
  public String timestampedLink() {
    if (videoLink == null || videoLink.isBlank()) {
      return null;
    }
    String videoId = extractVideoId(videoLink);
    if (videoId == null) {
      return videoLink;
    }
    String link = "https://www.youtube.com/watch?v=" + videoId;
    if (start == null) {
      return link;
    }
    return link + "&t=" + (long) Math.floor(start) + "s";
  }

  private static String extractVideoId(String link) {
    int marker = link.indexOf(WATCH_MARKER);
    if (marker >= 0) {
      return idUntilDelimiter(link.substring(marker + WATCH_MARKER.length()));
    }
    marker = link.indexOf(SHORT_MARKER);
    if (marker >= 0) {
      return idUntilDelimiter(link.substring(marker + SHORT_MARKER.length()));
    }
    return null;
  }

  private static String idUntilDelimiter(String tail) {
    int end = tail.length();
    for (int i = 0; i < tail.length(); i++) {
      char c = tail.charAt(i);
      if (c == '&' || c == '?' || c == '#' || c == '/') {
        end = i;
        break;
      }
    }
    return end == 0 ? null : tail.substring(0, end);
  }
}
