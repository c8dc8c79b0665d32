package com.flamingo.ai.arabicsearch.elasticsearch;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class TranscriptSegmentTest {

  @ParameterizedTest
  @CsvSource({
    "https://www.youtube.com/watch?v=abc123, 75.9, https://www.youtube.com/watch?v=abc123&t=75s",
    "https://www.youtube.com/watch?v=abc123&list=PL1, 3.0, "
        + "https://www.youtube.com/watch?v=abc123&t=3s",
    "https://youtu.be/xyz789?si=share, 0.4, https://www.youtube.com/watch?v=xyz789&t=0s"
  })
  @DisplayName("should link to the second the segment starts at")
  void shouldAddStartOffset(String videoLink, double start, String expected) {
    TranscriptSegment segment =
        TranscriptSegment.builder().id("d1").videoLink(videoLink).start(start).build();

    assertThat(segment.timestampedLink()).isEqualTo(expected);
  }

  @Test
  @DisplayName("should omit the offset when the start is unknown")
  void shouldOmitOffsetWithoutStart() {
    TranscriptSegment segment =
        TranscriptSegment.builder().videoLink("https://www.youtube.com/watch?v=abc123").build();

    assertThat(segment.timestampedLink()).isEqualTo("https://www.youtube.com/watch?v=abc123");
  }

  @Test
  @DisplayName("should leave unrecognized links alone")
  void shouldKeepOtherLinks() {
    TranscriptSegment segment =
        TranscriptSegment.builder().videoLink("https://example.org/lecture.mp4").start(5.0).build();

    assertThat(segment.timestampedLink()).isEqualTo("https://example.org/lecture.mp4");
    assertThat(TranscriptSegment.builder().build().timestampedLink()).isNull();
  }
}
