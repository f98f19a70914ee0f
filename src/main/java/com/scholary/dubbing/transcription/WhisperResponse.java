package com.scholary.dubbing.transcription;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Response from the Whisper transcription API.
 *
 * <p>Contains a list of segments and the detected language.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WhisperResponse(List<Segment> segments, String language) {

  /** A single transcribed segment, timed relative to the chunk. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Segment(double start, double end, String text) {}

  /** All segment texts joined with single spaces. */
  public String text() {
    if (segments == null) {
      return "";
    }
    return segments.stream()
        .map(Segment::text)
        .filter(text -> text != null && !text.isBlank())
        .map(String::strip)
        .collect(Collectors.joining(" "));
  }
}
