package com.scholary.dubbing.segmentation;

/**
 * A span of detected speech in seconds.
 *
 * <p>Produced by the segmentation service, one per utterance. Spans are strictly positive in length:
 * a zero-length span cannot be cut into an audio chunk.
 */
public record TimeRange(double start, double end) {

  public TimeRange {
    if (start < 0) {
      throw new IllegalArgumentException("Start time cannot be negative: " + start);
    }
    if (end <= start) {
      throw new IllegalArgumentException(
          String.format("End time must be greater than start time: start=%s, end=%s", start, end));
    }
  }

  public double duration() {
    return end - start;
  }

  /**
   * Seconds of silence between the end of this span and the start of the next one.
   *
   * <p>Negative when the spans overlap, which happens when two speakers talk over each other.
   */
  public double gapTo(TimeRange next) {
    return next.start - this.end;
  }
}
