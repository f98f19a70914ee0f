package com.scholary.dubbing.utterance;

/**
 * Thrown when the number of speaker tuples returned by diarization does not match the number of
 * utterances.
 *
 * <p>Attribution is positional, so a missing or extra tuple would shift every speaker after it.
 * There is no best-effort fallback.
 */
public class AttributionMismatchException extends RuntimeException {

  private final int utteranceCount;
  private final int speakerInfoCount;

  public AttributionMismatchException(int utteranceCount, int speakerInfoCount) {
    super(
        String.format(
            "The number of utterances (%d) and speaker info entries (%d) must be the same",
            utteranceCount, speakerInfoCount));
    this.utteranceCount = utteranceCount;
    this.speakerInfoCount = speakerInfoCount;
  }

  public int getUtteranceCount() {
    return utteranceCount;
  }

  public int getSpeakerInfoCount() {
    return speakerInfoCount;
  }
}
