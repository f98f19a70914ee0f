package com.scholary.dubbing.segmentation;

import java.nio.file.Path;
import java.util.List;

/** Finds the spans of speech in an audio file. */
public interface SpeechSegmenter {

  /**
   * Segment an audio file into utterances.
   *
   * @param audioFile the audio to analyse
   * @param numberOfSpeakers the exact number of speakers, used as a hint by the model
   * @return speech spans in chronological order
   */
  List<TimeRange> segment(Path audioFile, int numberOfSpeakers);
}
