package com.scholary.dubbing.media;

import com.scholary.dubbing.segmentation.TimeRange;
import com.scholary.dubbing.utterance.UtteranceMetadata;
import java.nio.file.Path;
import java.util.List;

/** Audio and video operations the pipeline needs. All outputs go to {@code outputDirectory}. */
public interface MediaProcessor {

  AudioVideoSplit splitAudioVideo(Path videoFile, Path outputDirectory);

  /**
   * Cut one chunk per span.
   *
   * @return chunk files in span order
   */
  List<Path> cutAudio(Path audioFile, List<TimeRange> spans, Path outputDirectory);

  /**
   * Lay every dubbed clip at its utterance's start time on a silent track as long as the
   * background.
   */
  Path insertAudioAtTimestamps(
      UtteranceMetadata utterances, Path backgroundAudio, Path outputDirectory);

  Path mergeBackgroundAndVocals(Path backgroundAudio, Path dubbedVocals, Path outputDirectory);

  Path combineAudioVideo(Path videoFile, Path dubbedAudio, Path outputDirectory);
}
