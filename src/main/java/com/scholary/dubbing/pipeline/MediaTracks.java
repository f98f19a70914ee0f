package com.scholary.dubbing.pipeline;

import com.scholary.dubbing.media.MediaFormat;
import java.nio.file.Path;

/**
 * Media files produced by preprocessing and needed again during postprocessing.
 *
 * @param format detected input format
 * @param video picture without sound, null for audio input
 * @param audio full sound track
 * @param vocals isolated speech
 * @param background music and effects without speech
 */
public record MediaTracks(
    MediaFormat format, Path video, Path audio, Path vocals, Path background) {

  public boolean hasVideo() {
    return video != null;
  }
}
