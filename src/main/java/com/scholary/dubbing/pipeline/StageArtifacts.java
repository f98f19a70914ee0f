package com.scholary.dubbing.pipeline;

import com.scholary.dubbing.utterance.UtteranceMetadata;

/**
 * Output of the first four stages: the media tracks, carried forward unchanged, and the utterance
 * snapshot as the stage left it.
 */
public record StageArtifacts(MediaTracks media, UtteranceMetadata utterances) {

  public StageArtifacts withUtterances(UtteranceMetadata updated) {
    return new StageArtifacts(media, updated);
  }
}
