package com.scholary.dubbing.transcription;

import java.nio.file.Path;

/**
 * Speech-to-text for a single utterance chunk.
 *
 * <p>This abstraction allows us to swap transcription providers without changing the pipeline.
 */
public interface Transcriber {

  /**
   * Transcribe an audio chunk.
   *
   * @param audioChunk the chunk to transcribe
   * @param languageHint ISO 639-1 code of the spoken language
   * @param prompt context that biases recognition, e.g. the advertiser's name; may be null
   * @return the transcript, empty if no speech was recognized
   * @throws TranscriptionException if transcription fails
   */
  String transcribe(Path audioChunk, String languageHint, String prompt);
}
