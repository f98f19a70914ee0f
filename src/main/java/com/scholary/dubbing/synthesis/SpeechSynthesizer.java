package com.scholary.dubbing.synthesis;

import java.nio.file.Path;
import java.util.List;

/** Renders text as speech. */
public interface SpeechSynthesizer {

  /** Voices available for a language. */
  List<Voice> listVoices(String languageCode);

  /**
   * Synthesize {@code text} with the named voice and write MP3 audio to {@code outputFile}.
   *
   * @return {@code outputFile}
   */
  Path synthesize(String text, String voiceName, String languageCode, Path outputFile);
}
