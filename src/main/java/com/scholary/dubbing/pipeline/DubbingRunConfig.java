package com.scholary.dubbing.pipeline;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Immutable settings of one run.
 *
 * @param inputFile source video or audio
 * @param outputDirectory working directory; all intermediate files and the result land here
 * @param advertiserName brand name, used as transcription prompt and kept untranslated
 * @param originalLanguage language of the source, e.g. {@code en-US}
 * @param targetLanguage language to dub into, e.g. {@code pl-PL}
 * @param numberOfSpeakers exact number of distinct speakers
 * @param diarizationInstructions optional extra guidance for speaker attribution
 * @param translationInstructions optional extra guidance for translation
 * @param mergeUtterances merge adjacent same-speaker utterances after translation
 * @param minimumMergeThreshold maximum gap in seconds between merged utterances
 * @param preferredVoices voice families or names to prefer, in order
 * @param cleanUp delete intermediate files at the end
 * @param diarizationSystemInstructions resolved system instruction text
 * @param translationSystemInstructions resolved system instruction text
 */
public record DubbingRunConfig(
    Path inputFile,
    Path outputDirectory,
    String advertiserName,
    String originalLanguage,
    String targetLanguage,
    int numberOfSpeakers,
    String diarizationInstructions,
    String translationInstructions,
    boolean mergeUtterances,
    double minimumMergeThreshold,
    List<String> preferredVoices,
    boolean cleanUp,
    String diarizationSystemInstructions,
    String translationSystemInstructions) {

  public DubbingRunConfig {
    Objects.requireNonNull(inputFile, "inputFile");
    Objects.requireNonNull(outputDirectory, "outputDirectory");
    Objects.requireNonNull(originalLanguage, "originalLanguage");
    Objects.requireNonNull(targetLanguage, "targetLanguage");
    if (numberOfSpeakers < 1) {
      throw new IllegalArgumentException("numberOfSpeakers must be at least 1");
    }
    if (minimumMergeThreshold < 0) {
      throw new IllegalArgumentException("minimumMergeThreshold cannot be negative");
    }
    preferredVoices = preferredVoices == null ? List.of() : List.copyOf(preferredVoices);
  }
}
