package com.scholary.dubbing.pipeline;

/**
 * Stages of a dubbing run, in execution order.
 *
 * <p>Each stage consumes its predecessor's output only. {@link #SAVE_METADATA} is a checkpoint
 * and does not advance progress; {@link #CLEANUP} advances it only when cleanup is enabled.
 */
public enum PipelineStage {
  PREPROCESSING(true),
  SPEECH_TO_TEXT(true),
  TRANSLATION(true),
  TEXT_TO_SPEECH(true),
  SAVE_METADATA(false),
  POSTPROCESSING(true),
  CLEANUP(true);

  private final boolean countsProgress;

  PipelineStage(boolean countsProgress) {
    this.countsProgress = countsProgress;
  }

  public boolean countsProgress() {
    return countsProgress;
  }

  /** The stage whose output this stage consumes, or null for the first stage. */
  public PipelineStage predecessor() {
    return ordinal() == 0 ? null : values()[ordinal() - 1];
  }

  /** Number of progress steps in a run. */
  public static int totalSteps(boolean cleanUp) {
    int total = 0;
    for (PipelineStage stage : values()) {
      if (stage.countsProgress && (stage != CLEANUP || cleanUp)) {
        total++;
      }
    }
    return total;
  }
}
