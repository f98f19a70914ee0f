package com.scholary.dubbing.pipeline;

/** Receives progress after each counted stage. */
@FunctionalInterface
public interface ProgressListener {

  ProgressListener NONE = (stage, completedSteps, totalSteps) -> {};

  void onProgress(PipelineStage stage, int completedSteps, int totalSteps);
}
