package com.scholary.dubbing.pipeline;

import com.scholary.dubbing.logging.StructuredLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Counts completed steps of one run. Observational only; never drives control flow.
 *
 * <p>A listener that throws is logged and ignored, so the run carries on.
 */
class ProgressTracker {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProgressTracker.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final int totalSteps;
  private final ProgressListener listener;
  private int completedSteps;

  ProgressTracker(int totalSteps, ProgressListener listener) {
    this.totalSteps = totalSteps;
    this.listener = listener;
  }

  void advance(PipelineStage stage) {
    if (completedSteps == totalSteps) {
      throw new IllegalStateException("All " + totalSteps + " steps are already complete");
    }
    completedSteps++;
    try {
      listener.onProgress(stage, completedSteps, totalSteps);
    } catch (RuntimeException e) {
      structuredLogger.logProgressListenerFailed(
          stage.name(), e.getClass().getSimpleName(), e.getMessage());
    }
  }

  int completedSteps() {
    return completedSteps;
  }

  int totalSteps() {
    return totalSteps;
  }
}
