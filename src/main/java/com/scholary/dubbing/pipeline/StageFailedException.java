package com.scholary.dubbing.pipeline;

/** A stage failed and the run was aborted. The cause is the original error. */
public class StageFailedException extends RuntimeException {

  private final PipelineStage stage;

  public StageFailedException(PipelineStage stage, Throwable cause) {
    super("Stage " + stage + " failed: " + cause.getMessage(), cause);
    this.stage = stage;
  }

  public PipelineStage getStage() {
    return stage;
  }
}
