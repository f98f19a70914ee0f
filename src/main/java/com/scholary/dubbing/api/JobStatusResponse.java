package com.scholary.dubbing.api;

import com.scholary.dubbing.pipeline.PipelineStage;
import java.util.List;

/**
 * Response for job status query.
 *
 * <p>Shows the current state of an async job and includes the result if completed.
 */
public record JobStatusResponse(
    String jobId,
    Status status,
    int completedSteps,
    int totalSteps,
    PipelineStage stage,
    PipelineStage failedStage,
    DubbingResponse result,
    List<String> warnings,
    String error,
    String kibanaUrl) {

  public enum Status {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED
  }
}
