package com.scholary.dubbing.job;

import com.scholary.dubbing.api.DubbingRequest;
import com.scholary.dubbing.api.DubbingResponse;
import com.scholary.dubbing.api.JobStatusResponse.Status;
import com.scholary.dubbing.pipeline.PipelineStage;
import java.time.Instant;
import java.util.List;

/**
 * Represents an async dubbing job.
 *
 * <p>Written by the worker thread and read by status requests, hence the volatile fields. Stored in
 * memory using Caffeine cache.
 */
public class DubbingJob {

  private final String jobId;
  private final DubbingRequest request;
  private final Instant createdAt;

  private volatile Status status;
  private volatile int completedSteps;
  private volatile int totalSteps;
  private volatile PipelineStage stage;
  private volatile PipelineStage failedStage;
  private volatile DubbingResponse result;
  private volatile List<String> warnings = List.of();
  private volatile String error;

  public DubbingJob(String jobId, DubbingRequest request) {
    this.jobId = jobId;
    this.request = request;
    this.createdAt = Instant.now();
    this.status = Status.PENDING;
  }

  public String getJobId() {
    return jobId;
  }

  public DubbingRequest getRequest() {
    return request;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Status getStatus() {
    return status;
  }

  public void setStatus(Status status) {
    this.status = status;
  }

  public int getCompletedSteps() {
    return completedSteps;
  }

  public int getTotalSteps() {
    return totalSteps;
  }

  public PipelineStage getStage() {
    return stage;
  }

  public void setProgress(PipelineStage stage, int completedSteps, int totalSteps) {
    this.stage = stage;
    this.completedSteps = completedSteps;
    this.totalSteps = totalSteps;
  }

  public PipelineStage getFailedStage() {
    return failedStage;
  }

  public void setFailedStage(PipelineStage failedStage) {
    this.failedStage = failedStage;
  }

  public DubbingResponse getResult() {
    return result;
  }

  public void setResult(DubbingResponse result) {
    this.result = result;
  }

  public List<String> getWarnings() {
    return warnings;
  }

  public void setWarnings(List<String> warnings) {
    this.warnings = List.copyOf(warnings);
  }

  public String getError() {
    return error;
  }

  public void setError(String error) {
    this.error = error;
  }
}
