package com.scholary.dubbing.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Provides methods to log pipeline events with structured fields that can be queried in Kibana.
 * Event fields live in the MDC only for the duration of the log call; job context stays for the
 * whole run.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log stage started event. */
  public void logStageStarted(String stage, int completedSteps, int totalSteps) {
    try {
      MDC.put("event_type", "stage_started");
      MDC.put("stage", stage);
      MDC.put("completedSteps", String.valueOf(completedSteps));
      MDC.put("totalSteps", String.valueOf(totalSteps));

      logger.info("Stage started: stage={}, progress={}/{}", stage, completedSteps, totalSteps);
    } finally {
      clearEventFields();
    }
  }

  /** Log stage finished event. */
  public void logStageFinished(
      String stage, int completedSteps, int totalSteps, int utterances, long durationMs) {
    try {
      MDC.put("event_type", "stage_finished");
      MDC.put("stage", stage);
      MDC.put("completedSteps", String.valueOf(completedSteps));
      MDC.put("totalSteps", String.valueOf(totalSteps));
      MDC.put("utterances", String.valueOf(utterances));
      MDC.put("durationMs", String.valueOf(durationMs));

      logger.info(
          "Stage finished: stage={}, progress={}/{}, utterances={}, duration={}ms",
          stage,
          completedSteps,
          totalSteps,
          utterances,
          durationMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log stage failure event. */
  public void logStageFailed(String stage, String errorType, String message, long durationMs) {
    try {
      MDC.put("event_type", "stage_failed");
      MDC.put("stage", stage);
      MDC.put("errorType", errorType);
      MDC.put("durationMs", String.valueOf(durationMs));

      logger.error(
          "Stage failed: stage={}, error={}, message={}, duration={}ms",
          stage,
          errorType,
          message,
          durationMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log remote asset status poll. */
  public void logAssetPoll(String assetName, int attempt, String state, long elapsedMs) {
    try {
      MDC.put("event_type", "asset_poll");
      MDC.put("assetName", assetName);
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("assetState", state);
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.debug(
          "Asset poll: name={}, attempt={}, state={}, elapsed={}ms",
          assetName,
          attempt,
          state,
          elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log a file that could not be removed during cleanup. */
  public void logCleanupFailed(String path, String errorType, String message) {
    try {
      MDC.put("event_type", "cleanup_failed");
      MDC.put("path", path);
      MDC.put("errorType", errorType);

      logger.warn("Cleanup failed: path={}, error={}, message={}", path, errorType, message);
    } finally {
      clearEventFields();
    }
  }

  /** Log a progress listener that threw while being notified. */
  public void logProgressListenerFailed(String stage, String errorType, String message) {
    try {
      MDC.put("event_type", "progress_listener_failed");
      MDC.put("stage", stage);
      MDC.put("errorType", errorType);

      logger.warn(
          "Progress listener failed: stage={}, error={}, message={}", stage, errorType, message);
    } finally {
      clearEventFields();
    }
  }

  /** Log a retried request to an external service. */
  public void logRequestRetry(
      String service, int attempt, int maxRetries, String errorType, String message) {
    try {
      MDC.put("event_type", "request_retry");
      MDC.put("service", service);
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("maxRetries", String.valueOf(maxRetries));
      MDC.put("errorType", errorType);

      logger.warn(
          "Request retry: service={}, attempt={}/{}, error={}, message={}",
          service,
          attempt,
          maxRetries,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log job progress event. */
  public void logJobProgress(String jobId, int completedSteps, int totalSteps, String stage) {
    try {
      MDC.put("event_type", "job_progress");
      MDC.put("jobId", jobId);
      MDC.put("completedSteps", String.valueOf(completedSteps));
      MDC.put("totalSteps", String.valueOf(totalSteps));
      MDC.put("stage", stage);

      logger.info(
          "Job progress: jobId={}, stage={}, steps={}/{}", jobId, stage, completedSteps, totalSteps);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId, String inputFile, String targetLanguage) {
    MDC.put("jobId", jobId);
    MDC.put("inputFile", inputFile);
    MDC.put("targetLanguage", targetLanguage);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("inputFile");
    MDC.remove("targetLanguage");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("stage");
    MDC.remove("completedSteps");
    MDC.remove("totalSteps");
    MDC.remove("utterances");
    MDC.remove("durationMs");
    MDC.remove("errorType");
    MDC.remove("assetName");
    MDC.remove("attempt");
    MDC.remove("assetState");
    MDC.remove("elapsedMs");
    MDC.remove("path");
    MDC.remove("service");
    MDC.remove("maxRetries");
  }
}
