package com.scholary.dubbing.job;

import com.scholary.dubbing.api.DubbingRequest;
import com.scholary.dubbing.api.DubbingResponse;
import com.scholary.dubbing.api.JobStatusResponse.Status;
import com.scholary.dubbing.config.DubbingProperties;
import com.scholary.dubbing.logging.StructuredLogger;
import com.scholary.dubbing.media.MediaFormat;
import com.scholary.dubbing.objectstore.ArtifactPublisher;
import com.scholary.dubbing.objectstore.ArtifactPublisher.PublishedArtifacts;
import com.scholary.dubbing.pipeline.DubbingResult;
import com.scholary.dubbing.pipeline.DubbingRunConfig;
import com.scholary.dubbing.pipeline.PersistenceWarning;
import com.scholary.dubbing.pipeline.StageFailedException;
import com.scholary.dubbing.service.DubbingService;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Runs dubbing jobs in the background.
 *
 * <p>Each job gets its own working directory, {@code <workDir>/<jobId>}, so jobs running in
 * parallel never share files.
 */
@Service
public class DubbingJobService {

  private static final Logger LOGGER = LoggerFactory.getLogger(DubbingJobService.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final DubbingService dubbingService;
  private final JobRepository jobRepository;
  private final Path workRoot;
  private final Optional<ArtifactPublisher> artifactPublisher;

  public DubbingJobService(
      DubbingService dubbingService,
      JobRepository jobRepository,
      DubbingProperties properties,
      Optional<ArtifactPublisher> artifactPublisher) {
    this.dubbingService = dubbingService;
    this.jobRepository = jobRepository;
    this.workRoot = Paths.get(properties.workDir());
    this.artifactPublisher = artifactPublisher;
  }

  /**
   * Validate a request and register a pending job for it.
   *
   * @throws com.scholary.dubbing.media.UnsupportedFormatException if the input is not a supported
   *     video or audio file
   * @throws IllegalArgumentException if the request needs object storage and none is configured
   */
  public DubbingJob createJob(DubbingRequest request) {
    String input = request.isObjectStoreInput() ? request.key() : request.inputFile();
    MediaFormat.detect(Paths.get(input));
    if ((request.isObjectStoreInput() || request.publish()) && artifactPublisher.isEmpty()) {
      throw new IllegalArgumentException("Object storage is not enabled");
    }

    DubbingJob job = new DubbingJob(UUID.randomUUID().toString(), request);
    jobRepository.save(job);
    LOGGER.info("Created async dubbing job: {}", job.getJobId());
    return job;
  }

  /**
   * Process a job asynchronously.
   *
   * <p>This runs in the task executor thread pool. The job is updated after every stage so status
   * requests see live progress.
   */
  @Async
  public void process(DubbingJob job) {
    DubbingRequest request = job.getRequest();
    String input = request.isObjectStoreInput() ? request.key() : request.inputFile();
    StructuredLogger.setJobContext(job.getJobId(), input, request.targetLanguage());

    try {
      job.setStatus(Status.PROCESSING);
      jobRepository.save(job);

      Path workDir = Files.createDirectories(workRoot.resolve(job.getJobId()));
      Path inputFile =
          request.isObjectStoreInput()
              ? artifactPublisher.get().download(request.bucket(), request.key(), workDir)
              : Paths.get(request.inputFile());

      DubbingRunConfig config = dubbingService.configure(request, inputFile, workDir);
      DubbingResult result =
          dubbingService.dub(
              config,
              (stage, completedSteps, totalSteps) -> {
                job.setProgress(stage, completedSteps, totalSteps);
                jobRepository.save(job);
                structuredLogger.logJobProgress(
                    job.getJobId(), completedSteps, totalSteps, stage.name());
              });

      PublishedArtifacts published = null;
      if (request.publish()) {
        published =
            artifactPublisher
                .get()
                .publish(job.getJobId(), result.outputFile(), result.utterances());
      }

      job.setResult(toResponse(result, published));
      job.setWarnings(warningMessages(result));
      job.setStatus(Status.COMPLETED);
      jobRepository.save(job);
      LOGGER.info("Completed async processing for job: {}", job.getJobId());

    } catch (StageFailedException e) {
      LOGGER.error("Dubbing failed for job {} in stage {}", job.getJobId(), e.getStage(), e);
      job.setFailedStage(e.getStage());
      fail(job, e.getCause().getMessage());

    } catch (IOException | RuntimeException e) {
      LOGGER.error("Async processing failed for job: {}", job.getJobId(), e);
      fail(job, e.getMessage());

    } finally {
      StructuredLogger.clearJobContext();
    }
  }

  private void fail(DubbingJob job, String error) {
    job.setStatus(Status.FAILED);
    job.setError(error);
    jobRepository.save(job);
  }

  static DubbingResponse toResponse(DubbingResult result, PublishedArtifacts published) {
    return new DubbingResponse(
        result.outputFile().toString(),
        result.metadataFile() == null ? null : result.metadataFile().toString(),
        result.utterances().size(),
        result.cleanupFailures().size(),
        published == null ? null : published.outputUrl(),
        published == null ? null : published.metadataUrl());
  }

  private static List<String> warningMessages(DubbingResult result) {
    List<String> messages = new ArrayList<>();
    for (PersistenceWarning warning : result.warnings()) {
      messages.add("Utterance metadata not saved to " + warning.file() + ": " + warning.message());
    }
    if (!result.cleanupFailures().isEmpty()) {
      messages.add(result.cleanupFailures().size() + " temporary files could not be removed");
    }
    return messages;
  }
}
