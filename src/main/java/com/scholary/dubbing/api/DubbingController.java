package com.scholary.dubbing.api;

import com.scholary.dubbing.job.DubbingJob;
import com.scholary.dubbing.job.DubbingJobService;
import com.scholary.dubbing.job.JobRepository;
import com.scholary.dubbing.media.UnsupportedFormatException;
import com.scholary.dubbing.monitoring.KibanaUrlGenerator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for dubbing.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Starting an asynchronous dubbing job (returns job ID immediately)
 *   <li>Job status polling
 * </ul>
 *
 * <p>A run takes minutes, so all dubbing is asynchronous; progress is visible in the job status and
 * in Kibana.
 */
@RestController
@Tag(name = "Dubbing", description = "Video and audio dubbing API")
public class DubbingController {

  private static final Logger LOGGER = LoggerFactory.getLogger(DubbingController.class);

  private final DubbingJobService jobService;
  private final JobRepository jobRepository;
  private final KibanaUrlGenerator kibanaUrlGenerator;

  public DubbingController(
      DubbingJobService jobService,
      JobRepository jobRepository,
      KibanaUrlGenerator kibanaUrlGenerator) {
    this.jobService = jobService;
    this.jobRepository = jobRepository;
    this.kibanaUrlGenerator = kibanaUrlGenerator;
  }

  /** Start asynchronous dubbing job. */
  @PostMapping("/api/dubbing")
  @Operation(
      summary = "Start dubbing",
      description = "Start asynchronous dubbing job and return job ID for status polling")
  public ResponseEntity<AsyncJobResponse> dub(@Valid @RequestBody DubbingRequest request) {
    LOGGER.info(
        "Dubbing request: inputFile={}, key={}, targetLanguage={}",
        request.inputFile(),
        request.key(),
        request.targetLanguage());

    DubbingJob job = jobService.createJob(request);
    jobService.process(job);

    String kibanaUrl = kibanaUrlGenerator.generateJobUrl(job.getJobId());
    return ResponseEntity.accepted().body(new AsyncJobResponse(job.getJobId(), kibanaUrl));
  }

  /**
   * Get job status.
   *
   * <p>Returns the current state of an async job. If the job is completed, includes the result.
   */
  @GetMapping("/api/jobs/{id}")
  @Operation(summary = "Get job status", description = "Check the status of an async dubbing job")
  public ResponseEntity<JobStatusResponse> getJobStatus(@PathVariable String id) {
    return jobRepository
        .findById(id)
        .map(job -> ResponseEntity.ok(toStatusResponse(job)))
        .orElse(ResponseEntity.notFound().build());
  }

  @ExceptionHandler({UnsupportedFormatException.class, IllegalArgumentException.class})
  public ResponseEntity<Map<String, String>> handleBadRequest(RuntimeException e) {
    LOGGER.warn("Rejected dubbing request: {}", e.getMessage());
    return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
  }

  private JobStatusResponse toStatusResponse(DubbingJob job) {
    return new JobStatusResponse(
        job.getJobId(),
        job.getStatus(),
        job.getCompletedSteps(),
        job.getTotalSteps(),
        job.getStage(),
        job.getFailedStage(),
        job.getResult(),
        job.getWarnings(),
        job.getError(),
        kibanaUrlGenerator.generateJobUrl(job.getJobId()));
  }
}
