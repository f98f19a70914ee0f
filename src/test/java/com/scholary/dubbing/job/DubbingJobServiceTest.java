package com.scholary.dubbing.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.dubbing.api.DubbingRequest;
import com.scholary.dubbing.api.JobStatusResponse.Status;
import com.scholary.dubbing.config.DubbingProperties;
import com.scholary.dubbing.media.UnsupportedFormatException;
import com.scholary.dubbing.objectstore.ArtifactPublisher;
import com.scholary.dubbing.objectstore.ArtifactPublisher.PublishedArtifacts;
import com.scholary.dubbing.pipeline.CleanupFailure;
import com.scholary.dubbing.pipeline.DubbingResult;
import com.scholary.dubbing.pipeline.DubbingRunConfig;
import com.scholary.dubbing.pipeline.PersistenceWarning;
import com.scholary.dubbing.pipeline.PipelineStage;
import com.scholary.dubbing.pipeline.ProgressListener;
import com.scholary.dubbing.pipeline.StageFailedException;
import com.scholary.dubbing.remote.RemoteAssetTimeoutException;
import com.scholary.dubbing.service.DubbingService;
import com.scholary.dubbing.utterance.UtteranceMetadata;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.MDC;

class DubbingJobServiceTest {

  @TempDir Path workRoot;

  private DubbingService dubbingService;
  private JobRepository jobRepository;
  private ArtifactPublisher publisher;

  @BeforeEach
  void setUp() {
    dubbingService = mock(DubbingService.class);
    jobRepository = new JobRepository(100, 60);
    publisher = mock(ArtifactPublisher.class);
  }

  private DubbingJobService service(Optional<ArtifactPublisher> artifactPublisher) {
    DubbingProperties properties =
        new DubbingProperties(
            workRoot.toString(),
            "diarization",
            "translation",
            true,
            0.001,
            true,
            List.of(),
            new DubbingProperties.PollingProperties(Duration.ofMinutes(5), Duration.ofSeconds(10)),
            2,
            10);
    return new DubbingJobService(dubbingService, jobRepository, properties, artifactPublisher);
  }

  private static DubbingRequest request(String inputFile, String key, boolean publish) {
    return new DubbingRequest(
        inputFile, null, key, "Acme", "en-US", "es-ES", 2, null, null, null, null, null, null,
        publish);
  }

  private DubbingRunConfig runConfig(Path input, Path workDir) {
    return new DubbingRunConfig(
        input, workDir, "Acme", "en-US", "es-ES", 2, null, null, true, 0.001, List.of(), true,
        "diarization", "translation");
  }

  @Test
  void createJob_shouldRegisterPendingJob() {
    DubbingJob job = service(Optional.empty()).createJob(request("/input/ad.mp4", null, false));

    assertThat(job.getStatus()).isEqualTo(Status.PENDING);
    assertThat(jobRepository.findById(job.getJobId())).containsSame(job);
  }

  @Test
  void createJob_shouldRejectUnsupportedFormat() {
    assertThatThrownBy(
            () -> service(Optional.empty()).createJob(request("/input/clip.mov", null, false)))
        .isInstanceOf(UnsupportedFormatException.class);
  }

  @Test
  void createJob_shouldRequireObjectStoreForKeysAndPublishing() {
    DubbingJobService service = service(Optional.empty());

    assertThatThrownBy(() -> service.createJob(request(null, "inputs/ad.mp4", false)))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> service.createJob(request("/input/ad.mp4", null, true)))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void process_shouldCompleteJobAndTrackProgress() {
    DubbingJobService service = service(Optional.empty());
    DubbingJob job = service.createJob(request("/input/ad.mp4", null, false));
    Path workDir = workRoot.resolve(job.getJobId());
    DubbingRunConfig config = runConfig(Path.of("/input/ad.mp4"), workDir);
    when(dubbingService.configure(job.getRequest(), Path.of("/input/ad.mp4"), workDir))
        .thenReturn(config);
    when(dubbingService.dub(eq(config), any()))
        .thenAnswer(
            invocation -> {
              ProgressListener listener = invocation.getArgument(1);
              listener.onProgress(PipelineStage.PREPROCESSING, 1, 6);
              assertThat(job.getStatus()).isEqualTo(Status.PROCESSING);
              assertThat(job.getCompletedSteps()).isEqualTo(1);
              assertThat(MDC.get("jobId")).isEqualTo(job.getJobId());
              return new DubbingResult(
                  workDir.resolve("dubbed_video.mp4"),
                  null,
                  List.of(new PersistenceWarning(workDir.resolve("m.json"), "disk full")),
                  List.of(new CleanupFailure(workDir.resolve("chunk_0.mp3"), "locked")),
                  UtteranceMetadata.empty());
            });

    service.process(job);

    assertThat(job.getStatus()).isEqualTo(Status.COMPLETED);
    assertThat(job.getResult().outputFile()).endsWith("dubbed_video.mp4");
    assertThat(job.getResult().metadataFile()).isNull();
    assertThat(job.getResult().cleanupFailures()).isEqualTo(1);
    assertThat(job.getWarnings()).hasSize(2);
    assertThat(job.getWarnings().get(0)).contains("disk full");
    assertThat(Files.isDirectory(workDir)).isTrue();
    assertThat(MDC.get("jobId")).isNull();
  }

  @Test
  void process_shouldRecordFailedStage() {
    DubbingJobService service = service(Optional.empty());
    DubbingJob job = service.createJob(request("/input/ad.mp4", null, false));
    when(dubbingService.configure(any(), any(), any()))
        .thenReturn(runConfig(Path.of("/input/ad.mp4"), workRoot));
    when(dubbingService.dub(any(), any()))
        .thenThrow(
            new StageFailedException(
                PipelineStage.SPEECH_TO_TEXT,
                new RemoteAssetTimeoutException("files/abc", Duration.ofMinutes(5))));

    service.process(job);

    assertThat(job.getStatus()).isEqualTo(Status.FAILED);
    assertThat(job.getFailedStage()).isEqualTo(PipelineStage.SPEECH_TO_TEXT);
    assertThat(job.getError()).contains("files/abc");
  }

  @Test
  void process_shouldDownloadInputAndPublishResult() {
    DubbingJobService service = service(Optional.of(publisher));
    DubbingJob job = service.createJob(request(null, "inputs/ad.mp4", true));
    Path workDir = workRoot.resolve(job.getJobId());
    Path downloaded = workDir.resolve("ad.mp4");
    Path output = workDir.resolve("dubbed_video.mp4");
    when(publisher.download(null, "inputs/ad.mp4", workDir)).thenReturn(downloaded);
    when(dubbingService.configure(job.getRequest(), downloaded, workDir))
        .thenReturn(runConfig(downloaded, workDir));
    when(dubbingService.dub(any(), any()))
        .thenReturn(
            new DubbingResult(output, null, List.of(), List.of(), UtteranceMetadata.empty()));
    when(publisher.publish(eq(job.getJobId()), eq(output), any()))
        .thenReturn(
            new PublishedArtifacts(
                "dubbing", "out", "meta", "http://minio/out?sig", "http://minio/meta?sig"));

    service.process(job);

    assertThat(job.getStatus()).isEqualTo(Status.COMPLETED);
    assertThat(job.getResult().outputUrl()).isEqualTo("http://minio/out?sig");
    assertThat(job.getResult().metadataUrl()).isEqualTo("http://minio/meta?sig");
    assertThat(job.getWarnings()).isEmpty();
  }

  @Test
  void process_shouldFailJobWhenDownloadFails() {
    DubbingJobService service = service(Optional.of(publisher));
    DubbingJob job = service.createJob(request(null, "inputs/ad.mp4", false));
    when(publisher.download(any(), any(), any()))
        .thenThrow(new IllegalStateException("Object not found"));

    service.process(job);

    assertThat(job.getStatus()).isEqualTo(Status.FAILED);
    assertThat(job.getError()).isEqualTo("Object not found");
    assertThat(job.getFailedStage()).isNull();
    verify(dubbingService, never()).dub(any(), any());
  }
}
