package com.scholary.dubbing.service;

import com.scholary.dubbing.api.DubbingRequest;
import com.scholary.dubbing.config.DubbingProperties;
import com.scholary.dubbing.config.SystemInstructions;
import com.scholary.dubbing.pipeline.DubbingCollaborators;
import com.scholary.dubbing.pipeline.DubbingResult;
import com.scholary.dubbing.pipeline.DubbingRun;
import com.scholary.dubbing.pipeline.DubbingRunConfig;
import com.scholary.dubbing.pipeline.ProgressListener;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

/**
 * Creates and runs dubbing pipelines.
 *
 * <p>Request values win over the configured defaults. System instructions are loaded once at
 * startup, so a missing instructions file fails the application instead of the first job.
 */
@Service
public class DubbingService {

  private static final Logger LOGGER = LoggerFactory.getLogger(DubbingService.class);

  private final DubbingCollaborators collaborators;
  private final DubbingProperties properties;
  private final String diarizationSystemInstructions;
  private final String translationSystemInstructions;

  public DubbingService(
      DubbingCollaborators collaborators,
      DubbingProperties properties,
      ResourceLoader resourceLoader) {
    this.collaborators = collaborators;
    this.properties = properties;
    this.diarizationSystemInstructions =
        SystemInstructions.read(properties.diarizationSystemInstructions(), resourceLoader);
    this.translationSystemInstructions =
        SystemInstructions.read(properties.translationSystemInstructions(), resourceLoader);
  }

  /** Build the settings of one run from a request and the configured defaults. */
  public DubbingRunConfig configure(DubbingRequest request, Path inputFile, Path workDir) {
    return new DubbingRunConfig(
        inputFile,
        workDir,
        request.advertiserName(),
        request.originalLanguage(),
        request.targetLanguage(),
        request.numberOfSpeakers() == null ? 1 : request.numberOfSpeakers(),
        request.diarizationInstructions(),
        request.translationInstructions(),
        request.mergeUtterances() == null
            ? properties.mergeUtterances()
            : request.mergeUtterances(),
        request.minimumMergeThreshold() == null
            ? properties.minimumMergeThreshold()
            : request.minimumMergeThreshold(),
        request.preferredVoices() == null
            ? properties.preferredVoices()
            : request.preferredVoices(),
        request.cleanUp() == null ? properties.cleanUp() : request.cleanUp(),
        diarizationSystemInstructions,
        translationSystemInstructions);
  }

  /**
   * Create a run without starting it.
   *
   * @throws com.scholary.dubbing.media.UnsupportedFormatException for unsupported input files
   */
  public DubbingRun createRun(DubbingRunConfig config, ProgressListener listener) {
    return new DubbingRun(config, collaborators, listener);
  }

  /** Create a run and execute it to the end. */
  public DubbingResult dub(DubbingRunConfig config, ProgressListener listener) {
    DubbingRun run = createRun(config, listener);
    LOGGER.info(
        "Starting dubbing run: input={}, steps={}", config.inputFile(), run.totalSteps());
    return run.run();
  }
}
