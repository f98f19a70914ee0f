package com.scholary.dubbing.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for dubbing runs.
 *
 * <p>Defaults applied to every job unless the request overrides them, plus resource limits for the
 * job executor.
 */
@ConfigurationProperties(prefix = "dubbing")
@Validated
public record DubbingProperties(
    @NotBlank String workDir,
    @NotBlank String diarizationSystemInstructions,
    @NotBlank String translationSystemInstructions,
    boolean mergeUtterances,
    @PositiveOrZero double minimumMergeThreshold,
    boolean cleanUp,
    List<String> preferredVoices,
    @Valid @NotNull PollingProperties polling,
    @Positive int asyncExecutorThreads,
    @Positive int asyncExecutorQueueSize) {

  /** How long to wait for an uploaded file to become usable by the model. */
  public record PollingProperties(@NotNull Duration maxWait, @NotNull Duration pollInterval) {}
}
