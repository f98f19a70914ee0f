package com.scholary.dubbing.pipeline;

import java.nio.file.Path;
import java.util.List;

/**
 * Output of {@link PipelineStage#CLEANUP}.
 *
 * @param enabled false when cleanup was switched off and nothing was touched
 * @param deleted entries removed from the working directory
 * @param failures entries that could not be removed
 */
public record CleanupReport(boolean enabled, List<Path> deleted, List<CleanupFailure> failures) {

  private static final CleanupReport DISABLED = new CleanupReport(false, List.of(), List.of());

  public CleanupReport {
    deleted = List.copyOf(deleted);
    failures = List.copyOf(failures);
  }

  public static CleanupReport disabled() {
    return DISABLED;
  }
}
