package com.scholary.dubbing.pipeline;

import com.scholary.dubbing.utterance.UtteranceMetadata;
import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of a completed run.
 *
 * @param outputFile the dubbed video or audio
 * @param metadataFile the utterance metadata JSON, or null when it was not written or was removed
 *     by cleanup
 * @param warnings non-fatal problems
 * @param cleanupFailures working-directory entries cleanup could not delete
 * @param utterances final utterance metadata
 */
public record DubbingResult(
    Path outputFile,
    Path metadataFile,
    List<PersistenceWarning> warnings,
    List<CleanupFailure> cleanupFailures,
    UtteranceMetadata utterances) {

  public DubbingResult {
    warnings = List.copyOf(warnings);
    cleanupFailures = List.copyOf(cleanupFailures);
  }
}
