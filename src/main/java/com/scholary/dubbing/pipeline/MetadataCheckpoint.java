package com.scholary.dubbing.pipeline;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Output of {@link PipelineStage#SAVE_METADATA}.
 *
 * @param source the text-to-speech output, passed through for postprocessing
 * @param metadataFile where the metadata was, or should have been, written
 * @param warning set when writing failed
 */
public record MetadataCheckpoint(
    StageArtifacts source, Path metadataFile, PersistenceWarning warning) {

  public boolean isSaved() {
    return warning == null;
  }

  public Optional<PersistenceWarning> persistenceWarning() {
    return Optional.ofNullable(warning);
  }
}
