package com.scholary.dubbing.media;

import java.nio.file.Path;

/** Separates vocals from background audio. */
public interface SourceSeparator {

  SeparatedAudio separate(Path audioFile, Path outputDirectory);
}
