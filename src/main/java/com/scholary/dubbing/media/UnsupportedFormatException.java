package com.scholary.dubbing.media;

import java.nio.file.Path;

/** Thrown for input files that are neither a supported video nor a supported audio format. */
public class UnsupportedFormatException extends RuntimeException {

  private final Path file;

  public UnsupportedFormatException(Path file) {
    super(
        "Unsupported input file: "
            + file
            + ". Supported video formats: .mp4; audio formats: .wav, .mp3, .flac");
    this.file = file;
  }

  public Path getFile() {
    return file;
  }
}
