package com.scholary.dubbing.media;

import java.nio.file.Path;
import java.util.Locale;

/** Input formats the pipeline accepts, detected from the file extension. */
public enum MediaFormat {
  MP4("mp4", "video/mp4", true),
  WAV("wav", "audio/wav", false),
  MP3("mp3", "audio/mpeg", false),
  FLAC("flac", "audio/flac", false);

  private final String extension;
  private final String mimeType;
  private final boolean video;

  MediaFormat(String extension, String mimeType, boolean video) {
    this.extension = extension;
    this.mimeType = mimeType;
    this.video = video;
  }

  public String extension() {
    return extension;
  }

  public String mimeType() {
    return mimeType;
  }

  public boolean isVideo() {
    return video;
  }

  /**
   * Detect the format of a file. The check is case-insensitive.
   *
   * @throws UnsupportedFormatException for any other extension, or none
   */
  public static MediaFormat detect(Path file) {
    String name = file.getFileName() == null ? "" : file.getFileName().toString();
    int dot = name.lastIndexOf('.');
    if (dot >= 0) {
      String extension = name.substring(dot + 1).toLowerCase(Locale.ROOT);
      for (MediaFormat format : values()) {
        if (format.extension.equals(extension)) {
          return format;
        }
      }
    }
    throw new UnsupportedFormatException(file);
  }
}
