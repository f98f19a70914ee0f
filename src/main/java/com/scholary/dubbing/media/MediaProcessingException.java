package com.scholary.dubbing.media;

/** Thrown when an external media tool fails. */
public class MediaProcessingException extends RuntimeException {

  public MediaProcessingException(String message) {
    super(message);
  }

  public MediaProcessingException(String message, Throwable cause) {
    super(message, cause);
  }
}
