package com.scholary.dubbing.synthesis;

/** Thrown when speech cannot be synthesized or no voice fits a speaker. */
public class SpeechSynthesisException extends RuntimeException {

  public SpeechSynthesisException(String message) {
    super(message);
  }

  public SpeechSynthesisException(String message, Throwable cause) {
    super(message, cause);
  }
}
