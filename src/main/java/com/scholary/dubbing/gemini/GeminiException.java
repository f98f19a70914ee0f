package com.scholary.dubbing.gemini;

/** Thrown when a Gemini call succeeds at the HTTP level but its response cannot be used. */
public class GeminiException extends GenerativeModelException {

  public GeminiException(String message) {
    super(message);
  }

  public GeminiException(String message, Throwable cause) {
    super(message, cause);
  }
}
