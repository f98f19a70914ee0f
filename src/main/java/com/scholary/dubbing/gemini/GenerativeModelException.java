package com.scholary.dubbing.gemini;

/**
 * Thrown when the generative model answers without usable content, for example when the prompt
 * was blocked by a safety filter or the response was cut off.
 */
public class GenerativeModelException extends RuntimeException {

  public GenerativeModelException(String message) {
    super(message);
  }

  public GenerativeModelException(String message, Throwable cause) {
    super(message, cause);
  }
}
