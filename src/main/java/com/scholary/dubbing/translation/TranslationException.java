package com.scholary.dubbing.translation;

/** Thrown when a translated script cannot be mapped back onto the utterances. */
public class TranslationException extends RuntimeException {

  public TranslationException(String message) {
    super(message);
  }
}
