package com.scholary.dubbing.translation;

/** Translates a dubbing script, keeping its line markers intact. */
public interface Translator {

  /**
   * Translate the script in one call.
   *
   * @return the translated script, with the same number of {@link TranslationScript#BREAK}
   *     markers as the input
   */
  String translate(TranslationRequest request);
}
