package com.scholary.dubbing.translation;

/**
 * Input of a script translation.
 *
 * @param script utterance texts joined by {@link TranslationScript#BREAK}
 * @param targetLanguage BCP-47 code, e.g. {@code pl-PL}
 * @param advertiserName brand name that must not be translated, may be null
 * @param instructions extra guidance for the translator, may be null
 * @param systemInstruction translation system instruction text
 */
public record TranslationRequest(
    String script,
    String targetLanguage,
    String advertiserName,
    String instructions,
    String systemInstruction) {}
