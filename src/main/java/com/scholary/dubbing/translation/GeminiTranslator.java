package com.scholary.dubbing.translation;

import com.scholary.dubbing.gemini.ChatSession;
import com.scholary.dubbing.gemini.GenerativeModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Translates scripts with a generative model in a fresh single-turn chat. */
public class GeminiTranslator implements Translator {

  private static final Logger LOGGER = LoggerFactory.getLogger(GeminiTranslator.class);

  private static final String TEMPLATE =
      "Translate the following script into %s. Keep every %s marker exactly where it is.%n"
          + "%s"
          + "%s"
          + "Script:%n%s";

  private final GenerativeModel model;

  public GeminiTranslator(GenerativeModel model) {
    this.model = model;
  }

  @Override
  public String translate(TranslationRequest request) {
    LOGGER.info(
        "Translating script: targetLanguage={}, characters={}",
        request.targetLanguage(),
        request.script().length());
    ChatSession session = model.startChat(request.systemInstruction(), null);
    return session.send(prompt(request)).strip();
  }

  static String prompt(TranslationRequest request) {
    String advertiser =
        isBlank(request.advertiserName())
            ? ""
            : String.format("Do not translate the brand name '%s'.%n", request.advertiserName());
    String instructions =
        isBlank(request.instructions())
            ? ""
            : String.format("Additional instructions: %s%n", request.instructions().strip());
    return String.format(
        TEMPLATE,
        request.targetLanguage(),
        TranslationScript.BREAK,
        advertiser,
        instructions,
        request.script());
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
