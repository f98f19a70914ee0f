package com.scholary.dubbing.translation;

import com.scholary.dubbing.utterance.UtteranceMetadata;
import com.scholary.dubbing.utterance.UtteranceRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Converts utterances to a single translatable script and back.
 *
 * <p>Translating the whole script in one request gives the model the full context of the ad. The
 * {@code <BREAK>} marker separates utterances and must survive translation.
 */
public final class TranslationScript {

  public static final String BREAK = "<BREAK>";

  private static final Pattern BREAK_PATTERN =
      Pattern.compile("\\s*" + Pattern.quote(BREAK) + "\\s*");

  private TranslationScript() {}

  public static String generate(UtteranceMetadata utterances) {
    List<String> lines = new ArrayList<>(utterances.size());
    for (UtteranceRecord record : utterances) {
      lines.add(record.text() == null ? "" : record.text().strip());
    }
    return String.join(" " + BREAK + " ", lines);
  }

  /**
   * Split a translated script back into one text per utterance.
   *
   * @throws TranslationException if the number of pieces differs from {@code expectedCount}
   */
  public static List<String> split(String translatedScript, int expectedCount) {
    String[] pieces = BREAK_PATTERN.split(translatedScript.strip(), -1);
    if (pieces.length != expectedCount) {
      throw new TranslationException(
          String.format(
              "Translated script has %d lines but %d utterances were sent",
              pieces.length, expectedCount));
    }
    List<String> texts = new ArrayList<>(pieces.length);
    for (String piece : pieces) {
      texts.add(piece.strip());
    }
    return texts;
  }
}
