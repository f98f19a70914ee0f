package com.scholary.dubbing.diarization;

import com.scholary.dubbing.utterance.UtteranceMetadata;
import com.scholary.dubbing.utterance.UtteranceRecord;
import java.util.Locale;

/** Builds the prompt that asks the model to attribute every utterance to a speaker. */
public final class DiarizationPrompt {

  private static final String TEMPLATE =
      "You got the video attached. The transcript is:%n%s%n"
          + "The number of speakers in the video is: %d.%n"
          + "You must return exactly %d tuples of (speaker_id, ssml_gender), one per line, "
          + "one for each transcript line above and in the same order.%n"
          + "%s";

  private DiarizationPrompt() {}

  public static String build(
      UtteranceMetadata utterances, int numberOfSpeakers, String diarizationInstructions) {
    String extra =
        diarizationInstructions == null || diarizationInstructions.isBlank()
            ? ""
            : "Additional instructions: " + diarizationInstructions.strip();
    return String.format(
        TEMPLATE, transcript(utterances), numberOfSpeakers, utterances.size(), extra);
  }

  /** One line per utterance: {@code [start - end] text}. */
  static String transcript(UtteranceMetadata utterances) {
    StringBuilder transcript = new StringBuilder();
    for (UtteranceRecord record : utterances) {
      transcript.append(
          String.format(
              Locale.ROOT,
              "[%.2f - %.2f] %s%n",
              record.start(),
              record.end(),
              record.text() == null ? "" : record.text()));
    }
    return transcript.toString();
  }
}
