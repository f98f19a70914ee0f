package com.scholary.dubbing.diarization;

import com.scholary.dubbing.utterance.SpeakerInfo;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the diarization model's reply into speaker tuples.
 *
 * <p>The expected reply is one {@code (speaker_label, gender_label)} tuple per line:
 *
 * <pre>
 * (speaker_1, Male)
 * (speaker_2, Female)
 * </pre>
 *
 * <p>Models occasionally put several tuples on one line separated by commas; that is accepted too.
 * Order and duplicates are kept exactly as written. Blank lines are ignored. Anything else on a
 * line is rejected with a {@link DiarizationParseException}.
 */
public final class DiarizationResponseParser {

  // One tuple: "(" label "," label ")", labels may not contain parentheses or commas
  private static final Pattern TUPLE =
      Pattern.compile("\\(\\s*([^(),]*?)\\s*,\\s*([^(),]*?)\\s*\\)");
  private static final Pattern SEPARATOR = Pattern.compile("\\s*,?\\s*");

  private DiarizationResponseParser() {}

  /**
   * Parse a diarization reply.
   *
   * @param response the raw model reply, may be empty
   * @return the speaker tuples in reply order
   * @throws DiarizationParseException if any non-blank line is malformed
   */
  public static List<SpeakerInfo> parse(String response) {
    List<SpeakerInfo> speakers = new ArrayList<>();
    if (response == null || response.isBlank()) {
      return speakers;
    }

    String[] lines = response.strip().split("\\R");
    for (int i = 0; i < lines.length; i++) {
      String line = lines[i].strip();
      if (!line.isEmpty()) {
        speakers.addAll(parseLine(i + 1, line));
      }
    }
    return speakers;
  }

  private static List<SpeakerInfo> parseLine(int lineNumber, String line) {
    List<SpeakerInfo> tuples = new ArrayList<>();
    Matcher matcher = TUPLE.matcher(line);
    int position = 0;

    while (matcher.find()) {
      String between = line.substring(position, matcher.start());
      if (!SEPARATOR.matcher(between).matches()) {
        throw new DiarizationParseException(lineNumber, line, "unexpected text '" + between + "'");
      }
      String speaker = matcher.group(1);
      String gender = matcher.group(2);
      if (speaker.isEmpty() || gender.isEmpty()) {
        throw new DiarizationParseException(lineNumber, line, "empty speaker or gender");
      }
      tuples.add(new SpeakerInfo(speaker, gender));
      position = matcher.end();
    }

    if (tuples.isEmpty()) {
      throw new DiarizationParseException(lineNumber, line, "expected (speaker, gender)");
    }
    String trailing = line.substring(position);
    if (!SEPARATOR.matcher(trailing).matches()) {
      throw new DiarizationParseException(lineNumber, line, "unexpected text '" + trailing + "'");
    }
    return tuples;
  }
}
