package com.scholary.dubbing.utterance;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.nio.file.Path;
import java.util.Objects;

/**
 * One detected speech segment and everything the pipeline learns about it.
 *
 * <p>The timing and chunk path are known after preprocessing. The remaining fields are filled in by
 * later stages and are {@code null} until then:
 *
 * <ul>
 *   <li>{@code text}: transcription
 *   <li>{@code speakerId}, {@code ssmlGender}: diarization
 *   <li>{@code translatedText}: translation
 *   <li>{@code assignedVoice}, {@code dubbedPath}: text-to-speech
 * </ul>
 *
 * <p>Fields are append-only. The {@code with*} methods return a copy and refuse to clear or
 * overwrite a field that is already set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UtteranceRecord(
    String audioPath,
    double start,
    double end,
    String text,
    String speakerId,
    String ssmlGender,
    String translatedText,
    String assignedVoice,
    String dubbedPath) {

  public UtteranceRecord {
    Objects.requireNonNull(audioPath, "audioPath");
    if (start < 0) {
      throw new IllegalArgumentException("Start time cannot be negative: " + start);
    }
    if (end <= start) {
      throw new IllegalArgumentException(
          String.format("End time must be greater than start time: start=%s, end=%s", start, end));
    }
  }

  public static UtteranceRecord of(Path audioFile, double start, double end) {
    return new UtteranceRecord(
        audioFile.toString(), start, end, null, null, null, null, null, null);
  }

  public double duration() {
    return end - start;
  }

  public UtteranceRecord withText(String text) {
    requireUnset(this.text, "text");
    return new UtteranceRecord(
        audioPath,
        start,
        end,
        Objects.requireNonNull(text, "text"),
        speakerId,
        ssmlGender,
        translatedText,
        assignedVoice,
        dubbedPath);
  }

  public UtteranceRecord withSpeaker(SpeakerInfo speaker) {
    requireUnset(this.speakerId, "speaker_id");
    return new UtteranceRecord(
        audioPath,
        start,
        end,
        text,
        speaker.speakerId(),
        speaker.gender(),
        translatedText,
        assignedVoice,
        dubbedPath);
  }

  public UtteranceRecord withTranslatedText(String translatedText) {
    requireUnset(this.translatedText, "translated_text");
    return new UtteranceRecord(
        audioPath,
        start,
        end,
        text,
        speakerId,
        ssmlGender,
        Objects.requireNonNull(translatedText, "translatedText"),
        assignedVoice,
        dubbedPath);
  }

  public UtteranceRecord withAssignedVoice(String assignedVoice) {
    requireUnset(this.assignedVoice, "assigned_voice");
    return new UtteranceRecord(
        audioPath,
        start,
        end,
        text,
        speakerId,
        ssmlGender,
        translatedText,
        Objects.requireNonNull(assignedVoice, "assignedVoice"),
        dubbedPath);
  }

  public UtteranceRecord withDubbedPath(Path dubbedFile) {
    requireUnset(this.dubbedPath, "dubbed_path");
    return new UtteranceRecord(
        audioPath,
        start,
        end,
        text,
        speakerId,
        ssmlGender,
        translatedText,
        assignedVoice,
        dubbedFile.toString());
  }

  /**
   * Merge this utterance with the one that follows it.
   *
   * <p>The merged utterance keeps this chunk's audio path, spans both time ranges and joins the
   * texts with a single space. Both utterances must belong to the same speaker.
   */
  public UtteranceRecord mergeWith(UtteranceRecord next) {
    if (!Objects.equals(speakerId, next.speakerId)) {
      throw new IllegalArgumentException(
          String.format(
              "Cannot merge utterances of different speakers: %s and %s",
              speakerId, next.speakerId));
    }
    return new UtteranceRecord(
        audioPath,
        start,
        Math.max(end, next.end),
        join(text, next.text),
        speakerId,
        ssmlGender,
        join(translatedText, next.translatedText),
        assignedVoice,
        dubbedPath);
  }

  private static String join(String left, String right) {
    if (left == null) {
      return right;
    }
    if (right == null) {
      return left;
    }
    return left.strip() + " " + right.strip();
  }

  private static void requireUnset(Object current, String field) {
    if (current != null) {
      throw new IllegalStateException("Utterance field '" + field + "' is already set");
    }
  }
}
