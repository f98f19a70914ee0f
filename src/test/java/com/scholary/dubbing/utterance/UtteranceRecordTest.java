package com.scholary.dubbing.utterance;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class UtteranceRecordTest {

  private final UtteranceRecord chunk = UtteranceRecord.of(Path.of("chunk_0.mp3"), 1.0, 3.5);

  @Test
  void of_shouldLeaveLaterFieldsUnset() {
    assertThat(chunk.audioPath()).isEqualTo("chunk_0.mp3");
    assertThat(chunk.duration()).isEqualTo(2.5);
    assertThat(chunk.text()).isNull();
    assertThat(chunk.speakerId()).isNull();
    assertThat(chunk.translatedText()).isNull();
    assertThat(chunk.dubbedPath()).isNull();
  }

  @Test
  void constructor_shouldRejectInvalidTiming() {
    assertThatThrownBy(() -> UtteranceRecord.of(Path.of("a.mp3"), -0.5, 1.0))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Start time cannot be negative");
    assertThatThrownBy(() -> UtteranceRecord.of(Path.of("a.mp3"), 2.0, 2.0))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("End time must be greater than start time");
  }

  @Test
  void with_shouldReturnCopyAndKeepOriginal() {
    UtteranceRecord transcribed = chunk.withText("Hello");

    assertThat(transcribed.text()).isEqualTo("Hello");
    assertThat(chunk.text()).isNull();
  }

  @Test
  void with_shouldRefuseToOverwriteField() {
    UtteranceRecord transcribed = chunk.withText("Hello");

    assertThatThrownBy(() -> transcribed.withText("Goodbye"))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("text");
  }

  @Test
  void withSpeaker_shouldSetIdAndGender() {
    UtteranceRecord attributed = chunk.withSpeaker(new SpeakerInfo("speaker_1", "Female"));

    assertThat(attributed.speakerId()).isEqualTo("speaker_1");
    assertThat(attributed.ssmlGender()).isEqualTo("Female");
  }

  @Test
  void mergeWith_shouldSpanBothAndJoinTexts() {
    SpeakerInfo speaker = new SpeakerInfo("speaker_1", "Male");
    UtteranceRecord first =
        chunk.withText("Hello ").withSpeaker(speaker).withTranslatedText("Hola");
    UtteranceRecord second =
        UtteranceRecord.of(Path.of("chunk_1.mp3"), 3.5, 5.0)
            .withText("world")
            .withSpeaker(speaker)
            .withTranslatedText("mundo");

    UtteranceRecord merged = first.mergeWith(second);

    assertThat(merged.audioPath()).isEqualTo("chunk_0.mp3");
    assertThat(merged.start()).isEqualTo(1.0);
    assertThat(merged.end()).isEqualTo(5.0);
    assertThat(merged.text()).isEqualTo("Hello world");
    assertThat(merged.translatedText()).isEqualTo("Hola mundo");
  }

  @Test
  void mergeWith_shouldRejectDifferentSpeakers() {
    UtteranceRecord first = chunk.withSpeaker(new SpeakerInfo("speaker_1", "Male"));
    UtteranceRecord second =
        UtteranceRecord.of(Path.of("chunk_1.mp3"), 4.0, 5.0)
            .withSpeaker(new SpeakerInfo("speaker_2", "Female"));

    assertThatThrownBy(() -> first.mergeWith(second))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
