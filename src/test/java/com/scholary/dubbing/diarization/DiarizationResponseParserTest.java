package com.scholary.dubbing.diarization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import com.scholary.dubbing.utterance.SpeakerInfo;
import java.util.List;
import org.junit.jupiter.api.Test;

class DiarizationResponseParserTest {

  @Test
  void parse_shouldReadOneTuplePerLine() {
    List<SpeakerInfo> speakers =
        DiarizationResponseParser.parse("(speaker_1, Male)\n(speaker_2, Female)\n");

    assertThat(speakers)
        .containsExactly(
            new SpeakerInfo("speaker_1", "Male"), new SpeakerInfo("speaker_2", "Female"));
  }

  @Test
  void parse_shouldKeepOrderAndDuplicates() {
    List<SpeakerInfo> speakers =
        DiarizationResponseParser.parse(
            "(speaker_2, Female)\n(speaker_1, Male)\n(speaker_2, Female)");

    assertThat(speakers)
        .extracting(SpeakerInfo::speakerId)
        .containsExactly("speaker_2", "speaker_1", "speaker_2");
  }

  @Test
  void parse_shouldAcceptSeveralTuplesOnOneLine() {
    List<SpeakerInfo> speakers =
        DiarizationResponseParser.parse("(speaker_1, Male), (speaker_2, Female)");

    assertThat(speakers).hasSize(2);
    assertThat(speakers.get(1)).isEqualTo(new SpeakerInfo("speaker_2", "Female"));
  }

  @Test
  void parse_shouldIgnoreBlankLinesAndWhitespace() {
    List<SpeakerInfo> speakers =
        DiarizationResponseParser.parse("\n  (  speaker_1 ,Male )  \n\n\r\n(speaker_1, Male)\n");

    assertThat(speakers)
        .containsExactly(
            new SpeakerInfo("speaker_1", "Male"), new SpeakerInfo("speaker_1", "Male"));
  }

  @Test
  void parse_shouldReturnEmptyListForEmptyReply() {
    assertThat(DiarizationResponseParser.parse("")).isEmpty();
    assertThat(DiarizationResponseParser.parse("   \n ")).isEmpty();
    assertThat(DiarizationResponseParser.parse(null)).isEmpty();
  }

  @Test
  void parse_shouldRejectLineWithoutTuple() {
    DiarizationParseException e =
        catchThrowableOfType(
            () -> DiarizationResponseParser.parse("(speaker_1, Male)\nspeaker_2 is Female"),
            DiarizationParseException.class);

    assertThat(e).hasMessageContaining("line 2");
    assertThat(e.getLineNumber()).isEqualTo(2);
    assertThat(e.getLine()).isEqualTo("speaker_2 is Female");
  }

  @Test
  void parse_shouldRejectTextAroundTuple() {
    assertThatThrownBy(() -> DiarizationResponseParser.parse("Answer: (speaker_1, Male)"))
        .isInstanceOf(DiarizationParseException.class);
    assertThatThrownBy(() -> DiarizationResponseParser.parse("(speaker_1, Male) done"))
        .isInstanceOf(DiarizationParseException.class);
  }

  @Test
  void parse_shouldRejectEmptyLabels() {
    assertThatThrownBy(() -> DiarizationResponseParser.parse("(speaker_1, )"))
        .isInstanceOf(DiarizationParseException.class)
        .hasMessageContaining("empty");
  }

  @Test
  void parse_shouldRejectTupleWithThreeElements() {
    assertThatThrownBy(() -> DiarizationResponseParser.parse("(speaker_1, Male, extra)"))
        .isInstanceOf(DiarizationParseException.class);
  }
}
