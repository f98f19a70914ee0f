package com.scholary.dubbing.diarization;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.dubbing.utterance.UtteranceMetadata;
import com.scholary.dubbing.utterance.UtteranceRecord;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;

class DiarizationPromptTest {

  private final UtteranceMetadata utterances =
      UtteranceMetadata.of(
              List.of(
                  UtteranceRecord.of(Path.of("chunk_0.mp3"), 0.0, 1.5),
                  UtteranceRecord.of(Path.of("chunk_1.mp3"), 2.25, 4.0)))
          .withTexts(List.of("Hello there", "Buy now"));

  @Test
  void transcript_shouldListEveryUtteranceWithTimestamps() {
    String transcript = DiarizationPrompt.transcript(utterances);

    assertThat(transcript.lines())
        .containsExactly("[0.00 - 1.50] Hello there", "[2.25 - 4.00] Buy now");
  }

  @Test
  void build_shouldAskForOneTuplePerUtterance() {
    String prompt = DiarizationPrompt.build(utterances, 1, null);

    assertThat(prompt)
        .contains("The number of speakers in the video is: 1.")
        .contains("exactly 2 tuples")
        .doesNotContain("Additional instructions");
  }

  @Test
  void build_shouldAppendExtraInstructions() {
    String prompt = DiarizationPrompt.build(utterances, 2, "  The narrator is female. ");

    assertThat(prompt).endsWith("Additional instructions: The narrator is female.");
  }
}
