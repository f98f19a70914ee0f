package com.scholary.dubbing.media;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.dubbing.segmentation.TimeRange;
import com.scholary.dubbing.utterance.UtteranceMetadata;
import com.scholary.dubbing.utterance.UtteranceRecord;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FfmpegMediaProcessorTest {

  private final Path workDir = Path.of("/work");
  private final List<List<String>> commands = new ArrayList<>();
  private FfmpegMediaProcessor processor;

  @BeforeEach
  void setUp() {
    CommandRunner recorder =
        command -> {
          commands.add(command);
          return "";
        };
    processor = new FfmpegMediaProcessor(new FfmpegProperties("ffmpeg", 0, "aac"), recorder);
  }

  @Test
  void splitAudioVideo_shouldWriteSilentVideoAndAudioTrack() {
    AudioVideoSplit split = processor.splitAudioVideo(Path.of("/in/ad.mp4"), workDir);

    assertThat(split.video()).isEqualTo(workDir.resolve("video_processed.mp4"));
    assertThat(split.audio()).isEqualTo(workDir.resolve("audio_processed.mp3"));
    assertThat(commands).hasSize(2);
    assertThat(commands.get(0)).contains("-an").endsWith("/work/video_processed.mp4");
    assertThat(commands.get(1)).contains("-vn").endsWith("/work/audio_processed.mp3");
  }

  @Test
  void cutAudio_shouldCutOneChunkPerSpan() {
    List<Path> chunks =
        processor.cutAudio(
            Path.of("/work/audio.mp3"),
            List.of(new TimeRange(0.5, 1.25), new TimeRange(2.0, 3.0)),
            workDir);

    assertThat(chunks)
        .containsExactly(workDir.resolve("chunk_0.mp3"), workDir.resolve("chunk_1.mp3"));
    assertThat(commands.get(0)).containsSequence("-ss", "0.500", "-to", "1.250");
    assertThat(commands.get(1)).containsSequence("-ss", "2.000", "-to", "3.000");
  }

  @Test
  void timelineFilter_shouldDelayEveryClipToItsStart() {
    UtteranceMetadata utterances =
        UtteranceMetadata.of(
            List.of(
                UtteranceRecord.of(Path.of("chunk_0.mp3"), 0.25, 1.0),
                UtteranceRecord.of(Path.of("chunk_1.mp3"), 2.0, 3.0)));

    assertThat(FfmpegMediaProcessor.timelineFilter(utterances))
        .isEqualTo(
            "[0:a]volume=0[base];[1:a]adelay=250:all=1[d1];[2:a]adelay=2000:all=1[d2];"
                + "[base][d1][d2]amix=inputs=3:duration=first:dropout_transition=0:normalize=0"
                + "[out]");
  }

  @Test
  void filtersAndFileNames_shouldUseAsciiDigitsRegardlessOfDefaultLocale() {
    Locale previous = Locale.getDefault();
    Locale.setDefault(Locale.forLanguageTag("th-TH-u-nu-thai"));
    try {
      UtteranceMetadata utterances =
          UtteranceMetadata.of(List.of(UtteranceRecord.of(Path.of("chunk_0.mp3"), 1.5, 2.0)));

      assertThat(FfmpegMediaProcessor.timelineFilter(utterances))
          .isEqualTo(
              "[0:a]volume=0[base];[1:a]adelay=1500:all=1[d1];"
                  + "[base][d1]amix=inputs=2:duration=first:dropout_transition=0:normalize=0"
                  + "[out]");
      assertThat(
              processor.cutAudio(
                  Path.of("/work/audio.mp3"), List.of(new TimeRange(0, 1)), workDir))
          .containsExactly(workDir.resolve("chunk_0.mp3"));
    } finally {
      Locale.setDefault(previous);
    }
  }

  @Test
  void insertAudioAtTimestamps_shouldUseDubbedClipsAsInputs() {
    UtteranceMetadata utterances =
        UtteranceMetadata.of(
                List.of(
                    UtteranceRecord.of(Path.of("chunk_0.mp3"), 0.0, 1.0),
                    UtteranceRecord.of(Path.of("chunk_1.mp3"), 2.0, 3.0)))
            .withDubbedFiles(
                List.of(Path.of("/work/dubbed_0.mp3"), Path.of("/work/dubbed_1.mp3")));

    Path output =
        processor.insertAudioAtTimestamps(utterances, Path.of("/work/no_vocals.wav"), workDir);

    assertThat(output).isEqualTo(workDir.resolve("dubbed_vocals.mp3"));
    assertThat(commands.get(0))
        .containsSequence(
            "-i", "/work/no_vocals.wav", "-i", "/work/dubbed_0.mp3", "-i", "/work/dubbed_1.mp3");
  }

  @Test
  void insertAudioAtTimestamps_shouldRejectUtteranceWithoutClip() {
    UtteranceMetadata utterances =
        UtteranceMetadata.of(List.of(UtteranceRecord.of(Path.of("chunk_0.mp3"), 0.0, 1.0)));

    assertThatThrownBy(
            () ->
                processor.insertAudioAtTimestamps(
                    utterances, Path.of("/work/no_vocals.wav"), workDir))
        .isInstanceOf(IllegalStateException.class);
    assertThat(commands).isEmpty();
  }

  @Test
  void combineAudioVideo_shouldCopyVideoStream() {
    Path output =
        processor.combineAudioVideo(
            Path.of("/work/video_processed.mp4"), Path.of("/work/dubbed_audio.mp3"), workDir);

    assertThat(output).isEqualTo(workDir.resolve("dubbed_video.mp4"));
    assertThat(commands.get(0)).containsSequence("-c:v", "copy", "-c:a", "aac");
  }
}
