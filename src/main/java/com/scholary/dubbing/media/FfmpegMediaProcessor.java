package com.scholary.dubbing.media;

import com.scholary.dubbing.segmentation.TimeRange;
import com.scholary.dubbing.utterance.UtteranceMetadata;
import com.scholary.dubbing.utterance.UtteranceRecord;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link MediaProcessor} backed by the ffmpeg command line.
 *
 * <p>Every method builds one ffmpeg invocation and runs it through a {@link CommandRunner}, so the
 * argument lists can be checked in tests without ffmpeg installed.
 */
public class FfmpegMediaProcessor implements MediaProcessor {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegMediaProcessor.class);

  static final String VIDEO_FILE = "video_processed.mp4";
  static final String AUDIO_FILE = "audio_processed.mp3";
  static final String DUBBED_VOCALS_FILE = "dubbed_vocals.mp3";
  static final String DUBBED_AUDIO_FILE = "dubbed_audio.mp3";
  static final String DUBBED_VIDEO_FILE = "dubbed_video.mp4";

  private final FfmpegProperties properties;
  private final CommandRunner runner;

  public FfmpegMediaProcessor(FfmpegProperties properties, CommandRunner runner) {
    this.properties = properties;
    this.runner = runner;
  }

  @Override
  public AudioVideoSplit splitAudioVideo(Path videoFile, Path outputDirectory) {
    Path video = outputDirectory.resolve(VIDEO_FILE);
    Path audio = outputDirectory.resolve(AUDIO_FILE);
    LOGGER.info("Splitting audio and video: file={}", videoFile.getFileName());

    runner.run(
        List.of(
            properties.binary(), "-y", "-i", videoFile.toString(),
            "-an", "-c:v", "copy", video.toString()));
    runner.run(
        List.of(
            properties.binary(), "-y", "-i", videoFile.toString(),
            "-vn", "-q:a", String.valueOf(properties.audioQuality()), audio.toString()));
    return new AudioVideoSplit(video, audio);
  }

  @Override
  public List<Path> cutAudio(Path audioFile, List<TimeRange> spans, Path outputDirectory) {
    LOGGER.info("Cutting {} chunks from {}", spans.size(), audioFile.getFileName());
    List<Path> chunks = new ArrayList<>(spans.size());
    for (int i = 0; i < spans.size(); i++) {
      TimeRange span = spans.get(i);
      Path chunk = outputDirectory.resolve(String.format(Locale.ROOT, "chunk_%d.mp3", i));
      runner.run(
          List.of(
              properties.binary(), "-y", "-i", audioFile.toString(),
              "-ss", seconds(span.start()),
              "-to", seconds(span.end()),
              "-q:a", String.valueOf(properties.audioQuality()),
              chunk.toString()));
      chunks.add(chunk);
    }
    return chunks;
  }

  @Override
  public Path insertAudioAtTimestamps(
      UtteranceMetadata utterances, Path backgroundAudio, Path outputDirectory) {
    Path output = outputDirectory.resolve(DUBBED_VOCALS_FILE);
    LOGGER.info("Placing {} dubbed clips on the timeline", utterances.size());

    List<String> command = new ArrayList<>();
    command.add(properties.binary());
    command.add("-y");
    command.add("-i");
    command.add(backgroundAudio.toString());
    for (UtteranceRecord record : utterances) {
      if (record.dubbedPath() == null) {
        throw new IllegalStateException("Utterance has no dubbed audio: " + record.audioPath());
      }
      command.add("-i");
      command.add(record.dubbedPath().toString());
    }
    command.add("-filter_complex");
    command.add(timelineFilter(utterances));
    command.add("-map");
    command.add("[out]");
    command.add("-q:a");
    command.add(String.valueOf(properties.audioQuality()));
    command.add(output.toString());

    runner.run(command);
    return output;
  }

  @Override
  public Path mergeBackgroundAndVocals(
      Path backgroundAudio, Path dubbedVocals, Path outputDirectory) {
    Path output = outputDirectory.resolve(DUBBED_AUDIO_FILE);
    LOGGER.info("Mixing dubbed vocals with background");
    runner.run(
        List.of(
            properties.binary(), "-y",
            "-i", backgroundAudio.toString(),
            "-i", dubbedVocals.toString(),
            "-filter_complex", "[0:a][1:a]amix=inputs=2:duration=longest:normalize=0[out]",
            "-map", "[out]",
            "-q:a", String.valueOf(properties.audioQuality()),
            output.toString()));
    return output;
  }

  @Override
  public Path combineAudioVideo(Path videoFile, Path dubbedAudio, Path outputDirectory) {
    Path output = outputDirectory.resolve(DUBBED_VIDEO_FILE);
    LOGGER.info("Combining dubbed audio with video: file={}", videoFile.getFileName());
    runner.run(
        List.of(
            properties.binary(), "-y",
            "-i", videoFile.toString(),
            "-i", dubbedAudio.toString(),
            "-map", "0:v:0",
            "-map", "1:a:0",
            "-c:v", "copy",
            "-c:a", properties.videoAudioCodec(),
            "-shortest",
            output.toString()));
    return output;
  }

  /**
   * Mute the background (input 0) to get a silent base of the right length, delay every clip to
   * its start time and mix them all onto the base.
   */
  static String timelineFilter(UtteranceMetadata utterances) {
    StringBuilder filter = new StringBuilder("[0:a]volume=0[base]");
    StringBuilder mixInputs = new StringBuilder("[base]");
    for (int i = 0; i < utterances.size(); i++) {
      long delayMs = Math.round(utterances.get(i).start() * 1000);
      int input = i + 1;
      filter.append(
          String.format(Locale.ROOT, ";[%d:a]adelay=%d:all=1[d%d]", input, delayMs, input));
      mixInputs.append(String.format(Locale.ROOT, "[d%d]", input));
    }
    filter
        .append(';')
        .append(mixInputs)
        .append(
            String.format(
                Locale.ROOT,
                "amix=inputs=%d:duration=first:dropout_transition=0:normalize=0[out]",
                utterances.size() + 1));
    return filter.toString();
  }

  private static String seconds(double value) {
    return String.format(Locale.ROOT, "%.3f", value);
  }
}
