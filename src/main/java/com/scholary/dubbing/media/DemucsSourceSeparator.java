package com.scholary.dubbing.media;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs Demucs in two-stem mode.
 *
 * <p>Demucs writes {@code <out>/<model>/<input name without extension>/vocals.wav} and {@code
 * no_vocals.wav}.
 */
public class DemucsSourceSeparator implements SourceSeparator {

  private static final Logger LOGGER = LoggerFactory.getLogger(DemucsSourceSeparator.class);

  private final DemucsProperties properties;
  private final CommandRunner runner;

  public DemucsSourceSeparator(DemucsProperties properties, CommandRunner runner) {
    this.properties = properties;
    this.runner = runner;
  }

  @Override
  public SeparatedAudio separate(Path audioFile, Path outputDirectory) {
    LOGGER.info(
        "Separating vocals: file={}, model={}", audioFile.getFileName(), properties.model());
    runner.run(command(audioFile, outputDirectory));

    SeparatedAudio separated = outputPaths(audioFile, outputDirectory);
    if (!Files.isRegularFile(separated.vocals()) || !Files.isRegularFile(separated.background())) {
      throw new MediaProcessingException(
          "Demucs did not produce the expected files under "
              + separated.vocals().getParent());
    }
    return separated;
  }

  List<String> command(Path audioFile, Path outputDirectory) {
    return List.of(
        properties.pythonExecutable(),
        "-m",
        "demucs",
        "--two-stems=vocals",
        "-n",
        properties.model(),
        "-d",
        properties.device(),
        "-o",
        outputDirectory.toString(),
        audioFile.toString());
  }

  SeparatedAudio outputPaths(Path audioFile, Path outputDirectory) {
    String name = audioFile.getFileName().toString();
    int dot = name.lastIndexOf('.');
    String stem = dot > 0 ? name.substring(0, dot) : name;
    Path directory = outputDirectory.resolve(properties.model()).resolve(stem);
    return new SeparatedAudio(directory.resolve("vocals.wav"), directory.resolve("no_vocals.wav"));
  }
}
