package com.scholary.dubbing.media;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Runs commands with {@link ProcessBuilder}, merging stderr into stdout. */
public class ProcessCommandRunner implements CommandRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProcessCommandRunner.class);

  @Override
  public String run(List<String> command) {
    LOGGER.debug("Executing: {}", String.join(" ", command));

    ProcessBuilder pb = new ProcessBuilder(command);
    pb.redirectErrorStream(true);

    try {
      Process process = pb.start();
      String output = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
      int exitCode = process.waitFor();

      if (exitCode != 0) {
        LOGGER.error("{} failed: exitCode={}, output={}", command.get(0), exitCode, tail(output));
        throw new MediaProcessingException(
            command.get(0) + " failed with exit code " + exitCode + ": " + tail(output));
      }
      return output;

    } catch (IOException e) {
      throw new MediaProcessingException("Failed to start " + command.get(0), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new MediaProcessingException(command.get(0) + " interrupted", e);
    }
  }

  /** ffmpeg prints the actual error at the end of a long banner. */
  private static String tail(String output) {
    return output.length() <= 1000 ? output : "..." + output.substring(output.length() - 1000);
  }
}
