package com.scholary.dubbing.media;

import java.util.List;

/** Runs an external command to completion. */
@FunctionalInterface
public interface CommandRunner {

  /**
   * Run the command and wait for it.
   *
   * @return combined stdout and stderr
   * @throws MediaProcessingException if the command cannot start or exits with a non-zero code
   */
  String run(List<String> command);
}
