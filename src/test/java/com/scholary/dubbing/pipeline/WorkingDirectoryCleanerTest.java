package com.scholary.dubbing.pipeline;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class WorkingDirectoryCleanerTest {

  @TempDir Path workDir;

  @Test
  void clean_shouldDeleteEverythingButKeptFiles() throws IOException {
    Path output = Files.writeString(workDir.resolve("dubbed_video.mp4"), "video");
    Files.writeString(workDir.resolve("chunk_0.mp3"), "chunk");
    Path stems = Files.createDirectories(workDir.resolve("htdemucs/audio_processed"));
    Files.writeString(stems.resolve("vocals.wav"), "vocals");

    CleanupReport report = new WorkingDirectoryCleaner().clean(workDir, Set.of(output));

    assertThat(report.enabled()).isTrue();
    assertThat(report.failures()).isEmpty();
    assertThat(report.deleted()).hasSize(2);
    try (var remaining = Files.list(workDir)) {
      assertThat(remaining).containsExactly(output);
    }
  }

  @Test
  void clean_shouldMatchKeptFilesByNormalizedPath() throws IOException {
    Path output = Files.writeString(workDir.resolve("dubbed_audio.mp3"), "audio");

    new WorkingDirectoryCleaner()
        .clean(workDir, Set.of(workDir.resolve("sub/../dubbed_audio.mp3")));

    assertThat(output).exists();
  }

  @Test
  void clean_shouldRecordFailuresAndContinue() throws IOException {
    Path locked = Files.writeString(workDir.resolve("a_locked.mp3"), "locked");
    Path other = Files.writeString(workDir.resolve("b_other.mp3"), "other");
    WorkingDirectoryCleaner cleaner =
        new WorkingDirectoryCleaner(
            path -> {
              if (path.equals(locked)) {
                throw new AccessDeniedException(path.toString());
              }
              Files.delete(path);
            });

    CleanupReport report = cleaner.clean(workDir, Set.of());

    assertThat(report.failures()).hasSize(1);
    assertThat(report.failures().get(0).path()).isEqualTo(locked);
    assertThat(report.deleted()).containsExactly(other);
    assertThat(other).doesNotExist();
  }

  @Test
  void clean_shouldReportMissingDirectory() {
    CleanupReport report =
        new WorkingDirectoryCleaner().clean(workDir.resolve("missing"), Set.of());

    assertThat(report.failures()).hasSize(1);
    assertThat(report.deleted()).isEmpty();
  }
}
