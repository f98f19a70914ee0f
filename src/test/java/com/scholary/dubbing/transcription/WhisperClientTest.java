package com.scholary.dubbing.transcription;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.dubbing.http.RetryingHttpExecutor;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class WhisperClientTest {

  @TempDir Path tempDir;

  private RetryingHttpExecutor executor;
  private WhisperClient client;
  private Path chunk;

  @BeforeEach
  void setUp() throws Exception {
    executor = mock(RetryingHttpExecutor.class);
    client =
        new WhisperClient(
            new WhisperProperties("http://whisper.test", "large-v3", 10, 60, 3),
            new ObjectMapper(),
            executor);
    chunk = Files.write(tempDir.resolve("chunk_0.mp3"), new byte[] {1, 2, 3});
  }

  @Test
  void transcribe_shouldJoinSegmentTexts() {
    when(executor.send(any()))
        .thenReturn(
            "{\"language\":\"en\",\"segments\":[{\"start\":0,\"end\":1,\"text\":\" Hello \"},"
                + "{\"start\":1,\"end\":2,\"text\":\"world.\"}]}");

    assertThat(client.transcribe(chunk, "en", "Acme")).isEqualTo("Hello world.");
  }

  @Test
  void transcribe_shouldReturnEmptyTextWithoutSpeech() {
    when(executor.send(any())).thenReturn("{\"language\":\"en\",\"segments\":[]}");

    assertThat(client.transcribe(chunk, "en", null)).isEmpty();
  }

  @Test
  void transcribe_shouldFailOnInvalidJson() {
    when(executor.send(any())).thenReturn("not json");

    assertThatThrownBy(() -> client.transcribe(chunk, "en", null))
        .isInstanceOf(TranscriptionException.class);
  }
}
