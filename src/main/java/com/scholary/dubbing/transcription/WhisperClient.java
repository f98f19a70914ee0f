package com.scholary.dubbing.transcription;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.dubbing.http.MultipartBody;
import com.scholary.dubbing.http.RetryingHttpExecutor;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.nio.file.Path;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for calling the faster-whisper transcription API.
 *
 * <p>This handles the low-level HTTP communication: building multipart requests, sending chunk
 * files and parsing responses. Transient failures are retried by {@link RetryingHttpExecutor}.
 */
public class WhisperClient implements Transcriber {

  private static final Logger LOGGER = LoggerFactory.getLogger(WhisperClient.class);

  private final RetryingHttpExecutor executor;
  private final WhisperProperties properties;
  private final ObjectMapper objectMapper;

  public WhisperClient(WhisperProperties properties, ObjectMapper objectMapper) {
    this(
        properties,
        objectMapper,
        new RetryingHttpExecutor(
            "whisper", Duration.ofSeconds(properties.connectTimeout()), properties.maxRetries()));
  }

  WhisperClient(
      WhisperProperties properties, ObjectMapper objectMapper, RetryingHttpExecutor executor) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.executor = executor;

    LOGGER.info(
        "Initialized Whisper client: baseUrl={}, model={}", properties.baseUrl(), properties.model());
  }

  @Override
  public String transcribe(Path audioChunk, String languageHint, String prompt) {
    LOGGER.debug(
        "Transcribing chunk: file={}, language={}", audioChunk.getFileName(), languageHint);

    MultipartBody body = buildBody(audioChunk, languageHint, prompt);
    String json =
        executor.send(
            () ->
                HttpRequest.newBuilder()
                    .uri(URI.create(properties.baseUrl() + "/api/v1/transcribe"))
                    .timeout(Duration.ofSeconds(properties.readTimeout()))
                    .header("Content-Type", body.contentType())
                    .POST(body.toPublisher())
                    .build());

    try {
      WhisperResponse response = objectMapper.readValue(json, WhisperResponse.class);
      String text = response.text();
      LOGGER.debug(
          "Transcription successful: file={}, segments={}, characters={}",
          audioChunk.getFileName(),
          response.segments() == null ? 0 : response.segments().size(),
          text.length());
      return text;
    } catch (JsonProcessingException e) {
      throw new TranscriptionException(
          "Invalid Whisper response for chunk " + audioChunk.getFileName(), e);
    }
  }

  private MultipartBody buildBody(Path audioChunk, String languageHint, String prompt) {
    try {
      return new MultipartBody()
          .addFile("file", audioChunk, "audio/mpeg")
          .addField("model", properties.model())
          .addField("language", languageHint)
          .addField("initial_prompt", prompt);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read audio chunk: " + audioChunk, e);
    }
  }
}
