package com.scholary.dubbing.synthesis;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scholary.dubbing.config.Credentials;
import com.scholary.dubbing.http.RetryingHttpExecutor;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** REST client for Google Cloud Text-to-Speech. */
public class GoogleTextToSpeechClient implements SpeechSynthesizer {

  private static final Logger LOGGER = LoggerFactory.getLogger(GoogleTextToSpeechClient.class);

  private final RetryingHttpExecutor executor;
  private final TextToSpeechProperties properties;
  private final ObjectMapper objectMapper;

  public GoogleTextToSpeechClient(TextToSpeechProperties properties, ObjectMapper objectMapper) {
    this(
        properties,
        objectMapper,
        new RetryingHttpExecutor(
            "tts", Duration.ofSeconds(properties.connectTimeout()), properties.maxRetries()));
  }

  GoogleTextToSpeechClient(
      TextToSpeechProperties properties, ObjectMapper objectMapper, RetryingHttpExecutor executor) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.executor = executor;
  }

  @Override
  public List<Voice> listVoices(String languageCode) {
    String apiKey = apiKey();
    String url =
        properties.baseUrl()
            + "/v1/voices?languageCode="
            + URLEncoder.encode(languageCode, StandardCharsets.UTF_8);
    String json =
        executor.send(
            () ->
                HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(Duration.ofSeconds(properties.readTimeout()))
                    .header("x-goog-api-key", apiKey)
                    .GET()
                    .build());
    try {
      VoicesResponse response = objectMapper.readValue(json, VoicesResponse.class);
      List<Voice> voices = response.voices() == null ? List.of() : response.voices();
      LOGGER.debug("Found {} voices for {}", voices.size(), languageCode);
      return voices;
    } catch (JsonProcessingException e) {
      throw new SpeechSynthesisException("Invalid voices response for " + languageCode, e);
    }
  }

  @Override
  public Path synthesize(String text, String voiceName, String languageCode, Path outputFile) {
    String apiKey = apiKey();
    String payload = requestBody(text, voiceName, languageCode);
    String json =
        executor.send(
            () ->
                HttpRequest.newBuilder()
                    .uri(URI.create(properties.baseUrl() + "/v1/text:synthesize"))
                    .timeout(Duration.ofSeconds(properties.readTimeout()))
                    .header("x-goog-api-key", apiKey)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(payload))
                    .build());

    String audioContent;
    try {
      audioContent = objectMapper.readTree(json).path("audioContent").asText("");
    } catch (JsonProcessingException e) {
      throw new SpeechSynthesisException("Invalid synthesis response for voice " + voiceName, e);
    }
    if (audioContent.isEmpty()) {
      throw new SpeechSynthesisException("Synthesis returned no audio for voice " + voiceName);
    }

    try {
      Files.write(outputFile, Base64.getDecoder().decode(audioContent));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write synthesized audio: " + outputFile, e);
    }
    LOGGER.debug("Synthesized {} characters to {}", text.length(), outputFile.getFileName());
    return outputFile;
  }

  String requestBody(String text, String voiceName, String languageCode) {
    ObjectNode request = objectMapper.createObjectNode();
    request.putObject("input").put("text", text);
    request.putObject("voice").put("languageCode", languageCode).put("name", voiceName);
    request.putObject("audioConfig").put("audioEncoding", properties.audioEncoding());
    try {
      return objectMapper.writeValueAsString(request);
    } catch (JsonProcessingException e) {
      throw new SpeechSynthesisException("Failed to serialize synthesis request", e);
    }
  }

  private String apiKey() {
    return Credentials.require(properties.apiKey(), "tts.apiKey", "TTS_TOKEN");
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record VoicesResponse(List<Voice> voices) {}
}
