package com.scholary.dubbing.gemini;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scholary.dubbing.config.Credentials;
import com.scholary.dubbing.http.RetryingHttpExecutor;
import com.scholary.dubbing.remote.RemoteAssetHandle;
import com.scholary.dubbing.remote.RemoteAssetState;
import java.io.FileNotFoundException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * REST client for the Gemini API.
 *
 * <p>Files go through the media upload endpoint and are referenced by URI in later requests.
 * Chats are kept client-side: every {@link GeminiChatSession#send(String)} posts the full history
 * to {@code generateContent}.
 */
public class GeminiClient implements GenerativeModel {

  private static final Logger LOGGER = LoggerFactory.getLogger(GeminiClient.class);

  private static final List<String> HARM_CATEGORIES =
      List.of(
          "HARM_CATEGORY_HARASSMENT",
          "HARM_CATEGORY_HATE_SPEECH",
          "HARM_CATEGORY_SEXUALLY_EXPLICIT",
          "HARM_CATEGORY_DANGEROUS_CONTENT");

  private final RetryingHttpExecutor executor;
  private final GeminiProperties properties;
  private final ObjectMapper objectMapper;

  public GeminiClient(GeminiProperties properties, ObjectMapper objectMapper) {
    this(
        properties,
        objectMapper,
        new RetryingHttpExecutor(
            "gemini", Duration.ofSeconds(properties.connectTimeout()), properties.maxRetries()));
  }

  GeminiClient(
      GeminiProperties properties, ObjectMapper objectMapper, RetryingHttpExecutor executor) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.executor = executor;

    LOGGER.info(
        "Initialized Gemini client: baseUrl={}, model={}", properties.baseUrl(), properties.model());
  }

  @Override
  public RemoteAssetHandle upload(Path file, String mimeType) {
    String apiKey = apiKey();
    if (!Files.isRegularFile(file)) {
      throw new UncheckedIOException(new FileNotFoundException(file.toString()));
    }
    LOGGER.info("Uploading file to Gemini: file={}, mimeType={}", file.getFileName(), mimeType);

    String json =
        executor.send(
            () -> {
              try {
                return HttpRequest.newBuilder()
                    .uri(URI.create(properties.baseUrl() + "/upload/v1beta/files?uploadType=media"))
                    .timeout(Duration.ofSeconds(properties.readTimeout()))
                    .header("x-goog-api-key", apiKey)
                    .header("X-Goog-Upload-Protocol", "raw")
                    .header("Content-Type", mimeType)
                    .POST(HttpRequest.BodyPublishers.ofFile(file))
                    .build();
              } catch (FileNotFoundException e) {
                throw new UncheckedIOException(e);
              }
            });

    RemoteAssetHandle handle = toHandle(readTree(json).path("file"));
    LOGGER.info("Uploaded file: name={}, state={}", handle.name(), handle.state());
    return handle;
  }

  @Override
  public RemoteAssetState queryStatus(RemoteAssetHandle handle) {
    String apiKey = apiKey();
    String json =
        executor.send(
            () ->
                HttpRequest.newBuilder()
                    .uri(URI.create(properties.baseUrl() + "/v1beta/" + handle.name()))
                    .timeout(Duration.ofSeconds(properties.readTimeout()))
                    .header("x-goog-api-key", apiKey)
                    .GET()
                    .build());
    return toState(readTree(json).path("state").asText(null));
  }

  @Override
  public ChatSession startChat(String systemInstruction, RemoteAssetHandle attachment) {
    if (attachment != null && attachment.state() != RemoteAssetState.ACTIVE) {
      throw new IllegalArgumentException(
          "File " + attachment.name() + " is not active: " + attachment.state());
    }
    return new GeminiChatSession(this, objectMapper, systemInstruction, attachment);
  }

  /** Post the conversation so far and return the reply text. */
  String generateContent(String systemInstruction, ArrayNode contents) {
    String apiKey = apiKey();
    ObjectNode request = buildRequest(objectMapper, properties, systemInstruction, contents);
    String payload;
    try {
      payload = objectMapper.writeValueAsString(request);
    } catch (JsonProcessingException e) {
      throw new GeminiException("Failed to serialize Gemini request", e);
    }

    String url = properties.baseUrl() + "/v1beta/models/" + properties.model() + ":generateContent";
    String json =
        executor.send(
            () ->
                HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(Duration.ofSeconds(properties.readTimeout()))
                    .header("x-goog-api-key", apiKey)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(payload))
                    .build());
    return extractText(readTree(json));
  }

  static ObjectNode buildRequest(
      ObjectMapper objectMapper,
      GeminiProperties properties,
      String systemInstruction,
      ArrayNode contents) {
    ObjectNode request = objectMapper.createObjectNode();
    request.set("contents", contents);

    if (systemInstruction != null && !systemInstruction.isBlank()) {
      ObjectNode instruction = request.putObject("systemInstruction");
      instruction.putArray("parts").addObject().put("text", systemInstruction);
    }

    ObjectNode generationConfig = request.putObject("generationConfig");
    generationConfig.put("temperature", properties.temperature());
    generationConfig.put("topP", properties.topP());
    generationConfig.put("topK", properties.topK());
    generationConfig.put("maxOutputTokens", properties.maxOutputTokens());
    generationConfig.put("responseMimeType", properties.responseMimeType());

    ArrayNode safetySettings = request.putArray("safetySettings");
    for (String category : HARM_CATEGORIES) {
      safetySettings
          .addObject()
          .put("category", category)
          .put("threshold", properties.safetyThreshold());
    }
    return request;
  }

  /**
   * Read the text of the first candidate.
   *
   * @throws GeminiException if the prompt was blocked or the reply has no text
   */
  static String extractText(JsonNode response) {
    JsonNode candidates = response.path("candidates");
    if (!candidates.isArray() || candidates.isEmpty()) {
      String reason = response.path("promptFeedback").path("blockReason").asText("UNKNOWN");
      throw new GeminiException("Gemini returned no candidates, block reason: " + reason);
    }

    JsonNode candidate = candidates.get(0);
    StringBuilder text = new StringBuilder();
    for (JsonNode part : candidate.path("content").path("parts")) {
      text.append(part.path("text").asText(""));
    }
    if (text.length() == 0) {
      throw new GeminiException(
          "Gemini returned an empty reply, finish reason: "
              + candidate.path("finishReason").asText("UNKNOWN"));
    }
    return text.toString();
  }

  static RemoteAssetHandle toHandle(JsonNode file) {
    String name = file.path("name").asText(null);
    if (name == null) {
      throw new GeminiException("Gemini upload response has no file name");
    }
    return new RemoteAssetHandle(
        name,
        file.path("uri").asText(null),
        file.path("mimeType").asText(null),
        toState(file.path("state").asText(null)));
  }

  /** Gemini reports {@code PROCESSING} while a file is being prepared. */
  static RemoteAssetState toState(String state) {
    if ("ACTIVE".equals(state)) {
      return RemoteAssetState.ACTIVE;
    }
    if ("FAILED".equals(state)) {
      return RemoteAssetState.FAILED;
    }
    return RemoteAssetState.PENDING;
  }

  private JsonNode readTree(String json) {
    try {
      return objectMapper.readTree(json);
    } catch (JsonProcessingException e) {
      throw new GeminiException("Invalid Gemini response", e);
    }
  }

  private String apiKey() {
    return Credentials.require(properties.apiKey(), "gemini.apiKey", "GEMINI_TOKEN");
  }
}
