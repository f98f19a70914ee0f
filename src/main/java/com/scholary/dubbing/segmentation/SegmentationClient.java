package com.scholary.dubbing.segmentation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.dubbing.config.Credentials;
import com.scholary.dubbing.http.MultipartBody;
import com.scholary.dubbing.http.RetryingHttpExecutor;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for a pyannote-based speaker segmentation service.
 *
 * <p>The service returns one segment per speaker turn. Segments are sorted by start time before
 * they become utterances; zero-length turns are dropped since they cannot be cut into a chunk.
 */
public class SegmentationClient implements SpeechSegmenter {

  private static final Logger LOGGER = LoggerFactory.getLogger(SegmentationClient.class);

  private final RetryingHttpExecutor executor;
  private final SegmentationProperties properties;
  private final ObjectMapper objectMapper;

  public SegmentationClient(SegmentationProperties properties, ObjectMapper objectMapper) {
    this(
        properties,
        objectMapper,
        new RetryingHttpExecutor(
            "segmentation",
            Duration.ofSeconds(properties.connectTimeout()),
            properties.maxRetries()));
  }

  SegmentationClient(
      SegmentationProperties properties,
      ObjectMapper objectMapper,
      RetryingHttpExecutor executor) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.executor = executor;
  }

  @Override
  public List<TimeRange> segment(Path audioFile, int numberOfSpeakers) {
    String token =
        Credentials.require(
            properties.huggingFaceToken(), "segmentation.huggingFaceToken", "HUGGING_FACE_TOKEN");

    LOGGER.info(
        "Segmenting audio: file={}, speakers={}, model={}",
        audioFile.getFileName(),
        numberOfSpeakers,
        properties.model());

    MultipartBody body;
    try {
      body =
          new MultipartBody()
              .addFile("file", audioFile, "audio/mpeg")
              .addField("model", properties.model())
              .addField("num_speakers", numberOfSpeakers);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read audio file: " + audioFile, e);
    }

    String json =
        executor.send(
            () ->
                HttpRequest.newBuilder()
                    .uri(URI.create(properties.baseUrl() + "/api/v1/segment"))
                    .timeout(Duration.ofSeconds(properties.readTimeout()))
                    .header("Authorization", "Bearer " + token)
                    .header("Content-Type", body.contentType())
                    .POST(body.toPublisher())
                    .build());

    try {
      List<TimeRange> spans =
          toTimeRanges(objectMapper.readValue(json, SegmentationResponse.class));
      LOGGER.info("Segmentation found {} utterances in {}", spans.size(), audioFile.getFileName());
      return spans;
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Invalid segmentation response for " + audioFile, e);
    }
  }

  static List<TimeRange> toTimeRanges(SegmentationResponse response) {
    List<TimeRange> spans = new ArrayList<>();
    if (response.segments() == null) {
      return spans;
    }
    for (SegmentationResponse.Segment segment : response.segments()) {
      double start = Math.max(0.0, segment.start());
      if (segment.end() <= start) {
        LOGGER.debug("Dropping empty segment at {}s", segment.start());
        continue;
      }
      spans.add(new TimeRange(start, segment.end()));
    }
    spans.sort(Comparator.comparingDouble(TimeRange::start));
    return spans;
  }

  /** Wire format of the segmentation service. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record SegmentationResponse(List<Segment> segments) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Segment(double start, double end, String speaker) {}
  }
}
