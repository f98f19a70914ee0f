package com.scholary.dubbing.objectstore;

import com.scholary.dubbing.utterance.UtteranceMetadata;
import com.scholary.dubbing.utterance.UtteranceMetadataWriter;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves job files between the object store and the local working directory.
 *
 * <p>Published objects are stored under {@code dubbed/<jobId>/} and returned as presigned URLs.
 */
public class ArtifactPublisher {

  private static final Logger LOGGER = LoggerFactory.getLogger(ArtifactPublisher.class);

  private final ObjectStoreClient objectStoreClient;
  private final ObjectStoreProperties properties;
  private final UtteranceMetadataWriter metadataWriter;

  public ArtifactPublisher(
      ObjectStoreClient objectStoreClient,
      ObjectStoreProperties properties,
      UtteranceMetadataWriter metadataWriter) {
    this.objectStoreClient = objectStoreClient;
    this.properties = properties;
    this.metadataWriter = metadataWriter;
  }

  /**
   * Download an input object into {@code directory}, keeping the key's file name.
   *
   * @return the local copy
   */
  public Path download(String bucket, String key, Path directory) {
    String fileName = key.substring(key.lastIndexOf('/') + 1);
    Path target = directory.resolve(fileName);
    try (InputStream stream = objectStoreClient.getObjectStream(bucketOrDefault(bucket), key)) {
      Files.copy(stream, target, StandardCopyOption.REPLACE_EXISTING);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to download " + key, e);
    }
    LOGGER.info("Downloaded input: key={}, file={}", key, target);
    return target;
  }

  /**
   * Upload the dubbed file and the utterance metadata.
   *
   * <p>The metadata is serialized from memory since cleanup may already have removed the local
   * JSON file.
   */
  public PublishedArtifacts publish(String jobId, Path outputFile, UtteranceMetadata utterances) {
    String prefix = "dubbed/" + jobId + "/";
    String outputKey = prefix + outputFile.getFileName();
    String metadataKey = prefix + UtteranceMetadataWriter.FILE_NAME;

    try {
      try (InputStream data = Files.newInputStream(outputFile)) {
        objectStoreClient.putObject(
            properties.bucket(), outputKey, data, Files.size(outputFile), contentType(outputFile));
      }
      byte[] json = metadataWriter.writeJson(utterances);
      objectStoreClient.putObject(
          properties.bucket(),
          metadataKey,
          new ByteArrayInputStream(json),
          json.length,
          "application/json");
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to publish artifacts of job " + jobId, e);
    }

    return new PublishedArtifacts(
        properties.bucket(),
        outputKey,
        metadataKey,
        objectStoreClient.presignGet(properties.bucket(), outputKey, properties.presignTtl())
            .toString(),
        objectStoreClient.presignGet(properties.bucket(), metadataKey, properties.presignTtl())
            .toString());
  }

  private String bucketOrDefault(String bucket) {
    return bucket == null || bucket.isBlank() ? properties.bucket() : bucket;
  }

  private static String contentType(Path file) {
    return file.getFileName().toString().endsWith(".mp4") ? "video/mp4" : "audio/mpeg";
  }

  /** Where the artifacts of a job were published. */
  public record PublishedArtifacts(
      String bucket, String outputKey, String metadataKey, String outputUrl, String metadataUrl) {}
}
