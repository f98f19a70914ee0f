package com.scholary.dubbing.utterance;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes utterance metadata as JSON.
 *
 * <p>Format: an array of utterance objects with snake_case keys; unset fields are omitted.
 *
 * <pre>
 * [
 *   {"audio_path": "chunk_0.mp3", "start": 0.0, "end": 2.4, "text": "Hello",
 *    "speaker_id": "speaker_1", "ssml_gender": "Male", ...}
 * ]
 * </pre>
 */
public class UtteranceMetadataWriter {

  public static final String FILE_NAME = "utterance_metadata.json";

  private final ObjectMapper objectMapper;

  public UtteranceMetadataWriter(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public byte[] writeJson(UtteranceMetadata utterances) throws IOException {
    return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(utterances.records());
  }

  /**
   * Write {@value #FILE_NAME} into {@code outputDirectory}, replacing any previous file.
   *
   * @return the written file
   */
  public Path write(UtteranceMetadata utterances, Path outputDirectory) throws IOException {
    Path file = outputDirectory.resolve(FILE_NAME);
    Files.write(file, writeJson(utterances));
    return file;
  }
}
