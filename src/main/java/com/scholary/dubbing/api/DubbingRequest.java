package com.scholary.dubbing.api;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.List;

/**
 * Request to dub a video or audio file.
 *
 * <p>The input is either a path on the server ({@code inputFile}) or an object in the store
 * ({@code key}, with {@code bucket} defaulting to the configured one). Optional fields left out
 * fall back to the service defaults.
 */
public record DubbingRequest(
    String inputFile,
    String bucket,
    String key,
    String advertiserName,
    @NotBlank String originalLanguage,
    @NotBlank String targetLanguage,
    @Positive Integer numberOfSpeakers,
    String diarizationInstructions,
    String translationInstructions,
    Boolean mergeUtterances,
    @PositiveOrZero Double minimumMergeThreshold,
    List<String> preferredVoices,
    Boolean cleanUp,
    boolean publish) {

  @JsonIgnore
  @AssertTrue(message = "Exactly one of inputFile or key must be set")
  public boolean isSingleInput() {
    return isBlank(inputFile) != isBlank(key);
  }

  @JsonIgnore
  public boolean isObjectStoreInput() {
    return !isBlank(key);
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
