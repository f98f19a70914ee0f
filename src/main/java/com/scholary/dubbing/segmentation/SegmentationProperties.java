package com.scholary.dubbing.segmentation;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the speaker segmentation service.
 *
 * <p>The service wraps a pyannote pipeline, which needs a Hugging Face token to download the model.
 * The token is forwarded as a bearer token and may also come from {@code HUGGING_FACE_TOKEN}.
 */
@ConfigurationProperties(prefix = "segmentation")
@Validated
public record SegmentationProperties(
    @NotBlank String baseUrl,
    @NotBlank String model,
    String huggingFaceToken,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @Positive int maxRetries) {}
