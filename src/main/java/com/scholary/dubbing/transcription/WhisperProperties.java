package com.scholary.dubbing.transcription;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the faster-whisper API client.
 *
 * <p>These control how we connect to the Whisper service and handle timeouts/retries.
 */
@ConfigurationProperties(prefix = "whisper")
@Validated
public record WhisperProperties(
    @NotBlank String baseUrl,
    @NotBlank String model,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @Positive int maxRetries) {}
