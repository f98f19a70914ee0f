package com.scholary.dubbing.synthesis;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the Cloud Text-to-Speech client.
 *
 * <p>The API key falls back to the {@code TTS_TOKEN} environment variable.
 */
@ConfigurationProperties(prefix = "tts")
@Validated
public record TextToSpeechProperties(
    @NotBlank String baseUrl,
    String apiKey,
    @NotBlank String audioEncoding,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @Positive int maxRetries) {}
