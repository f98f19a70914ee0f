package com.scholary.dubbing.gemini;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the Gemini API client.
 *
 * <p>The API key may be left empty here and exported as {@code GEMINI_TOKEN} instead; it is only
 * required when the first request is made.
 */
@ConfigurationProperties(prefix = "gemini")
@Validated
public record GeminiProperties(
    @NotBlank String baseUrl,
    String apiKey,
    @NotBlank String model,
    @PositiveOrZero double temperature,
    @Positive double topP,
    @Positive int topK,
    @Positive int maxOutputTokens,
    @NotBlank String responseMimeType,
    @NotBlank String safetyThreshold,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @Positive int maxRetries) {}
