package com.scholary.dubbing.media;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for ffmpeg operations.
 *
 * <p>{@code audioQuality} is the VBR quality passed to {@code -q:a} (0 is best, 9 is worst).
 */
@ConfigurationProperties(prefix = "ffmpeg")
@Validated
public record FfmpegProperties(
    @NotBlank String binary,
    @PositiveOrZero int audioQuality,
    @NotBlank String videoAudioCodec) {}
