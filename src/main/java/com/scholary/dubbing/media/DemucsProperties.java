package com.scholary.dubbing.media;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Configuration properties for Demucs source separation. */
@ConfigurationProperties(prefix = "demucs")
@Validated
public record DemucsProperties(
    @NotBlank String pythonExecutable, @NotBlank String model, @NotBlank String device) {}
