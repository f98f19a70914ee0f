package com.scholary.dubbing.media;

import java.nio.file.Path;

/**
 * An audio track split into speech and everything else.
 *
 * @param vocals the isolated voices
 * @param background music and effects
 */
public record SeparatedAudio(Path vocals, Path background) {}
