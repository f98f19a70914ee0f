package com.scholary.dubbing.media;

import java.nio.file.Path;

/**
 * The two tracks of a video.
 *
 * @param video the picture without sound
 * @param audio the sound track
 */
public record AudioVideoSplit(Path video, Path audio) {}
