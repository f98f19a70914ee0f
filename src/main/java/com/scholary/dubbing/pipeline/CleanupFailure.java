package com.scholary.dubbing.pipeline;

import java.nio.file.Path;

/** A working-directory entry that could not be deleted. */
public record CleanupFailure(Path path, String message) {}
