package com.scholary.dubbing.pipeline;

import java.nio.file.Path;

/**
 * The metadata checkpoint could not be written. The run carried on.
 *
 * @param file the file that was not written
 * @param message the underlying error
 */
public record PersistenceWarning(Path file, String message) {}
