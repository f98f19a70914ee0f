package com.scholary.dubbing.pipeline;

import com.scholary.dubbing.logging.StructuredLogger;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Empties a working directory except for the files to keep.
 *
 * <p>Directories are removed with their contents. A failed deletion is recorded and logged and
 * the remaining entries are still attempted; nothing is thrown.
 */
public class WorkingDirectoryCleaner {

  private static final Logger LOGGER = LoggerFactory.getLogger(WorkingDirectoryCleaner.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  /** Deletes one directory entry. */
  @FunctionalInterface
  public interface Deleter {
    void delete(Path path) throws IOException;
  }

  private final Deleter deleter;

  public WorkingDirectoryCleaner() {
    this(WorkingDirectoryCleaner::deleteRecursively);
  }

  public WorkingDirectoryCleaner(Deleter deleter) {
    this.deleter = deleter;
  }

  public CleanupReport clean(Path directory, Set<Path> keep) {
    Set<Path> keepNormalized = new HashSet<>();
    for (Path path : keep) {
      keepNormalized.add(normalize(path));
    }

    List<Path> entries;
    try (Stream<Path> listing = Files.list(directory)) {
      entries = listing.sorted().collect(Collectors.toList());
    } catch (IOException e) {
      structuredLogger.logCleanupFailed(
          directory.toString(), e.getClass().getSimpleName(), e.getMessage());
      return new CleanupReport(
          true, List.of(), List.of(new CleanupFailure(directory, e.getMessage())));
    }

    List<Path> deleted = new ArrayList<>();
    List<CleanupFailure> failures = new ArrayList<>();
    for (Path entry : entries) {
      if (keepNormalized.contains(normalize(entry))) {
        continue;
      }
      try {
        deleter.delete(entry);
        deleted.add(entry);
      } catch (IOException | RuntimeException e) {
        structuredLogger.logCleanupFailed(
            entry.toString(), e.getClass().getSimpleName(), e.getMessage());
        failures.add(new CleanupFailure(entry, e.getMessage()));
      }
    }

    LOGGER.info(
        "Temporary artifacts removed: deleted={}, failed={}, kept={}",
        deleted.size(),
        failures.size(),
        entries.size() - deleted.size() - failures.size());
    return new CleanupReport(true, deleted, failures);
  }

  static void deleteRecursively(Path path) throws IOException {
    if (!Files.isDirectory(path)) {
      Files.delete(path);
      return;
    }
    List<Path> tree;
    try (Stream<Path> walk = Files.walk(path)) {
      tree = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
    }
    for (Path child : tree) {
      Files.delete(child);
    }
  }

  private static Path normalize(Path path) {
    return path.toAbsolutePath().normalize();
  }
}
