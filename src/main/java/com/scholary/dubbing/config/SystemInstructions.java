package com.scholary.dubbing.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

/**
 * Loads system instructions for the generative model.
 *
 * <p>A value ending in {@code .txt} is a resource location ({@code classpath:}, {@code file:} or a
 * plain file path) whose content is returned. A value with any other extension is rejected. A value
 * without an extension is the instruction text itself.
 */
public final class SystemInstructions {

  private SystemInstructions() {}

  public static String read(String instructions, ResourceLoader resourceLoader) {
    if (instructions == null) {
      throw new IllegalArgumentException("System instructions must not be null");
    }

    String extension = extensionOf(instructions);
    if (extension.isEmpty()) {
      return instructions;
    }
    if (!extension.equals(".txt")) {
      throw new IllegalArgumentException("Unsupported system instructions file type: " + extension);
    }

    Resource resource = resourceLoader.getResource(instructions);
    if (!resource.exists()) {
      throw new IllegalArgumentException("System instructions file not found: " + instructions);
    }
    try (InputStream in = resource.getInputStream()) {
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read system instructions: " + instructions, e);
    }
  }

  // Only a dot in the last path element that is followed by word characters counts, so free text
  // ending in a sentence ("Be concise.") is not mistaken for a file name.
  private static String extensionOf(String value) {
    int separator = Math.max(value.lastIndexOf('/'), value.lastIndexOf('\\'));
    String lastElement = value.substring(separator + 1);
    if (lastElement.contains(" ") || lastElement.contains("\n")) {
      return "";
    }
    int dot = lastElement.lastIndexOf('.');
    if (dot <= 0 || dot == lastElement.length() - 1) {
      return "";
    }
    String extension = lastElement.substring(dot);
    return extension.matches("\\.\\w+") ? extension.toLowerCase() : "";
  }
}
