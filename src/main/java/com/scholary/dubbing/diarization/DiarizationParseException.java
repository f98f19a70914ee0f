package com.scholary.dubbing.diarization;

/**
 * Thrown when the diarization model's reply contains a line that is not a list of
 * {@code (speaker, gender)} tuples.
 *
 * <p>Skipping the line would drop a speaker and shift every attribution after it, so parsing fails
 * as a whole instead.
 */
public class DiarizationParseException extends RuntimeException {

  private final int lineNumber;
  private final String line;

  public DiarizationParseException(int lineNumber, String line, String reason) {
    super(String.format("Malformed diarization line %d (%s): '%s'", lineNumber, reason, line));
    this.lineNumber = lineNumber;
    this.line = line;
  }

  public int getLineNumber() {
    return lineNumber;
  }

  public String getLine() {
    return line;
  }
}
