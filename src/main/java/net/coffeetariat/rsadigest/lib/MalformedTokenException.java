package net.coffeetariat.rsadigest.lib;

import java.io.IOException;

/**
 * A line of a token stream could not be turned back into a byte.
 */
public class MalformedTokenException extends IOException {

  private final long lineNumber;

  public MalformedTokenException(long lineNumber, String message) {
    super("line " + lineNumber + ": " + message);
    this.lineNumber = lineNumber;
  }

  public MalformedTokenException(long lineNumber, String message, Throwable cause) {
    super("line " + lineNumber + ": " + message, cause);
    this.lineNumber = lineNumber;
  }

  /** 1-based line of the offending token. */
  public long getLineNumber() {
    return lineNumber;
  }
}
