package com.objectarchive;

import java.io.IOException;

/**
 * Base class for failures raised while writing or reading an object archive. Subclasses identify
 * which stage of the archive lifecycle failed so callers can tell a bad input apart from a
 * transfer problem.
 */
public class ArchiveException extends IOException {

  public ArchiveException(String message) {
    super(message);
  }

  public ArchiveException(String message, Throwable cause) {
    super(message, cause);
  }
}
