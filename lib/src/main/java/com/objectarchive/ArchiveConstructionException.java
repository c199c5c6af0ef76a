package com.objectarchive;

/**
 * Thrown when an archive cannot be opened: the write target cannot be created or made writable,
 * or the read source is missing, or lacks the marker and files a valid archive must contain.
 */
public class ArchiveConstructionException extends ArchiveException {

  public ArchiveConstructionException(String message) {
    super(message);
  }

  public ArchiveConstructionException(String message, Throwable cause) {
    super(message, cause);
  }
}
