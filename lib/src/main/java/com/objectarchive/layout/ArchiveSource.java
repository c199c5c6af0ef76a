package com.objectarchive.layout;

import java.nio.file.Path;

/**
 * The result of classifying a staged archive input.
 *
 * @param kind the form the input was recognized as
 * @param mainStream the file holding the main stream
 * @param version the declared format version, or {@code null} for inputs that predate versioning
 * @param stagingRoot the directory side-file paths resolve against, or {@code null} for a plain
 *     stream
 */
public record ArchiveSource(ArchiveKind kind, Path mainStream, String version, Path stagingRoot) {

  /**
   * Checks whether references in the main stream can be resolved to side files.
   *
   * @return true unless the input is a plain stream
   */
  public boolean hasSideFiles() {
    return stagingRoot != null;
  }
}
