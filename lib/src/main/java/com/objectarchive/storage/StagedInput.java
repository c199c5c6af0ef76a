package com.objectarchive.storage;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * A read source made available on the local filesystem.
 *
 * @param path the local file or directory holding the source
 * @param downloaded true if the path is a transient copy produced by a remote download
 */
public record StagedInput(Path path, boolean downloaded) {

  /**
   * Checks whether this input is a downloaded single file, which its reader deletes on close.
   *
   * @return true for a transient regular file
   */
  public boolean isTransientFile() {
    return downloaded && Files.isRegularFile(path);
  }
}
