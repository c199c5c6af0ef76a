package com.objectarchive;

import java.nio.file.Path;

/**
 * Thrown when an upload to or download from a remote backend fails partway. The local staging
 * location is left untouched so its contents can be recovered by hand.
 */
public class BackendTransferException extends ArchiveException {
  private final String location;
  private final Path stagingPath;

  public BackendTransferException(String location, Path stagingPath, Throwable cause) {
    super(
        String.format(
            "Transfer between '%s' and local staging '%s' failed", location, stagingPath),
        cause);
    this.location = location;
    this.stagingPath = stagingPath;
  }

  public String getLocation() {
    return location;
  }

  public Path getStagingPath() {
    return stagingPath;
  }
}
