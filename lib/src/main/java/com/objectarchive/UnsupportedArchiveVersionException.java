package com.objectarchive;

/** Thrown when an archive declares a format version this library does not know how to read. */
public class UnsupportedArchiveVersionException extends ArchiveException {
  private final String version;

  public UnsupportedArchiveVersionException(String version) {
    super(String.format("Unsupported archive version '%s'", version));
    this.version = version;
  }

  public String getVersion() {
    return version;
  }
}
