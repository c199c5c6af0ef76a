package com.objectarchive.storage;

import java.util.Objects;

/** The storage media an archive location string can address, recognized by scheme prefix. */
public enum StorageScheme {
  LOCAL(null),
  S3("s3://"),
  HDFS("hdfs://");

  /** Optional explicit prefix for local paths. */
  public static final String FILE_PREFIX = "file://";

  private final String prefix;

  StorageScheme(String prefix) {
    this.prefix = prefix;
  }

  public String prefix() {
    return prefix;
  }

  public boolean isRemote() {
    return this != LOCAL;
  }

  /**
   * Identifies which medium a location string addresses. Anything without a recognized remote
   * scheme is a local path.
   *
   * @param location the target or source string
   * @return the scheme of the location
   */
  public static StorageScheme classify(String location) {
    Objects.requireNonNull(location, "location");
    for (var scheme : values()) {
      if (scheme.prefix != null && location.startsWith(scheme.prefix)) {
        return scheme;
      }
    }
    return LOCAL;
  }
}
