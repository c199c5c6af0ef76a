package com.objectarchive.storage;

/**
 * A parsed {@code s3://bucket/key} location. The key never ends with a slash and is empty when the
 * location names a whole bucket.
 *
 * @param bucket the bucket name
 * @param key the object key or key prefix
 */
public record S3Location(String bucket, String key) {

  public S3Location {
    if (bucket == null || bucket.isEmpty()) {
      throw new IllegalArgumentException("S3 location needs a bucket");
    }
  }

  /**
   * Parses an {@code s3://} location string.
   *
   * @param location the location string
   * @return the parsed location
   * @throws IllegalArgumentException if the string is not an S3 location
   */
  public static S3Location parse(String location) {
    if (StorageScheme.classify(location) != StorageScheme.S3) {
      throw new IllegalArgumentException("Not an S3 location: " + location);
    }
    var rest = location.substring(StorageScheme.S3.prefix().length());
    var slash = rest.indexOf('/');
    if (slash < 0) {
      return new S3Location(rest, "");
    }
    var key = rest.substring(slash + 1);
    while (key.endsWith("/")) {
      key = key.substring(0, key.length() - 1);
    }
    return new S3Location(rest.substring(0, slash), key);
  }

  /**
   * Returns the prefix under which the entries of a directory stored at this location live.
   *
   * @return the key followed by a slash, or the empty string for a bucket root
   */
  public String directoryPrefix() {
    return key.isEmpty() ? "" : key + "/";
  }

  /**
   * Returns the key of a file inside the directory stored at this location.
   *
   * @param relativePath a slash separated path relative to the directory
   * @return the full object key
   */
  public String child(String relativePath) {
    return directoryPrefix() + relativePath;
  }

  @Override
  public String toString() {
    return StorageScheme.S3.prefix() + bucket + "/" + key;
  }
}
