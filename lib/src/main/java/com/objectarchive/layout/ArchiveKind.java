package com.objectarchive.layout;

/** The physical forms an archive input can take. */
public enum ArchiveKind {
  /** Current form: a directory holding a version marker, the main stream and side files. */
  DIRECTORY,
  /** Read-only compatibility form: a ZIP bundle naming its main-stream entry in a marker entry. */
  LEGACY_BUNDLE,
  /** A bare main stream with no side files; it cannot contain resolvable references. */
  PLAIN_STREAM
}
