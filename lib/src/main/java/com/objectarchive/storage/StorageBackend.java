package com.objectarchive.storage;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Uniform stage/commit operations over one storage medium. Writers assemble an archive in a local
 * staging directory and commit it; readers stage a source locally before reading it.
 */
public interface StorageBackend {

  /**
   * Returns the medium this backend handles.
   *
   * @return the storage scheme
   */
  StorageScheme scheme();

  /**
   * Returns the local directory an archive for {@code target} is assembled in. Local backends
   * return the target directory itself; remote backends return a fresh temporary directory.
   *
   * @param target the write target
   * @return the staging directory, existing and writable
   * @throws com.objectarchive.ArchiveConstructionException if no writable directory can be made
   * @throws IOException on other I/O errors
   */
  Path stageForWrite(String target) throws IOException;

  /**
   * Publishes a staging directory to {@code target}. Remote backends first remove everything
   * previously stored at the target.
   *
   * @param stagingDirectory the directory returned by {@link #stageForWrite(String)}
   * @param target the write target
   * @throws com.objectarchive.BackendTransferException if the upload fails
   * @throws IOException on other I/O errors
   */
  void commit(Path stagingDirectory, String target) throws IOException;

  /**
   * Makes {@code source} available locally, downloading it if needed.
   *
   * @param source the read source
   * @return the staged local input
   * @throws com.objectarchive.ArchiveConstructionException if the source does not exist
   * @throws com.objectarchive.BackendTransferException if a download fails
   * @throws IOException on other I/O errors
   */
  StagedInput stageForRead(String source) throws IOException;

  default boolean isRemote() {
    return scheme().isRemote();
  }
}
