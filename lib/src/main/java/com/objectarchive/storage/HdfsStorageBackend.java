package com.objectarchive.storage;

import com.objectarchive.ArchiveConstructionException;
import com.objectarchive.BackendTransferException;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.apache.hadoop.fs.FileStatus;
import org.apache.hadoop.fs.FileSystem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Backend for {@code hdfs://} locations on top of a Hadoop {@link FileSystem} client. The path
 * component of a location is resolved against the given file system, so the client decides which
 * cluster is addressed.
 */
public final class HdfsStorageBackend implements StorageBackend {
  private static final Logger logger = LoggerFactory.getLogger(HdfsStorageBackend.class);

  private final FileSystem fileSystem;
  private final Path tempDirectory;

  public HdfsStorageBackend(FileSystem fileSystem) {
    this(fileSystem, Path.of(System.getProperty("java.io.tmpdir")));
  }

  public HdfsStorageBackend(FileSystem fileSystem, Path tempDirectory) {
    this.fileSystem = Objects.requireNonNull(fileSystem, "fileSystem");
    this.tempDirectory = Objects.requireNonNull(tempDirectory, "tempDirectory");
  }

  @Override
  public StorageScheme scheme() {
    return StorageScheme.HDFS;
  }

  /**
   * Maps an {@code hdfs://} location onto a qualified path of the backing file system.
   *
   * @param location the location string
   * @return the remote path
   */
  public org.apache.hadoop.fs.Path remotePath(String location) {
    if (StorageScheme.classify(location) != StorageScheme.HDFS) {
      throw new IllegalArgumentException("Not an HDFS location: " + location);
    }
    var path = new org.apache.hadoop.fs.Path(location).toUri().getPath();
    if (path == null || path.isEmpty()) {
      path = "/";
    }
    return fileSystem.makeQualified(new org.apache.hadoop.fs.Path(path));
  }

  @Override
  public Path stageForWrite(String target) throws IOException {
    remotePath(target);
    try {
      return Files.createTempDirectory(tempDirectory, "archive_");
    } catch (IOException e) {
      throw new ArchiveConstructionException("Cannot create staging directory for " + target, e);
    }
  }

  @Override
  public void commit(Path stagingDirectory, String target) throws IOException {
    var remote = remotePath(target);
    logger.info("Uploading archive {} to {}", stagingDirectory, remote);
    try {
      fileSystem.delete(remote, true);
      fileSystem.copyFromLocalFile(false, true, localPath(stagingDirectory), remote);
    } catch (IOException e) {
      throw new BackendTransferException(target, stagingDirectory, e);
    }
  }

  @Override
  public StagedInput stageForRead(String source) throws IOException {
    var remote = remotePath(source);
    FileStatus status;
    try {
      status = fileSystem.getFileStatus(remote);
    } catch (FileNotFoundException e) {
      throw new ArchiveConstructionException(source + " does not exist", e);
    }

    // the copy creates the destination, so only reserve a name
    var local = Files.createTempFile(tempDirectory, "archive_", "");
    Files.delete(local);
    logger.info(
        "Downloading {} {} to {}", status.isDirectory() ? "directory" : "file", remote, local);
    try {
      fileSystem.copyToLocalFile(false, remote, localPath(local), true);
    } catch (IOException e) {
      throw new BackendTransferException(source, local, e);
    }
    return new StagedInput(local, true);
  }

  private static org.apache.hadoop.fs.Path localPath(Path path) {
    return new org.apache.hadoop.fs.Path("file", null, path.toAbsolutePath().toString());
  }
}
