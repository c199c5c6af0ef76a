package com.objectarchive.storage;

import com.objectarchive.ArchiveConstructionException;
import com.objectarchive.BackendTransferException;
import io.minio.GetObjectArgs;
import io.minio.ListObjectsArgs;
import io.minio.MinioClient;
import io.minio.RemoveObjectArgs;
import io.minio.Result;
import io.minio.StatObjectArgs;
import io.minio.UploadObjectArgs;
import io.minio.errors.ErrorResponseException;
import io.minio.messages.Item;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Backend for {@code s3://bucket/key} locations using a MinIO client. A directory archive is
 * stored as one object per file under {@code key/}; a legacy single-file archive is the object at
 * {@code key} itself.
 *
 * <p>Client construction and credentials are the caller's concern; this class only moves bytes.
 */
public final class S3StorageBackend implements StorageBackend {
  private static final Logger logger = LoggerFactory.getLogger(S3StorageBackend.class);

  private final MinioClient client;
  private final Path tempDirectory;

  public S3StorageBackend(MinioClient client) {
    this(client, Path.of(System.getProperty("java.io.tmpdir")));
  }

  public S3StorageBackend(MinioClient client, Path tempDirectory) {
    this.client = Objects.requireNonNull(client, "client");
    this.tempDirectory = Objects.requireNonNull(tempDirectory, "tempDirectory");
  }

  @Override
  public StorageScheme scheme() {
    return StorageScheme.S3;
  }

  @Override
  public Path stageForWrite(String target) throws IOException {
    S3Location.parse(target);
    try {
      return Files.createTempDirectory(tempDirectory, "archive_");
    } catch (IOException e) {
      throw new ArchiveConstructionException("Cannot create staging directory for " + target, e);
    }
  }

  @Override
  public void commit(Path stagingDirectory, String target) throws IOException {
    var location = S3Location.parse(target);
    logger.info("Uploading archive {} to {}", stagingDirectory, location);
    try {
      deleteRecursively(location);
      upload(stagingDirectory, location);
    } catch (Exception e) {
      throw new BackendTransferException(target, stagingDirectory, e);
    }
  }

  @Override
  public StagedInput stageForRead(String source) throws IOException {
    var location = S3Location.parse(source);
    boolean singleObject;
    try {
      singleObject = isSingleObject(location);
    } catch (Exception e) {
      throw new BackendTransferException(source, null, e);
    }

    if (singleObject) {
      var localFile = Files.createTempFile(tempDirectory, "archive_", "");
      logger.info("Downloading {} to {}", location, localFile);
      try {
        download(location.key(), location, localFile);
      } catch (Exception e) {
        throw new BackendTransferException(source, localFile, e);
      }
      return new StagedInput(localFile, true);
    }

    List<String> keys;
    try {
      keys = listKeys(location);
    } catch (Exception e) {
      throw new BackendTransferException(source, null, e);
    }
    if (keys.isEmpty()) {
      throw new ArchiveConstructionException(source + " does not exist");
    }

    var localDirectory = Files.createTempDirectory(tempDirectory, "archive_");
    logger.info("Downloading {} objects under {} to {}", keys.size(), location, localDirectory);
    try {
      var prefix = location.directoryPrefix();
      for (var key : keys) {
        var localFile = localDirectory.resolve(key.substring(prefix.length())).normalize();
        if (!localFile.startsWith(localDirectory)) {
          throw new IOException("Object key escapes the archive directory: " + key);
        }
        Files.createDirectories(localFile.getParent());
        download(key, location, localFile);
      }
    } catch (Exception e) {
      throw new BackendTransferException(source, localDirectory, e);
    }
    return new StagedInput(localDirectory, true);
  }

  private boolean isSingleObject(S3Location location) throws Exception {
    if (location.key().isEmpty()) {
      return false;
    }
    try {
      client.statObject(
          StatObjectArgs.builder().bucket(location.bucket()).object(location.key()).build());
      return true;
    } catch (ErrorResponseException e) {
      if ("NoSuchKey".equals(e.errorResponse().code())) {
        return false;
      }
      throw e;
    }
  }

  private List<String> listKeys(S3Location location) throws Exception {
    var keys = new ArrayList<String>();
    for (Result<Item> result :
        client.listObjects(
            ListObjectsArgs.builder()
                .bucket(location.bucket())
                .prefix(location.directoryPrefix())
                .recursive(true)
                .build())) {
      var item = result.get();
      if (!item.isDir()) {
        keys.add(item.objectName());
      }
    }
    return keys;
  }

  private void deleteRecursively(S3Location location) throws Exception {
    if (!location.key().isEmpty()) {
      // removeObject is silent on missing keys
      client.removeObject(
          RemoveObjectArgs.builder().bucket(location.bucket()).object(location.key()).build());
    }
    for (var key : listKeys(location)) {
      client.removeObject(RemoveObjectArgs.builder().bucket(location.bucket()).object(key).build());
    }
  }

  private void upload(Path stagingDirectory, S3Location location) throws Exception {
    List<Path> files;
    try (var walk = Files.walk(stagingDirectory)) {
      files = walk.filter(Files::isRegularFile).collect(Collectors.toList());
    }
    for (var file : files) {
      var relative = stagingDirectory.relativize(file).toString();
      var key = location.child(relative.replace(file.getFileSystem().getSeparator(), "/"));
      logger.debug("Uploading {} as {}", file, key);
      client.uploadObject(
          UploadObjectArgs.builder()
              .bucket(location.bucket())
              .object(key)
              .filename(file.toString())
              .build());
    }
  }

  private void download(String key, S3Location location, Path localFile) throws Exception {
    try (var in =
        client.getObject(GetObjectArgs.builder().bucket(location.bucket()).object(key).build())) {
      Files.copy(in, localFile, StandardCopyOption.REPLACE_EXISTING);
    }
  }
}
