package com.objectarchive.storage;

import com.objectarchive.ArchiveConstructionException;
import io.minio.MinioClient;
import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import org.apache.hadoop.fs.FileSystem;

/**
 * The set of storage backends available to a session, one per {@link StorageScheme}. The local
 * backend is always present; remote backends exist only when a client was supplied.
 */
public final class StorageBackends {
  private static final StorageBackends LOCAL_ONLY = builder().build();

  private final Map<StorageScheme, StorageBackend> backends;

  private StorageBackends(Map<StorageScheme, StorageBackend> backends) {
    this.backends = Collections.unmodifiableMap(new EnumMap<>(backends));
  }

  public static StorageBackends localOnly() {
    return LOCAL_ONLY;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Classifies a location string and returns the backend that handles it.
   *
   * @param location the target or source string
   * @return the matching backend
   * @throws ArchiveConstructionException if no backend is configured for the location's scheme
   */
  public StorageBackend forLocation(String location) throws ArchiveConstructionException {
    var scheme = StorageScheme.classify(location);
    var backend = backends.get(scheme);
    if (backend == null) {
      throw new ArchiveConstructionException(
          "No " + scheme + " backend configured for location " + location);
    }
    return backend;
  }

  public boolean supports(StorageScheme scheme) {
    return backends.containsKey(scheme);
  }

  /** Assembles a {@link StorageBackends} set. */
  public static final class Builder {
    private final Map<StorageScheme, StorageBackend> backends = new EnumMap<>(StorageScheme.class);
    private Path tempDirectory = Path.of(System.getProperty("java.io.tmpdir"));

    private Builder() {
      backends.put(StorageScheme.LOCAL, new LocalStorageBackend());
    }

    /**
     * Sets the directory remote backends added afterwards stage their files in.
     *
     * @param tempDirectory an existing local directory
     * @return this builder
     */
    public Builder tempDirectory(Path tempDirectory) {
      this.tempDirectory = Objects.requireNonNull(tempDirectory, "tempDirectory");
      return this;
    }

    public Builder s3(MinioClient client) {
      return backend(new S3StorageBackend(client, tempDirectory));
    }

    public Builder hdfs(FileSystem fileSystem) {
      return backend(new HdfsStorageBackend(fileSystem, tempDirectory));
    }

    /**
     * Adds or replaces the backend for the scheme it reports.
     *
     * @param backend the backend
     * @return this builder
     */
    public Builder backend(StorageBackend backend) {
      backends.put(backend.scheme(), backend);
      return this;
    }

    public StorageBackends build() {
      return new StorageBackends(backends);
    }
  }
}
