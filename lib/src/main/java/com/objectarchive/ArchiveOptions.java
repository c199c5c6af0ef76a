package com.objectarchive;

import com.objectarchive.codec.GraphCodec;
import com.objectarchive.codec.cbor.CborGraphCodec;
import com.objectarchive.loader.LoaderRegistry;
import com.objectarchive.storage.StorageBackends;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Settings shared by {@link ArchiveSerializer} and {@link ArchiveDeserializer}. Instances are
 * immutable; use {@link #builder()} to change a default.
 */
public final class ArchiveOptions {
  private static final ArchiveOptions DEFAULTS = builder().build();

  private final StorageBackends backends;
  private final LoaderRegistry loaders;
  private final GraphCodec codec;
  private final Path tempDirectory;

  private ArchiveOptions(Builder builder) {
    this.backends = builder.backends;
    this.loaders = builder.loaders;
    this.codec = builder.codec;
    this.tempDirectory = builder.tempDirectory;
  }

  /**
   * Returns the default options: local storage only, no loaders, the CBOR codec and the system
   * temporary directory.
   *
   * @return the default options
   */
  public static ArchiveOptions defaults() {
    return DEFAULTS;
  }

  public static Builder builder() {
    return new Builder();
  }

  public StorageBackends backends() {
    return backends;
  }

  public LoaderRegistry loaders() {
    return loaders;
  }

  public GraphCodec codec() {
    return codec;
  }

  /**
   * Returns the directory legacy bundles are extracted below.
   *
   * @return the temporary directory
   */
  public Path tempDirectory() {
    return tempDirectory;
  }

  /** Builder for {@link ArchiveOptions}. */
  public static final class Builder {
    private StorageBackends backends = StorageBackends.localOnly();
    private LoaderRegistry loaders = LoaderRegistry.empty();
    private GraphCodec codec = new CborGraphCodec();
    private Path tempDirectory = Path.of(System.getProperty("java.io.tmpdir"));

    private Builder() {}

    public Builder backends(StorageBackends backends) {
      this.backends = Objects.requireNonNull(backends, "backends");
      return this;
    }

    public Builder loaders(LoaderRegistry loaders) {
      this.loaders = Objects.requireNonNull(loaders, "loaders");
      return this;
    }

    public Builder codec(GraphCodec codec) {
      this.codec = Objects.requireNonNull(codec, "codec");
      return this;
    }

    public Builder tempDirectory(Path tempDirectory) {
      this.tempDirectory = Objects.requireNonNull(tempDirectory, "tempDirectory");
      return this;
    }

    public ArchiveOptions build() {
      return new ArchiveOptions(this);
    }
  }
}
