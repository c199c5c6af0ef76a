package com.objectarchive;

import com.objectarchive.codec.ExternalReference;
import com.objectarchive.codec.GraphReader;
import com.objectarchive.layout.ArchiveKind;
import com.objectarchive.layout.ArchiveLayout;
import com.objectarchive.layout.ArchiveSource;
import com.objectarchive.loader.ArchiveLoader;
import com.objectarchive.loader.BuiltinType;
import com.objectarchive.loader.LoaderRegistry;
import com.objectarchive.resource.DeferredCleanup;
import com.objectarchive.resource.StreamGuard;
import com.objectarchive.storage.StagedInput;
import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads object graphs back from an archive. The input form is detected automatically: a directory
 * archive, a legacy ZIP bundle or a plain main stream, on any configured storage backend.
 *
 * <p>References are resolved through the {@link LoaderRegistry} of the session. References that
 * carry an identity are loaded once and shared: every later reference to the same identity returns
 * the same instance. Legacy references without identity are loaded each time they occur.
 *
 * <p>Side files of a directory archive or an extracted bundle stay on disk after {@link #close()},
 * since loaded objects may still read from them lazily.
 */
public final class ArchiveDeserializer implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(ArchiveDeserializer.class);

  private final String source;
  private final StagedInput staged;
  private final ArchiveSource archive;
  private final LoaderRegistry loaders;
  private final Map<Long, Object> loadedObjects = new HashMap<>();
  private final GraphReader reader;
  private final StreamGuard guard;
  private boolean closed = false;

  private ArchiveDeserializer(
      String source, StagedInput staged, ArchiveSource archive, ArchiveOptions options)
      throws IOException {
    this.source = source;
    this.staged = staged;
    this.archive = archive;
    this.loaders = options.loaders();

    InputStream in = new BufferedInputStream(Files.newInputStream(archive.mainStream()));
    this.guard = StreamGuard.register(this, in, "ArchiveDeserializer(" + source + ")");
    try {
      this.reader = options.codec().newReader(in, this::resolve);
    } catch (IOException e) {
      guard.release();
      throw e;
    }
  }

  /**
   * Opens a deserializer for {@code source} with default options.
   *
   * @param source a local path or a remote location
   * @return the open deserializer
   * @throws IOException if the source cannot be opened
   */
  public static ArchiveDeserializer open(String source) throws IOException {
    return open(source, ArchiveOptions.defaults());
  }

  /**
   * Opens a deserializer for {@code source}, staging remote inputs locally and validating the
   * archive before any value is read. Downloads and extracted bundles are removed again if the
   * open fails.
   *
   * @param source a local path or a remote location
   * @param options storage backends, loaders and codec to use
   * @return the open deserializer
   * @throws ArchiveConstructionException if the source is missing or malformed
   * @throws UnsupportedArchiveVersionException if the archive version is unknown
   * @throws BackendTransferException if a download fails
   * @throws IOException on other I/O errors
   */
  public static ArchiveDeserializer open(String source, ArchiveOptions options)
      throws IOException {
    var backend = options.backends().forLocation(source);
    var staged = backend.stageForRead(source);
    ArchiveSource archive = null;
    try {
      archive = new ArchiveLayout(options.tempDirectory()).classifyAndValidate(staged.path());
      logger.info(
          "Opened {} archive {} (version {})", archive.kind(), source, archive.version());
      return new ArchiveDeserializer(source, staged, archive, options);
    } catch (IOException e) {
      if (archive != null && archive.kind() == ArchiveKind.LEGACY_BUNDLE) {
        DeferredCleanup.deleteOrDefer(archive.stagingRoot());
      }
      if (staged.downloaded()) {
        DeferredCleanup.deleteOrDefer(staged.path());
      }
      throw e;
    }
  }

  /**
   * Reads the next top-level value.
   *
   * @return the value, with references replaced by loaded objects
   * @throws java.io.EOFException if the main stream holds no further value
   * @throws UnresolvableReferenceException if a reference cannot be loaded
   * @throws IOException on other decoding errors
   * @throws IllegalStateException if the deserializer is closed
   */
  public Object load() throws IOException {
    checkOpen();
    return reader.read();
  }

  /**
   * Checks whether {@link #load()} would return another value.
   *
   * @return true if the main stream holds a further value
   * @throws IOException if the stream cannot be read
   */
  public boolean hasNext() throws IOException {
    checkOpen();
    return reader.hasNext();
  }

  /** Reference resolver installed in the codec. */
  Object resolve(ExternalReference reference) throws IOException {
    if (!archive.hasSideFiles()) {
      throw new UnresolvableReferenceException(
          reference, "a plain stream cannot contain externally archived objects");
    }

    if (reference.isLegacy()) {
      // legacy archives predate identity sharing, nothing is memoized
      var type =
          BuiltinType.fromDescriptor(reference.descriptor())
              .orElseThrow(
                  () ->
                      new UnresolvableReferenceException(
                          reference, "legacy references may only name built-in types"));
      var loader =
          loaders
              .builtin(type)
              .orElseThrow(
                  () -> new UnresolvableReferenceException(reference, "no loader registered"));
      return loader.load(sidePath(reference));
    }

    var identity = reference.identity();
    if (loadedObjects.containsKey(identity)) {
      return loadedObjects.get(identity);
    }
    if (reference.isReuse()) {
      throw new UnresolvableReferenceException(
          reference, "identity was not defined earlier in this archive");
    }

    var loader = loaderFor(reference);
    var path = sidePath(reference);
    logger.debug("Loading {} from {}", reference.descriptor(), path);
    var object = loader.load(path);
    loadedObjects.put(identity, object);
    return object;
  }

  private ArchiveLoader<?> loaderFor(ExternalReference reference)
      throws UnresolvableReferenceException {
    return loaders
        .find(reference.descriptor())
        .orElseThrow(
            () ->
                new UnresolvableReferenceException(
                    reference, "no loader registered for " + reference.descriptor()));
  }

  private Path sidePath(ExternalReference reference) throws UnresolvableReferenceException {
    var root = archive.stagingRoot();
    var path = root.resolve(reference.relativePath()).normalize();
    if (!path.startsWith(root) || path.equals(root)) {
      throw new UnresolvableReferenceException(reference, "path escapes the archive");
    }
    return path;
  }

  public String getSource() {
    return source;
  }

  /**
   * Returns the declared version of the archive.
   *
   * @return the version, or {@code null} for inputs that predate versioning
   */
  public String getVersion() {
    return archive.version();
  }

  public ArchiveKind getKind() {
    return archive.kind();
  }

  /**
   * Returns the local directory side files are read from.
   *
   * @return the staging root, or {@code null} for a plain stream
   */
  public Path getStagingRoot() {
    return archive.stagingRoot();
  }

  public boolean isClosed() {
    return closed;
  }

  /**
   * Closes the main stream and removes a transient single-file download. Staged directories are
   * kept. Calling it again has no effect.
   *
   * @throws IOException if the main stream cannot be closed
   */
  @Override
  public void close() throws IOException {
    if (closed) {
      return;
    }
    closed = true;

    try {
      reader.close();
    } finally {
      guard.release();
      if (staged.isTransientFile()) {
        DeferredCleanup.deleteOrDefer(staged.path());
      }
    }
    logger.debug("Closed archive {}", source);
  }

  private void checkOpen() {
    if (closed) {
      throw new IllegalStateException("Deserializer for " + source + " is closed");
    }
  }
}
