package com.objectarchive;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.objectarchive.codec.ExternalReference;
import com.objectarchive.codec.GraphWriter;
import com.objectarchive.layout.ArchiveLayout;
import com.objectarchive.loader.LoaderRegistry;
import com.objectarchive.resource.DeferredCleanup;
import com.objectarchive.resource.StreamGuard;
import com.objectarchive.storage.StorageBackend;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes an object graph into a directory archive. Ordinary values are encoded inline in the main
 * stream; {@link ExternallyArchivable} objects with a registered loader save themselves to a side
 * file and are replaced by a reference.
 *
 * <p>Each externally archivable instance is saved at most once per serializer: later occurrences,
 * within one {@link #dump(Object)} or across several, are written as a reuse reference carrying only
 * the identity assigned on first save.
 *
 * <p>Writing to a local directory that already holds an archive overwrites it: files present at
 * open time, other than the main stream and version marker, are removed on {@link #close()}.
 * Remote targets are assembled in a temporary directory and uploaded on close, replacing whatever
 * was stored there.
 *
 * <p>Instances are not thread-safe and must be closed; use try-with-resources:
 *
 * <pre>{@code
 * try (var serializer = ArchiveSerializer.open("/data/run-42", options)) {
 *   serializer.dump(Map.of("model", model, "frames", List.of(frame, frame)));
 * }
 * }</pre>
 */
public final class ArchiveSerializer implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(ArchiveSerializer.class);

  private final String target;
  private final StorageBackend backend;
  private final Path stagingDirectory;
  private final LoaderRegistry loaders;
  private final Set<Path> pendingDeletion;
  private final Cache<Object, ExternalReference> savedObjects;
  private final GraphWriter writer;
  private final StreamGuard guard;
  private long nextIdentity = 1;
  private boolean closed = false;

  private ArchiveSerializer(
      String target, StorageBackend backend, Path stagingDirectory, ArchiveOptions options)
      throws IOException {
    this.target = target;
    this.backend = backend;
    this.stagingDirectory = stagingDirectory;
    this.loaders = options.loaders();
    // weak keys compare by identity
    this.savedObjects = Caffeine.newBuilder().weakKeys().build();
    this.pendingDeletion = backend.isRemote() ? new HashSet<>() : listExisting(stagingDirectory);

    OutputStream out;
    try {
      out =
          new BufferedOutputStream(
              Files.newOutputStream(stagingDirectory.resolve(ArchiveLayout.MAIN_STREAM_FILE)));
    } catch (IOException e) {
      throw new ArchiveConstructionException("Cannot create main stream in " + stagingDirectory, e);
    }
    this.guard = StreamGuard.register(this, out, "ArchiveSerializer(" + target + ")");

    try {
      this.writer = options.codec().newWriter(out, this::referenceFor);
      ArchiveLayout.writeVersion(stagingDirectory);
    } catch (IOException e) {
      guard.release();
      throw new ArchiveConstructionException("Cannot initialize archive in " + stagingDirectory, e);
    }
  }

  /**
   * Opens a serializer for {@code target} with default options.
   *
   * @param target a local path or a remote location
   * @return the open serializer
   * @throws IOException if the target cannot be prepared
   */
  public static ArchiveSerializer open(String target) throws IOException {
    return open(target, ArchiveOptions.defaults());
  }

  /**
   * Opens a serializer for {@code target}. The version marker is written immediately.
   *
   * @param target a local path or a remote location
   * @param options storage backends, loaders and codec to use
   * @return the open serializer
   * @throws ArchiveConstructionException if the target cannot be created or made writable
   * @throws IOException on other I/O errors
   */
  public static ArchiveSerializer open(String target, ArchiveOptions options) throws IOException {
    var backend = options.backends().forLocation(target);
    var stagingDirectory = backend.stageForWrite(target);
    try {
      var serializer = new ArchiveSerializer(target, backend, stagingDirectory, options);
      logger.info("Opened archive {} (staging in {})", target, stagingDirectory);
      return serializer;
    } catch (IOException e) {
      if (backend.isRemote()) {
        DeferredCleanup.deleteOrDefer(stagingDirectory);
      }
      throw e;
    }
  }

  /**
   * Appends one top-level value to the main stream.
   *
   * @param value the value to write, may be {@code null}
   * @throws IOException if encoding fails or an object cannot save itself
   * @throws IllegalStateException if the serializer is closed
   */
  public void dump(Object value) throws IOException {
    checkOpen();
    writer.write(value);
  }

  /**
   * Reference hook installed in the codec. Returns empty for values that must be encoded inline.
   */
  Optional<ExternalReference> referenceFor(Object value) throws IOException {
    if (!(value instanceof ExternallyArchivable)) {
      return Optional.empty();
    }
    var archivable = (ExternallyArchivable) value;
    var descriptor =
        Objects.requireNonNull(
            archivable.archiveDescriptor(), "archiveDescriptor() of " + value.getClass());
    if (!loaders.canLoad(descriptor)) {
      logger.debug("No loader registered for {}; encoding inline", descriptor);
      return Optional.empty();
    }

    var saved = savedObjects.getIfPresent(value);
    if (saved != null) {
      return Optional.of(ExternalReference.reuse(saved.identity()));
    }

    var relativePath = UUID.randomUUID().toString();
    var path = stagingDirectory.resolve(relativePath);
    pendingDeletion.remove(path);
    logger.debug("Saving {} to {}", descriptor, path);
    archivable.saveArchive(path);

    var reference = ExternalReference.full(descriptor, relativePath, nextIdentity++);
    savedObjects.put(value, reference);
    return Optional.of(reference);
  }

  public String getTarget() {
    return target;
  }

  public Path getStagingDirectory() {
    return stagingDirectory;
  }

  /** Paths of the previous archive that {@link #close()} will remove. */
  Set<Path> getPendingDeletion() {
    return Set.copyOf(pendingDeletion);
  }

  public boolean isClosed() {
    return closed;
  }

  /**
   * Seals the archive. Remote targets are uploaded, replacing their previous contents; local
   * targets lose the leftover files of the archive they overwrote. Files that cannot be removed
   * are retried at JVM shutdown rather than failing the close. Calling it again has no effect.
   *
   * @throws BackendTransferException if the upload fails; the staging directory is kept
   * @throws IOException if the main stream cannot be flushed
   */
  @Override
  public void close() throws IOException {
    if (closed) {
      return;
    }
    closed = true;

    try {
      writer.close();
    } finally {
      guard.release();
    }

    if (backend.isRemote()) {
      backend.commit(stagingDirectory, target);
      DeferredCleanup.deleteOrDefer(stagingDirectory);
    } else {
      for (var path : pendingDeletion) {
        logger.debug("Removing stale archive entry {}", path);
        DeferredCleanup.deleteOrDefer(path);
      }
    }
    logger.info("Closed archive {}", target);
  }

  private void checkOpen() {
    if (closed) {
      throw new IllegalStateException("Serializer for " + target + " is closed");
    }
  }

  private static Set<Path> listExisting(Path directory) throws IOException {
    try (var entries = Files.list(directory)) {
      return entries
          .filter(path -> !ArchiveLayout.isReserved(path.getFileName().toString()))
          .map(path -> path.toAbsolutePath().normalize())
          .collect(Collectors.toCollection(HashSet::new));
    }
  }
}
