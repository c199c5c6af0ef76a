package com.objectarchive.layout;

import com.objectarchive.ArchiveConstructionException;
import com.objectarchive.UnsupportedArchiveVersionException;
import com.objectarchive.resource.DeferredCleanup;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Set;
import java.util.zip.ZipFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Defines what a valid archive looks like and recognizes which form a local input takes.
 *
 * <p>Directory archive (current form):
 *
 * <pre>
 * {root}/version         text, exactly the version string
 * {root}/pickle_archive  main stream
 * {root}/&lt;uuid&gt;          one side artifact per externally archived object
 * </pre>
 *
 * <p>Legacy bundle: a ZIP file whose {@value #LEGACY_MARKER_ENTRY} entry contains the name of the
 * main-stream entry and whose archive comment carries the version (absent in the oldest bundles).
 * Bundles are extracted wholesale before reading.
 *
 * <p>Anything else that is a readable regular file is read as a plain main stream.
 */
public final class ArchiveLayout {
  private static final Logger logger = LoggerFactory.getLogger(ArchiveLayout.class);

  /** Name of the version marker file of a directory archive. */
  public static final String VERSION_FILE = "version";

  /** Name of the main-stream file of a directory archive. */
  public static final String MAIN_STREAM_FILE = "pickle_archive";

  /** Name of the legacy bundle entry holding the main-stream entry name. */
  public static final String LEGACY_MARKER_ENTRY = "pickle_file";

  /** Version written by this library. */
  public static final String CURRENT_VERSION = "1.0";

  /** Every version this library can read. Inputs without any version are read as the earliest. */
  public static final Set<String> SUPPORTED_VERSIONS = Set.of(CURRENT_VERSION);

  private static final byte[] ZIP_MAGIC = {0x50, 0x4B, 0x03, 0x04};
  private static final byte[] EMPTY_ZIP_MAGIC = {0x50, 0x4B, 0x05, 0x06};

  private final Path tempDirectory;

  /**
   * Creates a layout that extracts legacy bundles below {@code tempDirectory}.
   *
   * @param tempDirectory parent directory for extraction staging areas
   */
  public ArchiveLayout(Path tempDirectory) {
    this.tempDirectory = tempDirectory;
  }

  /**
   * Checks whether a file name is reserved for the version marker or the main stream.
   *
   * @param fileName a file name inside an archive directory
   * @return true if the name is reserved
   */
  public static boolean isReserved(String fileName) {
    return VERSION_FILE.equals(fileName) || MAIN_STREAM_FILE.equals(fileName);
  }

  /**
   * Writes the current version marker into an archive directory.
   *
   * @param directory the archive directory
   * @throws IOException if the marker cannot be written
   */
  public static void writeVersion(Path directory) throws IOException {
    Files.writeString(directory.resolve(VERSION_FILE), CURRENT_VERSION, StandardCharsets.UTF_8);
  }

  /**
   * Fails unless {@code version} is readable by this library. A {@code null} version denotes the
   * earliest format and is always accepted.
   *
   * @param version the declared version
   * @throws UnsupportedArchiveVersionException if the version is unknown
   */
  public static void checkSupported(String version) throws UnsupportedArchiveVersionException {
    if (version != null && !SUPPORTED_VERSIONS.contains(version)) {
      throw new UnsupportedArchiveVersionException(version);
    }
  }

  /**
   * Recognizes the form of a staged input and validates it.
   *
   * @param input a local file or directory
   * @return where the main stream is, which version governs it and where side files live
   * @throws ArchiveConstructionException if the input is missing required parts
   * @throws UnsupportedArchiveVersionException if the declared version is unknown
   * @throws IOException on other I/O errors
   */
  public ArchiveSource classifyAndValidate(Path input) throws IOException {
    if (Files.isDirectory(input)) {
      return openDirectory(input);
    }
    if (Files.isRegularFile(input) && isZip(input)) {
      return openLegacyBundle(input);
    }
    if (Files.isRegularFile(input) && Files.isReadable(input)) {
      logger.debug("Reading {} as a plain stream", input);
      return new ArchiveSource(ArchiveKind.PLAIN_STREAM, input, null, null);
    }
    throw new ArchiveConstructionException(
        "Input must be an archive directory, a legacy bundle or a readable stream: " + input);
  }

  private ArchiveSource openDirectory(Path directory) throws IOException {
    var versionFile = directory.resolve(VERSION_FILE);
    var mainStream = directory.resolve(MAIN_STREAM_FILE);
    if (!Files.exists(versionFile)) {
      throw new ArchiveConstructionException("Corrupted archive: missing version file");
    }
    if (!Files.exists(mainStream)) {
      throw new ArchiveConstructionException(
          "Corrupted archive: missing main stream file " + mainStream);
    }

    String version;
    try {
      version = Files.readString(versionFile, StandardCharsets.UTF_8).strip();
    } catch (IOException e) {
      throw new ArchiveConstructionException("Corrupted archive: unreadable version file", e);
    }
    checkSupported(version);

    var root = directory.toAbsolutePath().normalize();
    logger.debug("Reading {} as a directory archive, version {}", root, version);
    return new ArchiveSource(ArchiveKind.DIRECTORY, root.resolve(MAIN_STREAM_FILE), version, root);
  }

  private ArchiveSource openLegacyBundle(Path bundle) throws IOException {
    try (var zip = new ZipFile(bundle.toFile())) {
      var marker = zip.getEntry(LEGACY_MARKER_ENTRY);
      if (marker == null) {
        throw new ArchiveConstructionException(
            "Cannot read bundle "
                + bundle
                + ": missing "
                + LEGACY_MARKER_ENTRY
                + " entry naming the main stream");
      }
      String mainEntry;
      try (var in = zip.getInputStream(marker)) {
        mainEntry = new String(in.readAllBytes(), StandardCharsets.UTF_8).strip();
      }

      var comment = zip.getComment();
      var version = comment == null || comment.isBlank() ? null : comment.strip();
      checkSupported(version);

      var root = Files.createTempDirectory(tempDirectory, "archive_").toAbsolutePath();
      logger.info("Extracting legacy bundle {} to {}", bundle, root);
      try {
        return extract(zip, root, mainEntry, version);
      } catch (IOException e) {
        DeferredCleanup.deleteOrDefer(root);
        throw e;
      }
    }
  }

  private static ArchiveSource extract(ZipFile zip, Path root, String mainEntry, String version)
      throws IOException {
    var entries = zip.entries();
    while (entries.hasMoreElements()) {
      var entry = entries.nextElement();
      var target = resolveInside(root, entry.getName());
      if (entry.isDirectory()) {
        Files.createDirectories(target);
      } else {
        Files.createDirectories(target.getParent());
        try (InputStream in = zip.getInputStream(entry)) {
          Files.copy(in, target);
        }
      }
    }

    var mainStream = resolveInside(root, mainEntry);
    if (!Files.isRegularFile(mainStream)) {
      throw new ArchiveConstructionException(
          "Corrupted bundle: main stream entry " + mainEntry + " not found");
    }
    return new ArchiveSource(ArchiveKind.LEGACY_BUNDLE, mainStream, version, root);
  }

  private static Path resolveInside(Path root, String name) throws ArchiveConstructionException {
    var resolved = root.resolve(name).normalize();
    if (!resolved.startsWith(root) || resolved.equals(root)) {
      throw new ArchiveConstructionException("Bundle entry escapes the archive: " + name);
    }
    return resolved;
  }

  private static boolean isZip(Path file) throws IOException {
    byte[] header;
    try (var in = Files.newInputStream(file)) {
      header = in.readNBytes(ZIP_MAGIC.length);
    }
    return Arrays.equals(header, ZIP_MAGIC) || Arrays.equals(header, EMPTY_ZIP_MAGIC);
  }
}
