package com.objectarchive.storage;

import com.objectarchive.ArchiveConstructionException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Backend for plain filesystem paths. Archives are written in place, so staging and committing
 * are trivial. Location strings may start with {@code file://}, a leading {@code ~} expands to the
 * user's home directory and {@code $VAR} or {@code ${VAR}} expand from the environment; unknown
 * variables are left as written.
 */
public final class LocalStorageBackend implements StorageBackend {
  private static final Pattern ENV_REFERENCE = Pattern.compile("\\$(?:\\{(\\w+)\\}|(\\w+))");

  private final UnaryOperator<String> environment;
  private final String userHome;

  public LocalStorageBackend() {
    this(System::getenv, System.getProperty("user.home"));
  }

  /**
   * Creates a backend with an explicit environment, mainly for tests.
   *
   * @param environment variable lookup returning {@code null} for unknown names
   * @param userHome the directory {@code ~} expands to
   */
  public LocalStorageBackend(UnaryOperator<String> environment, String userHome) {
    this.environment = environment;
    this.userHome = userHome;
  }

  @Override
  public StorageScheme scheme() {
    return StorageScheme.LOCAL;
  }

  /**
   * Expands a location string into an absolute, normalized path.
   *
   * @param location the location string
   * @return the absolute path
   */
  public Path resolve(String location) {
    var expanded = location;
    if (expanded.startsWith(StorageScheme.FILE_PREFIX)) {
      expanded = expanded.substring(StorageScheme.FILE_PREFIX.length());
    }
    expanded = expandVariables(expanded);
    if (expanded.equals("~") || expanded.startsWith("~/")) {
      expanded = userHome + expanded.substring(1);
    }
    return Paths.get(expanded).toAbsolutePath().normalize();
  }

  @Override
  public Path stageForWrite(String target) throws IOException {
    var directory = resolve(target);
    try {
      if (Files.isRegularFile(directory)) {
        Files.delete(directory);
      }
      Files.createDirectories(directory);
    } catch (IOException e) {
      throw new ArchiveConstructionException("Cannot create archive directory " + directory, e);
    }
    if (!Files.isWritable(directory)) {
      throw new ArchiveConstructionException("Archive directory is not writable: " + directory);
    }
    return directory;
  }

  @Override
  public void commit(Path stagingDirectory, String target) {
    // archives are written in place
  }

  @Override
  public StagedInput stageForRead(String source) throws IOException {
    var path = resolve(source);
    if (!Files.exists(path)) {
      throw new ArchiveConstructionException(path + " is not a valid file name");
    }
    return new StagedInput(path, false);
  }

  private String expandVariables(String location) {
    Matcher matcher = ENV_REFERENCE.matcher(location);
    var result = new StringBuilder();
    while (matcher.find()) {
      var name = matcher.group(1) != null ? matcher.group(1) : matcher.group(2);
      var value = environment.apply(name);
      matcher.appendReplacement(
          result, Matcher.quoteReplacement(value != null ? value : matcher.group()));
    }
    matcher.appendTail(result);
    return result.toString();
  }
}
