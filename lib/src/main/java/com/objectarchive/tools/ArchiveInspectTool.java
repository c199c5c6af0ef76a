package com.objectarchive.tools;

import com.objectarchive.codec.GraphCodec;
import com.objectarchive.codec.cbor.CborGraphCodec;
import com.objectarchive.layout.ArchiveLayout;
import com.objectarchive.layout.ArchiveSource;
import com.objectarchive.resource.DeferredCleanup;
import com.objectarchive.storage.StorageBackends;
import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Command-line tool for inspecting archives without loading their external objects.
 *
 * <p>Usage: java com.objectarchive.tools.ArchiveInspectTool &lt;archive-path&gt; [options]
 *
 * <p>Options: --values Print a summary of each top-level value, showing references as placeholders
 * --limit &lt;n&gt; Maximum number of values to print (default: 20) --help Show this help message
 */
public class ArchiveInspectTool {

  public static void main(String[] args) {
    if (args.length == 0 || "--help".equals(args[0])) {
      showHelp();
      return;
    }

    try {
      Config config = parseArgs(args);
      inspect(config, System.out);
    } catch (Exception e) {
      System.err.println("Error: " + e.getMessage());
      System.exit(1);
    }
  }

  private static void showHelp() {
    System.out.println("ArchiveInspectTool - Describes an object archive without loading it");
    System.out.println();
    System.out.println(
        "Usage: java com.objectarchive.tools.ArchiveInspectTool <archive-path> [options]");
    System.out.println();
    System.out.println("Options:");
    System.out.println("  --values              Summarize each top-level value");
    System.out.println("  --limit <n>           Maximum number of values to summarize (default: 20)");
    System.out.println("  --help                Show this help message");
    System.out.println();
    System.out.println("Examples:");
    System.out.println("  java com.objectarchive.tools.ArchiveInspectTool /path/to/archive");
    System.out.println(
        "  java com.objectarchive.tools.ArchiveInspectTool /path/to/archive --values --limit 5");
  }

  static Config parseArgs(String[] args) {
    Config config = new Config();
    config.archivePath = args[0];

    for (int i = 1; i < args.length; i++) {
      switch (args[i]) {
        case "--values":
          config.showValues = true;
          break;
        case "--limit":
          if (i + 1 >= args.length) throw new IllegalArgumentException("--limit requires a value");
          config.limit = Integer.parseInt(args[++i]);
          break;
        default:
          throw new IllegalArgumentException("Unknown option: " + args[i]);
      }
    }

    return config;
  }

  static void inspect(Config config, PrintStream out) throws IOException {
    var backend = StorageBackends.localOnly().forLocation(config.archivePath);
    var staged = backend.stageForRead(config.archivePath);
    var tempDirectory = Files.createTempDirectory("archive_inspect_");
    try {
      var archive = new ArchiveLayout(tempDirectory).classifyAndValidate(staged.path());
      out.println("Archive: " + staged.path());
      out.println("  Kind: " + archive.kind());
      out.println("  Version: " + (archive.version() != null ? archive.version() : "(none)"));
      out.println("  Main stream: " + archive.mainStream());

      var sideFiles = listSideFiles(archive);
      out.println("  Side artifacts: " + sideFiles.size());
      for (var sideFile : sideFiles) {
        out.println("    " + sideFile);
      }

      if (config.showValues) {
        out.println();
        printValues(archive, new CborGraphCodec(), config.limit, out);
      }
    } finally {
      DeferredCleanup.deleteOrDefer(tempDirectory);
    }
  }

  private static List<String> listSideFiles(ArchiveSource archive) throws IOException {
    if (!archive.hasSideFiles()) {
      return List.of();
    }
    var mainStream = archive.mainStream().getFileName().toString();
    try (var entries = Files.list(archive.stagingRoot())) {
      return entries
          .map(path -> path.getFileName().toString())
          .filter(name -> !ArchiveLayout.isReserved(name))
          .filter(name -> !name.equals(mainStream))
          .filter(name -> !name.equals(ArchiveLayout.LEGACY_MARKER_ENTRY))
          .sorted()
          .collect(Collectors.toList());
    }
  }

  private static void printValues(
      ArchiveSource archive, GraphCodec codec, int limit, PrintStream out) throws IOException {
    var in = new BufferedInputStream(Files.newInputStream(archive.mainStream()));
    try (var reader =
        codec.newReader(
            in,
            reference ->
                reference.isReuse()
                    ? "<ref #" + reference.identity() + ">"
                    : "<" + reference.descriptor() + " at " + reference.relativePath() + ">")) {
      var index = 0;
      while (reader.hasNext() && index < limit) {
        out.println("Value " + index + ": " + summarize(reader.read()));
        index++;
      }
      if (reader.hasNext()) {
        out.println("... more values not shown");
      }
    }
  }

  static String summarize(Object value) {
    if (value == null) {
      return "null";
    }
    if (value instanceof Map) {
      var keys = ((Map<?, ?>) value).keySet();
      return "map with " + keys.size() + " keys " + keys;
    }
    if (value instanceof Collection) {
      var elements = (Collection<?>) value;
      return value.getClass().getSimpleName() + " of " + elements.size() + " " + elements;
    }
    if (value instanceof byte[]) {
      return "bytes[" + ((byte[]) value).length + "]";
    }
    return value.toString();
  }

  static class Config {
    String archivePath;
    boolean showValues = false;
    int limit = 20;
  }
}
