package com.objectarchive.tools;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.objectarchive.ArchiveConstructionException;
import com.objectarchive.codec.ExternalReference;
import com.objectarchive.codec.ReferenceHook;
import com.objectarchive.codec.TypeDescriptor;
import com.objectarchive.codec.cbor.CborGraphCodec;
import com.objectarchive.layout.ArchiveLayout;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ArchiveInspectToolTest {

  @TempDir Path tempDir;

  private Path writeArchive(Object... values) throws IOException {
    var directory = Files.createDirectories(tempDir.resolve("archive"));
    ArchiveLayout.writeVersion(directory);
    Files.writeString(directory.resolve("0f3e"), "side");
    ReferenceHook hook =
        value ->
            "frame".equals(value)
                ? Optional.of(
                    ExternalReference.full(new TypeDescriptor("lib", "Frame"), "0f3e", 1))
                : Optional.empty();
    try (var out = Files.newOutputStream(directory.resolve(ArchiveLayout.MAIN_STREAM_FILE));
        var writer = new CborGraphCodec().newWriter(out, hook)) {
      for (var value : values) {
        writer.write(value);
      }
    }
    return directory;
  }

  private String run(String... args) throws IOException {
    var bytes = new ByteArrayOutputStream();
    try (var out = new PrintStream(bytes, true, StandardCharsets.UTF_8)) {
      ArchiveInspectTool.inspect(ArchiveInspectTool.parseArgs(args), out);
    }
    return bytes.toString(StandardCharsets.UTF_8);
  }

  @Test
  void testParseArgs() {
    var config = ArchiveInspectTool.parseArgs(new String[] {"/a", "--values", "--limit", "3"});

    assertEquals("/a", config.archivePath);
    assertTrue(config.showValues);
    assertEquals(3, config.limit);
  }

  @Test
  void testParseArgsRejectsUnknownOption() {
    assertThrows(
        IllegalArgumentException.class,
        () -> ArchiveInspectTool.parseArgs(new String[] {"/a", "--verbose"}));
    assertThrows(
        IllegalArgumentException.class,
        () -> ArchiveInspectTool.parseArgs(new String[] {"/a", "--limit"}));
  }

  @Test
  void testDescribesDirectoryArchive() throws IOException {
    var archive = writeArchive("plain");

    var output = run(archive.toString());

    assertTrue(output.contains("Kind: DIRECTORY"));
    assertTrue(output.contains("Version: 1.0"));
    assertTrue(output.contains("Side artifacts: 1"));
    assertTrue(output.contains("0f3e"));
    assertFalse(output.contains("Value 0"));
  }

  @Test
  void testSummarizesValuesWithoutLoadingReferences() throws IOException {
    var archive = writeArchive(Map.of("model", "frame"), List.of(1, 2), "third");

    var output = run(archive.toString(), "--values", "--limit", "2");

    assertTrue(output.contains("Value 0: map with 1 keys [model]"));
    assertTrue(output.contains("Value 1: ArrayList of 2 [1, 2]"));
    assertFalse(output.contains("Value 2"));
    assertTrue(output.contains("... more values not shown"));
  }

  @Test
  void testSummarize() {
    assertEquals("null", ArchiveInspectTool.summarize(null));
    assertEquals("bytes[3]", ArchiveInspectTool.summarize(new byte[3]));
    assertEquals("HashSet of 0 []", ArchiveInspectTool.summarize(new HashSet<>()));
  }

  @Test
  void testReferencesArePrintedAsPlaceholders() throws IOException {
    var archive = writeArchive("frame");

    var output = run(archive.toString(), "--values");

    assertTrue(output.contains("Value 0: <(lib, Frame) at 0f3e>"));
  }

  @Test
  void testMissingArchive() {
    assertThrows(
        ArchiveConstructionException.class, () -> run(tempDir.resolve("missing").toString()));
  }
}
