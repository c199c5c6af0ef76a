package com.objectarchive.codec.cbor;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.cbor.CBORFactory;
import com.fasterxml.jackson.dataformat.cbor.CBORGenerator;
import com.objectarchive.codec.ExternalReference;
import com.objectarchive.codec.ReferenceHook;
import com.objectarchive.codec.ReferenceResolver;
import com.objectarchive.codec.TypeDescriptor;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;

class CborGraphCodecTest {

  /** Marker the hook below turns into a reference. */
  static final class Handle {
    final ExternalReference reference;

    Handle(ExternalReference reference) {
      this.reference = reference;
    }
  }

  private final CborGraphCodec codec = new CborGraphCodec();

  private static final ReferenceHook HANDLE_HOOK =
      value ->
          value instanceof Handle ? Optional.of(((Handle) value).reference) : Optional.empty();

  private byte[] write(ReferenceHook hook, Object... values) throws IOException {
    var out = new ByteArrayOutputStream();
    try (var writer = codec.newWriter(out, hook)) {
      for (var value : values) {
        writer.write(value);
      }
    }
    return out.toByteArray();
  }

  private List<Object> readAll(byte[] bytes, ReferenceResolver resolver) throws IOException {
    var values = new ArrayList<>();
    try (var reader = codec.newReader(new ByteArrayInputStream(bytes), resolver)) {
      while (reader.hasNext()) {
        values.add(reader.read());
      }
    }
    return values;
  }

  private static final ReferenceResolver NO_REFERENCES =
      reference -> {
        throw new IOException("unexpected reference " + reference);
      };

  @Test
  void testInlineValues() throws IOException {
    var nested = new LinkedHashMap<String, Object>();
    nested.put("name", "frame");
    nested.put("rows", 12);
    nested.put("ratio", 0.5);
    nested.put("tags", List.of("a", "b"));
    nested.put("missing", null);

    var values = readAll(write(ReferenceHook.INLINE, nested, true, "text"), NO_REFERENCES);

    assertEquals(List.of(nested, true, "text"), values);
  }

  @Test
  void testNumbersComeBackAsNarrowestType() throws IOException {
    var big = BigInteger.valueOf(Long.MAX_VALUE).multiply(BigInteger.TEN);
    var values =
        readAll(
            write(ReferenceHook.INLINE, (short) 3, 7, 1L << 40, big, 1.5f, 2.25), NO_REFERENCES);

    assertEquals(List.of(3, 7, 1L << 40, big, 1.5, 2.25), values);
  }

  @Test
  void testBinarySetsAndArrays() throws IOException {
    var values =
        readAll(
            write(
                ReferenceHook.INLINE,
                new byte[] {1, 2, 3},
                Set.of("only"),
                new Object[] {"x", 1}),
            NO_REFERENCES);

    assertArrayEquals(new byte[] {1, 2, 3}, (byte[]) values.get(0));
    assertEquals(Set.of("only"), values.get(1));
    assertTrue(values.get(1) instanceof Set);
    assertEquals(List.of("x", 1), values.get(2));
  }

  @Test
  void testUnsupportedValueIsRejected() {
    var e =
        assertThrows(
            IOException.class, () -> write(ReferenceHook.INLINE, List.of(new StringBuilder("x"))));
    assertTrue(e.getMessage().contains("Unsupported value type"));
  }

  @Test
  void testNonStringMapKeyIsRejected() {
    var e = assertThrows(IOException.class, () -> write(ReferenceHook.INLINE, Map.of(1, "one")));
    assertTrue(e.getMessage().contains("Map keys must be strings"));
  }

  @Test
  void testReferencesReachResolverUnchanged() throws IOException {
    var full =
        ExternalReference.full(new TypeDescriptor("com.example", "Frame"), "0a1b", 1);
    var reuse = ExternalReference.reuse(1);
    var legacy = ExternalReference.legacy(TypeDescriptor.tag("SGraph"), "graphs/g");
    var bytes =
        write(
            HANDLE_HOOK,
            List.of(new Handle(full), new Handle(reuse)),
            Map.of("old", new Handle(legacy)));

    var seen = new ArrayList<ExternalReference>();
    var values =
        readAll(
            bytes,
            reference -> {
              seen.add(reference);
              return "resolved-" + seen.size();
            });

    assertEquals(List.of(full, reuse, legacy), seen);
    assertEquals(List.of("resolved-1", "resolved-2"), values.get(0));
    assertEquals(Map.of("old", "resolved-3"), values.get(1));
  }

  @Test
  void testReferenceIsTaggedArray() throws IOException {
    var bytes =
        write(
            HANDLE_HOOK,
            new Handle(ExternalReference.full(new TypeDescriptor("pkg", "Type"), "path", 9)));

    var tree = new ObjectMapper(new CBORFactory()).readTree(bytes);

    assertTrue(tree.isArray());
    assertEquals(3, tree.size());
    assertEquals("pkg", tree.get(0).get(0).asText());
    assertEquals("Type", tree.get(0).get(1).asText());
    assertEquals("path", tree.get(1).asText());
    assertEquals(9, tree.get(2).asLong());
    assertEquals((byte) 0xD9, bytes[0], "two byte tag header");
    assertEquals(CborGraphCodec.REFERENCE_TAG, ((bytes[1] & 0xFF) << 8) | (bytes[2] & 0xFF));
  }

  @Test
  void testMalformedReferenceIsRejected() throws IOException {
    var out = new ByteArrayOutputStream();
    CBORGenerator generator = new CBORFactory().createGenerator(out);
    generator.writeTag(CborGraphCodec.REFERENCE_TAG);
    generator.writeStartArray();
    generator.writeNull();
    generator.writeNull();
    generator.writeEndArray();
    generator.close();

    var e = assertThrows(IOException.class, () -> readAll(out.toByteArray(), NO_REFERENCES));
    assertTrue(e.getMessage().startsWith("Malformed reference"));
  }

  @Test
  void testReadPastEndFails() throws IOException {
    try (var reader =
        codec.newReader(
            new ByteArrayInputStream(write(ReferenceHook.INLINE, (Object) null)), NO_REFERENCES)) {
      assertTrue(reader.hasNext());
      assertNull(reader.read());
      assertFalse(reader.hasNext());
      assertThrows(EOFException.class, reader::read);
    }
  }
}
