package com.objectarchive.codec.cbor;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.cbor.CBORFactory;
import com.fasterxml.jackson.dataformat.cbor.CBORGenerator;
import com.fasterxml.jackson.dataformat.cbor.CBORParser;
import com.objectarchive.codec.ExternalReference;
import com.objectarchive.codec.GraphCodec;
import com.objectarchive.codec.GraphReader;
import com.objectarchive.codec.GraphWriter;
import com.objectarchive.codec.ReferenceHook;
import com.objectarchive.codec.ReferenceResolver;
import com.objectarchive.codec.TypeDescriptor;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@link GraphCodec} backed by Jackson's CBOR streaming API.
 *
 * <p>Inline values are limited to null, booleans, integral and floating point numbers, {@link
 * BigInteger}, strings, byte arrays, lists and object arrays, sets and maps with string keys.
 * Integral numbers come back as the narrowest of {@code Integer}, {@code Long} or {@code
 * BigInteger}; floating point numbers come back as {@code Double}.
 *
 * <p>References are written as an array under {@link #REFERENCE_TAG}:
 *
 * <ul>
 *   <li>legacy: {@code [descriptor, path]}
 *   <li>full: {@code [descriptor, path, identity]}
 *   <li>reuse: {@code [null, null, identity]}
 * </ul>
 *
 * A descriptor is a text string for a bare tag and a two element text array {@code [namespace,
 * name]} otherwise.
 */
public final class CborGraphCodec implements GraphCodec {

  /** CBOR tag marking an external reference array. */
  public static final int REFERENCE_TAG = 27001;

  /** CBOR tag for a finite set (IANA registered). */
  public static final int SET_TAG = 258;

  private final ObjectMapper mapper;

  public CborGraphCodec() {
    this.mapper = new ObjectMapper(new CBORFactory());
  }

  @Override
  public GraphWriter newWriter(OutputStream out, ReferenceHook hook) throws IOException {
    var generator = (CBORGenerator) mapper.getFactory().createGenerator(out);
    return new CborGraphWriter(generator, hook);
  }

  @Override
  public GraphReader newReader(InputStream in, ReferenceResolver resolver) throws IOException {
    var parser = (CBORParser) mapper.getFactory().createParser(in);
    return new CborGraphReader(parser, resolver);
  }

  private static final class CborGraphWriter implements GraphWriter {
    private final CBORGenerator generator;
    private final ReferenceHook hook;

    CborGraphWriter(CBORGenerator generator, ReferenceHook hook) {
      this.generator = generator;
      this.hook = hook;
    }

    @Override
    public void write(Object value) throws IOException {
      writeValue(value);
      generator.flush();
    }

    private void writeValue(Object value) throws IOException {
      if (value == null) {
        generator.writeNull();
        return;
      }

      var reference = hook.referenceFor(value);
      if (reference.isPresent()) {
        writeReference(reference.get());
        return;
      }

      if (value instanceof Boolean) {
        generator.writeBoolean((Boolean) value);
      } else if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
        generator.writeNumber(((Number) value).intValue());
      } else if (value instanceof Long) {
        generator.writeNumber((Long) value);
      } else if (value instanceof Double || value instanceof Float) {
        generator.writeNumber(((Number) value).doubleValue());
      } else if (value instanceof BigInteger) {
        generator.writeNumber((BigInteger) value);
      } else if (value instanceof String) {
        generator.writeString((String) value);
      } else if (value instanceof byte[]) {
        generator.writeBinary((byte[]) value);
      } else if (value instanceof Set) {
        generator.writeTag(SET_TAG);
        writeArray((Set<?>) value);
      } else if (value instanceof Collection) {
        writeArray((Collection<?>) value);
      } else if (value instanceof Object[]) {
        writeArray(Arrays.asList((Object[]) value));
      } else if (value instanceof Map) {
        writeMap((Map<?, ?>) value);
      } else {
        throw new IOException("Unsupported value type for inline encoding: " + value.getClass());
      }
    }

    private void writeArray(Collection<?> elements) throws IOException {
      generator.writeStartArray();
      for (var element : elements) {
        writeValue(element);
      }
      generator.writeEndArray();
    }

    private void writeMap(Map<?, ?> map) throws IOException {
      generator.writeStartObject();
      for (var entry : map.entrySet()) {
        if (!(entry.getKey() instanceof String)) {
          throw new IOException("Map keys must be strings, found: " + entry.getKey());
        }
        generator.writeFieldName((String) entry.getKey());
        writeValue(entry.getValue());
      }
      generator.writeEndObject();
    }

    private void writeReference(ExternalReference reference) throws IOException {
      generator.writeTag(REFERENCE_TAG);
      generator.writeStartArray();

      var descriptor = reference.descriptor();
      if (descriptor == null) {
        generator.writeNull();
      } else if (descriptor.isTag()) {
        generator.writeString(descriptor.name());
      } else {
        generator.writeStartArray();
        generator.writeString(descriptor.namespace());
        generator.writeString(descriptor.name());
        generator.writeEndArray();
      }

      if (reference.relativePath() == null) {
        generator.writeNull();
      } else {
        generator.writeString(reference.relativePath());
      }

      if (!reference.isLegacy()) {
        generator.writeNumber(reference.identity());
      }
      generator.writeEndArray();
    }

    @Override
    public void close() throws IOException {
      generator.close();
    }
  }

  private static final class CborGraphReader implements GraphReader {
    private final CBORParser parser;
    private final ReferenceResolver resolver;
    private JsonToken pending;

    CborGraphReader(CBORParser parser, ReferenceResolver resolver) {
      this.parser = parser;
      this.resolver = resolver;
    }

    @Override
    public boolean hasNext() throws IOException {
      if (pending == null) {
        pending = parser.nextToken();
      }
      return pending != null;
    }

    @Override
    public Object read() throws IOException {
      if (!hasNext()) {
        throw new EOFException("No more values in stream");
      }
      var token = pending;
      pending = null;
      return readValue(token);
    }

    private Object readValue(JsonToken token) throws IOException {
      if (token == null) {
        throw new EOFException("Unexpected end of stream");
      }
      switch (token) {
        case VALUE_NULL:
          return null;
        case VALUE_TRUE:
          return Boolean.TRUE;
        case VALUE_FALSE:
          return Boolean.FALSE;
        case VALUE_NUMBER_INT:
          return readInteger();
        case VALUE_NUMBER_FLOAT:
          return parser.getDoubleValue();
        case VALUE_STRING:
          return parser.getText();
        case VALUE_EMBEDDED_OBJECT:
          return parser.getBinaryValue();
        case START_ARRAY:
          var tag = parser.getCurrentTag();
          if (tag == REFERENCE_TAG) {
            return resolver.resolve(readReference());
          }
          var elements = readElements();
          return tag == SET_TAG ? new LinkedHashSet<>(elements) : elements;
        case START_OBJECT:
          return readMap();
        default:
          throw new IOException("Unexpected token " + token + " in stream");
      }
    }

    private Object readInteger() throws IOException {
      if (parser.getNumberType() == JsonParser.NumberType.INT) {
        return parser.getIntValue();
      }
      if (parser.getNumberType() == JsonParser.NumberType.LONG) {
        return parser.getLongValue();
      }
      return parser.getBigIntegerValue();
    }

    private List<Object> readElements() throws IOException {
      var elements = new ArrayList<>();
      JsonToken token;
      while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
        elements.add(readValue(token));
      }
      return elements;
    }

    private Map<String, Object> readMap() throws IOException {
      var map = new LinkedHashMap<String, Object>();
      JsonToken token;
      while ((token = parser.nextToken()) != JsonToken.END_OBJECT) {
        if (token != JsonToken.FIELD_NAME) {
          throw new IOException("Expected field name but found " + token);
        }
        var key = parser.currentName();
        map.put(key, readValue(parser.nextToken()));
      }
      return map;
    }

    private ExternalReference readReference() throws IOException {
      var descriptor = readDescriptor(parser.nextToken());

      var token = parser.nextToken();
      String relativePath;
      if (token == JsonToken.VALUE_NULL) {
        relativePath = null;
      } else if (token == JsonToken.VALUE_STRING) {
        relativePath = parser.getText();
      } else {
        throw new IOException("Malformed reference: expected path but found " + token);
      }

      token = parser.nextToken();
      Long identity = null;
      if (token == JsonToken.VALUE_NUMBER_INT) {
        identity = parser.getLongValue();
        token = parser.nextToken();
      }
      if (token != JsonToken.END_ARRAY) {
        throw new IOException("Malformed reference: unexpected " + token);
      }
      try {
        return new ExternalReference(descriptor, relativePath, identity);
      } catch (IllegalArgumentException e) {
        throw new IOException("Malformed reference: " + e.getMessage(), e);
      }
    }

    private TypeDescriptor readDescriptor(JsonToken token) throws IOException {
      if (token == JsonToken.VALUE_NULL) {
        return null;
      }
      if (token == JsonToken.VALUE_STRING) {
        return TypeDescriptor.tag(parser.getText());
      }
      if (token == JsonToken.START_ARRAY
          && parser.nextToken() == JsonToken.VALUE_STRING) {
        var namespace = parser.getText();
        if (parser.nextToken() == JsonToken.VALUE_STRING) {
          var name = parser.getText();
          if (parser.nextToken() == JsonToken.END_ARRAY) {
            return new TypeDescriptor(namespace, name);
          }
        }
      }
      throw new IOException("Malformed reference descriptor");
    }

    @Override
    public void close() throws IOException {
      parser.close();
    }
  }
}
