package com.objectarchive.codec;

import java.io.Closeable;
import java.io.IOException;

/** Writes successive top-level values to one stream. */
public interface GraphWriter extends Closeable {

  /**
   * Encodes one top-level value, consulting the writer's hook for each value in the graph.
   *
   * @param value the value to encode, may be {@code null}
   * @throws IOException if encoding fails or a value type is unsupported
   */
  void write(Object value) throws IOException;
}
