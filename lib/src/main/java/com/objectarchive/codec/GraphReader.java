package com.objectarchive.codec;

import java.io.Closeable;
import java.io.IOException;

/** Reads back the top-level values written by a {@link GraphWriter}, one per call. */
public interface GraphReader extends Closeable {

  /**
   * Checks whether another top-level value remains in the stream.
   *
   * @return true if {@link #read()} would return a value
   * @throws IOException if the stream cannot be read
   */
  boolean hasNext() throws IOException;

  /**
   * Decodes the next top-level value, passing every reference to the reader's resolver.
   *
   * @return the decoded value, may be {@code null}
   * @throws java.io.EOFException if no value remains
   * @throws IOException if decoding or reference resolution fails
   */
  Object read() throws IOException;
}
