package com.objectarchive.codec;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Generic recursive encoder/decoder with an injectable interception point. The archive layer only
 * relies on this contract: a writer that lets a {@link ReferenceHook} replace any value with an
 * {@link ExternalReference}, and a reader that hands every decoded reference to a {@link
 * ReferenceResolver}.
 *
 * <p>Implementations must write references in all three shapes described by {@link
 * ExternalReference} and read them back with the same shape.
 */
public interface GraphCodec {

  /**
   * Opens a writer over {@code out}. The writer owns the stream and closes it.
   *
   * @param out the main stream
   * @param hook the interception hook
   * @return a new writer
   * @throws IOException if the writer cannot be created
   */
  GraphWriter newWriter(OutputStream out, ReferenceHook hook) throws IOException;

  /**
   * Opens a reader over {@code in}. The reader owns the stream and closes it.
   *
   * @param in the main stream
   * @param resolver the reference resolver
   * @return a new reader
   * @throws IOException if the reader cannot be created
   */
  GraphReader newReader(InputStream in, ReferenceResolver resolver) throws IOException;
}
