package com.objectarchive;

import com.objectarchive.codec.GraphCodec;
import com.objectarchive.codec.GraphReader;
import com.objectarchive.codec.GraphWriter;
import com.objectarchive.codec.ReferenceHook;
import com.objectarchive.codec.ReferenceResolver;
import com.objectarchive.codec.cbor.CborGraphCodec;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/** CBOR codec whose writer or reader can be made to fail on creation. */
class FailingCodec implements GraphCodec {
  private final CborGraphCodec delegate = new CborGraphCodec();
  private final boolean failWriter;
  private final boolean failReader;

  private FailingCodec(boolean failWriter, boolean failReader) {
    this.failWriter = failWriter;
    this.failReader = failReader;
  }

  static FailingCodec failingWriter() {
    return new FailingCodec(true, false);
  }

  static FailingCodec failingReader() {
    return new FailingCodec(false, true);
  }

  @Override
  public GraphWriter newWriter(OutputStream out, ReferenceHook hook) throws IOException {
    if (failWriter) {
      throw new IOException("writer unavailable");
    }
    return delegate.newWriter(out, hook);
  }

  @Override
  public GraphReader newReader(InputStream in, ReferenceResolver resolver) throws IOException {
    if (failReader) {
      throw new IOException("reader unavailable");
    }
    return delegate.newReader(in, resolver);
  }
}
