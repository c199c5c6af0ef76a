package com.objectarchive.codec;

import java.io.IOException;
import java.util.Optional;

/**
 * Interception point consulted by a {@link GraphWriter} for every value it is about to encode.
 */
@FunctionalInterface
public interface ReferenceHook {

  /** A hook that never substitutes anything. */
  ReferenceHook INLINE = value -> Optional.empty();

  /**
   * Decides whether {@code value} is written inline or replaced by a reference.
   *
   * @param value the value about to be encoded, never {@code null}
   * @return the reference to store instead of the value, or empty to encode it inline
   * @throws IOException if producing the reference fails, e.g. the object cannot save itself
   */
  Optional<ExternalReference> referenceFor(Object value) throws IOException;
}
