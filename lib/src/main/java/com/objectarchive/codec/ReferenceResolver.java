package com.objectarchive.codec;

import java.io.IOException;

/** Mirror of {@link ReferenceHook}: turns a decoded reference back into an object. */
@FunctionalInterface
public interface ReferenceResolver {

  /**
   * Resolves a reference read from the main stream.
   *
   * @param reference the decoded reference
   * @return the object the reference stands for
   * @throws IOException if the reference cannot be resolved
   */
  Object resolve(ExternalReference reference) throws IOException;
}
