package com.objectarchive.loader;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Class-level half of the external archiving contract: rebuilds an object from the path it saved
 * itself to.
 *
 * @param <T> the type of object produced
 */
@FunctionalInterface
public interface ArchiveLoader<T> {

  /**
   * Loads an object from its side file or directory.
   *
   * @param path the absolute staged path of the side artifact
   * @return the reconstructed object
   * @throws IOException if the artifact cannot be read
   */
  T load(Path path) throws IOException;
}
