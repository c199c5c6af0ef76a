package com.objectarchive;

import com.objectarchive.codec.TypeDescriptor;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Implemented by heavy objects that persist themselves to their own file or directory instead of
 * being encoded inline in the main stream.
 *
 * <p>An object is archived externally only when it implements this interface <em>and</em> a loader
 * for its {@link #archiveDescriptor() descriptor} is registered in the {@link
 * com.objectarchive.loader.LoaderRegistry} of the session. The loader is the class-level half of
 * the contract: it rebuilds an instance from the path passed to {@link #saveArchive(Path)}.
 */
public interface ExternallyArchivable {

  /**
   * Saves this object to the given path. The path does not exist yet; the object may create
   * either a single file or a directory there. The format is private to the implementation.
   *
   * @param path the absolute location to save to
   * @throws IOException if the object cannot be saved
   */
  void saveArchive(Path path) throws IOException;

  /**
   * Returns the descriptor written into the reference for this object and used to find its loader
   * when reading. Defaults to the descriptor of the runtime class.
   *
   * @return the type descriptor of this object
   */
  default TypeDescriptor archiveDescriptor() {
    return TypeDescriptor.of(getClass());
  }
}
