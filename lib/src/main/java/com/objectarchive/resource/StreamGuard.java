package com.objectarchive.resource;

import java.io.Closeable;
import java.io.IOException;
import java.lang.ref.Cleaner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Closes a stream handle if its owner becomes unreachable without having been closed. This is a
 * safety net only: owners release the handle through {@link #release()} from their own {@code
 * close()}, and a guard that fires logs a warning because it means a caller leaked the owner.
 *
 * <p>The guard must not reference its owner, otherwise the owner never becomes unreachable.
 */
public final class StreamGuard implements Runnable {
  private static final Logger logger = LoggerFactory.getLogger(StreamGuard.class);
  private static final Cleaner CLEANER = Cleaner.create();

  private final Closeable handle;
  private final String description;
  private volatile boolean released = false;
  private Cleaner.Cleanable cleanable;

  private StreamGuard(Closeable handle, String description) {
    this.handle = handle;
    this.description = description;
  }

  /**
   * Creates a guard for {@code handle} that fires when {@code owner} is collected.
   *
   * @param owner the object owning the handle
   * @param handle the handle to close
   * @param description a human readable name used in the leak warning
   * @return the registered guard
   */
  public static StreamGuard register(Object owner, Closeable handle, String description) {
    var guard = new StreamGuard(handle, description);
    guard.cleanable = CLEANER.register(owner, guard);
    return guard;
  }

  /**
   * Closes the handle on behalf of the owner and disarms the guard. Calling it again is a no-op.
   *
   * @throws IOException if closing the handle fails
   */
  public void release() throws IOException {
    if (released) {
      return;
    }
    released = true;
    try {
      handle.close();
    } finally {
      cleanable.clean();
    }
  }

  public boolean isReleased() {
    return released;
  }

  @Override
  public void run() {
    if (released) {
      return;
    }
    released = true;
    logger.warn("{} was never closed; releasing its stream handle", description);
    try {
      handle.close();
    } catch (IOException e) {
      logger.warn("Failed to release stream handle of {}", description, e);
    }
  }
}
