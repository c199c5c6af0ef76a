package com.objectarchive.resource;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Best-effort removal of files and directory trees. Paths that cannot be removed right away (for
 * example because another process holds them open) are queued and retried once more when the JVM
 * shuts down. Nothing here ever throws on a failed deletion.
 */
public final class DeferredCleanup {
  private static final Logger logger = LoggerFactory.getLogger(DeferredCleanup.class);

  private static final Set<Path> pending = ConcurrentHashMap.newKeySet();
  private static volatile boolean hookInstalled = false;

  private DeferredCleanup() {}

  /**
   * Deletes {@code path} recursively, queueing it for a retry at shutdown if anything is left
   * behind.
   *
   * @param path the file or directory to remove
   * @return true if the path is gone now, false if it was deferred
   */
  public static boolean deleteOrDefer(Path path) {
    try {
      deleteRecursively(path);
      return true;
    } catch (IOException e) {
      logger.warn("Could not delete {} ({}); retrying at shutdown", path, e.toString());
      schedule(path);
      return false;
    }
  }

  /**
   * Queues a path for deletion when the JVM shuts down.
   *
   * @param path the path to remove later
   */
  public static void schedule(Path path) {
    installHook();
    pending.add(path.toAbsolutePath().normalize());
  }

  /**
   * Returns the paths currently queued for deletion at shutdown.
   *
   * @return a snapshot of the queue
   */
  public static List<Path> pending() {
    return List.copyOf(pending);
  }

  /**
   * Runs the queued deletions now. Paths that still cannot be removed stay queued.
   *
   * @return the number of paths removed
   */
  public static int runPending() {
    var removed = 0;
    for (var path : List.copyOf(pending)) {
      try {
        deleteRecursively(path);
        pending.remove(path);
        removed++;
      } catch (IOException e) {
        logger.debug("Deferred deletion of {} failed again: {}", path, e.toString());
      }
    }
    return removed;
  }

  /**
   * Deletes a file, or a directory and everything below it. A missing path counts as deleted.
   *
   * @param path the path to remove
   * @throws IOException if some entry cannot be removed
   */
  public static void deleteRecursively(Path path) throws IOException {
    if (!Files.exists(path, java.nio.file.LinkOption.NOFOLLOW_LINKS)) {
      return;
    }
    Files.walkFileTree(
        path,
        new SimpleFileVisitor<>() {
          @Override
          public FileVisitResult visitFile(Path file, BasicFileAttributes attrs)
              throws IOException {
            deleteIfPresent(file);
            return FileVisitResult.CONTINUE;
          }

          @Override
          public FileVisitResult postVisitDirectory(Path dir, IOException exc)
              throws IOException {
            if (exc != null) {
              throw exc;
            }
            deleteIfPresent(dir);
            return FileVisitResult.CONTINUE;
          }
        });
  }

  private static void deleteIfPresent(Path path) throws IOException {
    try {
      Files.delete(path);
    } catch (NoSuchFileException e) {
      // already gone
    }
  }

  private static synchronized void installHook() {
    if (hookInstalled) {
      return;
    }
    Runtime.getRuntime()
        .addShutdownHook(new Thread(DeferredCleanup::runPending, "archive-deferred-cleanup"));
    hookInstalled = true;
  }
}
