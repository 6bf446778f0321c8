package com.acme.delivery.replication.core;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Advisory OS file lock on a well-known path. The lock file is deleted on release.
 */
public final class FileProcessLock implements ProcessLock {

  private static final Logger LOG = LoggerFactory.getLogger(FileProcessLock.class);

  public static final String DEFAULT_PATH = "/tmp/cdc_handler.lock";

  // Closing a second channel on a locked file can drop the JVM's lock on some platforms,
  // so holders inside this JVM are tracked before any channel is opened.
  private static final Set<Path> HELD_IN_JVM = ConcurrentHashMap.newKeySet();

  private final Path file;
  private final Object monitor = new Object();

  private FileChannel channel;
  private FileLock lock;

  public FileProcessLock(Path file) {
    this.file = Objects.requireNonNull(file, "file").toAbsolutePath().normalize();
  }

  public Path file() {
    return file;
  }

  @Override
  public boolean acquire() {
    synchronized (monitor) {
      if (lock != null || !HELD_IN_JVM.add(file)) {
        LOG.error("Lock {} is already held inside this process", file);
        return false;
      }
      FileChannel opened = null;
      try {
        Path parent = file.getParent();
        if (parent != null) {
          Files.createDirectories(parent);
        }
        opened = FileChannel.open(file, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
        FileLock acquired = opened.tryLock();
        if (acquired == null) {
          closeQuietly(opened);
          HELD_IN_JVM.remove(file);
          LOG.error("Another CDC process is already running (lock {} is held)", file);
          return false;
        }
        channel = opened;
        lock = acquired;
        LOG.info("Acquired exclusive lock {}", file);
        return true;
      } catch (OverlappingFileLockException e) {
        closeQuietly(opened);
        HELD_IN_JVM.remove(file);
        LOG.error("Lock {} is already held inside this process", file);
        return false;
      } catch (IOException e) {
        closeQuietly(opened);
        HELD_IN_JVM.remove(file);
        LOG.error("Could not open lock file {}: {}", file, e.toString());
        return false;
      }
    }
  }

  @Override
  public void release() {
    synchronized (monitor) {
      if (lock == null) {
        return;
      }
      try {
        lock.release();
      } catch (IOException | RuntimeException e) {
        LOG.warn("Error releasing lock {}: {}", file, e.toString());
      }
      closeQuietly(channel);
      lock = null;
      channel = null;
      try {
        Files.deleteIfExists(file);
        LOG.info("Released exclusive lock {}", file);
      } catch (IOException e) {
        LOG.warn("Could not remove lock file {}: {}", file, e.toString());
      } finally {
        HELD_IN_JVM.remove(file);
      }
    }
  }

  @Override
  public boolean isHeld() {
    synchronized (monitor) {
      return lock != null;
    }
  }

  private void closeQuietly(FileChannel target) {
    if (target == null) {
      return;
    }
    try {
      target.close();
    } catch (IOException e) {
      LOG.warn("Error closing lock file {}: {}", file, e.toString());
    }
  }
}
