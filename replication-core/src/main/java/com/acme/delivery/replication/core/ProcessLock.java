package com.acme.delivery.replication.core;

/**
 * Process-wide exclusivity for a single consumer.
 */
public interface ProcessLock {

  /**
   * Attempts to take the lock without waiting.
   *
   * @return false immediately when another holder owns it
   */
  boolean acquire();

  /**
   * Releases the lock if held. Safe to call more than once and never throws.
   */
  void release();

  boolean isHeld();
}
