package com.acme.delivery.replication.core;

/**
 * Applies one decoded change. Runs on the stream's worker thread and blocks it until the
 * change is fully handled.
 */
@FunctionalInterface
public interface ChangeConsumer<E> {
  void handle(E event) throws Exception;
}
