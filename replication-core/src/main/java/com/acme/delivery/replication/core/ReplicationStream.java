package com.acme.delivery.replication.core;

import io.vertx.core.Future;
import io.vertx.core.Handler;

public interface ReplicationStream<E> extends AutoCloseable {

  /**
   * Starts the stream. The future completes once the stream is RUNNING and fails when the
   * first session cannot be established.
   */
  Future<Void> start();

  /**
   * Completes when the stream stops for good: successfully after {@link #close()}, failed
   * with the fatal cause otherwise.
   */
  Future<Void> completion();

  ReplicationStreamState state();

  ReplicationSubscription onStateChange(Handler<ReplicationStateChange> handler);

  @Override
  void close();
}
