package com.acme.delivery.replication.core;

@FunctionalInterface
public interface ReplicationSubscription {
  void cancel();
}
