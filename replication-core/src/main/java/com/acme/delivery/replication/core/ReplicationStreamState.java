package com.acme.delivery.replication.core;

public enum ReplicationStreamState {
  CREATED,
  /** Lock taken, connecting, verifying the publication and reclaiming the slot. */
  STARTING,
  /** Consuming the change stream. */
  RUNNING,
  /** Waiting out the reconnect delay after a connection failure. */
  RETRYING,
  FAILED,
  CLOSED;

  public boolean isTerminal() {
    return this == FAILED || this == CLOSED;
  }
}
