package com.acme.delivery.replication.core;

/**
 * One lifecycle transition of a {@link ReplicationStream}, with the session counters at the
 * time it happened.
 */
public final class ReplicationStateChange {
  private final ReplicationStreamState previousState;
  private final ReplicationStreamState state;
  private final long attempt;
  private final Throwable cause;
  private final SessionCounters.Snapshot counters;

  public ReplicationStateChange(ReplicationStreamState previousState,
                                ReplicationStreamState state,
                                Throwable cause,
                                long attempt,
                                SessionCounters.Snapshot counters) {
    this.previousState = previousState;
    this.state = state;
    this.attempt = attempt;
    this.cause = cause;
    this.counters = counters == null ? SessionCounters.Snapshot.EMPTY : counters;
  }

  public ReplicationStreamState previousState() {
    return previousState;
  }

  public ReplicationStreamState state() {
    return state;
  }

  /** Session attempt the transition belongs to, starting at 1. */
  public long attempt() {
    return attempt;
  }

  public Throwable cause() {
    return cause;
  }

  public SessionCounters.Snapshot counters() {
    return counters;
  }

  /**
   * The stream stopped for good because of {@link #cause()}.
   */
  public boolean isFatal() {
    return cause != null && state.isTerminal();
  }

  @Override
  public String toString() {
    String text = "state=" + state + " prev=" + previousState + " attempt=" + attempt + " " + counters;
    return cause == null ? text : text + " cause=" + cause;
  }
}
