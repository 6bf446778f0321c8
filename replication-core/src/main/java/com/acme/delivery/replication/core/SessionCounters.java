package com.acme.delivery.replication.core;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-cycle bookkeeping of a replication session. Written by the consume loop only, read
 * from any thread. Reset at the start of every session cycle, never persisted.
 */
public final class SessionCounters {

  private final AtomicLong processed = new AtomicLong();
  private final AtomicLong skipped = new AtomicLong();
  private final AtomicLong failed = new AtomicLong();

  public void recordProcessed() {
    processed.incrementAndGet();
  }

  public void recordSkipped() {
    skipped.incrementAndGet();
  }

  public void recordFailed() {
    failed.incrementAndGet();
  }

  public void reset() {
    processed.set(0);
    skipped.set(0);
    failed.set(0);
  }

  public Snapshot snapshot() {
    return new Snapshot(processed.get(), skipped.get(), failed.get());
  }

  public static final class Snapshot {
    public static final Snapshot EMPTY = new Snapshot(0, 0, 0);

    private final long processed;
    private final long skipped;
    private final long failed;

    public Snapshot(long processed, long skipped, long failed) {
      this.processed = processed;
      this.skipped = skipped;
      this.failed = failed;
    }

    /** Changes applied to the analytical store. */
    public long processed() {
      return processed;
    }

    /** Records that were undecodable or carried nothing to apply. */
    public long skipped() {
      return skipped;
    }

    /** Message-level failures absorbed or raised. */
    public long failed() {
      return failed;
    }

    @Override
    public String toString() {
      return "processed=" + processed + " skipped=" + skipped + " failed=" + failed;
    }
  }
}
