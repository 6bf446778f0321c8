/*
 * Copyright (C) 2026 ACME Delivery Services
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.acme.delivery.replication.pg;

import com.acme.delivery.replication.core.ChangeConsumer;
import com.acme.delivery.replication.core.FailureGovernor;
import com.acme.delivery.replication.core.PreflightFailedException;
import com.acme.delivery.replication.core.ProcessLock;
import com.acme.delivery.replication.core.ReplicationStateChange;
import com.acme.delivery.replication.core.ReplicationStream;
import com.acme.delivery.replication.core.ReplicationStreamState;
import com.acme.delivery.replication.core.ReplicationSubscription;
import com.acme.delivery.replication.core.RetryPolicy;
import com.acme.delivery.replication.core.SessionCounters;
import com.acme.delivery.replication.core.SourcePrerequisite;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import java.nio.ByteBuffer;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.postgresql.PGConnection;
import org.postgresql.replication.LogSequenceNumber;
import org.postgresql.replication.PGReplicationStream;
import org.postgresql.replication.fluent.logical.ChainedLogicalStreamBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Consumes the logical change stream of the source database and hands every decoded
 * change to a {@link ChangeConsumer}, one at a time, on a dedicated worker thread.
 *
 * <p>Each session cycle verifies the publication, reclaims and recreates the slot, then
 * streams until the connection drops or a fatal error occurs. Connection failures restart
 * the cycle under the configured retry policy. Every cycle ends with the replication
 * connection closed and one more reclamation pass; the run ends with the process lock
 * released.
 */
public class PostgresCdcSession implements ReplicationStream<ChangeEvent> {

  private static final Logger LOG = LoggerFactory.getLogger(PostgresCdcSession.class);
  private static final long IDLE_SLEEP_MILLIS = 50;

  static final String PUBLICATION_MISSING = "PUBLICATION_MISSING";
  static final String WAL_LEVEL_INVALID = "WAL_LEVEL_INVALID";

  private final Vertx vertx;
  private final PostgresCdcOptions options;
  private final SourceConnector connector;
  private final ProcessLock lock;
  private final ChangeConsumer<ChangeEvent> consumer;
  private final RetryPolicy connectionRetry;
  private final FailureGovernor governor;
  private final ChangeMessageDecoder decoder;
  private final SessionCounters counters = new SessionCounters();
  private final List<Handler<ReplicationStateChange>> stateHandlers = new CopyOnWriteArrayList<>();
  private final AtomicBoolean shouldRun = new AtomicBoolean(false);

  private volatile Connection replConnection;
  private volatile PGReplicationStream replicationStream;
  private volatile Thread worker;
  private volatile Promise<Void> startPromise;
  private volatile Promise<Void> completionPromise = Promise.promise();
  private volatile ReplicationStreamState state = ReplicationStreamState.CREATED;

  public PostgresCdcSession(Vertx vertx,
                            PostgresCdcOptions options,
                            SourceConnector connector,
                            ProcessLock lock,
                            ChangeConsumer<ChangeEvent> consumer) {
    this.vertx = Objects.requireNonNull(vertx, "vertx");
    this.options = new PostgresCdcOptions(Objects.requireNonNull(options, "options"));
    this.options.validate();
    this.connector = Objects.requireNonNull(connector, "connector");
    this.lock = Objects.requireNonNull(lock, "lock");
    this.consumer = Objects.requireNonNull(consumer, "consumer");
    this.connectionRetry = this.options.getRetryPolicy().copy()
      .setRetryOn(ConnectionFailures::isConnectionFailure);
    this.governor = new FailureGovernor(this.options.getMessageRetryPolicy());
    this.decoder = new ChangeMessageDecoder(this.options.getSourceSchema());
  }

  @Override
  public synchronized Future<Void> start() {
    if (state == ReplicationStreamState.CLOSED) {
      return Future.failedFuture("stream is closed");
    }
    if (state == ReplicationStreamState.RUNNING) {
      return Future.succeededFuture();
    }
    if ((state == ReplicationStreamState.STARTING || state == ReplicationStreamState.RETRYING)
      && startPromise != null) {
      return startPromise.future();
    }

    if (completionPromise.future().isComplete()) {
      completionPromise = Promise.promise();
    }
    startPromise = Promise.promise();
    Promise<Void> promiseToReturn = startPromise;
    transition(ReplicationStreamState.STARTING, null, 0);

    if (!lock.acquire()) {
      IllegalStateException error =
        new IllegalStateException("Could not acquire lock - another CDC process may be running");
      transition(ReplicationStreamState.FAILED, error, 0);
      failStart(error);
      completionPromise.tryFail(error);
      return promiseToReturn.future();
    }

    shouldRun.set(true);
    worker = new Thread(this::runLoop, "cdc-" + options.getSlotName());
    worker.setDaemon(true);
    worker.start();
    return promiseToReturn.future();
  }

  @Override
  public Future<Void> completion() {
    return completionPromise.future();
  }

  @Override
  public ReplicationStreamState state() {
    return state;
  }

  /**
   * Counters of the current session cycle.
   */
  public SessionCounters.Snapshot counters() {
    return counters.snapshot();
  }

  public PostgresCdcOptions options() {
    return options;
  }

  @Override
  public ReplicationSubscription onStateChange(Handler<ReplicationStateChange> handler) {
    Handler<ReplicationStateChange> resolved = Objects.requireNonNull(handler, "handler");
    stateHandlers.add(resolved);
    return () -> stateHandlers.remove(resolved);
  }

  @Override
  public synchronized void close() {
    boolean wasRunning = shouldRun.getAndSet(false);
    transition(ReplicationStreamState.CLOSED, null, 0);

    closeStream();

    Thread thread = worker;
    if (thread != null) {
      thread.interrupt();
    }

    Promise<Void> currentStartPromise = startPromise;
    startPromise = null;
    if (currentStartPromise != null && !currentStartPromise.future().isComplete()) {
      currentStartPromise.fail("stream closed before reaching RUNNING");
    }
    if (!wasRunning && thread == null) {
      completionPromise.tryComplete();
    }
  }

  private void runLoop() {
    long attempt = 0;
    Throwable fatal = null;

    try {
      while (shouldRun.get()) {
        attempt++;
        transition(ReplicationStreamState.STARTING, null, attempt);
        try {
          runSession(attempt);
          if (!shouldRun.get()) {
            return;
          }
          throw new IllegalStateException("replication session ended unexpectedly");
        } catch (Exception e) {
          if (!shouldRun.get()) {
            return;
          }
          if (!ConnectionFailures.isConnectionFailure(e)) {
            LOG.error("CDC session for slot {} failed", options.getSlotName(), e);
            fatal = e;
            return;
          }
          if (!connectionRetry.shouldRetry(e, attempt)) {
            LOG.error("Giving up on the source database after {} attempts", attempt, e);
            fatal = new IllegalStateException("Failed to connect to database after " + attempt + " attempts", e);
            return;
          }
          LOG.warn("Connection to the source database lost (attempt {} of {}): {}",
            attempt, connectionRetry.getMaxAttempts(), e.getMessage());
          transition(ReplicationStreamState.RETRYING, e, attempt);
          connectionRetry.pause();
        }
      }
    } finally {
      connector.close();
      lock.release();
      synchronized (this) {
        worker = null;
        shouldRun.set(false);
      }
      if (fatal != null) {
        transition(ReplicationStreamState.FAILED, fatal, attempt);
        failStart(fatal);
        completionPromise.tryFail(fatal);
      } else {
        completionPromise.tryComplete();
      }
    }
  }

  private void runSession(long attempt) throws Exception {
    counters.reset();
    governor.reset();

    ReplicationAdmin admin = connector.admin();
    verifyPrerequisites(admin);

    String slotName = options.getSlotName();
    SlotReclaimer reclaimer = new SlotReclaimer(admin, options.getReclaimRetryPolicy());
    try {
      reclaimer.reclaim(slotName);
      admin.createSlot(slotName, options.getPlugin());
      Optional<ReplicationAdmin.SlotInfo> slot = admin.findSlot(slotName);
      if (slot.isPresent() && slot.get().isActive()) {
        throw new IllegalStateException("Replication slot '" + slotName
          + "' is still held by backend " + slot.get().activePid());
      }
      LOG.info("Created replication slot '{}' with plugin {}", slotName, options.getPlugin());

      try {
        Connection replConn = connector.openReplication();
        this.replConnection = replConn;
        PGReplicationStream stream = openReplicationStream(replConn.unwrap(PGConnection.class), slotName);
        this.replicationStream = stream;

        transition(ReplicationStreamState.RUNNING, null, attempt);
        completeStart();
        LOG.info("Streaming changes from publication {} on slot {}", options.getPublication(), slotName);

        consume(stream);
      } finally {
        closeStream();
      }
    } finally {
      // close() interrupts the worker; the cleanup pass still has to wait between attempts
      boolean interrupted = Thread.interrupted();
      try {
        reclaimer.reclaim(slotName);
      } catch (SQLException | RuntimeException e) {
        LOG.error("Slot cleanup for '{}' failed: {}", slotName, e.toString());
      } finally {
        if (interrupted) {
          Thread.currentThread().interrupt();
        }
      }
      connector.close();
    }
  }

  private void verifyPrerequisites(ReplicationAdmin admin) throws SQLException {
    List<SourcePrerequisite> unmet = new ArrayList<>();
    String publication = options.getPublication();
    if (!admin.publicationExists(publication)) {
      unmet.add(new SourcePrerequisite(
        PUBLICATION_MISSING,
        "Publication '" + publication + "' does not exist",
        "Create it with CREATE PUBLICATION " + publication + " FOR TABLE ..."));
    }
    String walLevel = admin.walLevel();
    if (walLevel != null && !"logical".equalsIgnoreCase(walLevel)) {
      unmet.add(new SourcePrerequisite(
        WAL_LEVEL_INVALID,
        "wal_level is '" + walLevel + "'",
        "Set wal_level=logical and restart PostgreSQL."));
    }

    if (!unmet.isEmpty()) {
      throw new PreflightFailedException(unmet);
    }
    LOG.debug("Publication {} present and wal_level is logical", publication);
  }

  private PGReplicationStream openReplicationStream(PGConnection pgConnection, String slotName) throws SQLException {
    ChainedLogicalStreamBuilder builder = pgConnection.getReplicationAPI()
      .replicationStream()
      .logical()
      .withSlotName(slotName)
      .withStatusInterval((int) options.getStatusInterval().toMillis(), TimeUnit.MILLISECONDS);

    if (options.usesPgOutput()) {
      builder.withSlotOption("proto_version", String.valueOf(options.getProtoVersion()))
        .withSlotOption("publication_names", options.getPublication());
    } else {
      builder.withSlotOption("include-xids", false);
    }
    return builder.start();
  }

  private void consume(PGReplicationStream stream) throws Exception {
    PgOutputRecordRenderer renderer = new PgOutputRecordRenderer();
    while (shouldRun.get()) {
      ByteBuffer buffer = stream.readPending();
      if (buffer == null) {
        sleepInterruptibly(IDLE_SLEEP_MILLIS);
        continue;
      }

      handleMessage(renderer, toBytes(buffer));
      acknowledge(stream);
    }
  }

  /**
   * Decodes and applies one message of the stream. A failed apply is absorbed while the
   * failure budget lasts and rethrown once it is spent.
   */
  void handleMessage(PgOutputRecordRenderer renderer, byte[] payload) throws Exception {
    ChangeEvent event;
    try {
      byte[] record = options.usesPgOutput() ? renderer.render(payload) : payload;
      if (record == null) {
        return;
      }
      event = decoder.decode(record);
    } catch (IllegalArgumentException e) {
      LOG.warn("Skipping undecodable message: {}", e.getMessage());
      counters.recordSkipped();
      return;
    }
    if (event == null) {
      counters.recordSkipped();
      return;
    }

    try {
      consumer.handle(event);
      counters.recordProcessed();
    } catch (Exception e) {
      counters.recordFailed();
      LOG.error("Error applying {} on {}: {}", event.operationKind(), event.table(), e.toString());
      if (!governor.shouldContinue(e, event.table() + " " + event.fields())) {
        throw e;
      }
    }
  }

  private void acknowledge(PGReplicationStream stream) {
    LogSequenceNumber lsn = stream.getLastReceiveLSN();
    if (lsn == null) {
      return;
    }
    stream.setAppliedLSN(lsn);
    stream.setFlushedLSN(lsn);
  }

  private void closeStream() {
    PGReplicationStream stream = this.replicationStream;
    this.replicationStream = null;
    if (stream != null) {
      try {
        stream.close();
      } catch (SQLException e) {
        LOG.warn("Error closing replication stream: {}", e.getMessage());
      }
    }
    Connection replConn = this.replConnection;
    this.replConnection = null;
    if (replConn != null) {
      try {
        replConn.close();
      } catch (SQLException e) {
        LOG.warn("Error closing replication connection: {}", e.getMessage());
      }
    }
  }

  private static byte[] toBytes(ByteBuffer buffer) {
    byte[] bytes = new byte[buffer.remaining()];
    buffer.get(bytes);
    return bytes;
  }

  private void transition(ReplicationStreamState nextState, Throwable cause, long attempt) {
    ReplicationStreamState previous = this.state;
    if (previous == ReplicationStreamState.CLOSED || (previous == nextState && cause == null)) {
      return;
    }
    this.state = nextState;
    ReplicationStateChange change = new ReplicationStateChange(previous, nextState, cause, attempt, counters.snapshot());
    for (Handler<ReplicationStateChange> handler : stateHandlers) {
      vertx.runOnContext(v -> handler.handle(change));
    }
  }

  private void failStart(Throwable error) {
    Promise<Void> promise = startPromise;
    if (promise != null && !promise.future().isComplete()) {
      promise.fail(error);
    }
  }

  private void completeStart() {
    Promise<Void> promise = startPromise;
    if (promise != null && !promise.future().isComplete()) {
      promise.complete();
    }
  }

  private void sleepInterruptibly(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException ignored) {
      Thread.currentThread().interrupt();
    }
  }
}
