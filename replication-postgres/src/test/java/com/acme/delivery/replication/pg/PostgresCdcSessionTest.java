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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.acme.delivery.replication.core.PreflightFailedException;
import com.acme.delivery.replication.core.ProcessLock;
import com.acme.delivery.replication.core.ReplicationStreamState;
import com.acme.delivery.replication.core.RetryPolicy;
import com.acme.delivery.replication.core.SessionCounters;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PostgresCdcSessionTest {

  private Vertx vertx;

  @BeforeEach
  void setUp() {
    vertx = Vertx.vertx();
  }

  @AfterEach
  void tearDown() throws Exception {
    vertx.close().toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
  }

  @Test
  void refusesToStartWhileAnotherProcessHoldsTheLock() throws Exception {
    FakeLock lock = new FakeLock(false);
    FakeConnector connector = new FakeConnector(new FakeReplicationAdmin());
    PostgresCdcSession session = new PostgresCdcSession(vertx, fastOptions(), connector, lock, event -> { });

    Throwable error = failureOf(session.start());

    assertInstanceOf(IllegalStateException.class, error);
    assertEquals("Could not acquire lock - another CDC process may be running", error.getMessage());
    assertEquals(ReplicationStreamState.FAILED, session.state());
    assertEquals(0, connector.adminCalls.get());
    assertInstanceOf(IllegalStateException.class, failureOf(session.completion()));
  }

  @Test
  void givesUpAfterFiveConnectionFailuresAndReleasesTheLock() throws Exception {
    FakeLock lock = new FakeLock(true);
    FakeConnector connector = new FakeConnector(null);
    PostgresCdcSession session = new PostgresCdcSession(vertx, fastOptions(), connector, lock, event -> { });

    session.start();
    Throwable error = failureOf(session.completion());

    assertInstanceOf(IllegalStateException.class, error);
    assertEquals("Failed to connect to database after 5 attempts", error.getMessage());
    assertInstanceOf(SQLException.class, error.getCause());
    assertEquals(5, connector.adminCalls.get());
    assertFalse(lock.held);
    assertTrue(connector.closed);
  }

  @Test
  void missingPublicationIsFatalWithoutRetry() throws Exception {
    FakeLock lock = new FakeLock(true);
    FakeReplicationAdmin admin = new FakeReplicationAdmin();
    admin.publicationExists = false;
    FakeConnector connector = new FakeConnector(admin);
    PostgresCdcSession session = new PostgresCdcSession(vertx, fastOptions(), connector, lock, event -> { });

    Throwable startError = failureOf(session.start());
    Throwable error = failureOf(session.completion());

    assertInstanceOf(PreflightFailedException.class, startError);
    assertTrue(((PreflightFailedException) error).hasIssue("PUBLICATION_MISSING"));
    assertEquals(1, connector.adminCalls.get());
    assertFalse(admin.calls.stream().anyMatch(call -> call.startsWith("create")));
    assertFalse(lock.held);
  }

  @Test
  void slotStillHeldAfterReclaimEndsTheRun() throws Exception {
    FakeLock lock = new FakeLock(true);
    FakeReplicationAdmin admin = new FakeReplicationAdmin();
    admin.slot = new ReplicationAdmin.SlotInfo("cdc_pgoutput2", 31, "pgoutput");
    admin.holderAfterCreate = 32;
    FakeConnector connector = new FakeConnector(admin);
    PostgresCdcSession session = new PostgresCdcSession(vertx, fastOptions(), connector, lock, event -> { });

    session.start();
    Throwable error = failureOf(session.completion());

    assertInstanceOf(IllegalStateException.class, error);
    assertTrue(error.getMessage().contains("still held by backend 32"));
    assertEquals(0, connector.replicationOpens.get());
    int created = admin.calls.indexOf("create cdc_pgoutput2 pgoutput");
    assertTrue(admin.calls.indexOf("terminate 31") < admin.calls.indexOf("drop cdc_pgoutput2"));
    assertTrue(admin.calls.indexOf("drop cdc_pgoutput2") < created);
    assertTrue(admin.calls.subList(created, admin.calls.size()).contains("terminate 32"));
    assertFalse(lock.held);
  }

  @Test
  void closeBeforeStartCompletesTheRun() throws Exception {
    FakeLock lock = new FakeLock(true);
    PostgresCdcSession session = new PostgresCdcSession(
      vertx, fastOptions(), new FakeConnector(new FakeReplicationAdmin()), lock, event -> { });

    session.close();

    session.completion().toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
    assertEquals(ReplicationStreamState.CLOSED, session.state());
    assertThrows(ExecutionException.class,
      () -> session.start().toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS));
  }

  @Test
  void failedApplyIsAbsorbedAndTheNextRecordIsApplied() throws Exception {
    List<String> applied = new ArrayList<>();
    PostgresCdcSession session = new PostgresCdcSession(vertx, testDecodingOptions(),
      new FakeConnector(new FakeReplicationAdmin()), new FakeLock(true), event -> {
        if ("2".equals(event.string("order_id"))) {
          throw new SQLException("duplicate key value violates unique constraint", "23505");
        }
        applied.add(event.string("order_id"));
      });
    PgOutputRecordRenderer renderer = new PgOutputRecordRenderer();

    session.handleMessage(renderer, orderInsert(1));
    session.handleMessage(renderer, orderInsert(2));
    session.handleMessage(renderer, orderInsert(3));
    session.handleMessage(renderer, utf8("table operations.invoices: INSERT: invoice_id[integer]:1"));
    session.handleMessage(renderer, utf8("BEGIN 1234"));

    assertEquals(List.of("1", "3"), applied);
    SessionCounters.Snapshot counters = session.counters();
    assertEquals(2, counters.processed());
    assertEquals(1, counters.failed());
    assertEquals(2, counters.skipped());
  }

  @Test
  void sixthFailedApplyEndsTheSessionWithTheOriginalError() throws Exception {
    SQLException rejected = new SQLException("value too long for type character varying(50)", "22001");
    PostgresCdcSession session = new PostgresCdcSession(vertx, testDecodingOptions(),
      new FakeConnector(new FakeReplicationAdmin()), new FakeLock(true), event -> {
        throw rejected;
      });
    PgOutputRecordRenderer renderer = new PgOutputRecordRenderer();

    for (int i = 1; i <= 5; i++) {
      session.handleMessage(renderer, orderInsert(i));
    }
    SQLException error = assertThrows(SQLException.class, () -> session.handleMessage(renderer, orderInsert(6)));

    assertSame(rejected, error);
    assertFalse(ConnectionFailures.isConnectionFailure(error));
    assertEquals(6, session.counters().failed());
    assertEquals(0, session.counters().processed());
  }

  private static PostgresCdcOptions testDecodingOptions() {
    return fastOptions().setPlugin(PostgresCdcOptions.PLUGIN_TEST_DECODING);
  }

  private static byte[] orderInsert(int orderId) {
    return utf8("table operations.orders: INSERT: order_id[integer]:" + orderId
      + " delivery_date[date]:'2024-01-05' status[character varying]:'PENDING'");
  }

  private static byte[] utf8(String text) {
    return text.getBytes(StandardCharsets.UTF_8);
  }

  private static PostgresCdcOptions fastOptions() {
    return new PostgresCdcOptions()
      .setRetryPolicy(RetryPolicy.fixedDelay(Duration.ZERO, 5))
      .setMessageRetryPolicy(RetryPolicy.fixedDelay(Duration.ZERO, 5))
      .setReclaimRetryPolicy(RetryPolicy.fixedDelay(Duration.ZERO, 3));
  }

  private static Throwable failureOf(Future<Void> future) throws Exception {
    ExecutionException error = assertThrows(ExecutionException.class,
      () -> future.toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS));
    return error.getCause();
  }

  private static final class FakeLock implements ProcessLock {
    private final boolean available;
    private volatile boolean held;

    private FakeLock(boolean available) {
      this.available = available;
    }

    @Override
    public boolean acquire() {
      held = available;
      return available;
    }

    @Override
    public void release() {
      held = false;
    }

    @Override
    public boolean isHeld() {
      return held;
    }
  }

  /**
   * Hands out {@code admin}, or fails like an unreachable server when it is null.
   */
  private static final class FakeConnector implements SourceConnector {
    private final ReplicationAdmin admin;
    private final AtomicInteger adminCalls = new AtomicInteger();
    private final AtomicInteger replicationOpens = new AtomicInteger();
    private volatile boolean closed;

    private FakeConnector(ReplicationAdmin admin) {
      this.admin = admin;
    }

    @Override
    public ReplicationAdmin admin() throws SQLException {
      adminCalls.incrementAndGet();
      if (admin == null) {
        throw new SQLException("Connection refused", "08001");
      }
      return admin;
    }

    @Override
    public Connection openReplication() throws SQLException {
      replicationOpens.incrementAndGet();
      throw new SQLException("replication is not available in this test", "08001");
    }

    @Override
    public void close() {
      closed = true;
    }
  }
}
