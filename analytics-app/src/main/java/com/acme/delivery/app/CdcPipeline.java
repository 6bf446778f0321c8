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

package com.acme.delivery.app;

import com.acme.delivery.analytics.ChangeApplier;
import com.acme.delivery.analytics.JdbcAnalyticsStore;
import com.acme.delivery.analytics.JdbcSourceOrderReader;
import com.acme.delivery.analytics.MaterializedViews;
import com.acme.delivery.analytics.ViewRefreshScheduler;
import com.acme.delivery.replication.core.FileProcessLock;
import com.acme.delivery.replication.pg.DatabaseEndpoint;
import com.acme.delivery.replication.pg.JdbcSourceConnector;
import com.acme.delivery.replication.pg.PostgresCdcOptions;
import com.acme.delivery.replication.pg.PostgresCdcSession;
import com.acme.delivery.replication.pg.PostgresConnectionFactory;
import com.acme.delivery.replication.pg.ReplicationLogging;
import com.acme.delivery.replication.pg.ReusableConnectionProvider;
import io.vertx.core.Vertx;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the change-data-capture pipeline until the process is stopped or the stream fails.
 */
public final class CdcPipeline {

  private static final Logger LOG = LoggerFactory.getLogger(CdcPipeline.class);
  private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(30);

  private CdcPipeline() {
  }

  public static void main(String[] args) {
    int exitCode;
    try {
      exitCode = run(ReplicationAppConfig.fromEnv());
    } catch (Exception e) {
      LOG.error("Fatal error in main process: {}", e.getMessage(), e);
      exitCode = 1;
    }
    System.exit(exitCode);
  }

  static int run(ReplicationAppConfig config) throws SQLException, InterruptedException {
    config.validate();
    PostgresCdcOptions options = config.cdcOptions();
    DatabaseEndpoint sourceEndpoint = config.source();
    DatabaseEndpoint analyticsEndpoint = config.analytics();

    LOG.info("Starting CDC pipeline: source={} analytics={} {}", sourceEndpoint, analyticsEndpoint, options);

    PostgresConnectionFactory factory = new PostgresConnectionFactory();
    Connection sourceConnection = factory.connectWithRetry(sourceEndpoint);
    Connection targetConnection;
    try {
      targetConnection = factory.connectWithRetry(analyticsEndpoint);
    } catch (SQLException e) {
      closeQuietly(sourceConnection);
      throw e;
    }
    LOG.info("Database connections established");

    Vertx vertx = Vertx.vertx();
    ReusableConnectionProvider target = ReusableConnectionProvider.of(factory, analyticsEndpoint, targetConnection, false);
    ReusableConnectionProvider sourceReads = ReusableConnectionProvider.of(factory, sourceEndpoint, null, true);
    JdbcSourceConnector connector = new JdbcSourceConnector(factory, sourceEndpoint, sourceConnection);
    try {
      JdbcAnalyticsStore store = new JdbcAnalyticsStore(target);
      ViewRefreshScheduler scheduler = new ViewRefreshScheduler(
        store, MaterializedViews.ALL, config.viewRefreshInterval(), Clock.systemUTC());
      ChangeApplier applier = new ChangeApplier(
        store, new JdbcSourceOrderReader(sourceReads, options.getSourceSchema()), scheduler);

      PostgresCdcSession session = new PostgresCdcSession(
        vertx, options, connector, new FileProcessLock(Path.of(options.getLockFile())), applier);
      ReplicationLogging.attachDefaultLogging(session, LOG, options.getSlotName());

      CountDownLatch done = new CountDownLatch(1);
      AtomicReference<Throwable> failure = new AtomicReference<>();
      Runtime.getRuntime().addShutdownHook(new Thread(() -> {
        LOG.info("Shutdown requested, closing replication session");
        session.close();
        try {
          if (!done.await(SHUTDOWN_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
            LOG.warn("Replication session did not stop within {}", SHUTDOWN_GRACE);
          }
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        }
      }, "cdc-shutdown"));

      session.start().onFailure(err -> LOG.error("Replication session did not start: {}", err.getMessage()));
      session.completion().onComplete(ar -> {
        if (ar.failed()) {
          failure.set(ar.cause());
        }
        done.countDown();
      });
      done.await();

      Throwable cause = failure.get();
      if (cause != null) {
        LOG.error("CDC pipeline stopped: {}", cause.getMessage(), cause);
        return 1;
      }
      LOG.info("CDC pipeline stopped");
      return 0;
    } finally {
      connector.close();
      target.close();
      sourceReads.close();
      vertx.close();
    }
  }

  private static void closeQuietly(Connection connection) {
    try {
      connection.close();
    } catch (SQLException e) {
      LOG.warn("Failed to close connection: {}", e.getMessage());
    }
  }
}
