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

import com.acme.delivery.replication.core.RetryPolicy;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;
import org.postgresql.PGProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens JDBC sessions against PostgreSQL.
 */
public class PostgresConnectionFactory {

  private static final Logger LOG = LoggerFactory.getLogger(PostgresConnectionFactory.class);

  public static final int DEFAULT_CONNECT_TIMEOUT_SECONDS = 5;

  private final RetryPolicy retryPolicy;
  private final int connectTimeoutSeconds;

  public PostgresConnectionFactory() {
    this(defaultRetryPolicy(), DEFAULT_CONNECT_TIMEOUT_SECONDS);
  }

  public PostgresConnectionFactory(RetryPolicy retryPolicy, int connectTimeoutSeconds) {
    this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy")
      .copy()
      .setRetryOn(ConnectionFailures::isConnectionFailure);
    this.retryPolicy.validate();
    this.connectTimeoutSeconds = connectTimeoutSeconds;
  }

  /**
   * Ten attempts, ten seconds apart.
   */
  public static RetryPolicy defaultRetryPolicy() {
    return RetryPolicy.fixedDelay(Duration.ofSeconds(10), 10);
  }

  /**
   * Single attempt.
   */
  public Connection connect(DatabaseEndpoint endpoint) throws SQLException {
    Properties props = endpoint.connectionProperties();
    PGProperty.CONNECT_TIMEOUT.set(props, connectTimeoutSeconds);
    return DriverManager.getConnection(endpoint.jdbcUrl(), props);
  }

  /**
   * Connects, retrying connection failures according to the retry policy. Other failures
   * (bad credentials, unknown database) are raised at once.
   */
  public Connection connectWithRetry(DatabaseEndpoint endpoint) throws SQLException {
    long attempt = 0;
    while (true) {
      attempt++;
      try {
        return connect(endpoint);
      } catch (SQLException e) {
        if (!ConnectionFailures.isConnectionFailure(e)) {
          throw e;
        }
        LOG.warn("Connection attempt {}/{} to {} failed: {}",
          attempt, retryPolicy.getMaxAttempts(), endpoint, e.getMessage());
        if (!retryPolicy.shouldRetry(e, attempt)) {
          LOG.error("Failed to connect to {} after {} attempts", endpoint, attempt);
          throw new SQLException(
            "Failed to connect to database after " + attempt + " attempts: " + e.getMessage(),
            "08001",
            e);
        }
        LOG.info("Retrying in {} ms...", retryPolicy.getDelay().toMillis());
        retryPolicy.pause();
      }
    }
  }

  /**
   * Single-attempt connection in logical replication mode.
   */
  public Connection openReplication(DatabaseEndpoint endpoint) throws SQLException {
    Properties props = endpoint.connectionProperties();
    PGProperty.CONNECT_TIMEOUT.set(props, connectTimeoutSeconds);
    PGProperty.REPLICATION.set(props, "database");
    PGProperty.PREFER_QUERY_MODE.set(props, "simple");
    PGProperty.ASSUME_MIN_SERVER_VERSION.set(props, "9.4");
    return DriverManager.getConnection(endpoint.jdbcUrl(), props);
  }
}
