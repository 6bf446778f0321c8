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

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps one connection open and replaces it when it is closed or fails validation.
 */
public final class ReusableConnectionProvider implements ConnectionProvider {

  private static final Logger LOG = LoggerFactory.getLogger(ReusableConnectionProvider.class);
  private static final int VALIDATION_TIMEOUT_SECONDS = 2;

  /**
   * Opens a replacement connection.
   */
  @FunctionalInterface
  public interface Opener {
    Connection open() throws SQLException;
  }

  private final Opener opener;
  private final boolean autoCommit;
  private Connection current;

  public ReusableConnectionProvider(Opener opener, Connection initial, boolean autoCommit) {
    this.opener = Objects.requireNonNull(opener, "opener");
    this.current = initial;
    this.autoCommit = autoCommit;
  }

  public static ReusableConnectionProvider of(PostgresConnectionFactory factory,
                                              DatabaseEndpoint endpoint,
                                              Connection initial,
                                              boolean autoCommit) {
    return new ReusableConnectionProvider(() -> factory.connect(endpoint), initial, autoCommit);
  }

  @Override
  public synchronized Connection connection() throws SQLException {
    if (current != null && isLive(current)) {
      if (current.getAutoCommit() != autoCommit) {
        current.setAutoCommit(autoCommit);
      }
      return current;
    }
    if (current != null) {
      LOG.warn("Connection is no longer usable, reconnecting");
      closeCurrent();
    }
    Connection opened = opener.open();
    opened.setAutoCommit(autoCommit);
    current = opened;
    return opened;
  }

  @Override
  public synchronized void close() {
    closeCurrent();
  }

  private static boolean isLive(Connection connection) {
    try {
      return !connection.isClosed() && connection.isValid(VALIDATION_TIMEOUT_SECONDS);
    } catch (SQLException e) {
      return false;
    }
  }

  private void closeCurrent() {
    Connection target = current;
    current = null;
    if (target == null) {
      return;
    }
    try {
      target.close();
    } catch (SQLException e) {
      LOG.warn("Error closing connection: {}", e.getMessage());
    }
  }
}
