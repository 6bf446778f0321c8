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

import java.io.EOFException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLTransientConnectionException;

/**
 * Separates "the database went away" from every other failure. Only the former is worth a
 * reconnect.
 */
public final class ConnectionFailures {

  private ConnectionFailures() {
  }

  public static boolean isConnectionFailure(Throwable error) {
    Throwable current = error;
    int depth = 0;
    while (current != null && depth++ < 16) {
      if (current instanceof SQLTransientConnectionException
        || current instanceof SQLNonTransientConnectionException
        || current instanceof SocketException
        || current instanceof SocketTimeoutException
        || current instanceof EOFException) {
        return true;
      }
      if (current instanceof SQLException && isConnectionState(((SQLException) current).getSQLState())) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  /**
   * Class 08 (connection exception) plus the operator-intervention states a server emits
   * when it terminates or refuses a session.
   */
  static boolean isConnectionState(String sqlState) {
    if (sqlState == null) {
      return false;
    }
    return sqlState.startsWith("08")
      || "57P01".equals(sqlState)
      || "57P02".equals(sqlState)
      || "57P03".equals(sqlState);
  }
}
