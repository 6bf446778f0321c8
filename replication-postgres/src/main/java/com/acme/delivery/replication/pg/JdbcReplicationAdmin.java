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
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Optional;

public final class JdbcReplicationAdmin implements ReplicationAdmin {

  private final ConnectionProvider connections;

  public JdbcReplicationAdmin(ConnectionProvider connections) {
    this.connections = Objects.requireNonNull(connections, "connections");
  }

  @Override
  public String walLevel() throws SQLException {
    try (PreparedStatement statement = connections.connection().prepareStatement("SHOW wal_level");
         ResultSet rs = statement.executeQuery()) {
      return rs.next() ? rs.getString(1) : null;
    }
  }

  @Override
  public boolean publicationExists(String publication) throws SQLException {
    try (PreparedStatement statement = connections.connection().prepareStatement(
      "SELECT 1 FROM pg_publication WHERE pubname = ?")) {
      statement.setString(1, publication);
      try (ResultSet rs = statement.executeQuery()) {
        return rs.next();
      }
    }
  }

  @Override
  public Optional<SlotInfo> findSlot(String slotName) throws SQLException {
    try (PreparedStatement statement = connections.connection().prepareStatement(
      "SELECT slot_name, active_pid, plugin FROM pg_replication_slots WHERE slot_name = ?")) {
      statement.setString(1, slotName);
      try (ResultSet rs = statement.executeQuery()) {
        if (!rs.next()) {
          return Optional.empty();
        }
        int pid = rs.getInt(2);
        Integer activePid = rs.wasNull() ? null : pid;
        return Optional.of(new SlotInfo(rs.getString(1), activePid, rs.getString(3)));
      }
    }
  }

  @Override
  public boolean terminateBackend(int pid) throws SQLException {
    try (PreparedStatement statement = connections.connection().prepareStatement(
      "SELECT pg_terminate_backend(?)")) {
      statement.setInt(1, pid);
      try (ResultSet rs = statement.executeQuery()) {
        return rs.next() && rs.getBoolean(1);
      }
    }
  }

  @Override
  public void dropSlot(String slotName) throws SQLException {
    try (PreparedStatement statement = connections.connection().prepareStatement(
      "SELECT pg_drop_replication_slot(?)")) {
      statement.setString(1, slotName);
      statement.execute();
    }
  }

  @Override
  public void createSlot(String slotName, String plugin) throws SQLException {
    Connection conn = connections.connection();
    try (PreparedStatement statement = conn.prepareStatement(
      "SELECT pg_create_logical_replication_slot(?, ?)")) {
      statement.setString(1, slotName);
      statement.setString(2, plugin);
      try {
        statement.execute();
      } catch (SQLException createError) {
        if (!isSlotAlreadyExists(createError)) {
          throw createError;
        }
      }
    }
  }

  private static boolean isSlotAlreadyExists(SQLException error) {
    if ("42710".equals(error.getSQLState())) {
      return true;
    }
    String message = error.getMessage();
    return message != null && message.contains("already exists");
  }
}
