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

/**
 * Access to the source database for one replication run: a reusable control channel for
 * metadata and slot maintenance, and fresh connections in logical replication mode.
 */
public interface SourceConnector extends AutoCloseable {

  ReplicationAdmin admin() throws SQLException;

  /**
   * Opens a new connection in {@code replication=database} mode. The caller owns it.
   */
  Connection openReplication() throws SQLException;

  /**
   * Closes the control channel. Never throws.
   */
  @Override
  void close();
}
