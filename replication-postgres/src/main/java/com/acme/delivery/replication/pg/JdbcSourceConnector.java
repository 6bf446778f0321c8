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

public final class JdbcSourceConnector implements SourceConnector {

  private final PostgresConnectionFactory factory;
  private final DatabaseEndpoint endpoint;
  private final ConnectionProvider control;
  private final ReplicationAdmin admin;

  public JdbcSourceConnector(PostgresConnectionFactory factory, DatabaseEndpoint endpoint) {
    this(factory, endpoint, null);
  }

  /**
   * @param initial an already open control connection to reuse, may be null
   */
  public JdbcSourceConnector(PostgresConnectionFactory factory, DatabaseEndpoint endpoint, Connection initial) {
    this.factory = Objects.requireNonNull(factory, "factory");
    this.endpoint = new DatabaseEndpoint(Objects.requireNonNull(endpoint, "endpoint"));
    this.endpoint.validate();
    this.control = ReusableConnectionProvider.of(factory, this.endpoint, initial, true);
    this.admin = new JdbcReplicationAdmin(control);
  }

  @Override
  public ReplicationAdmin admin() throws SQLException {
    control.connection();
    return admin;
  }

  @Override
  public Connection openReplication() throws SQLException {
    return factory.openReplication(endpoint);
  }

  @Override
  public void close() {
    control.close();
  }
}
