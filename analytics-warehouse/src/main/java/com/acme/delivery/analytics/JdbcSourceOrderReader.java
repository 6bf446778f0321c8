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

package com.acme.delivery.analytics;

import com.acme.delivery.replication.core.OptionValidation;
import com.acme.delivery.replication.pg.ConnectionProvider;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public final class JdbcSourceOrderReader implements SourceOrderReader {

  private final ConnectionProvider connections;
  private final String query;

  public JdbcSourceOrderReader(ConnectionProvider connections, String schema) {
    this.connections = Objects.requireNonNull(connections, "connections");
    OptionValidation.requireIdentifier("schema", schema);
    this.query = "SELECT oi.order_id, oi.product_id, oi.quantity, o.order_date, o.delivery_date, o.customer_id, o.status "
      + "FROM " + schema + ".order_items oi "
      + "JOIN " + schema + ".orders o ON o.order_id = oi.order_id "
      + "WHERE oi.order_id = ?";
  }

  @Override
  public List<OrderFact> findOrderLines(long orderId) throws SQLException {
    try (PreparedStatement statement = connections.connection().prepareStatement(query)) {
      statement.setLong(1, orderId);
      try (ResultSet rs = statement.executeQuery()) {
        List<OrderFact> lines = new ArrayList<>();
        while (rs.next()) {
          lines.add(new OrderFact(
            rs.getLong("order_id"),
            rs.getObject("order_date", LocalDate.class),
            rs.getObject("delivery_date", LocalDate.class),
            nullableLong(rs, "customer_id"),
            nullableLong(rs, "product_id"),
            rs.getString("status"),
            nullableInt(rs, "quantity")));
        }
        return lines;
      }
    }
  }

  private static Long nullableLong(ResultSet rs, String column) throws SQLException {
    long value = rs.getLong(column);
    return rs.wasNull() ? null : value;
  }

  private static Integer nullableInt(ResultSet rs, String column) throws SQLException {
    int value = rs.getInt(column);
    return rs.wasNull() ? null : value;
  }
}
