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

import com.acme.delivery.replication.pg.ConnectionProvider;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Operational reports over the analytical store. Only PENDING and PROCESSING orders count
 * as open.
 */
public final class ReportQueries {

  private static final Logger LOG = LoggerFactory.getLogger(ReportQueries.class);
  private static final Logger PERFORMANCE = LoggerFactory.getLogger("query.performance");

  public static final Duration DEFAULT_STATEMENT_TIMEOUT = Duration.ofSeconds(30);

  static final String OPEN_ORDERS =
    "SELECT delivery_date, status, COUNT(*) AS order_count "
      + "FROM analytics.fact_orders "
      + "WHERE status IN ('PENDING', 'PROCESSING') "
      + "GROUP BY delivery_date, status "
      + "ORDER BY delivery_date, status";

  static final String TOP_DELIVERY_DATES =
    "SELECT delivery_date, COUNT(*) AS order_count "
      + "FROM analytics.fact_orders "
      + "WHERE status IN ('PENDING', 'PROCESSING') "
      + "GROUP BY delivery_date "
      + "ORDER BY order_count DESC, delivery_date "
      + "LIMIT 3";

  static final String PENDING_ITEMS =
    "SELECT product_id, SUM(quantity) AS pending_quantity "
      + "FROM analytics.fact_orders "
      + "WHERE status IN ('PENDING', 'PROCESSING') "
      + "GROUP BY product_id "
      + "ORDER BY product_id";

  static final String TOP_CUSTOMERS =
    "SELECT c.customer_id, c.customer_name, COUNT(*) AS pending_order_count "
      + "FROM analytics.fact_orders o "
      + "JOIN analytics.dim_customers c ON o.customer_id = c.customer_id "
      + "WHERE o.status IN ('PENDING', 'PROCESSING') "
      + "GROUP BY c.customer_id, c.customer_name "
      + "ORDER BY pending_order_count DESC, c.customer_id "
      + "LIMIT 3";

  private static final int LOGGED_QUERY_CHARS = 200;

  private final ConnectionProvider connections;
  private final Duration statementTimeout;

  public ReportQueries(ConnectionProvider connections) {
    this(connections, DEFAULT_STATEMENT_TIMEOUT);
  }

  public ReportQueries(ConnectionProvider connections, Duration statementTimeout) {
    this.connections = Objects.requireNonNull(connections, "connections");
    this.statementTimeout = Objects.requireNonNull(statementTimeout, "statementTimeout");
    if (statementTimeout.isNegative()) {
      throw new IllegalArgumentException("statementTimeout must be >= 0");
    }
  }

  /**
   * Open order counts per delivery date and status.
   */
  public List<Map<String, Object>> openOrders() throws SQLException {
    return execute(OPEN_ORDERS);
  }

  /**
   * The three delivery dates with the most open orders, busiest first.
   */
  public List<Map<String, Object>> topDeliveryDates() throws SQLException {
    return execute(TOP_DELIVERY_DATES);
  }

  public List<Map<String, Object>> pendingItems() throws SQLException {
    return execute(PENDING_ITEMS);
  }

  public List<Map<String, Object>> topCustomers() throws SQLException {
    return execute(TOP_CUSTOMERS);
  }

  List<Map<String, Object>> execute(String query) throws SQLException {
    long started = System.nanoTime();
    Connection connection = connections.connection();
    List<Map<String, Object>> rows = new ArrayList<>();
    try (Statement statement = connection.createStatement()) {
      statement.execute("SET statement_timeout = " + statementTimeout.toMillis());
      try (ResultSet rs = statement.executeQuery(query)) {
        ResultSetMetaData meta = rs.getMetaData();
        int columns = meta.getColumnCount();
        while (rs.next()) {
          Map<String, Object> row = new LinkedHashMap<>();
          for (int i = 1; i <= columns; i++) {
            row.put(meta.getColumnLabel(i), rs.getObject(i));
          }
          rows.add(row);
        }
      }
    } catch (SQLException e) {
      LOG.error("Report query failed: {}", e.getMessage());
      throw e;
    }
    if (rows.isEmpty()) {
      throw new EmptyReportException();
    }
    double seconds = (System.nanoTime() - started) / 1_000_000_000.0;
    PERFORMANCE.info("Query executed in {}s, returned {} rows\nQuery: {}...",
      String.format(Locale.ROOT, "%.2f", seconds), rows.size(), abbreviate(query));
    return rows;
  }

  private static String abbreviate(String query) {
    return query.length() <= LOGGED_QUERY_CHARS ? query : query.substring(0, LOGGED_QUERY_CHARS);
  }
}
