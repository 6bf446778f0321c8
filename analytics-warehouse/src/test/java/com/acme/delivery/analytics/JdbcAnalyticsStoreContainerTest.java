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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.acme.delivery.replication.pg.ReusableConnectionProvider;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.testcontainers.DockerClientFactory;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.wait.strategy.Wait;

class JdbcAnalyticsStoreContainerTest {

  private static final String DB_NAME = "analytics_db";
  private static final String DB_USER = "analytics_user";
  private static final String DB_PASSWORD = "analytics123";
  private static final LocalDate DELIVERY_DATE = LocalDate.of(2024, 1, 5);

  private static GenericContainer<?> postgres;

  @BeforeAll
  static void startDatabase() throws Exception {
    Assumptions.assumeTrue(
      DockerClientFactory.instance().isDockerAvailable(),
      "Docker is required for Testcontainers integration tests");

    postgres = new GenericContainer<>("postgres:16")
      .withExposedPorts(5432)
      .withEnv("POSTGRES_DB", DB_NAME)
      .withEnv("POSTGRES_USER", DB_USER)
      .withEnv("POSTGRES_PASSWORD", DB_PASSWORD)
      .waitingFor(Wait.forLogMessage(".*database system is ready to accept connections.*\\s", 2))
      .withStartupTimeout(Duration.ofMinutes(10));
    postgres.start();

    try (Connection conn = open(); Statement statement = conn.createStatement()) {
      statement.execute("CREATE SCHEMA analytics");
      statement.execute("CREATE TABLE analytics.fact_orders (order_id INT NOT NULL, order_date DATE,"
        + " delivery_date DATE NOT NULL, customer_id INT, product_id INT, status TEXT, quantity INT,"
        + " updated_at TIMESTAMP, PRIMARY KEY (order_id, delivery_date))");
      statement.execute("CREATE TABLE analytics.dim_customers (customer_id INT PRIMARY KEY,"
        + " customer_name TEXT NOT NULL, is_active BOOLEAN, customer_address TEXT, updated_at TIMESTAMP)");
      statement.execute("CREATE TABLE analytics.dim_products (product_id INT PRIMARY KEY, product_name TEXT,"
        + " barcode TEXT, unity_price NUMERIC(10, 2), is_active BOOLEAN, updated_at TIMESTAMP)");
      statement.execute("CREATE MATERIALIZED VIEW analytics.open_orders_by_date_status AS"
        + " SELECT delivery_date, status, COUNT(*) AS order_count FROM analytics.fact_orders"
        + " WHERE status IN ('PENDING', 'PROCESSING') GROUP BY delivery_date, status");
      statement.execute("CREATE UNIQUE INDEX ON analytics.open_orders_by_date_status (delivery_date, status)");

      statement.execute("CREATE SCHEMA operations");
      statement.execute("CREATE TABLE operations.orders (order_id INT PRIMARY KEY, order_date DATE,"
        + " delivery_date DATE, customer_id INT, status TEXT)");
      statement.execute("CREATE TABLE operations.order_items (order_item_id SERIAL PRIMARY KEY,"
        + " order_id INT REFERENCES operations.orders, product_id INT, quantity INT)");
    }
  }

  @AfterAll
  static void stopDatabase() {
    if (postgres != null) {
      postgres.stop();
    }
  }

  @Test
  void upsertsOrderFactsAndKeepsItemColumnsForHeaderOnlyChanges() throws Exception {
    try (ReusableConnectionProvider connections = provider(false)) {
      JdbcAnalyticsStore store = new JdbcAnalyticsStore(connections);

      store.upsertOrderFact(new OrderFact(1, LocalDate.of(2024, 1, 2), DELIVERY_DATE, 7L, 10L, "PENDING", 3));
      store.upsertOrderFact(new OrderFact(1, LocalDate.of(2024, 1, 2), DELIVERY_DATE, 7L, null, "PROCESSING", null));

      try (Connection conn = open();
           Statement statement = conn.createStatement();
           ResultSet rs = statement.executeQuery(
             "SELECT product_id, quantity, status, updated_at FROM analytics.fact_orders WHERE order_id = 1")) {
        assertTrue(rs.next());
        assertEquals(10, rs.getInt("product_id"));
        assertEquals(3, rs.getInt("quantity"));
        assertEquals("PROCESSING", rs.getString("status"));
        assertNotNull(rs.getTimestamp("updated_at"));
      }
    }
  }

  @Test
  void failedUpsertRollsBackAndLeavesTheConnectionUsable() throws Exception {
    try (ReusableConnectionProvider connections = provider(false)) {
      JdbcAnalyticsStore store = new JdbcAnalyticsStore(connections);

      assertThrows(SQLException.class, () -> store.upsertCustomer(new CustomerDim(5, null, true, "Main St")));
      store.upsertCustomer(new CustomerDim(5, "Bea", true, "Main St"));
      store.upsertProduct(new ProductDim(10, "Mug", "789", new BigDecimal("4.50"), true));
      store.upsertProduct(new ProductDim(10, "Mug", "789", new BigDecimal("5.00"), false));

      try (Connection conn = open(); Statement statement = conn.createStatement()) {
        try (ResultSet rs = statement.executeQuery("SELECT customer_name FROM analytics.dim_customers WHERE customer_id = 5")) {
          assertTrue(rs.next());
          assertEquals("Bea", rs.getString(1));
        }
        try (ResultSet rs = statement.executeQuery("SELECT unity_price, is_active FROM analytics.dim_products WHERE product_id = 10")) {
          assertTrue(rs.next());
          assertEquals(new BigDecimal("5.00"), rs.getBigDecimal(1));
          assertFalse(rs.getBoolean(2));
        }
      }
    }
  }

  @Test
  void refreshesMaterializedViews() throws Exception {
    try (ReusableConnectionProvider connections = provider(false)) {
      JdbcAnalyticsStore store = new JdbcAnalyticsStore(connections);
      store.upsertOrderFact(new OrderFact(2, LocalDate.of(2024, 1, 3), LocalDate.of(2024, 1, 9), 8L, 11L, "PENDING", 1));

      store.refreshViews(List.of(MaterializedViews.OPEN_ORDERS_BY_DATE_STATUS));

      try (Connection conn = open();
           Statement statement = conn.createStatement();
           ResultSet rs = statement.executeQuery(
             "SELECT order_count FROM analytics.open_orders_by_date_status WHERE delivery_date = '2024-01-09'")) {
        assertTrue(rs.next());
        assertEquals(1, rs.getInt(1));
      }
      assertThrows(SQLException.class, () -> store.refreshViews(List.of("missing_view")));
    }
  }

  @Test
  void readsEveryLineItemWithItsOrderHeader() throws Exception {
    try (Connection conn = open(); Statement statement = conn.createStatement()) {
      statement.execute("INSERT INTO operations.orders VALUES (40, '2024-02-01', '2024-02-03', 9, 'PENDING')");
      statement.execute("INSERT INTO operations.order_items (order_id, product_id, quantity)"
        + " VALUES (40, 1, 2), (40, 2, 1), (40, 3, 6)");
    }

    try (ReusableConnectionProvider connections = provider(true)) {
      List<OrderFact> lines = new JdbcSourceOrderReader(connections, "operations").findOrderLines(40);

      assertEquals(3, lines.size());
      for (OrderFact line : lines) {
        assertEquals(LocalDate.of(2024, 2, 3), line.deliveryDate());
        assertEquals(9L, line.customerId());
        assertEquals("PENDING", line.status());
      }
      assertTrue(new JdbcSourceOrderReader(connections, "operations").findOrderLines(41).isEmpty());
    }
  }

  private static ReusableConnectionProvider provider(boolean autoCommit) {
    return new ReusableConnectionProvider(JdbcAnalyticsStoreContainerTest::open, null, autoCommit);
  }

  private static Connection open() throws SQLException {
    return DriverManager.getConnection(
      "jdbc:postgresql://" + postgres.getHost() + ":" + postgres.getFirstMappedPort() + "/" + DB_NAME,
      DB_USER,
      DB_PASSWORD);
  }
}
