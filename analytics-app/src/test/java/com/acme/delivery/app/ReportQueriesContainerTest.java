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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.acme.delivery.replication.pg.ReusableConnectionProvider;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.testcontainers.DockerClientFactory;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.wait.strategy.Wait;

class ReportQueriesContainerTest {

  private static final String DB_NAME = "analytics_db";
  private static final String DB_USER = "analytics_user";
  private static final String DB_PASSWORD = "analytics123";

  private static GenericContainer<?> postgres;

  private ReusableConnectionProvider connections;
  private ReportQueries queries;

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
    }
  }

  @AfterAll
  static void stopDatabase() {
    if (postgres != null) {
      postgres.stop();
    }
  }

  @BeforeEach
  void setUp() throws SQLException {
    try (Connection conn = open(); Statement statement = conn.createStatement()) {
      statement.execute("TRUNCATE analytics.fact_orders, analytics.dim_customers");
    }
    connections = new ReusableConnectionProvider(ReportQueriesContainerTest::open, null, true);
    queries = new ReportQueries(connections);
  }

  @AfterEach
  void tearDown() {
    if (connections != null) {
      connections.close();
    }
  }

  @Test
  void topDeliveryDatesReturnsThreeBusiestDatesDescending() throws Exception {
    int orderId = 1;
    int[] ordersPerDay = {1, 4, 2, 5, 3};
    for (int day = 0; day < ordersPerDay.length; day++) {
      for (int i = 0; i < ordersPerDay[day]; i++) {
        insertOrder(orderId++, LocalDate.of(2024, 3, 1 + day), 1, 10, "PENDING", 1);
      }
    }
    insertOrder(orderId, LocalDate.of(2024, 3, 1), 1, 10, "DELIVERED", 1);

    List<Map<String, Object>> rows = queries.topDeliveryDates();

    assertEquals(3, rows.size());
    assertEquals(List.of("delivery_date", "order_count"), List.copyOf(rows.get(0).keySet()));
    assertEquals("2024-03-04", rows.get(0).get("delivery_date").toString());
    assertEquals(5L, rows.get(0).get("order_count"));
    assertEquals(4L, rows.get(1).get("order_count"));
    assertEquals(3L, rows.get(2).get("order_count"));
  }

  @Test
  void openOrdersGroupsByDateAndStatus() throws Exception {
    LocalDate date = LocalDate.of(2024, 3, 1);
    insertOrder(1, date, 1, 10, "PENDING", 1);
    insertOrder(2, date, 1, 10, "PENDING", 1);
    insertOrder(3, date, 1, 10, "PROCESSING", 1);
    insertOrder(4, date, 1, 10, "CANCELLED", 1);

    List<Map<String, Object>> rows = queries.openOrders();

    assertEquals(2, rows.size());
    assertEquals("PENDING", rows.get(0).get("status"));
    assertEquals(2L, rows.get(0).get("order_count"));
    assertEquals("PROCESSING", rows.get(1).get("status"));
    assertEquals(1L, rows.get(1).get("order_count"));
  }

  @Test
  void pendingItemsSumsQuantityPerProduct() throws Exception {
    LocalDate date = LocalDate.of(2024, 3, 1);
    insertOrder(1, date, 1, 10, "PENDING", 2);
    insertOrder(2, date, 1, 10, "PROCESSING", 5);
    insertOrder(3, date, 1, 11, "PENDING", 1);

    List<Map<String, Object>> rows = queries.pendingItems();

    assertEquals(2, rows.size());
    assertEquals(10, rows.get(0).get("product_id"));
    assertEquals(7L, rows.get(0).get("pending_quantity"));
    assertEquals(11, rows.get(1).get("product_id"));
    assertEquals(1L, rows.get(1).get("pending_quantity"));
  }

  @Test
  void topCustomersJoinsCustomerNames() throws Exception {
    try (Connection conn = open(); Statement statement = conn.createStatement()) {
      statement.execute("INSERT INTO analytics.dim_customers (customer_id, customer_name) VALUES"
        + " (1, 'Ana'), (2, 'Bruno')");
    }
    LocalDate date = LocalDate.of(2024, 3, 1);
    insertOrder(1, date, 2, 10, "PENDING", 1);
    insertOrder(2, date, 2, 10, "PENDING", 1);
    insertOrder(3, date, 1, 10, "PROCESSING", 1);

    List<Map<String, Object>> rows = queries.topCustomers();

    assertEquals(2, rows.size());
    assertEquals("Bruno", rows.get(0).get("customer_name"));
    assertEquals(2L, rows.get(0).get("pending_order_count"));
    assertEquals("Ana", rows.get(1).get("customer_name"));
  }

  @Test
  void emptyResultIsAnError() {
    EmptyReportException error = assertThrows(EmptyReportException.class, () -> queries.openOrders());

    assertEquals("No data returned from query", error.getMessage());
  }

  private static void insertOrder(int orderId, LocalDate deliveryDate, int customerId, int productId,
                                  String status, int quantity) throws SQLException {
    try (Connection conn = open(); Statement statement = conn.createStatement()) {
      statement.execute("INSERT INTO analytics.fact_orders"
        + " (order_id, order_date, delivery_date, customer_id, product_id, status, quantity) VALUES ("
        + orderId + ", DATE '" + deliveryDate.minusDays(2) + "', DATE '" + deliveryDate + "', "
        + customerId + ", " + productId + ", '" + status + "', " + quantity + ")");
    }
  }

  private static Connection open() throws SQLException {
    return DriverManager.getConnection(
      "jdbc:postgresql://" + postgres.getHost() + ":" + postgres.getFirstMappedPort() + "/" + DB_NAME,
      DB_USER,
      DB_PASSWORD);
  }
}
