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
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link AnalyticsStore} over a single non-autocommit connection to the analytical database.
 */
public final class JdbcAnalyticsStore implements AnalyticsStore {

  private static final Logger LOG = LoggerFactory.getLogger(JdbcAnalyticsStore.class);

  static final String UPSERT_ORDER_FACT =
    "INSERT INTO analytics.fact_orders AS f "
      + "(order_id, order_date, delivery_date, customer_id, product_id, status, quantity, updated_at) "
      + "VALUES (?, ?, ?, ?, ?, ?, ?, NOW()) "
      + "ON CONFLICT (order_id, delivery_date) DO UPDATE SET "
      + "order_date = EXCLUDED.order_date, "
      + "customer_id = EXCLUDED.customer_id, "
      + "product_id = COALESCE(EXCLUDED.product_id, f.product_id), "
      + "status = EXCLUDED.status, "
      + "quantity = COALESCE(EXCLUDED.quantity, f.quantity), "
      + "updated_at = NOW()";

  static final String UPSERT_CUSTOMER =
    "INSERT INTO analytics.dim_customers "
      + "(customer_id, customer_name, is_active, customer_address, updated_at) "
      + "VALUES (?, ?, ?, ?, NOW()) "
      + "ON CONFLICT (customer_id) DO UPDATE SET "
      + "customer_name = EXCLUDED.customer_name, "
      + "is_active = EXCLUDED.is_active, "
      + "customer_address = EXCLUDED.customer_address, "
      + "updated_at = NOW()";

  static final String UPSERT_PRODUCT =
    "INSERT INTO analytics.dim_products "
      + "(product_id, product_name, barcode, unity_price, is_active, updated_at) "
      + "VALUES (?, ?, ?, ?, ?, NOW()) "
      + "ON CONFLICT (product_id) DO UPDATE SET "
      + "product_name = EXCLUDED.product_name, "
      + "barcode = EXCLUDED.barcode, "
      + "unity_price = EXCLUDED.unity_price, "
      + "is_active = EXCLUDED.is_active, "
      + "updated_at = NOW()";

  private final ConnectionProvider connections;

  /**
   * @param connections provider of non-autocommit connections to the analytical database
   */
  public JdbcAnalyticsStore(ConnectionProvider connections) {
    this.connections = Objects.requireNonNull(connections, "connections");
  }

  @Override
  public void upsertOrderFact(OrderFact fact) throws SQLException {
    Connection conn = connections.connection();
    try (PreparedStatement statement = conn.prepareStatement(UPSERT_ORDER_FACT)) {
      statement.setLong(1, fact.orderId());
      setNullable(statement, 2, fact.orderDate(), Types.DATE);
      statement.setObject(3, fact.deliveryDate());
      setNullable(statement, 4, fact.customerId(), Types.BIGINT);
      setNullable(statement, 5, fact.productId(), Types.BIGINT);
      setNullable(statement, 6, fact.status(), Types.VARCHAR);
      setNullable(statement, 7, fact.quantity(), Types.INTEGER);
      statement.executeUpdate();
      conn.commit();
      LOG.debug("Upserted {}", fact);
    } catch (SQLException e) {
      rollback(conn, e, "order fact " + fact.orderId());
      throw e;
    }
  }

  @Override
  public void upsertCustomer(CustomerDim customer) throws SQLException {
    Connection conn = connections.connection();
    try (PreparedStatement statement = conn.prepareStatement(UPSERT_CUSTOMER)) {
      statement.setLong(1, customer.customerId());
      setNullable(statement, 2, customer.customerName(), Types.VARCHAR);
      setNullable(statement, 3, customer.active(), Types.BOOLEAN);
      setNullable(statement, 4, customer.customerAddress(), Types.VARCHAR);
      statement.executeUpdate();
      conn.commit();
      LOG.debug("Upserted {}", customer);
    } catch (SQLException e) {
      rollback(conn, e, "customer " + customer.customerId());
      throw e;
    }
  }

  @Override
  public void upsertProduct(ProductDim product) throws SQLException {
    Connection conn = connections.connection();
    try (PreparedStatement statement = conn.prepareStatement(UPSERT_PRODUCT)) {
      statement.setLong(1, product.productId());
      setNullable(statement, 2, product.productName(), Types.VARCHAR);
      setNullable(statement, 3, product.barcode(), Types.VARCHAR);
      setNullable(statement, 4, product.unityPrice(), Types.NUMERIC);
      setNullable(statement, 5, product.active(), Types.BOOLEAN);
      statement.executeUpdate();
      conn.commit();
      LOG.debug("Upserted {}", product);
    } catch (SQLException e) {
      rollback(conn, e, "product " + product.productId());
      throw e;
    }
  }

  @Override
  public void refreshViews(List<String> views) throws SQLException {
    for (String view : views) {
      OptionValidation.requireIdentifier("view", view);
    }
    Connection conn = connections.connection();
    try (Statement statement = conn.createStatement()) {
      for (String view : views) {
        statement.execute("REFRESH MATERIALIZED VIEW CONCURRENTLY " + MaterializedViews.SCHEMA + "." + view);
      }
      conn.commit();
    } catch (SQLException e) {
      rollback(conn, e, "materialized view refresh");
      throw e;
    }
  }

  private static void setNullable(PreparedStatement statement, int index, Object value, int sqlType)
    throws SQLException {
    if (value == null) {
      statement.setNull(index, sqlType);
    } else {
      statement.setObject(index, value);
    }
  }

  private static void rollback(Connection conn, SQLException cause, String what) {
    LOG.error("Error writing {}: {}", what, cause.getMessage());
    try {
      conn.rollback();
    } catch (SQLException rollbackError) {
      LOG.warn("Rollback after failed {} also failed: {}", what, rollbackError.getMessage());
      cause.addSuppressed(rollbackError);
    }
  }
}
