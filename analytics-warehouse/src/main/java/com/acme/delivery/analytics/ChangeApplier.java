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

import com.acme.delivery.replication.core.ChangeConsumer;
import com.acme.delivery.replication.pg.ChangeEvent;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes decoded changes to the matching warehouse upserts and then gives the view
 * scheduler a chance to refresh.
 *
 * <p>An order change rewrites its header row and then re-reads every line item of the
 * order from the source; an item change only triggers that re-read. Line items of one
 * order share the {@code (order_id, delivery_date)} key, so the row ends up holding the
 * last item read.
 */
public final class ChangeApplier implements ChangeConsumer<ChangeEvent> {

  private static final Logger LOG = LoggerFactory.getLogger(ChangeApplier.class);

  private final AnalyticsStore store;
  private final SourceOrderReader orders;
  private final ViewRefreshScheduler scheduler;

  public ChangeApplier(AnalyticsStore store, SourceOrderReader orders, ViewRefreshScheduler scheduler) {
    this.store = Objects.requireNonNull(store, "store");
    this.orders = Objects.requireNonNull(orders, "orders");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
  }

  @Override
  public void handle(ChangeEvent event) throws SQLException {
    switch (event.entity()) {
      case ORDER:
        store.upsertOrderFact(orderHeader(event));
        cascade(event.requireLong("order_id"));
        break;
      case ORDER_ITEM:
        cascade(event.requireLong("order_id"));
        break;
      case CUSTOMER:
        store.upsertCustomer(new CustomerDim(
          event.requireLong("customer_id"),
          event.string("customer_name"),
          event.bool("is_active"),
          event.string("customer_address")));
        break;
      case PRODUCT:
        store.upsertProduct(new ProductDim(
          event.requireLong("product_id"),
          event.string("product_name"),
          event.string("barcode"),
          event.decimal("unity_price"),
          event.bool("is_active")));
        break;
      default:
        throw new IllegalArgumentException("Unsupported entity " + event.entity());
    }
    scheduler.maybeRefresh();
  }

  private static OrderFact orderHeader(ChangeEvent event) {
    return new OrderFact(
      event.requireLong("order_id"),
      event.date("order_date"),
      event.requireDate("delivery_date"),
      event.longValue("customer_id"),
      event.longValue("product_id"),
      event.string("status"),
      event.intValue("quantity"));
  }

  private void cascade(long orderId) throws SQLException {
    List<OrderFact> lines = orders.findOrderLines(orderId);
    for (OrderFact line : lines) {
      store.upsertOrderFact(line);
    }
    LOG.debug("Order {}: {} line item(s) applied", orderId, lines.size());
  }
}
