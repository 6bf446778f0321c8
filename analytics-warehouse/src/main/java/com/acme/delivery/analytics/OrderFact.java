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

import java.time.LocalDate;
import java.util.Objects;

/**
 * One row of {@code analytics.fact_orders}, keyed by order id and delivery date.
 *
 * <p>{@code productId} and {@code quantity} are null for an order header seen without its
 * line items; the upsert then keeps whatever the row already carries.
 */
public final class OrderFact {

  private final long orderId;
  private final LocalDate orderDate;
  private final LocalDate deliveryDate;
  private final Long customerId;
  private final Long productId;
  private final String status;
  private final Integer quantity;

  public OrderFact(long orderId,
                   LocalDate orderDate,
                   LocalDate deliveryDate,
                   Long customerId,
                   Long productId,
                   String status,
                   Integer quantity) {
    this.orderId = orderId;
    this.orderDate = orderDate;
    this.deliveryDate = Objects.requireNonNull(deliveryDate, "deliveryDate");
    this.customerId = customerId;
    this.productId = productId;
    this.status = status;
    this.quantity = quantity;
  }

  public long orderId() {
    return orderId;
  }

  public LocalDate orderDate() {
    return orderDate;
  }

  public LocalDate deliveryDate() {
    return deliveryDate;
  }

  public Long customerId() {
    return customerId;
  }

  public Long productId() {
    return productId;
  }

  public String status() {
    return status;
  }

  public Integer quantity() {
    return quantity;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof OrderFact)) {
      return false;
    }
    OrderFact that = (OrderFact) o;
    return orderId == that.orderId
      && Objects.equals(orderDate, that.orderDate)
      && deliveryDate.equals(that.deliveryDate)
      && Objects.equals(customerId, that.customerId)
      && Objects.equals(productId, that.productId)
      && Objects.equals(status, that.status)
      && Objects.equals(quantity, that.quantity);
  }

  @Override
  public int hashCode() {
    return Objects.hash(orderId, orderDate, deliveryDate, customerId, productId, status, quantity);
  }

  @Override
  public String toString() {
    return "OrderFact{" +
      "orderId=" + orderId +
      ", orderDate=" + orderDate +
      ", deliveryDate=" + deliveryDate +
      ", customerId=" + customerId +
      ", productId=" + productId +
      ", status='" + status + '\'' +
      ", quantity=" + quantity +
      '}';
  }
}
