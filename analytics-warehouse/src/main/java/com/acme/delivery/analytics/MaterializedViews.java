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

import java.util.List;

public final class MaterializedViews {

  public static final String SCHEMA = "analytics";

  public static final String OPEN_ORDERS_BY_DATE_STATUS = "open_orders_by_date_status";
  public static final String TOP3_DELIVERY_DATES = "top3_delivery_dates";
  public static final String PENDING_ITEMS_BY_PRODUCT = "pending_items_by_product";
  public static final String TOP3_CUSTOMERS_PENDING_ORDERS = "top3_customers_pending_orders";

  public static final List<String> ALL = List.of(
    OPEN_ORDERS_BY_DATE_STATUS,
    TOP3_DELIVERY_DATES,
    PENDING_ITEMS_BY_PRODUCT,
    TOP3_CUSTOMERS_PENDING_ORDERS);

  private MaterializedViews() {
  }
}
