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

import java.sql.SQLException;
import java.util.List;
import java.util.Map;

/**
 * The exportable reports, with the file each one is written to by default.
 */
public enum Report {

  OPEN_ORDERS("open_orders.csv", ReportQueries::openOrders),
  TOP_DELIVERY_DATES("top_delivery_dates.csv", ReportQueries::topDeliveryDates),
  PENDING_ITEMS("pending_items.csv", ReportQueries::pendingItems),
  TOP_CUSTOMERS("top_customers.csv", ReportQueries::topCustomers);

  @FunctionalInterface
  interface Query {
    List<Map<String, Object>> run(ReportQueries queries) throws SQLException;
  }

  private final String defaultOutput;
  private final Query query;

  Report(String defaultOutput, Query query) {
    this.defaultOutput = defaultOutput;
    this.query = query;
  }

  public String defaultOutput() {
    return defaultOutput;
  }

  public List<Map<String, Object>> run(ReportQueries queries) throws SQLException {
    return query.run(queries);
  }
}
