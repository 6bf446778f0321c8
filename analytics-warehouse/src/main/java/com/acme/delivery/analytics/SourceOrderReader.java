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

import java.sql.SQLException;
import java.util.List;

/**
 * Reads the current line items of an order from the operational database.
 */
public interface SourceOrderReader {

  /**
   * One fact per line item, carrying the order header attributes. Empty when the order has
   * no items.
   */
  List<OrderFact> findOrderLines(long orderId) throws SQLException;
}
