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

import java.util.Objects;

/**
 * One row of {@code analytics.dim_customers}.
 */
public final class CustomerDim {

  private final long customerId;
  private final String customerName;
  private final Boolean active;
  private final String customerAddress;

  public CustomerDim(long customerId, String customerName, Boolean active, String customerAddress) {
    this.customerId = customerId;
    this.customerName = customerName;
    this.active = active;
    this.customerAddress = customerAddress;
  }

  public long customerId() {
    return customerId;
  }

  public String customerName() {
    return customerName;
  }

  public Boolean active() {
    return active;
  }

  public String customerAddress() {
    return customerAddress;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CustomerDim)) {
      return false;
    }
    CustomerDim that = (CustomerDim) o;
    return customerId == that.customerId
      && Objects.equals(customerName, that.customerName)
      && Objects.equals(active, that.active)
      && Objects.equals(customerAddress, that.customerAddress);
  }

  @Override
  public int hashCode() {
    return Objects.hash(customerId, customerName, active, customerAddress);
  }

  @Override
  public String toString() {
    return "CustomerDim{customerId=" + customerId + ", customerName='" + customerName + "', active=" + active + '}';
  }
}
