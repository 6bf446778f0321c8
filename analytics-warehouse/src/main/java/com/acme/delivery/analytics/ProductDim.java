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

import java.math.BigDecimal;
import java.util.Objects;

/**
 * One row of {@code analytics.dim_products}.
 */
public final class ProductDim {

  private final long productId;
  private final String productName;
  private final String barcode;
  private final BigDecimal unityPrice;
  private final Boolean active;

  public ProductDim(long productId, String productName, String barcode, BigDecimal unityPrice, Boolean active) {
    this.productId = productId;
    this.productName = productName;
    this.barcode = barcode;
    this.unityPrice = unityPrice;
    this.active = active;
  }

  public long productId() {
    return productId;
  }

  public String productName() {
    return productName;
  }

  public String barcode() {
    return barcode;
  }

  /** Unit price. */
  public BigDecimal unityPrice() {
    return unityPrice;
  }

  public Boolean active() {
    return active;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ProductDim)) {
      return false;
    }
    ProductDim that = (ProductDim) o;
    return productId == that.productId
      && Objects.equals(productName, that.productName)
      && Objects.equals(barcode, that.barcode)
      && Objects.equals(unityPrice, that.unityPrice)
      && Objects.equals(active, that.active);
  }

  @Override
  public int hashCode() {
    return Objects.hash(productId, productName, barcode, unityPrice, active);
  }

  @Override
  public String toString() {
    return "ProductDim{productId=" + productId + ", productName='" + productName + "', barcode='" + barcode
      + "', unityPrice=" + unityPrice + ", active=" + active + '}';
  }
}
