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

package com.acme.delivery.replication.pg;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * A decoded row change on one of the operational tables.
 *
 * <p>Field values are kept as the raw text the server sent. A SQL NULL is present as a key
 * mapped to {@code null}; a column missing from the record is absent from {@link #fields()}.
 */
public final class ChangeEvent {

  /**
   * Operational entities mirrored into the warehouse.
   */
  public enum Entity {
    ORDER("orders"),
    ORDER_ITEM("order_items"),
    CUSTOMER("customers"),
    PRODUCT("products");

    private final String tableName;

    Entity(String tableName) {
      this.tableName = tableName;
    }

    public String tableName() {
      return tableName;
    }

    /**
     * @return the entity stored in {@code tableName}, or null for any other table
     */
    public static Entity fromTable(String tableName) {
      for (Entity entity : values()) {
        if (entity.tableName.equals(tableName)) {
          return entity;
        }
      }
      return null;
    }
  }

  public enum OperationKind {
    INSERT,
    UPDATE
  }

  private final Entity entity;
  private final OperationKind operationKind;
  private final String table;
  private final Map<String, String> fields;

  public ChangeEvent(Entity entity, OperationKind operationKind, String table, Map<String, String> fields) {
    this.entity = Objects.requireNonNull(entity, "entity");
    this.operationKind = Objects.requireNonNull(operationKind, "operationKind");
    this.table = Objects.requireNonNull(table, "table");
    this.fields = fields == null || fields.isEmpty()
      ? Collections.emptyMap()
      : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
  }

  public Entity entity() {
    return entity;
  }

  public OperationKind operationKind() {
    return operationKind;
  }

  /**
   * Schema-qualified source table, e.g. {@code operations.orders}.
   */
  public String table() {
    return table;
  }

  public Map<String, String> fields() {
    return fields;
  }

  public boolean has(String field) {
    return fields.containsKey(field);
  }

  public String string(String field) {
    return fields.get(field);
  }

  /**
   * Null when the column is absent or blank. A value that does not parse throws
   * {@link IllegalArgumentException}.
   */
  public Long longValue(String field) {
    String raw = trimmed(field);
    if (raw == null) {
      return null;
    }
    try {
      return Long.valueOf(raw);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(describe(field, "an integer"), e);
    }
  }

  public Integer intValue(String field) {
    String raw = trimmed(field);
    if (raw == null) {
      return null;
    }
    try {
      return Integer.valueOf(raw);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(describe(field, "an integer"), e);
    }
  }

  public BigDecimal decimal(String field) {
    String raw = trimmed(field);
    if (raw == null) {
      return null;
    }
    try {
      return new BigDecimal(raw);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(describe(field, "a decimal"), e);
    }
  }

  /**
   * ISO date; a timestamp value is cut to its date part.
   */
  public LocalDate date(String field) {
    String raw = trimmed(field);
    if (raw == null) {
      return null;
    }
    String datePart = raw.length() > 10 ? raw.substring(0, 10) : raw;
    try {
      return LocalDate.parse(datePart);
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException(describe(field, "a date"), e);
    }
  }

  public Boolean bool(String field) {
    String raw = trimmed(field);
    if (raw == null) {
      return null;
    }
    switch (raw.toLowerCase(Locale.ROOT)) {
      case "t":
      case "true":
      case "1":
      case "yes":
      case "y":
        return Boolean.TRUE;
      case "f":
      case "false":
      case "0":
      case "no":
      case "n":
        return Boolean.FALSE;
      default:
        throw new IllegalArgumentException(describe(field, "a boolean"));
    }
  }

  public long requireLong(String field) {
    Long value = longValue(field);
    if (value == null) {
      throw new IllegalArgumentException(describe(field, "an integer"));
    }
    return value;
  }

  public LocalDate requireDate(String field) {
    LocalDate value = date(field);
    if (value == null) {
      throw new IllegalArgumentException(describe(field, "a date"));
    }
    return value;
  }

  @Override
  public String toString() {
    return "ChangeEvent{" +
      "entity=" + entity +
      ", operationKind=" + operationKind +
      ", table='" + table + '\'' +
      ", fields=" + fields +
      '}';
  }

  private String trimmed(String field) {
    String raw = fields.get(field);
    if (raw == null) {
      return null;
    }
    String value = raw.trim();
    return value.isEmpty() ? null : value;
  }

  private String describe(String field, String expected) {
    return table + " change has no " + expected + " value for '" + field + "': " + fields.get(field);
  }
}
