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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.vertx.core.json.JsonObject;
import java.util.Properties;
import org.junit.jupiter.api.Test;

class DatabaseEndpointTest {

  @Test
  void buildsJdbcUrlAndDriverProperties() {
    DatabaseEndpoint endpoint = new DatabaseEndpoint(new JsonObject()
      .put("host", "transactions-db")
      .put("database", "finance_db")
      .put("user", "finance_db_user")
      .put("password", "1234"));

    assertEquals("jdbc:postgresql://transactions-db:5432/finance_db", endpoint.jdbcUrl());
    Properties props = endpoint.connectionProperties();
    assertEquals("finance_db_user", props.getProperty("user"));
    assertEquals("1234", props.getProperty("password"));
    endpoint.validate();
  }

  @Test
  void jsonFormOmitsPassword() {
    DatabaseEndpoint endpoint = new DatabaseEndpoint()
      .setDatabase("analytics_db")
      .setUser("analytics_user")
      .setPassword("analytics123");

    JsonObject json = endpoint.toJson();

    assertFalse(json.containsKey("password"));
    assertEquals("analytics_db", new DatabaseEndpoint(json).getDatabase());
  }

  @Test
  void rejectsIncompleteEndpoints() {
    assertThrows(IllegalArgumentException.class, () -> new DatabaseEndpoint().setUser("u").validate());
    assertThrows(IllegalArgumentException.class,
      () -> new DatabaseEndpoint().setDatabase("d").setUser("u").setPort(0).validate());
  }
}
