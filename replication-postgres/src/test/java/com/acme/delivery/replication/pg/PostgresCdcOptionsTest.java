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
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.vertx.core.json.JsonObject;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class PostgresCdcOptionsTest {

  @Test
  void defaultsMatchTheDeployedPipeline() {
    PostgresCdcOptions options = new PostgresCdcOptions();

    assertEquals("cdc_pgoutput2", options.getSlotName());
    assertEquals("cdc_publication", options.getPublication());
    assertEquals("pgoutput", options.getPlugin());
    assertEquals(1, options.getProtoVersion());
    assertEquals("operations", options.getSourceSchema());
    assertEquals(Duration.ofSeconds(10), options.getStatusInterval());
    assertEquals("/tmp/cdc_handler.lock", options.getLockFile());
    assertEquals(5, options.getRetryPolicy().getMaxAttempts());
    assertEquals(Duration.ofSeconds(5), options.getMessageRetryPolicy().getDelay());
    assertEquals(3, options.getReclaimRetryPolicy().getMaxAttempts());
    options.validate();
  }

  @Test
  void readsJson() {
    PostgresCdcOptions options = new PostgresCdcOptions(new JsonObject()
      .put("slotName", "analytics_slot")
      .put("plugin", "test_decoding")
      .put("statusIntervalMs", 2500)
      .put("retryPolicy", new JsonObject().put("delayMs", 100).put("maxAttempts", 2)));

    assertEquals("analytics_slot", options.getSlotName());
    assertEquals("test_decoding", options.getPlugin());
    assertEquals(Duration.ofMillis(2500), options.getStatusInterval());
    assertEquals(Duration.ofMillis(100), options.getRetryPolicy().getDelay());
    assertEquals(2, options.getRetryPolicy().getMaxAttempts());
    assertEquals("cdc_publication", options.getPublication());

    JsonObject json = options.toJson();
    assertEquals(2500L, json.getLong("statusIntervalMs"));
    assertEquals(2L, json.getJsonObject("retryPolicy").getLong("maxAttempts"));
  }

  @Test
  void rejectsUnsafeIdentifiersAndUnknownPlugins() {
    assertThrows(IllegalArgumentException.class,
      () -> new PostgresCdcOptions().setSlotName("slot; DROP TABLE x").validate());
    assertThrows(IllegalArgumentException.class,
      () -> new PostgresCdcOptions().setSourceSchema("Operations").validate());
    IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
      () -> new PostgresCdcOptions().setPlugin("wal2json").validate());
    assertTrue(error.getMessage().contains("wal2json"));
    assertThrows(IllegalArgumentException.class,
      () -> new PostgresCdcOptions().setStatusInterval(Duration.ZERO).validate());
  }
}
