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

import com.acme.delivery.replication.core.RetryPolicy;
import io.vertx.core.json.JsonObject;
import java.time.Duration;

final class PostgresCdcOptionsConverter {

  private PostgresCdcOptionsConverter() {
  }

  static void fromJson(JsonObject json, PostgresCdcOptions options) {
    if (json == null) {
      return;
    }

    if (json.containsKey("slotName")) {
      options.setSlotName(json.getString("slotName"));
    }
    if (json.containsKey("publication")) {
      options.setPublication(json.getString("publication"));
    }
    if (json.containsKey("plugin")) {
      options.setPlugin(json.getString("plugin"));
    }
    if (json.containsKey("protoVersion")) {
      options.setProtoVersion(json.getInteger("protoVersion"));
    }
    if (json.containsKey("sourceSchema")) {
      options.setSourceSchema(json.getString("sourceSchema"));
    }
    if (json.containsKey("statusIntervalMs")) {
      options.setStatusInterval(Duration.ofMillis(json.getLong("statusIntervalMs")));
    }
    if (json.containsKey("lockFile")) {
      options.setLockFile(json.getString("lockFile"));
    }

    JsonObject retry = json.getJsonObject("retryPolicy");
    if (retry != null) {
      options.setRetryPolicy(parseRetry(retry, options.getRetryPolicy()));
    }
    JsonObject messageRetry = json.getJsonObject("messageRetryPolicy");
    if (messageRetry != null) {
      options.setMessageRetryPolicy(parseRetry(messageRetry, options.getMessageRetryPolicy()));
    }
    JsonObject reclaimRetry = json.getJsonObject("reclaimRetryPolicy");
    if (reclaimRetry != null) {
      options.setReclaimRetryPolicy(parseRetry(reclaimRetry, options.getReclaimRetryPolicy()));
    }
  }

  static void toJson(PostgresCdcOptions options, JsonObject json) {
    json.put("slotName", options.getSlotName());
    json.put("publication", options.getPublication());
    json.put("plugin", options.getPlugin());
    json.put("protoVersion", options.getProtoVersion());
    json.put("sourceSchema", options.getSourceSchema());
    if (options.getStatusInterval() != null) {
      json.put("statusIntervalMs", options.getStatusInterval().toMillis());
    }
    json.put("lockFile", options.getLockFile());
    json.put("retryPolicy", retryToJson(options.getRetryPolicy()));
    json.put("messageRetryPolicy", retryToJson(options.getMessageRetryPolicy()));
    json.put("reclaimRetryPolicy", retryToJson(options.getReclaimRetryPolicy()));
  }

  private static RetryPolicy parseRetry(JsonObject json, RetryPolicy defaults) {
    long delayMs = json.getLong("delayMs", defaults.getDelay().toMillis());
    long maxAttempts = json.getLong("maxAttempts", defaults.getMaxAttempts());
    return RetryPolicy.fixedDelay(Duration.ofMillis(delayMs), maxAttempts);
  }

  private static JsonObject retryToJson(RetryPolicy policy) {
    return new JsonObject()
      .put("delayMs", policy.getDelay().toMillis())
      .put("maxAttempts", policy.getMaxAttempts());
  }
}
