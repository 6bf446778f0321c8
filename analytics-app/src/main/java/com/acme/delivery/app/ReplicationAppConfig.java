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

import com.acme.delivery.analytics.ViewRefreshScheduler;
import com.acme.delivery.replication.core.FileProcessLock;
import com.acme.delivery.replication.core.RetryPolicy;
import com.acme.delivery.replication.pg.DatabaseEndpoint;
import com.acme.delivery.replication.pg.PostgresCdcOptions;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Process configuration read from environment variables, with the defaults of the
 * docker-compose deployment.
 */
public final class ReplicationAppConfig {

  private final DatabaseEndpoint source;
  private final DatabaseEndpoint analytics;
  private final PostgresCdcOptions cdcOptions;
  private final Duration viewRefreshInterval;

  private ReplicationAppConfig(DatabaseEndpoint source,
                               DatabaseEndpoint analytics,
                               PostgresCdcOptions cdcOptions,
                               Duration viewRefreshInterval) {
    this.source = source;
    this.analytics = analytics;
    this.cdcOptions = cdcOptions;
    this.viewRefreshInterval = viewRefreshInterval;
  }

  public static ReplicationAppConfig fromEnv() {
    return fromMap(System.getenv());
  }

  static ReplicationAppConfig fromMap(Map<String, String> env) {
    Objects.requireNonNull(env, "env");

    DatabaseEndpoint source = new DatabaseEndpoint()
      .setHost(envOrDefault(env, "TRANSACTIONS_DB_HOST", "transactions-db"))
      .setPort(intEnvOrDefault(env, "TRANSACTIONS_DB_PORT", DatabaseEndpoint.DEFAULT_PORT))
      .setDatabase(envOrDefault(env, "TRANSACTIONS_DB_NAME", "finance_db"))
      .setUser(envOrDefault(env, "TRANSACTIONS_DB_USER", "finance_db_user"))
      .setPassword(envOrDefault(env, "TRANSACTIONS_DB_PASSWORD", "1234"));

    DatabaseEndpoint analytics = new DatabaseEndpoint()
      .setHost(envOrDefault(env, "ANALYTICAL_DB_HOST", "analytical-db"))
      .setPort(intEnvOrDefault(env, "ANALYTICAL_DB_PORT", DatabaseEndpoint.DEFAULT_PORT))
      .setDatabase(envOrDefault(env, "ANALYTICAL_DB_NAME", "analytics_db"))
      .setUser(envOrDefault(env, "ANALYTICAL_DB_USER", "analytics_user"))
      .setPassword(envOrDefault(env, "ANALYTICAL_DB_PASSWORD", "analytics123"));

    long maxRetries = intEnvOrDefault(env, "CDC_MAX_RETRIES", (int) PostgresCdcOptions.DEFAULT_MAX_RETRIES);
    Duration retryDelay = Duration.ofSeconds(intEnvOrDefault(env, "CDC_RETRY_DELAY_SECONDS",
      (int) PostgresCdcOptions.DEFAULT_RETRY_DELAY.toSeconds()));

    PostgresCdcOptions cdcOptions = new PostgresCdcOptions()
      .setSlotName(envOrDefault(env, "CDC_SLOT_NAME", PostgresCdcOptions.DEFAULT_SLOT_NAME))
      .setPublication(envOrDefault(env, "CDC_PUBLICATION", PostgresCdcOptions.DEFAULT_PUBLICATION))
      .setPlugin(envOrDefault(env, "CDC_PLUGIN", PostgresCdcOptions.PLUGIN_PGOUTPUT))
      .setSourceSchema(envOrDefault(env, "CDC_SOURCE_SCHEMA", PostgresCdcOptions.DEFAULT_SOURCE_SCHEMA))
      .setLockFile(envOrDefault(env, "CDC_LOCK_FILE", FileProcessLock.DEFAULT_PATH))
      .setStatusInterval(Duration.ofSeconds(intEnvOrDefault(env, "CDC_STATUS_INTERVAL_SECONDS",
        (int) PostgresCdcOptions.DEFAULT_STATUS_INTERVAL.toSeconds())))
      .setRetryPolicy(RetryPolicy.fixedDelay(retryDelay, maxRetries))
      .setMessageRetryPolicy(RetryPolicy.fixedDelay(retryDelay, maxRetries));

    Duration viewRefreshInterval = Duration.ofSeconds(intEnvOrDefault(env, "CDC_VIEW_REFRESH_SECONDS",
      (int) ViewRefreshScheduler.DEFAULT_INTERVAL.toSeconds()));

    return new ReplicationAppConfig(source, analytics, cdcOptions, viewRefreshInterval);
  }

  /**
   * The operational database the change stream is read from.
   */
  public DatabaseEndpoint source() {
    return new DatabaseEndpoint(source);
  }

  public DatabaseEndpoint analytics() {
    return new DatabaseEndpoint(analytics);
  }

  public PostgresCdcOptions cdcOptions() {
    return new PostgresCdcOptions(cdcOptions);
  }

  public Duration viewRefreshInterval() {
    return viewRefreshInterval;
  }

  public void validate() {
    source.validate();
    analytics.validate();
    cdcOptions.validate();
    if (viewRefreshInterval.isNegative()) {
      throw new IllegalArgumentException("CDC_VIEW_REFRESH_SECONDS must be >= 0");
    }
  }

  private static String envOrDefault(Map<String, String> env, String key, String defaultValue) {
    String value = env.get(key);
    return value == null || value.isBlank() ? defaultValue : value;
  }

  private static int intEnvOrDefault(Map<String, String> env, String key, int defaultValue) {
    String value = env.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException ignore) {
      return defaultValue;
    }
  }
}
