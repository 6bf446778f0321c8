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

import com.acme.delivery.replication.core.FileProcessLock;
import com.acme.delivery.replication.core.OptionValidation;
import com.acme.delivery.replication.core.RetryPolicy;
import io.vertx.core.json.JsonObject;
import java.time.Duration;
import java.util.Objects;

/**
 * Stream, slot and retry configuration of a {@link PostgresCdcSession}.
 */
public class PostgresCdcOptions {

  public static final String DEFAULT_SLOT_NAME = "cdc_pgoutput2";
  public static final String DEFAULT_PUBLICATION = "cdc_publication";
  public static final String PLUGIN_PGOUTPUT = "pgoutput";
  public static final String PLUGIN_TEST_DECODING = "test_decoding";
  public static final String DEFAULT_SOURCE_SCHEMA = "operations";
  public static final int DEFAULT_PROTO_VERSION = 1;
  public static final Duration DEFAULT_STATUS_INTERVAL = Duration.ofSeconds(10);
  public static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(5);
  public static final long DEFAULT_MAX_RETRIES = 5;

  private String slotName;
  private String publication;
  private String plugin;
  private int protoVersion;
  private String sourceSchema;
  private Duration statusInterval;
  private String lockFile;
  private RetryPolicy retryPolicy;
  private RetryPolicy messageRetryPolicy;
  private RetryPolicy reclaimRetryPolicy;

  public PostgresCdcOptions() {
    init();
  }

  public PostgresCdcOptions(JsonObject json) {
    init();
    PostgresCdcOptionsConverter.fromJson(json, this);
  }

  public PostgresCdcOptions(PostgresCdcOptions other) {
    this.slotName = other.slotName;
    this.publication = other.publication;
    this.plugin = other.plugin;
    this.protoVersion = other.protoVersion;
    this.sourceSchema = other.sourceSchema;
    this.statusInterval = other.statusInterval;
    this.lockFile = other.lockFile;
    this.retryPolicy = other.retryPolicy.copy();
    this.messageRetryPolicy = other.messageRetryPolicy.copy();
    this.reclaimRetryPolicy = other.reclaimRetryPolicy.copy();
  }

  public String getSlotName() {
    return slotName;
  }

  public PostgresCdcOptions setSlotName(String slotName) {
    this.slotName = slotName;
    return this;
  }

  public String getPublication() {
    return publication;
  }

  public PostgresCdcOptions setPublication(String publication) {
    this.publication = publication;
    return this;
  }

  /**
   * Logical decoding output plugin: {@code pgoutput} or {@code test_decoding}.
   */
  public String getPlugin() {
    return plugin;
  }

  public PostgresCdcOptions setPlugin(String plugin) {
    this.plugin = plugin;
    return this;
  }

  public int getProtoVersion() {
    return protoVersion;
  }

  public PostgresCdcOptions setProtoVersion(int protoVersion) {
    this.protoVersion = protoVersion;
    return this;
  }

  public String getSourceSchema() {
    return sourceSchema;
  }

  public PostgresCdcOptions setSourceSchema(String sourceSchema) {
    this.sourceSchema = sourceSchema;
    return this;
  }

  public Duration getStatusInterval() {
    return statusInterval;
  }

  public PostgresCdcOptions setStatusInterval(Duration statusInterval) {
    this.statusInterval = statusInterval;
    return this;
  }

  public String getLockFile() {
    return lockFile;
  }

  public PostgresCdcOptions setLockFile(String lockFile) {
    this.lockFile = lockFile;
    return this;
  }

  /**
   * Restarts of the whole session after a connection failure.
   */
  public RetryPolicy getRetryPolicy() {
    return retryPolicy;
  }

  public PostgresCdcOptions setRetryPolicy(RetryPolicy retryPolicy) {
    this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
    return this;
  }

  /**
   * Budget and delay for failures while applying individual changes.
   */
  public RetryPolicy getMessageRetryPolicy() {
    return messageRetryPolicy;
  }

  public PostgresCdcOptions setMessageRetryPolicy(RetryPolicy messageRetryPolicy) {
    this.messageRetryPolicy = Objects.requireNonNull(messageRetryPolicy, "messageRetryPolicy");
    return this;
  }

  public RetryPolicy getReclaimRetryPolicy() {
    return reclaimRetryPolicy;
  }

  public PostgresCdcOptions setReclaimRetryPolicy(RetryPolicy reclaimRetryPolicy) {
    this.reclaimRetryPolicy = Objects.requireNonNull(reclaimRetryPolicy, "reclaimRetryPolicy");
    return this;
  }

  public boolean usesPgOutput() {
    return PLUGIN_PGOUTPUT.equals(plugin);
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject();
    PostgresCdcOptionsConverter.toJson(this, json);
    return json;
  }

  public void validate() {
    OptionValidation.requireIdentifier("slotName", slotName);
    OptionValidation.requireIdentifier("publication", publication);
    OptionValidation.requireIdentifier("sourceSchema", sourceSchema);
    OptionValidation.require("plugin", plugin);
    if (!PLUGIN_PGOUTPUT.equals(plugin) && !PLUGIN_TEST_DECODING.equals(plugin)) {
      throw new IllegalArgumentException(
        "plugin must be " + PLUGIN_PGOUTPUT + " or " + PLUGIN_TEST_DECODING + " but was " + plugin);
    }
    OptionValidation.requireRange("protoVersion", protoVersion, 1, 4);
    OptionValidation.requirePositive("statusInterval", statusInterval);
    OptionValidation.require("lockFile", lockFile);
    Objects.requireNonNull(retryPolicy, "retryPolicy").validate();
    Objects.requireNonNull(messageRetryPolicy, "messageRetryPolicy").validate();
    Objects.requireNonNull(reclaimRetryPolicy, "reclaimRetryPolicy").validate();
  }

  @Override
  public String toString() {
    return "PostgresCdcOptions" + toJson().encode();
  }

  private void init() {
    slotName = DEFAULT_SLOT_NAME;
    publication = DEFAULT_PUBLICATION;
    plugin = PLUGIN_PGOUTPUT;
    protoVersion = DEFAULT_PROTO_VERSION;
    sourceSchema = DEFAULT_SOURCE_SCHEMA;
    statusInterval = DEFAULT_STATUS_INTERVAL;
    lockFile = FileProcessLock.DEFAULT_PATH;
    retryPolicy = RetryPolicy.fixedDelay(DEFAULT_RETRY_DELAY, DEFAULT_MAX_RETRIES);
    messageRetryPolicy = RetryPolicy.fixedDelay(DEFAULT_RETRY_DELAY, DEFAULT_MAX_RETRIES);
    reclaimRetryPolicy = SlotReclaimer.defaultRetryPolicy();
  }
}
