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

import com.acme.delivery.replication.core.OptionValidation;
import io.vertx.core.json.JsonObject;
import java.util.Properties;
import org.postgresql.PGProperty;

/**
 * Where and as whom to connect to one PostgreSQL database.
 */
public class DatabaseEndpoint {

  public static final String DEFAULT_HOST = "localhost";
  public static final int DEFAULT_PORT = 5432;

  private String host = DEFAULT_HOST;
  private int port = DEFAULT_PORT;
  private String database;
  private String user;
  private String password;
  private boolean ssl;

  public DatabaseEndpoint() {
  }

  public DatabaseEndpoint(DatabaseEndpoint other) {
    this.host = other.host;
    this.port = other.port;
    this.database = other.database;
    this.user = other.user;
    this.password = other.password;
    this.ssl = other.ssl;
  }

  public DatabaseEndpoint(JsonObject json) {
    this.host = json.getString("host", DEFAULT_HOST);
    this.port = json.getInteger("port", DEFAULT_PORT);
    this.database = json.getString("database");
    this.user = json.getString("user");
    this.password = json.getString("password");
    this.ssl = json.getBoolean("ssl", false);
  }

  public String getHost() {
    return host;
  }

  public DatabaseEndpoint setHost(String host) {
    this.host = host;
    return this;
  }

  public int getPort() {
    return port;
  }

  public DatabaseEndpoint setPort(int port) {
    this.port = port;
    return this;
  }

  public String getDatabase() {
    return database;
  }

  public DatabaseEndpoint setDatabase(String database) {
    this.database = database;
    return this;
  }

  public String getUser() {
    return user;
  }

  public DatabaseEndpoint setUser(String user) {
    this.user = user;
    return this;
  }

  public String getPassword() {
    return password;
  }

  public DatabaseEndpoint setPassword(String password) {
    this.password = password;
    return this;
  }

  public boolean isSsl() {
    return ssl;
  }

  public DatabaseEndpoint setSsl(boolean ssl) {
    this.ssl = ssl;
    return this;
  }

  public String jdbcUrl() {
    return "jdbc:postgresql://" + host + ':' + port + '/' + database;
  }

  /**
   * Driver properties for a regular session.
   */
  public Properties connectionProperties() {
    Properties props = new Properties();
    PGProperty.USER.set(props, user);
    if (password != null && !password.isBlank()) {
      PGProperty.PASSWORD.set(props, password);
    }
    if (ssl) {
      PGProperty.SSL.set(props, true);
    }
    return props;
  }

  /**
   * JSON form without the password.
   */
  public JsonObject toJson() {
    return new JsonObject()
      .put("host", host)
      .put("port", port)
      .put("database", database)
      .put("user", user)
      .put("ssl", ssl);
  }

  public void validate() {
    OptionValidation.require("host", host);
    OptionValidation.requireRange("port", port, 1, 65535);
    OptionValidation.require("database", database);
    OptionValidation.require("user", user);
  }

  @Override
  public String toString() {
    return user + "@" + host + ":" + port + "/" + database;
  }
}
