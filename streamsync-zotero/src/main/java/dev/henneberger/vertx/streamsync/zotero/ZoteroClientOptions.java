/*
 * Copyright (C) 2026 Daniel Henneberger
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

package dev.henneberger.vertx.streamsync.zotero;

import io.vertx.codegen.annotations.DataObject;
import io.vertx.core.json.JsonObject;

/**
 * Zotero Web API endpoint and request defaults.
 */
@DataObject
public class ZoteroClientOptions {

  public static final String DEFAULT_HOST = "api.zotero.org";
  public static final int DEFAULT_PORT = 443;
  public static final boolean DEFAULT_SSL = true;
  public static final int DEFAULT_API_VERSION = 3;
  public static final String DEFAULT_USER_AGENT = "vertx-stream-sync";

  private String host;
  private int port;
  private boolean ssl;
  private int apiVersion;
  private String userAgent;

  public ZoteroClientOptions() {
    init();
  }

  public ZoteroClientOptions(JsonObject json) {
    init();
    ZoteroClientOptionsConverter.fromJson(json, this);
  }

  public ZoteroClientOptions(ZoteroClientOptions other) {
    this.host = other.host;
    this.port = other.port;
    this.ssl = other.ssl;
    this.apiVersion = other.apiVersion;
    this.userAgent = other.userAgent;
  }

  public String getHost() {
    return host;
  }

  public ZoteroClientOptions setHost(String host) {
    this.host = host;
    return this;
  }

  public Integer getPort() {
    return port;
  }

  public ZoteroClientOptions setPort(Integer port) {
    this.port = port == null ? DEFAULT_PORT : port;
    return this;
  }

  public Boolean getSsl() {
    return ssl;
  }

  public ZoteroClientOptions setSsl(Boolean ssl) {
    this.ssl = Boolean.TRUE.equals(ssl);
    return this;
  }

  public int getApiVersion() {
    return apiVersion;
  }

  public ZoteroClientOptions setApiVersion(int apiVersion) {
    this.apiVersion = apiVersion;
    return this;
  }

  public String getUserAgent() {
    return userAgent;
  }

  public ZoteroClientOptions setUserAgent(String userAgent) {
    this.userAgent = userAgent;
    return this;
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject();
    ZoteroClientOptionsConverter.toJson(this, json);
    return json;
  }

  public ZoteroClientOptions merge(JsonObject other) {
    JsonObject json = toJson();
    json.mergeIn(other);
    return new ZoteroClientOptions(json);
  }

  void validate() {
    if (host == null || host.isBlank()) {
      throw new IllegalArgumentException("host is required");
    }
    if (port < 1 || port > 65535) {
      throw new IllegalArgumentException("port must be between 1 and 65535");
    }
    if (apiVersion < 1) {
      throw new IllegalArgumentException("apiVersion must be >= 1");
    }
  }

  private void init() {
    host = DEFAULT_HOST;
    port = DEFAULT_PORT;
    ssl = DEFAULT_SSL;
    apiVersion = DEFAULT_API_VERSION;
    userAgent = DEFAULT_USER_AGENT;
  }
}
