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
 * Location of the Zotero streaming endpoint.
 */
@DataObject
public class ZoteroStreamOptions {

  public static final String DEFAULT_HOST = "stream.zotero.org";
  public static final int DEFAULT_PORT = 443;
  public static final boolean DEFAULT_SSL = true;
  public static final String DEFAULT_PATH = "/";

  private String host;
  private int port;
  private boolean ssl;
  private String path;
  private String apiKey;

  public ZoteroStreamOptions() {
    init();
  }

  public ZoteroStreamOptions(JsonObject json) {
    init();
    ZoteroStreamOptionsConverter.fromJson(json, this);
  }

  public ZoteroStreamOptions(ZoteroStreamOptions other) {
    this.host = other.host;
    this.port = other.port;
    this.ssl = other.ssl;
    this.path = other.path;
    this.apiKey = other.apiKey;
  }

  public String getHost() {
    return host;
  }

  public ZoteroStreamOptions setHost(String host) {
    this.host = host;
    return this;
  }

  public Integer getPort() {
    return port;
  }

  public ZoteroStreamOptions setPort(Integer port) {
    this.port = port == null ? DEFAULT_PORT : port;
    return this;
  }

  public Boolean getSsl() {
    return ssl;
  }

  public ZoteroStreamOptions setSsl(Boolean ssl) {
    this.ssl = Boolean.TRUE.equals(ssl);
    return this;
  }

  public String getPath() {
    return path;
  }

  public ZoteroStreamOptions setPath(String path) {
    this.path = path;
    return this;
  }

  /**
   * Key sent when connecting. A connection opened with a key is bound to that key's
   * topics; without one each subscription carries its own key.
   */
  public String getApiKey() {
    return apiKey;
  }

  public ZoteroStreamOptions setApiKey(String apiKey) {
    this.apiKey = apiKey;
    return this;
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject();
    ZoteroStreamOptionsConverter.toJson(this, json);
    return json;
  }

  public ZoteroStreamOptions merge(JsonObject other) {
    JsonObject json = toJson();
    json.mergeIn(other);
    return new ZoteroStreamOptions(json);
  }

  void validate() {
    require("host", host);
    if (port < 1 || port > 65535) {
      throw new IllegalArgumentException("port must be between 1 and 65535");
    }
    require("path", path);
    if (!path.startsWith("/")) {
      throw new IllegalArgumentException("path must start with /");
    }
  }

  private static void require(String fieldName, String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(fieldName + " is required");
    }
  }

  private void init() {
    host = DEFAULT_HOST;
    port = DEFAULT_PORT;
    ssl = DEFAULT_SSL;
    path = DEFAULT_PATH;
    apiKey = null;
  }
}
