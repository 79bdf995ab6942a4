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

import dev.henneberger.vertx.streamsync.core.StreamListener;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Objects;

public final class StreamSyncAppConfig {

  private final String streamHost;
  private final int streamPort;
  private final String apiHost;
  private final int apiPort;
  private final boolean ssl;
  private final String subscriptionsFile;
  private final long shutdownTimeoutMs;

  private StreamSyncAppConfig(String streamHost,
                              int streamPort,
                              String apiHost,
                              int apiPort,
                              boolean ssl,
                              String subscriptionsFile,
                              long shutdownTimeoutMs) {
    this.streamHost = streamHost;
    this.streamPort = streamPort;
    this.apiHost = apiHost;
    this.apiPort = apiPort;
    this.ssl = ssl;
    this.subscriptionsFile = subscriptionsFile;
    this.shutdownTimeoutMs = shutdownTimeoutMs;
  }

  public static StreamSyncAppConfig fromEnv() {
    return fromMap(System.getenv());
  }

  static StreamSyncAppConfig fromMap(Map<String, String> env) {
    Objects.requireNonNull(env, "env");

    String streamHost = envOrDefault(env, "ZOTERO_STREAM_HOST", ZoteroStreamOptions.DEFAULT_HOST);
    int streamPort = intEnvOrDefault(env, "ZOTERO_STREAM_PORT", ZoteroStreamOptions.DEFAULT_PORT);
    String apiHost = envOrDefault(env, "ZOTERO_API_HOST", ZoteroClientOptions.DEFAULT_HOST);
    int apiPort = intEnvOrDefault(env, "ZOTERO_API_PORT", ZoteroClientOptions.DEFAULT_PORT);
    boolean ssl = boolEnvOrDefault(env, "ZOTERO_SSL", true);
    String subscriptionsFile = envOrDefault(env, "SUBSCRIPTIONS_FILE", null);
    long shutdownTimeoutMs = longEnvOrDefault(env, "SHUTDOWN_TIMEOUT_MS", StreamListener.DEFAULT_SHUTDOWN_TIMEOUT_MS);

    return new StreamSyncAppConfig(streamHost, streamPort, apiHost, apiPort, ssl, subscriptionsFile, shutdownTimeoutMs);
  }

  public String streamHost() {
    return streamHost;
  }

  public int streamPort() {
    return streamPort;
  }

  public String apiHost() {
    return apiHost;
  }

  public int apiPort() {
    return apiPort;
  }

  public boolean ssl() {
    return ssl;
  }

  /**
   * File backing the subscription store, or {@code null} to keep subscriptions in memory.
   */
  public Path subscriptionsFile() {
    return subscriptionsFile == null ? null : Paths.get(subscriptionsFile);
  }

  public long shutdownTimeoutMs() {
    return shutdownTimeoutMs;
  }

  public ZoteroStreamOptions toStreamOptions() {
    return new ZoteroStreamOptions()
      .setHost(streamHost)
      .setPort(streamPort)
      .setSsl(ssl);
  }

  public ZoteroClientOptions toClientOptions() {
    return new ZoteroClientOptions()
      .setHost(apiHost)
      .setPort(apiPort)
      .setSsl(ssl);
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
      return Integer.parseInt(value);
    } catch (NumberFormatException ignore) {
      return defaultValue;
    }
  }

  private static long longEnvOrDefault(Map<String, String> env, String key, long defaultValue) {
    String value = env.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Long.parseLong(value);
    } catch (NumberFormatException ignore) {
      return defaultValue;
    }
  }

  private static boolean boolEnvOrDefault(Map<String, String> env, String key, boolean defaultValue) {
    String value = env.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return "true".equalsIgnoreCase(value) || "1".equals(value) || "yes".equalsIgnoreCase(value);
  }
}
