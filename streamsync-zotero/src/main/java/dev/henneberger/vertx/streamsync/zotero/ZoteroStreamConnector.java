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

import dev.henneberger.vertx.streamsync.core.StreamConnector;
import io.vertx.core.Vertx;
import io.vertx.core.http.WebSocketClientOptions;
import io.vertx.core.http.WebSocketConnectOptions;
import java.util.Objects;

/**
 * Opens a fresh WebSocket client per connection, so every listener start gets its own
 * socket.
 */
public final class ZoteroStreamConnector implements StreamConnector {

  public static final String API_KEY_HEADER = "Zotero-API-Key";

  private final Vertx vertx;
  private final ZoteroStreamOptions options;

  public ZoteroStreamConnector(Vertx vertx, ZoteroStreamOptions options) {
    this.vertx = Objects.requireNonNull(vertx, "vertx");
    this.options = new ZoteroStreamOptions(Objects.requireNonNull(options, "options"));
    this.options.validate();
  }

  @Override
  public ZoteroStreamConnection connect() {
    return new ZoteroStreamConnection(vertx.createWebSocketClient(new WebSocketClientOptions()), connectOptions());
  }

  WebSocketConnectOptions connectOptions() {
    WebSocketConnectOptions connectOptions = new WebSocketConnectOptions()
      .setHost(options.getHost())
      .setPort(options.getPort())
      .setSsl(options.getSsl())
      .setURI(options.getPath());
    if (options.getApiKey() != null && !options.getApiKey().isBlank()) {
      connectOptions.addHeader(API_KEY_HEADER, options.getApiKey());
    }
    return connectOptions;
  }
}
