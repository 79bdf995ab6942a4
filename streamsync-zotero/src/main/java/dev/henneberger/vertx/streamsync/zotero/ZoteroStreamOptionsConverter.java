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

import io.vertx.core.json.JsonObject;

final class ZoteroStreamOptionsConverter {

  private ZoteroStreamOptionsConverter() {
  }

  static void fromJson(JsonObject json, ZoteroStreamOptions options) {
    if (json == null) {
      return;
    }

    if (json.containsKey("host")) {
      options.setHost(json.getString("host"));
    }
    if (json.containsKey("port")) {
      options.setPort(json.getInteger("port"));
    }
    if (json.containsKey("ssl")) {
      options.setSsl(json.getBoolean("ssl"));
    }
    if (json.containsKey("path")) {
      options.setPath(json.getString("path"));
    }
    if (json.containsKey("apiKey")) {
      options.setApiKey(json.getString("apiKey"));
    }
  }

  static void toJson(ZoteroStreamOptions options, JsonObject json) {
    json.put("host", options.getHost());
    json.put("port", options.getPort());
    json.put("ssl", options.getSsl());
    json.put("path", options.getPath());
    if (options.getApiKey() != null) {
      json.put("apiKey", options.getApiKey());
    }
  }
}
