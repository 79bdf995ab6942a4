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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.Test;

class ZoteroClientOptionsTest {

  @Test
  void defaultsToPublicWebApi() {
    ZoteroClientOptions options = new ZoteroClientOptions();

    assertEquals("api.zotero.org", options.getHost());
    assertEquals(443, options.getPort());
    assertTrue(options.getSsl());
    assertEquals(3, options.getApiVersion());
    assertEquals(ZoteroClientOptions.DEFAULT_USER_AGENT, options.getUserAgent());
  }

  @Test
  void readsFromJsonAndCopies() {
    ZoteroClientOptions options = new ZoteroClientOptions(new JsonObject()
      .put("host", "localhost")
      .put("port", 8080)
      .put("ssl", false)
      .put("apiVersion", 2)
      .put("userAgent", "sync-test"));

    ZoteroClientOptions copy = new ZoteroClientOptions(options);
    options.setHost("changed");

    assertEquals("localhost", copy.getHost());
    assertEquals(8080, copy.getPort());
    assertFalse(copy.getSsl());
    assertEquals(2, copy.getApiVersion());
    assertEquals("sync-test", copy.toJson().getString("userAgent"));
  }

  @Test
  void validatesEndpoint() {
    assertThrows(IllegalArgumentException.class, () -> new ZoteroClientOptions().setHost(null).validate());
    assertThrows(IllegalArgumentException.class, () -> new ZoteroClientOptions().setPort(70000).validate());
    assertThrows(IllegalArgumentException.class, () -> new ZoteroClientOptions().setApiVersion(0).validate());
  }
}
